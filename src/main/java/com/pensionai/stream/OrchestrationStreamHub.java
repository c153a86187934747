package com.pensionai.stream;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps the event buffer of every streamed run and pushes new events to connected sockets.
 * Late subscribers replay the buffer from the event id they last saw.
 */
@Component
@Slf4j
public class OrchestrationStreamHub {

    static final String RUN_ID_ATTRIBUTE = "runId";
    private static final int BUFFER_CAPACITY = 500;
    private static final Duration RETENTION = Duration.ofMinutes(30);

    private final ObjectMapper objectMapper;
    private final Map<String, StreamRun> runs = new ConcurrentHashMap<>();

    public OrchestrationStreamHub(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String createRun() {
        evictExpiredRuns();
        String runId = UUID.randomUUID().toString();
        runs.put(runId, new StreamRun(runId));
        return runId;
    }

    public void subscribe(String runId, WebSocketSession session, long sinceId) throws IOException {
        StreamRun run = runs.get(runId);
        if (run == null) {
            log.debug("Rejecting subscription to unknown run {}.", runId);
            session.close();
            return;
        }
        run.subscribers().put(session.getId(), session);
        session.getAttributes().put(RUN_ID_ATTRIBUTE, runId);
        for (StreamEvent event : run.eventsAfter(sinceId)) {
            send(session, event);
        }
    }

    public void unsubscribe(WebSocketSession session) {
        Object runId = session.getAttributes().get(RUN_ID_ATTRIBUTE);
        if (runId == null) {
            return;
        }
        StreamRun run = runs.get(runId.toString());
        if (run != null) {
            run.subscribers().remove(session.getId());
        }
        evictExpiredRuns();
    }

    public void emit(String runId, String type, Object data) {
        StreamRun run = runs.get(runId);
        if (run == null) {
            return;
        }
        // once cancelled only the partial result and terminal events still go out
        if (run.cancelled() && !StreamEvent.FINAL.equals(type) && !StreamEvent.endsRun(type)) {
            return;
        }
        StreamEvent event = run.append(type, data, BUFFER_CAPACITY);
        run.subscribers().values().forEach(session -> send(session, event));
        if (StreamEvent.endsRun(type)) {
            run.markCompleted();
        }
    }

    public boolean cancelRun(String runId) {
        StreamRun run = runs.get(runId);
        if (run == null) {
            return false;
        }
        if (!run.cancelled() && !run.completed()) {
            run.markCancelled();
            StreamEvent event = run.append(StreamEvent.RUN_CANCEL, Map.of(), BUFFER_CAPACITY);
            run.subscribers().values().forEach(session -> send(session, event));
        }
        return true;
    }

    public boolean isCancelled(String runId) {
        StreamRun run = runs.get(runId);
        return run != null && run.cancelled();
    }

    private void send(WebSocketSession session, StreamEvent event) {
        if (!session.isOpen()) {
            return;
        }
        try {
            String payload = objectMapper.writeValueAsString(event);
            synchronized (session) {
                session.sendMessage(new TextMessage(payload));
            }
        } catch (IOException ex) {
            log.debug("Failed to push event {} to session {}: {}", event.id(), session.getId(), ex.getMessage());
        }
    }

    private void evictExpiredRuns() {
        Instant cutoff = Instant.now().minus(RETENTION);
        runs.values().removeIf(run -> run.expired(cutoff));
    }
}
