package com.pensionai.stream;

import org.springframework.web.socket.WebSocketSession;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Replay buffer and subscriber set of one streamed run.
 */
class StreamRun {

    private final String runId;
    private final Deque<StreamEvent> buffer = new ArrayDeque<>();
    private final Map<String, WebSocketSession> subscribers = new ConcurrentHashMap<>();
    private long lastEventId;
    private volatile boolean completed;
    private volatile boolean cancelled;
    private volatile Instant lastUpdated = Instant.now();

    StreamRun(String runId) {
        this.runId = runId;
    }

    String runId() {
        return runId;
    }

    Map<String, WebSocketSession> subscribers() {
        return subscribers;
    }

    synchronized StreamEvent append(String type, Object data, int capacity) {
        StreamEvent event = new StreamEvent(++lastEventId, Instant.now(), type, data);
        buffer.addLast(event);
        while (buffer.size() > capacity) {
            buffer.removeFirst();
        }
        lastUpdated = event.timestamp();
        return event;
    }

    synchronized List<StreamEvent> eventsAfter(long sinceId) {
        return buffer.stream()
                .filter(event -> event.id() > sinceId)
                .toList();
    }

    boolean completed() {
        return completed;
    }

    boolean cancelled() {
        return cancelled;
    }

    void markCompleted() {
        completed = true;
        lastUpdated = Instant.now();
    }

    void markCancelled() {
        cancelled = true;
        lastUpdated = Instant.now();
    }

    boolean expired(Instant cutoff) {
        return completed && subscribers.isEmpty() && lastUpdated.isBefore(cutoff);
    }
}
