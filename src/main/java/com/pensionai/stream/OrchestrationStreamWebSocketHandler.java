package com.pensionai.stream;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.MultiValueMap;
import org.springframework.util.StringUtils;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;

/**
 * Server-push socket for run events: {@code /ws/stream?runId=...&since=...}.
 */
@Component
@Slf4j
public class OrchestrationStreamWebSocketHandler extends TextWebSocketHandler {

    private final OrchestrationStreamHub hub;

    public OrchestrationStreamWebSocketHandler(OrchestrationStreamHub hub) {
        this.hub = hub;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws IOException {
        URI uri = session.getUri();
        if (uri == null) {
            session.close(CloseStatus.BAD_DATA);
            return;
        }
        MultiValueMap<String, String> params = UriComponentsBuilder.fromUri(uri).build().getQueryParams();
        String runId = params.getFirst("runId");
        if (!StringUtils.hasText(runId)) {
            session.close(CloseStatus.BAD_DATA);
            return;
        }
        hub.subscribe(runId, session, sinceId(params.getFirst("since")));
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        log.debug("Ignoring inbound message on stream session {}.", session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        hub.unsubscribe(session);
    }

    private long sinceId(String value) {
        if (!StringUtils.hasText(value)) {
            return 0L;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException ex) {
            log.debug("Invalid since parameter {}", value);
            return 0L;
        }
    }
}
