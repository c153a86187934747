package com.pensionai.config;

import com.pensionai.stream.OrchestrationStreamWebSocketHandler;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.EnableWebSocket;
import org.springframework.web.socket.config.annotation.WebSocketConfigurer;
import org.springframework.web.socket.config.annotation.WebSocketHandlerRegistry;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    public static final String STREAM_PATH = "/ws/stream";

    private final OrchestrationStreamWebSocketHandler streamHandler;

    public WebSocketConfig(OrchestrationStreamWebSocketHandler streamHandler) {
        this.streamHandler = streamHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        registry.addHandler(streamHandler, STREAM_PATH).setAllowedOrigins("*");
    }
}
