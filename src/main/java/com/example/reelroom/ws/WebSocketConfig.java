package com.example.reelroom.ws;

import org.springframework.context.annotation.Configuration;
import org.springframework.web.socket.config.annotation.*;

@Configuration
@EnableWebSocket
public class WebSocketConfig implements WebSocketConfigurer {

    private final IngestWebSocketHandler ingestWebSocketHandler;

    public WebSocketConfig(IngestWebSocketHandler ingestWebSocketHandler) {
        this.ingestWebSocketHandler = ingestWebSocketHandler;
    }

    @Override
    public void registerWebSocketHandlers(WebSocketHandlerRegistry registry) {
        // the DOM engine streams render events and console output here while a session runs
        registry.addHandler(ingestWebSocketHandler, "/ws/ingest")
                .setAllowedOriginPatterns("*");
    }
}
