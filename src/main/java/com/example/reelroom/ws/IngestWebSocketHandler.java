package com.example.reelroom.ws;

import com.example.reelroom.model.ConsoleLogRequest;
import com.example.reelroom.model.RenderEventBatch;
import com.example.reelroom.service.SessionRecorder;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.*;
import org.springframework.web.socket.handler.TextWebSocketHandler;

/**
 * Accepts {@code {"type":"rrweb","events":[...]}} batches and {@code {"type":"console",...}} lines
 * for the running session.
 */
@Component
public class IngestWebSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(IngestWebSocketHandler.class);

    private final SessionRecorder recorder;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public IngestWebSocketHandler(SessionRecorder recorder) {
        this.recorder = recorder;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) throws Exception {
        if (recorder.currentSessionId() == null) {
            session.close(CloseStatus.SERVICE_RESTARTED.withReason("recorder is not running"));
        }
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) throws Exception {
        if (recorder.currentSessionId() == null) {
            session.close(CloseStatus.SERVICE_RESTARTED.withReason("recorder is not running"));
            return;
        }

        JsonNode node;
        try {
            node = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            log.debug("ignoring non-JSON ingest message: {}", e.getOriginalMessage());
            return;
        }
        String type = node.path("type").asText("");

        try {
            if ("rrweb".equals(type)) {
                RenderEventBatch batch = objectMapper.treeToValue(node, RenderEventBatch.class);
                if (batch.getEvents() != null) recorder.recordBatch(batch.getEvents());
            } else if ("console".equals(type)) {
                ConsoleLogRequest req = objectMapper.treeToValue(node, ConsoleLogRequest.class);
                recorder.recordConsole(req.getLevel(), req.getPayload(), req.getTs());
            } else {
                log.debug("ignoring ingest message of type '{}'", type);
            }
        } catch (JsonProcessingException e) {
            log.debug("malformed {} ingest message: {}", type, e.getOriginalMessage());
        }
    }
}
