package com.example.reelroom.ws;

import com.example.reelroom.model.RenderEvent;
import com.example.reelroom.service.SessionRecorder;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class IngestWebSocketHandlerTest {

    private SessionRecorder recorder;
    private WebSocketSession session;
    private IngestWebSocketHandler handler;

    @BeforeEach
    void setUp() {
        recorder = mock(SessionRecorder.class);
        session = mock(WebSocketSession.class);
        handler = new IngestWebSocketHandler(recorder);
    }

    @Test
    void connectionIsClosedWhenRecorderStopped() throws Exception {
        handler.afterConnectionEstablished(session);

        ArgumentCaptor<CloseStatus> status = ArgumentCaptor.forClass(CloseStatus.class);
        verify(session).close(status.capture());
        assertEquals(CloseStatus.SERVICE_RESTARTED.getCode(), status.getValue().getCode());
    }

    @SuppressWarnings("unchecked")
    @Test
    void eventBatchGoesToRecorder() throws Exception {
        when(recorder.currentSessionId()).thenReturn(1L);

        handler.handleMessage(session, new TextMessage(
                "{\"type\":\"rrweb\",\"events\":[{\"type\":2,\"timestamp\":1,\"data\":{}},{\"type\":3,\"timestamp\":2,\"data\":{}}]}"));

        ArgumentCaptor<List<RenderEvent>> captor = ArgumentCaptor.forClass(List.class);
        verify(recorder).recordBatch(captor.capture());
        assertEquals(2, captor.getValue().size());
        verify(session, never()).close(any());
    }

    @Test
    void consoleLineGoesToRecorder() throws Exception {
        when(recorder.currentSessionId()).thenReturn(1L);

        handler.handleMessage(session, new TextMessage(
                "{\"type\":\"console\",\"level\":\"warn\",\"payload\":[\"slow\"],\"ts\":9}"));

        verify(recorder).recordConsole("warn", List.of("slow"), 9L);
    }

    @Test
    void malformedMessagesAreIgnored() throws Exception {
        when(recorder.currentSessionId()).thenReturn(1L);

        handler.handleMessage(session, new TextMessage("not json"));
        handler.handleMessage(session, new TextMessage("{\"type\":\"rrweb\",\"events\":\"nope\"}"));
        handler.handleMessage(session, new TextMessage("{\"type\":\"mystery\"}"));

        verify(recorder, never()).recordBatch(any());
        verify(recorder, never()).recordConsole(any(), any(), any());
        verify(session, never()).close(any());
    }
}
