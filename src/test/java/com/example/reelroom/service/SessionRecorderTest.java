package com.example.reelroom.service;

import com.example.reelroom.archive.ArchivePackager;
import com.example.reelroom.archive.ArchiveReader;
import com.example.reelroom.archive.PackagedArchive;
import com.example.reelroom.capture.CaptureListener;
import com.example.reelroom.capture.NavigationInterceptor;
import com.example.reelroom.capture.NetworkInterceptor;
import com.example.reelroom.config.ReelroomProperties;
import com.example.reelroom.model.RecordCollection;
import com.example.reelroom.model.RenderEvent;
import com.example.reelroom.model.SessionData;
import com.example.reelroom.model.TraceEntry;
import com.example.reelroom.model.UploadResponse;
import com.example.reelroom.store.EventStore;
import com.example.reelroom.store.RetentionPolicy;
import com.example.reelroom.transfer.CancellationToken;
import com.example.reelroom.transfer.SessionUploader;
import com.example.reelroom.transfer.UploadException;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SessionRecorderTest {

    private static final long NOW = 1_700_000_000_000L;

    @Mock EventStore store;
    @Mock NetworkInterceptor networkInterceptor;
    @Mock NavigationInterceptor navigationInterceptor;
    @Mock SessionUploader uploader;
    @Mock TaskScheduler scheduler;
    @Mock ScheduledFuture<Object> sweepFuture;

    @TempDir Path exportDir;

    private ReelroomProperties props;
    private SessionRecorder recorder;

    @BeforeEach
    void setUp() {
        props = new ReelroomProperties();
        props.getExport().setDirectory(exportDir.toString());
        Clock clock = Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC);
        recorder = new SessionRecorder(store, networkInterceptor, navigationInterceptor,
                new ArchivePackager(props, clock), new ArchiveReader(clock), uploader, props, scheduler, clock);
        lenient().doReturn(sweepFuture).when(scheduler).schedule(any(Runnable.class), any(Instant.class));
    }

    private static RenderEvent event(int type, long ts) {
        ObjectNode n = JsonNodeFactory.instance.objectNode();
        n.put("type", type);
        n.put("timestamp", ts);
        n.putObject("data");
        return new RenderEvent(n);
    }

    private static SessionData recorded() {
        List<RenderEvent> events = new ArrayList<>();
        events.add(event(RenderEvent.TYPE_FULL_SNAPSHOT, NOW + 1));
        events.add(event(3, NOW + 2));
        return new SessionData(events, new ArrayList<>());
    }

    @Test
    void startInstallsCaptureAndSchedulesSweep() {
        long id = recorder.start();

        assertEquals(NOW, id);
        assertEquals(Long.valueOf(NOW), recorder.currentSessionId());
        ArgumentCaptor<CaptureListener> sink = ArgumentCaptor.forClass(CaptureListener.class);
        verify(networkInterceptor).install(sink.capture());
        verify(scheduler).schedule(any(Runnable.class), eq(Instant.ofEpochMilli(NOW + 1000)));

        TraceEntry entry = new TraceEntry();
        sink.getValue().onRequestComplete(entry);
        verify(store).appendTraceEntry(NOW, entry);
    }

    @Test
    void secondStartKeepsRunningSession() {
        recorder.start();
        assertEquals(NOW, recorder.start());
        verify(networkInterceptor, times(1)).install(any());
    }

    @Test
    void stopUninstallsAndCancelsSweep() {
        recorder.start();
        when(networkInterceptor.isActive()).thenReturn(true);
        when(navigationInterceptor.isActive()).thenReturn(false);

        recorder.stop();

        verify(networkInterceptor).uninstall();
        verify(navigationInterceptor, never()).uninstall();
        verify(sweepFuture).cancel(false);
        assertNull(recorder.currentSessionId());
    }

    @Test
    void eventsAreDroppedWithoutSession() {
        assertFalse(recorder.recordEvent(event(3, 1)));
        assertEquals(0, recorder.recordBatch(Collections.singletonList(event(3, 1))));
        verifyNoInteractions(store);
    }

    @Test
    void storeFailureDoesNotReachCaller() {
        recorder.start();
        doThrow(new IllegalStateException("disk full")).when(store).appendRenderEvent(eq(NOW), any());

        assertFalse(recorder.recordEvent(event(3, 1)));
    }

    @Test
    void consoleLineWithoutTimestampUsesClock() {
        recorder.start();

        assertTrue(recorder.recordConsole("warn", List.of("low memory"), null));

        ArgumentCaptor<RenderEvent> captor = ArgumentCaptor.forClass(RenderEvent.class);
        verify(store).appendRenderEvent(eq(NOW), captor.capture());
        assertTrue(captor.getValue().isConsoleEvent());
        assertEquals(NOW, captor.getValue().getTimestamp());
    }

    @Test
    void sweepUsesConfiguredRetention() {
        recorder.start();
        recorder.sweepExpired();
        verify(store).sweep(eq(NOW), any(RetentionPolicy.class));
    }

    @Test
    void exportWritesArchiveAndClearsSession() throws Exception {
        recorder.start();
        when(store.readSession(NOW)).thenReturn(recorded());

        Path file = recorder.exportLog(true);

        assertEquals(exportDir.resolve("record-" + NOW + ".zip"), file);
        assertTrue(Files.size(file) > 0);
        verify(store).deleteSession(NOW);
    }

    @Test
    void exportOfEmptySessionWritesNothing() {
        recorder.start();
        when(store.readSession(NOW)).thenReturn(new SessionData());

        assertNull(recorder.exportLog(true));
        verify(store, never()).deleteSession(anyLong());
    }

    @Test
    void exportRequiresRunningRecorder() {
        assertThrows(IllegalStateException.class, () -> recorder.exportLog(false));
    }

    @Test
    void successfulUploadClearsSession() {
        recorder.start();
        when(store.readSession(NOW)).thenReturn(recorded());
        when(uploader.upload(any(PackagedArchive.class), any(), any())).thenReturn(new UploadResponse(true, null, null));
        List<Double> progress = new ArrayList<>();

        UploadResponse res = recorder.uploadLog(true, progress::add, null);

        assertTrue(res.isSuccess());
        verify(store).deleteSession(NOW);
        assertFalse(progress.isEmpty());
        assertTrue(progress.stream().allMatch(p -> p <= 50.0));

        ArgumentCaptor<CancellationToken> token = ArgumentCaptor.forClass(CancellationToken.class);
        verify(uploader).upload(any(PackagedArchive.class), any(), token.capture());
        assertFalse(token.getValue().isCancelled());
    }

    @Test
    void failedUploadKeepsSession() {
        recorder.start();
        when(store.readSession(NOW)).thenReturn(recorded());
        when(uploader.upload(any(PackagedArchive.class), any(), any())).thenThrow(new UploadException(500, "Upload failed with status 500"));

        assertThrows(UploadException.class, () -> recorder.uploadLog(true, null, CancellationToken.create()));
        verify(store, never()).deleteSession(anyLong());
    }

    @Test
    void importClearsThenAppendsEverySession() {
        Map<Long, SessionData> sessions = new LinkedHashMap<>();
        sessions.put(100L, recorded());
        sessions.put(200L, recorded());
        byte[] archive = new ArchivePackager(props, Clock.systemUTC()).pack(sessions, null).getBytes();

        RecordCollection imported = recorder.importLog(archive, true);

        assertEquals(List.of("100", "200"), imported.sessionIds());
        InOrder order = inOrder(store);
        order.verify(store).clearAll();
        order.verify(store).appendRenderEvents(eq(100L), anyList());
        order.verify(store).appendTraceEntries(eq(100L), anyList());
        order.verify(store).appendRenderEvents(eq(200L), anyList());
    }

    @Test
    void importRejectsNonNumericSessionKeyBeforeClearing() {
        byte[] doc = "{\"abc\":{\"eventData\":[],\"responseData\":[]}}".getBytes(StandardCharsets.UTF_8);

        assertThrows(IllegalArgumentException.class, () -> recorder.importLog(doc, true));
        verify(store, never()).clearAll();
    }

    @Test
    void statusReportsCurrentSession() {
        recorder.start();
        when(networkInterceptor.isActive()).thenReturn(true);
        when(store.sessionIds()).thenReturn(List.of(NOW));
        when(store.countRenderEvents(NOW)).thenReturn(7L);

        assertEquals(Long.valueOf(NOW), recorder.status().getCurrentSessionId());
        assertEquals(7L, recorder.status().getRenderEventCount());
        assertTrue(recorder.status().isNetworkCaptureActive());
    }
}
