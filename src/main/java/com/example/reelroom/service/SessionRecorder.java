package com.example.reelroom.service;

import com.example.reelroom.archive.ArchiveException;
import com.example.reelroom.archive.ArchivePackager;
import com.example.reelroom.archive.ArchiveReader;
import com.example.reelroom.archive.PackagedArchive;
import com.example.reelroom.archive.ProgressListener;
import com.example.reelroom.capture.CaptureListener;
import com.example.reelroom.capture.HistoryHost;
import com.example.reelroom.capture.NavigationInterceptor;
import com.example.reelroom.capture.NetworkInterceptor;
import com.example.reelroom.config.ReelroomProperties;
import com.example.reelroom.model.RecordCollection;
import com.example.reelroom.model.RecorderStatus;
import com.example.reelroom.model.RenderEvent;
import com.example.reelroom.model.SessionData;
import com.example.reelroom.model.TraceEntry;
import com.example.reelroom.model.UploadResponse;
import com.example.reelroom.store.EventStore;
import com.example.reelroom.store.RetentionPolicy;
import com.example.reelroom.transfer.CancellationToken;
import com.example.reelroom.transfer.SessionUploader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;

/**
 * Owns the current recording session: wires capture into the store, and packages, exports,
 * uploads or imports session data.
 */
@Service
public class SessionRecorder {

    private static final Logger log = LoggerFactory.getLogger(SessionRecorder.class);

    private final EventStore store;
    private final NetworkInterceptor networkInterceptor;
    private final NavigationInterceptor navigationInterceptor;
    private final ArchivePackager packager;
    private final ArchiveReader reader;
    private final SessionUploader uploader;
    private final ReelroomProperties props;
    private final TaskScheduler scheduler;
    private final Clock clock;

    private volatile Long currentSessionId;
    private ScheduledFuture<?> sweepTask;

    public SessionRecorder(EventStore store,
                           NetworkInterceptor networkInterceptor,
                           NavigationInterceptor navigationInterceptor,
                           ArchivePackager packager,
                           ArchiveReader reader,
                           SessionUploader uploader,
                           ReelroomProperties props,
                           @Qualifier("recorderScheduler") TaskScheduler scheduler,
                           Clock clock) {
        this.store = store;
        this.networkInterceptor = networkInterceptor;
        this.navigationInterceptor = navigationInterceptor;
        this.packager = packager;
        this.reader = reader;
        this.uploader = uploader;
        this.props = props;
        this.scheduler = scheduler;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onReady() {
        if (props.getRecorder().isAutoStart()) start();
    }

    // ---------- lifecycle ----------
    public synchronized long start() {
        if (currentSessionId != null) {
            log.warn("recorder already running (session {})", currentSessionId);
            return currentSessionId;
        }
        long id = clock.millis();
        currentSessionId = id;

        networkInterceptor.install(new StoreSink(id));
        sweepTask = scheduler.schedule(this::sweepExpired,
                Instant.ofEpochMilli(clock.millis() + props.getStore().getSweepDelayMs()));
        log.info("recording session {}", id);
        return id;
    }

    public synchronized void stop() {
        if (currentSessionId == null) return;
        if (networkInterceptor.isActive()) networkInterceptor.uninstall();
        if (navigationInterceptor.isActive()) navigationInterceptor.uninstall();
        if (sweepTask != null) sweepTask.cancel(false);
        sweepTask = null;
        log.info("stopped session {}", currentSessionId);
        currentSessionId = null;
    }

    public Long currentSessionId() {
        return currentSessionId;
    }

    public synchronized void watchNavigation(HistoryHost host) {
        requireSession();
        navigationInterceptor.install(host, this::recordEvent);
    }

    public synchronized void unwatchNavigation() {
        if (navigationInterceptor.isActive()) navigationInterceptor.uninstall();
    }

    void sweepExpired() {
        Long id = currentSessionId;
        if (id == null) return;
        try {
            store.sweep(id, RetentionPolicy.ofDays(props.getStore().getRecordIntervalDays()));
        } catch (RuntimeException e) {
            log.error("retention sweep failed for session {}", id, e);
        }
    }

    // ---------- capture ----------
    public boolean recordEvent(RenderEvent event) {
        Long id = currentSessionId;
        if (id == null || event == null) return false;
        try {
            store.appendRenderEvent(id, event);
            return true;
        } catch (RuntimeException e) {
            log.error("dropping render event (type {}) for session {}", event.getType(), id, e);
            return false;
        }
    }

    public int recordBatch(List<RenderEvent> events) {
        Long id = currentSessionId;
        if (id == null || events == null || events.isEmpty()) return 0;
        try {
            return store.appendRenderEvents(id, events);
        } catch (RuntimeException e) {
            log.error("dropping batch of {} render events for session {}", events.size(), id, e);
            return 0;
        }
    }

    public boolean recordConsole(String level, List<String> args, Long ts) {
        return recordEvent(RenderEvent.consoleLog(level, args, ts == null ? clock.millis() : ts));
    }

    // ---------- export / upload ----------
    /**
     * Packages the current session. Returns null when nothing has been recorded yet.
     */
    public PackagedArchive packageCurrent(ProgressListener progress) {
        long id = requireSession();
        SessionData data = store.readSession(id);
        if (data.isEmpty()) {
            log.warn("session {} has no data, nothing to package", id);
            return null;
        }
        Map<Long, SessionData> sessions = new LinkedHashMap<>();
        sessions.put(id, data);
        return packager.pack(sessions, progress);
    }

    public Path exportLog(boolean clear) {
        long id = requireSession();
        PackagedArchive archive = packageCurrent(ProgressListener.NONE);
        if (archive == null) return null;

        Path dir = Paths.get(props.getExport().getDirectory());
        Path target = dir.resolve(archive.getFileName());
        try {
            Files.createDirectories(dir);
            Files.write(target, archive.getBytes());
        } catch (IOException e) {
            throw new ArchiveException("Failed to write archive to " + target, e);
        }
        log.info("exported session {} to {}", id, target);

        if (clear) store.deleteSession(id);
        return target;
    }

    public UploadResponse uploadLog(boolean clear, ProgressListener progress, CancellationToken token) {
        long id = requireSession();
        ProgressListener listener = progress == null ? ProgressListener.NONE : progress;
        CancellationToken t = token != null ? token
                : CancellationToken.withTimeout(Duration.ofMillis(props.getUpload().getTimeoutMs()));

        PackagedArchive archive = packageCurrent(listener.scaled(0, 50));
        if (archive == null) return null;

        UploadResponse res = uploader.upload(archive, listener.scaled(50, 100), t);
        log.info("uploaded session {} ({} bytes){}", id, archive.getSize(),
                res.getSession() != null ? " as " + res.getSession().getId() : "");

        if (clear && res.isSuccess()) store.deleteSession(id);
        return res;
    }

    // ---------- import ----------
    public RecordCollection importLog(Path file, boolean clearBefore) {
        return importCollection(reader.read(file), clearBefore);
    }

    public RecordCollection importLog(byte[] bytes, boolean clearBefore) {
        return importCollection(reader.read(bytes), clearBefore);
    }

    private RecordCollection importCollection(RecordCollection records, boolean clearBefore) {
        Map<Long, SessionData> parsed = new LinkedHashMap<>();
        for (Map.Entry<String, SessionData> e : records.getSessions().entrySet()) {
            try {
                parsed.put(Long.parseLong(e.getKey().trim()), e.getValue());
            } catch (NumberFormatException ex) {
                throw new IllegalArgumentException("session id is not a timestamp: " + e.getKey());
            }
        }

        if (clearBefore) store.clearAll();
        for (Map.Entry<Long, SessionData> e : parsed.entrySet()) {
            int events = store.appendRenderEvents(e.getKey(), e.getValue().getEventData());
            int entries = store.appendTraceEntries(e.getKey(), e.getValue().getResponseData());
            log.info("imported session {} ({} events, {} trace entries)", e.getKey(), events, entries);
        }
        return records;
    }

    // ---------- housekeeping ----------
    public void deleteSession(long sessionId) {
        store.deleteSession(sessionId);
    }

    public void clearAll() {
        store.clearAll();
    }

    public RecorderStatus status() {
        Long id = currentSessionId;
        return new RecorderStatus(id,
                networkInterceptor.isActive(),
                navigationInterceptor.isActive(),
                store.sessionIds(),
                id == null ? 0 : store.countRenderEvents(id),
                id == null ? 0 : store.countTraceEntries(id),
                store.approxRenderEventBytes(),
                store.approxTraceEntryBytes());
    }

    private long requireSession() {
        Long id = currentSessionId;
        if (id == null) throw new IllegalStateException("recorder is not running");
        return id;
    }

    /**
     * Writes every captured call of one session to the store, on the calling thread.
     */
    private final class StoreSink implements CaptureListener {
        private final long sessionId;

        StoreSink(long sessionId) {
            this.sessionId = sessionId;
        }

        @Override
        public void onRequestComplete(TraceEntry entry) {
            store.appendTraceEntry(sessionId, entry);
        }
    }
}
