package com.example.reelroom.store;

import com.example.reelroom.config.ReelroomProperties;
import com.example.reelroom.model.RenderEvent;
import com.example.reelroom.model.SessionData;
import com.example.reelroom.model.TraceEntry;
import com.example.reelroom.persistence.RenderEventEntity;
import com.example.reelroom.persistence.RenderEventRepository;
import com.example.reelroom.persistence.TraceEntryEntity;
import com.example.reelroom.persistence.TraceEntryRepository;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Session-partitioned storage of render events and trace entries.
 *
 * <p>Render events are capped per session. The running count lives here, seeded from the table the
 * first time a session is touched; once an append pushes it past the cap the oldest events (by event
 * timestamp) are removed in one pass and the count is set back to the cap.
 *
 * <p>Writes that touch render events run under one lock that is held until their transaction has
 * committed, and the cached counts change only after that commit. Callers must not wrap these
 * methods in a transaction of their own.
 */
@Service
public class EventStore {

    private static final Logger log = LoggerFactory.getLogger(EventStore.class);

    private final RenderEventRepository renderRepo;
    private final TraceEntryRepository traceRepo;
    private final int maxEventsPerSession;
    private final long graceWindowMs;

    private final TransactionTemplate tx;
    private final Object writeLock = new Object();

    private final Map<Long, Integer> renderCounts = new ConcurrentHashMap<>();
    private final ObjectMapper om = new ObjectMapper();

    public EventStore(RenderEventRepository renderRepo, TraceEntryRepository traceRepo,
                      PlatformTransactionManager transactionManager, ReelroomProperties props) {
        this.renderRepo = renderRepo;
        this.traceRepo = traceRepo;
        this.tx = new TransactionTemplate(transactionManager);
        this.maxEventsPerSession = props.getStore().getMaxEventsPerSession();
        this.graceWindowMs = props.getStore().getGraceWindowMs();
    }

    // ---------- append ----------
    public void appendRenderEvent(long traceTime, RenderEvent event) {
        appendRenderEvents(traceTime, List.of(event));
    }

    public int appendRenderEvents(long traceTime, List<RenderEvent> events) {
        if (events == null || events.isEmpty()) return 0;

        synchronized (writeLock) {
            int[] savedAndCount = tx.execute(status -> insertCapped(traceTime, events));
            renderCounts.put(traceTime, savedAndCount[1]);
            return savedAndCount[0];
        }
    }

    private int[] insertCapped(long traceTime, List<RenderEvent> events) {
        Integer known = renderCounts.get(traceTime);
        int count = known != null ? known : (int) renderRepo.countByTraceTime(traceTime);
        int saved = 0;
        for (RenderEvent ev : events) {
            if (ev == null) continue;
            renderRepo.save(new RenderEventEntity(traceTime, ev.getType(), ev.getTimestamp(), toJson(ev.toJson())));
            saved += 1;
        }
        count += saved;

        if (count > maxEventsPerSession) {
            int excess = count - maxEventsPerSession;
            List<Long> oldest = renderRepo.findIdsOldestFirst(traceTime, PageRequest.of(0, excess));
            if (!oldest.isEmpty()) renderRepo.deleteByIds(oldest);
            log.debug("session {} over {} events, evicted {} oldest", traceTime, maxEventsPerSession, oldest.size());
            count = maxEventsPerSession;
        }
        return new int[]{saved, count};
    }

    @Transactional
    public void appendTraceEntry(long traceTime, TraceEntry entry) {
        TraceEntry.Request req = entry.getRequest();
        String method = req.getMethod() == null ? "GET" : req.getMethod();
        String url = req.getUrl() == null ? "" : req.getUrl();
        if (url.length() > 4096) url = url.substring(0, 4096);

        traceRepo.save(new TraceEntryEntity(traceTime, entry.getClientRequestId(), method, url,
                entry.getResponse().getStatus(), startedAt(entry), toJson(entry)));
    }

    @Transactional
    public int appendTraceEntries(long traceTime, List<TraceEntry> entries) {
        if (entries == null) return 0;
        int saved = 0;
        for (TraceEntry e : entries) {
            if (e == null) continue;
            appendTraceEntry(traceTime, e);
            saved += 1;
        }
        return saved;
    }

    // ---------- read ----------
    @Transactional(readOnly = true)
    public List<RenderEvent> readRenderEvents(long traceTime) {
        List<RenderEvent> out = new ArrayList<>();
        for (RenderEventEntity e : renderRepo.findByTraceTime(traceTime)) {
            out.add(new RenderEvent(fromJson(e.getPayloadJson(), ObjectNode.class)));
        }
        return out;
    }

    @Transactional(readOnly = true)
    public List<TraceEntry> readTraceEntries(long traceTime) {
        List<TraceEntry> out = new ArrayList<>();
        for (TraceEntryEntity e : traceRepo.findByTraceTime(traceTime)) {
            out.add(fromJson(e.getPayloadJson(), TraceEntry.class));
        }
        return out;
    }

    @Transactional(readOnly = true)
    public SessionData readSession(long traceTime) {
        return new SessionData(readRenderEvents(traceTime), readTraceEntries(traceTime));
    }

    /** Newest first. */
    @Transactional(readOnly = true)
    public List<Long> sessionIds() {
        TreeSet<Long> ids = new TreeSet<>(renderRepo.findTraceTimes());
        ids.addAll(traceRepo.findTraceTimes());
        return new ArrayList<>(ids.descendingSet());
    }

    @Transactional(readOnly = true)
    public long countRenderEvents(long traceTime) { return renderRepo.countByTraceTime(traceTime); }

    @Transactional(readOnly = true)
    public long countTraceEntries(long traceTime) { return traceRepo.countByTraceTime(traceTime); }

    @Transactional(readOnly = true)
    public long approxRenderEventBytes() { return renderRepo.sumApproxBytes(); }

    @Transactional(readOnly = true)
    public long approxTraceEntryBytes() { return traceRepo.sumApproxBytes(); }

    // ---------- delete ----------
    public void deleteSession(long traceTime) {
        synchronized (writeLock) {
            int[] removed = tx.execute(status ->
                    new int[]{renderRepo.deleteByTraceTime(traceTime), traceRepo.deleteByTraceTime(traceTime)});
            renderCounts.remove(traceTime);
            log.info("deleted session {} ({} events, {} trace entries)", traceTime, removed[0], removed[1]);
        }
    }

    public void clearRenderEvents() {
        synchronized (writeLock) {
            tx.executeWithoutResult(status -> renderRepo.deleteAllRows());
            renderCounts.clear();
        }
    }

    public void clearTraceEntries() {
        tx.executeWithoutResult(status -> traceRepo.deleteAllRows());
    }

    public void clearAll() {
        synchronized (writeLock) {
            tx.executeWithoutResult(status -> {
                renderRepo.deleteAllRows();
                traceRepo.deleteAllRows();
            });
            renderCounts.clear();
        }
    }

    /**
     * Deletes every session older than the policy allows, relative to {@code currentTraceTime}.
     * Returns the number of rows removed.
     */
    public int sweep(long currentTraceTime, RetentionPolicy policy) {
        if (!policy.isSweepEnabled()) return 0;
        long cutoff = policy.cutoff(currentTraceTime, graceWindowMs);

        synchronized (writeLock) {
            Integer removed = tx.execute(status -> renderRepo.deleteOlderThan(cutoff) + traceRepo.deleteOlderThan(cutoff));
            renderCounts.keySet().removeIf(tt -> tt < cutoff);
            if (removed != null && removed > 0) {
                log.info("retention sweep ({}) removed {} rows older than {}", policy, removed, cutoff);
            }
            return removed == null ? 0 : removed;
        }
    }

    private long startedAt(TraceEntry entry) {
        String s = entry.getStartedDateTime();
        if (s == null || s.isBlank()) return 0L;
        try {
            return Instant.parse(s).toEpochMilli();
        } catch (DateTimeParseException e) {
            log.debug("unparseable startedDateTime '{}'", s);
            return 0L;
        }
    }

    private String toJson(Object value) {
        try {
            return om.writeValueAsString(value);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("value cannot be stored as JSON: " + e.getOriginalMessage(), e);
        }
    }

    private <T> T fromJson(String json, Class<T> type) {
        try {
            return om.readValue(json, type);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("corrupt stored row: " + e.getOriginalMessage(), e);
        }
    }
}
