package com.example.reelroom.store;

import com.example.reelroom.config.ReelroomProperties;
import com.example.reelroom.model.RenderEvent;
import com.example.reelroom.persistence.RenderEventRepository;
import com.example.reelroom.persistence.TraceEntryRepository;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs without the test-managed transaction so every append commits on its own thread.
 */
@DataJpaTest
@Transactional(propagation = Propagation.NOT_SUPPORTED)
class EventStoreConcurrencyTest {

    private static final long SESSION = 1_700_000_000_000L;
    private static final int CAP = 10;

    @Autowired
    private RenderEventRepository renderRepo;

    @Autowired
    private TraceEntryRepository traceRepo;

    @Autowired
    private PlatformTransactionManager txManager;

    private EventStore store;

    @BeforeEach
    void setUp() {
        ReelroomProperties props = new ReelroomProperties();
        props.getStore().setMaxEventsPerSession(CAP);
        store = new EventStore(renderRepo, traceRepo, txManager, props);
        store.clearAll();
    }

    @AfterEach
    void tearDown() {
        store.clearAll();
    }

    @Test
    void concurrentAppendsStayAtCap() throws Exception {
        int threads = 4;
        int perThread = 25;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        List<Future<?>> done = new ArrayList<>();
        try {
            for (int t = 0; t < threads; t++) {
                int base = t * perThread;
                done.add(pool.submit(() -> {
                    go.await();
                    for (int i = 1; i <= perThread; i++) {
                        if (i % 5 == 0) {
                            store.appendRenderEvents(SESSION, List.of(event(base + i), event(base + i + 1000)));
                        } else {
                            store.appendRenderEvent(SESSION, event(base + i));
                        }
                    }
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> f : done) f.get(30, TimeUnit.SECONDS);
        } finally {
            pool.shutdownNow();
        }

        assertEquals(CAP, store.countRenderEvents(SESSION));
        assertEquals(CAP, store.readRenderEvents(SESSION).size());
    }

    @Test
    void failedBatchLeavesCountInStep() {
        for (int ts = 1; ts <= 4; ts++) store.appendRenderEvent(SESSION, event(ts));

        ObjectNode bad = JsonNodeFactory.instance.objectNode();
        bad.put("type", 3);
        bad.putPOJO("data", new Object());
        assertThrows(IllegalArgumentException.class,
                () -> store.appendRenderEvents(SESSION, List.of(event(5), new RenderEvent(bad))));
        assertEquals(4, store.countRenderEvents(SESSION));

        for (int ts = 6; ts <= 20; ts++) store.appendRenderEvent(SESSION, event(ts));
        assertEquals(CAP, store.countRenderEvents(SESSION));
        assertEquals(11L, store.readRenderEvents(SESSION).get(0).getTimestamp());
    }

    private static RenderEvent event(long ts) {
        ObjectNode n = JsonNodeFactory.instance.objectNode();
        n.put("type", 3);
        n.put("timestamp", ts);
        n.putObject("data").put("source", 1);
        return new RenderEvent(n);
    }
}
