package com.example.reelroom.archive;

import com.example.reelroom.config.ReelroomProperties;
import com.example.reelroom.model.RecordCollection;
import com.example.reelroom.model.RenderEvent;
import com.example.reelroom.model.SessionData;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

import static org.junit.jupiter.api.Assertions.*;

class ArchivePackagerTest {

    private static final long NOW = 1_700_000_000_000L;

    private final Clock clock = Clock.fixed(Instant.ofEpochMilli(NOW), ZoneOffset.UTC);
    private ReelroomProperties props;
    private ArchivePackager packager;
    private ArchiveReader reader;

    @BeforeEach
    void setUp() {
        props = new ReelroomProperties();
        packager = new ArchivePackager(props, clock);
        reader = new ArchiveReader(clock);
    }

    @Test
    void packagedSessionReadsBackIdentically() {
        SessionData original = ArchiveFixtures.session(4);
        PackagedArchive archive = packager.pack(single(111L, original), ProgressListener.NONE);

        assertEquals("record-" + NOW + ".zip", archive.getFileName());
        assertEquals(1, archive.getSessionCount());
        assertEquals(4, archive.getEventCount());
        assertEquals(1, archive.getTraceEntryCount());
        assertEquals(0, archive.getDroppedEvents());

        RecordCollection back = reader.read(archive.getBytes());
        assertEquals(List.of("111"), back.sessionIds());
        SessionData s = back.getSessions().get("111");
        assertEquals(original.getEventData(), s.getEventData());
        assertEquals(1, s.getResponseData().size());
        assertEquals("https://api.example.com/cart", s.getResponseData().get(0).getRequest().getUrl());
        assertEquals("req-200", s.getResponseData().get(0).getClientRequestId());
        assertTrue(s.hasFullSnapshot());
    }

    @Test
    void archiveHoldsManifestAndData() throws Exception {
        PackagedArchive archive = packager.pack(single(111L, ArchiveFixtures.session(2)), ProgressListener.NONE);

        List<String> names = new ArrayList<>();
        try (ZipInputStream zis = new ZipInputStream(new ByteArrayInputStream(archive.getBytes()))) {
            ZipEntry e;
            while ((e = zis.getNextEntry()) != null) names.add(e.getName());
        }
        assertEquals(List.of(ArchivePackager.MANIFEST_ENTRY, ArchivePackager.DATA_ENTRY), names);
    }

    @Test
    void sameInputGivesSameBytes() {
        Map<Long, SessionData> sessions = single(111L, ArchiveFixtures.session(10));
        assertArrayEquals(packager.pack(sessions, ProgressListener.NONE).getBytes(),
                packager.pack(sessions, ProgressListener.NONE).getBytes());
    }

    @Test
    void eventsBeyondCapAreDroppedOldestFirst() {
        props.getStore().setMaxEventsPerSession(5);
        packager = new ArchivePackager(props, clock);

        PackagedArchive archive = packager.pack(single(111L, ArchiveFixtures.session(8)), ProgressListener.NONE);

        assertEquals(3, archive.getDroppedEvents());
        List<RenderEvent> kept = reader.read(archive.getBytes()).getSessions().get("111").getEventData();
        assertEquals(5, kept.size());
        assertEquals(4, kept.get(0).getTimestamp());
        assertEquals(8, kept.get(4).getTimestamp());
    }

    @Test
    void serializationFailureProducesNoArchive() {
        ObjectNode bad = JsonNodeFactory.instance.objectNode();
        bad.put("type", 3);
        bad.putPOJO("data", new Object());
        SessionData data = ArchiveFixtures.session(2);
        data.getEventData().add(new RenderEvent(bad));

        List<Double> progress = new ArrayList<>();
        assertThrows(ArchiveException.class, () -> packager.pack(single(111L, data), progress::add));
        assertTrue(progress.isEmpty());
    }

    @Test
    void progressIsMonotonicAndScaled() {
        SessionData big = ArchiveFixtures.session(1);
        for (int i = 0; i < 400; i++) {
            ObjectNode n = JsonNodeFactory.instance.objectNode();
            n.put("type", 3);
            n.put("timestamp", 10 + i);
            n.put("blob", "x".repeat(1000) + i);
            big.getEventData().add(new RenderEvent(n));
        }

        List<Double> seen = new ArrayList<>();
        ProgressListener outer = seen::add;
        packager.pack(single(111L, big), outer.scaled(0, 50));

        assertTrue(seen.size() > 3, "expected several progress callbacks");
        for (int i = 1; i < seen.size(); i++) {
            assertTrue(seen.get(i) >= seen.get(i - 1));
        }
        assertEquals(0.0, seen.get(0));
        assertEquals(50.0, seen.get(seen.size() - 1));
    }

    private static Map<Long, SessionData> single(long id, SessionData data) {
        Map<Long, SessionData> m = new LinkedHashMap<>();
        m.put(id, data);
        return m;
    }
}
