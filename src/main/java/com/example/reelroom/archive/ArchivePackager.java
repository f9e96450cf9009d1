package com.example.reelroom.archive;

import com.example.reelroom.config.ReelroomProperties;
import com.example.reelroom.model.RenderEvent;
import com.example.reelroom.model.SessionData;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.Deflater;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;

/**
 * Serializes sessions into {@code data.json} and zips it. Identical input gives identical bytes.
 */
@Component
public class ArchivePackager {

    private static final Logger log = LoggerFactory.getLogger(ArchivePackager.class);

    public static final String DATA_ENTRY = "data.json";
    public static final String MANIFEST_ENTRY = "manifest.json";

    static final int SLICE = 64 * 1024;
    // 1980-01-01T00:00:00Z, the earliest time a zip entry can carry
    private static final long ENTRY_TIME = 315532800000L;

    private final int maxEvents;
    private final Clock clock;
    private final ObjectMapper om = new ObjectMapper();

    public ArchivePackager(ReelroomProperties props, Clock clock) {
        this.maxEvents = props.getStore().getMaxEventsPerSession();
        this.clock = clock;
    }

    public PackagedArchive pack(Map<Long, SessionData> sessions, ProgressListener progress) {
        Map<String, SessionData> doc = new LinkedHashMap<>();
        int events = 0;
        int entries = 0;
        int dropped = 0;

        for (Map.Entry<Long, SessionData> s : sessions.entrySet()) {
            List<RenderEvent> ev = s.getValue().getEventData();
            if (ev.size() > maxEvents) {
                int over = ev.size() - maxEvents;
                log.warn("session {} has {} render events, keeping the latest {}", s.getKey(), ev.size(), maxEvents);
                ev = new ArrayList<>(ev.subList(over, ev.size()));
                dropped += over;
            }
            doc.put(String.valueOf(s.getKey()), new SessionData(ev, s.getValue().getResponseData()));
            events += ev.size();
            entries += s.getValue().getResponseData().size();
        }

        byte[] json;
        byte[] manifest;
        try {
            json = om.writerWithDefaultPrettyPrinter().writeValueAsBytes(doc);
            manifest = om.writerWithDefaultPrettyPrinter().writeValueAsBytes(new ArchiveManifest(new ArrayList<>(doc.keySet())));
        } catch (JsonProcessingException e) {
            throw new ArchiveException("Failed to serialize session data: " + e.getOriginalMessage(), e);
        }

        byte[] zipped = zip(manifest, json, progress == null ? ProgressListener.NONE : progress);
        String fileName = "record-" + clock.millis() + ".zip";
        log.info("packaged {} session(s) into {} ({} -> {} bytes)", doc.size(), fileName, json.length, zipped.length);
        return new PackagedArchive(zipped, fileName, json.length, doc.size(), events, entries, dropped);
    }

    private byte[] zip(byte[] manifest, byte[] json, ProgressListener progress) {
        ByteArrayOutputStream bos = new ByteArrayOutputStream(Math.max(1024, json.length / 4));
        try (ZipOutputStream zos = new ZipOutputStream(bos)) {
            zos.setLevel(Deflater.BEST_COMPRESSION);

            ZipEntry m = new ZipEntry(MANIFEST_ENTRY);
            m.setTime(ENTRY_TIME);
            zos.putNextEntry(m);
            zos.write(manifest);
            zos.closeEntry();

            ZipEntry d = new ZipEntry(DATA_ENTRY);
            d.setTime(ENTRY_TIME);
            zos.putNextEntry(d);
            progress.onProgress(0);
            for (int off = 0; off < json.length; off += SLICE) {
                int len = Math.min(SLICE, json.length - off);
                zos.write(json, off, len);
                progress.onProgress((off + len) * 100.0 / json.length);
            }
            zos.closeEntry();
        } catch (IOException e) {
            throw new ArchiveException("Failed to compress session data", e);
        }
        progress.onProgress(100);
        return bos.toByteArray();
    }
}
