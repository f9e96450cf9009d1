package com.example.reelroom.archive;

import com.example.reelroom.model.RecordCollection;
import com.example.reelroom.model.SessionData;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Opens an archive (zip or bare JSON) and returns its sessions in the keyed layout.
 */
@Component
public class ArchiveReader {

    private static final Logger log = LoggerFactory.getLogger(ArchiveReader.class);

    private final LegacyDocumentNormalizer legacy;
    private final ObjectMapper om = new ObjectMapper();

    public ArchiveReader(Clock clock) {
        this.legacy = new LegacyDocumentNormalizer(clock);
    }

    public RecordCollection read(Path file) {
        try {
            return read(Files.readAllBytes(file));
        } catch (IOException e) {
            throw new ArchiveException("Cannot read archive " + file, e);
        }
    }

    public RecordCollection read(byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            throw new ArchiveException("Archive is empty");
        }
        if (isZip(bytes)) return readZip(bytes);
        return toCollection(parse(bytes), false);
    }

    private RecordCollection readZip(byte[] bytes) {
        byte[] data = null;
        byte[] fallback = null;
        boolean hasManifest = false;

        try (ZipInputStream zis = new ZipInputStream(new ByteArrayInputStream(bytes))) {
            ZipEntry entry;
            while ((entry = zis.getNextEntry()) != null) {
                if (entry.isDirectory()) continue;
                String name = entry.getName();
                String base = name.substring(name.lastIndexOf('/') + 1);
                if (ArchivePackager.MANIFEST_ENTRY.equals(base)) {
                    ArchiveManifest m = om.readValue(StreamUtils.copyToByteArray(zis), ArchiveManifest.class);
                    hasManifest = ArchiveManifest.FORMAT.equals(m.getFormat());
                    if (m.getVersion() > ArchiveManifest.VERSION) {
                        log.warn("archive manifest version {} is newer than {}, reading anyway", m.getVersion(), ArchiveManifest.VERSION);
                    }
                } else if (ArchivePackager.DATA_ENTRY.equals(base)) {
                    data = StreamUtils.copyToByteArray(zis);
                } else if (fallback == null && base.endsWith(".json")) {
                    fallback = StreamUtils.copyToByteArray(zis);
                }
            }
        } catch (IOException e) {
            throw new ArchiveException("Corrupt archive", e);
        }

        if (data == null) data = fallback;
        if (data == null) throw new ArchiveException("No JSON data found in archive");
        return toCollection(parse(data), hasManifest);
    }

    private RecordCollection toCollection(JsonNode root, boolean keyed) {
        ObjectNode doc;
        if (keyed) {
            if (!root.isObject()) throw new ArchiveException("Archive data must be a JSON object");
            doc = (ObjectNode) root;
        } else {
            doc = legacy.normalize(root);
        }

        Map<String, SessionData> sessions = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> it = doc.fields();
        while (it.hasNext()) {
            Map.Entry<String, JsonNode> e = it.next();
            try {
                sessions.put(e.getKey(), om.treeToValue(e.getValue(), SessionData.class));
            } catch (JsonProcessingException | IllegalArgumentException ex) {
                throw new ArchiveException("Invalid session " + e.getKey() + " in archive", ex);
            }
        }
        return new RecordCollection(sessions);
    }

    private JsonNode parse(byte[] json) {
        try {
            return om.readTree(json);
        } catch (IOException e) {
            throw new ArchiveException("Archive data is not valid JSON", e);
        }
    }

    private static boolean isZip(byte[] b) {
        return b.length >= 4 && b[0] == 'P' && b[1] == 'K' && b[2] == 3 && b[3] == 4;
    }
}
