package com.example.reelroom.api;

import com.example.reelroom.model.ConsoleLogRequest;
import com.example.reelroom.model.RecordCollection;
import com.example.reelroom.model.RecorderStatus;
import com.example.reelroom.model.RenderEventBatch;
import com.example.reelroom.model.UploadResponse;
import com.example.reelroom.service.SessionRecorder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequestMapping("/api/recorder")
public class RecorderApiController {

    private static final Logger log = LoggerFactory.getLogger(RecorderApiController.class);

    private final SessionRecorder recorder;

    public RecorderApiController(SessionRecorder recorder) {
        this.recorder = recorder;
    }

    @GetMapping(value = "/status", produces = MediaType.APPLICATION_JSON_VALUE)
    public RecorderStatus status() {
        return recorder.status();
    }

    @PostMapping(value = "/start", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> start() {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("sessionId", recorder.start());
        return m;
    }

    @PostMapping(value = "/stop", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> stop() {
        recorder.stop();
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("ok", true);
        return m;
    }

    @PostMapping(value = "/events", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> events(@RequestBody RenderEventBatch batch) {
        requireRunning();
        int saved = batch.getEvents() == null ? 0 : recorder.recordBatch(batch.getEvents());
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("saved", saved);
        return m;
    }

    @PostMapping(value = "/console", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> console(@RequestBody ConsoleLogRequest req) {
        requireRunning();
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("saved", recorder.recordConsole(req.getLevel(), req.getPayload(), req.getTs()));
        return m;
    }

    @PostMapping(value = "/export", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> export(@RequestParam(name = "clear", defaultValue = "true") boolean clear) {
        requireRunning();
        Path file = recorder.exportLog(clear);
        if (file == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "current session has no data");
        }
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("file", file.toString());
        return m;
    }

    @PostMapping(value = "/upload", produces = MediaType.APPLICATION_JSON_VALUE)
    public UploadResponse upload(@RequestParam(name = "clear", defaultValue = "true") boolean clear) {
        requireRunning();
        UploadResponse res = recorder.uploadLog(clear, p -> log.debug("upload progress {}%", Math.round(p)), null);
        if (res == null) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "current session has no data");
        }
        return res;
    }

    @PostMapping(value = "/import", consumes = MediaType.MULTIPART_FORM_DATA_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> importArchive(@RequestParam("file") MultipartFile file,
                                             @RequestParam(name = "clearBefore", defaultValue = "false") boolean clearBefore) throws IOException {
        if (file.isEmpty()) {
            throw new IllegalArgumentException("file is empty");
        }
        RecordCollection imported = recorder.importLog(file.getBytes(), clearBefore);
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("sessions", imported.sessionIds());
        return m;
    }

    @DeleteMapping(value = "/sessions/{sessionId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> deleteSession(@PathVariable long sessionId) {
        recorder.deleteSession(sessionId);
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("deleted", sessionId);
        return m;
    }

    @DeleteMapping(value = "/sessions", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> clear() {
        recorder.clearAll();
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("ok", true);
        return m;
    }

    private void requireRunning() {
        if (recorder.currentSessionId() == null) {
            throw new ResponseStatusException(HttpStatus.CONFLICT, "recorder is not running");
        }
    }
}
