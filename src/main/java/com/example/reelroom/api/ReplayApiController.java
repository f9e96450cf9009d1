package com.example.reelroom.api;

import com.example.reelroom.archive.ArchiveReader;
import com.example.reelroom.config.ReelroomProperties;
import com.example.reelroom.model.RecordCollection;
import com.example.reelroom.model.ReplayFetchRequest;
import com.example.reelroom.model.SessionData;
import com.example.reelroom.transfer.CancellationToken;
import com.example.reelroom.transfer.ChunkedDownloader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Duration;

/**
 * Pulls an uploaded archive back for replay.
 */
@RestController
@RequestMapping("/api/replay")
public class ReplayApiController {

    private static final Logger log = LoggerFactory.getLogger(ReplayApiController.class);

    private final ChunkedDownloader downloader;
    private final ArchiveReader reader;
    private final Duration fetchTimeout;

    public ReplayApiController(ChunkedDownloader downloader, ArchiveReader reader, ReelroomProperties props) {
        this.downloader = downloader;
        this.reader = reader;
        this.fetchTimeout = Duration.ofMillis(props.getDownload().getTimeoutMs());
    }

    @PostMapping(value = "/fetch", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public RecordCollection fetch(@RequestBody ReplayFetchRequest req) {
        String url = req.getUrl() == null ? "" : req.getUrl().trim();
        if (!(url.startsWith("http://") || url.startsWith("https://"))) {
            throw new IllegalArgumentException("url must be absolute http(s): " + url);
        }

        byte[] bytes = downloader.download(url, req.getFileSize(),
                p -> log.debug("replay fetch {}: {}%", url, Math.round(p.getPercentage())),
                CancellationToken.withTimeout(fetchTimeout));
        RecordCollection records = reader.read(bytes);

        SessionData latest = records.latestSession();
        if (latest == null) {
            throw new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY, "archive contains no sessions");
        }
        if (!latest.hasFullSnapshot()) {
            throw new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY, "no full snapshot in session, cannot replay");
        }
        return records;
    }
}
