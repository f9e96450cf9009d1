package com.example.reelroom.transfer;

import com.example.reelroom.config.ReelroomProperties;
import com.example.reelroom.model.ChunkTask;
import com.example.reelroom.model.DownloadProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.client.ClientHttpResponse;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Fetches a file as concurrent byte ranges with per-range retry, then stitches the ranges together.
 * Files below the chunk threshold go through one plain GET.
 */
@Component
public class ChunkedDownloader {

    private static final Logger log = LoggerFactory.getLogger(ChunkedDownloader.class);

    private static final int READ_BUFFER = 8 * 1024;
    private static final long BACKOFF_STEP_MS = 50;

    private final RestTemplate restTemplate;
    private final ReelroomProperties.Download cfg;

    public ChunkedDownloader(RestTemplate transferRestTemplate, ReelroomProperties props) {
        this.restTemplate = transferRestTemplate;
        this.cfg = props.getDownload();
    }

    public byte[] download(String url, Long knownSize, DownloadListener listener, CancellationToken token) {
        URI uri = URI.create(url);
        DownloadListener target = listener == null ? DownloadListener.NONE : listener;
        token.throwIfCancelled();

        long size = knownSize != null && knownSize >= 0 ? knownSize : probeSize(uri);
        if (size > Integer.MAX_VALUE - 8) {
            throw new DownloadException("File too large to buffer: " + size + " bytes");
        }
        if (size == 0) {
            target.onProgress(new DownloadProgress(0, 0, 100, 0, 0, Collections.emptyList()));
            return new byte[0];
        }

        List<ChunkTask> tasks = plan(size);
        boolean ranged = size >= cfg.getChunkThreshold();
        log.info("downloading {} ({} bytes, {} range(s))", url, size, tasks.size());

        ProgressTracker tracker = new ProgressTracker(size, tasks, target);
        byte[][] parts = ranged
                ? fetchAll(uri, tasks, tracker, token)
                : new byte[][]{fetchWithRetry(uri, tasks.get(0), false, tracker, token)};

        byte[] out = new byte[(int) size];
        for (int i = 0; i < tasks.size(); i++) {
            ChunkTask t = tasks.get(i);
            System.arraycopy(parts[i], 0, out, (int) t.getStart(), parts[i].length);
        }
        return out;
    }

    long probeSize(URI uri) {
        HttpHeaders headers;
        try {
            headers = restTemplate.headForHeaders(uri);
        } catch (RestClientException e) {
            throw new DownloadException("Size probe failed for " + uri, e);
        }
        long len = headers.getContentLength();
        if (len < 0) throw new DownloadException("Server did not report Content-Length for " + uri);
        return len;
    }

    /**
     * Splits [0, size) into inclusive ranges of at most chunkSize bytes. Below the threshold the
     * whole file is a single range.
     */
    List<ChunkTask> plan(long size) {
        List<ChunkTask> tasks = new ArrayList<>();
        if (size < cfg.getChunkThreshold()) {
            tasks.add(new ChunkTask(0, 0, size - 1));
            return tasks;
        }
        long chunk = cfg.getChunkSize();
        int index = 0;
        for (long start = 0; start < size; start += chunk) {
            tasks.add(new ChunkTask(index++, start, Math.min(start + chunk - 1, size - 1)));
        }
        return tasks;
    }

    private byte[][] fetchAll(URI uri, List<ChunkTask> tasks, ProgressTracker tracker, CancellationToken token) {
        int threads = Math.max(1, Math.min(cfg.getMaxConcurrent(), tasks.size()));
        ExecutorService pool = Executors.newFixedThreadPool(threads, new CustomizableThreadFactory("chunk-download-"));
        CompletionService<Integer> done = new ExecutorCompletionService<>(pool);
        byte[][] parts = new byte[tasks.size()][];
        List<Future<Integer>> futures = new ArrayList<>();

        try {
            for (ChunkTask t : tasks) {
                futures.add(done.submit(() -> {
                    parts[t.getIndex()] = fetchWithRetry(uri, t, true, tracker, token);
                    return t.getIndex();
                }));
            }
            for (int i = 0; i < tasks.size(); i++) {
                try {
                    done.take().get();
                } catch (ExecutionException e) {
                    for (Future<Integer> f : futures) f.cancel(true);
                    Throwable cause = e.getCause();
                    if (cause instanceof RuntimeException) throw (RuntimeException) cause;
                    throw new DownloadException("Chunk download failed", cause);
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            for (Future<Integer> f : futures) f.cancel(true);
            throw new TransferCancelledException("Download interrupted");
        } finally {
            pool.shutdownNow();
        }
        return parts;
    }

    private byte[] fetchWithRetry(URI uri, ChunkTask task, boolean ranged, ProgressTracker tracker, CancellationToken token) {
        int attempts = cfg.getMaxRetries() + 1;
        RestClientException last = null;

        for (int attempt = 0; attempt < attempts; attempt++) {
            token.throwIfCancelled();
            if (Thread.currentThread().isInterrupted()) throw new TransferCancelledException("Download interrupted");
            tracker.started(task.getIndex());
            try {
                byte[] data = restTemplate.execute(uri, HttpMethod.GET,
                        request -> {
                            if (ranged) request.getHeaders().set(HttpHeaders.RANGE, task.rangeHeader());
                        },
                        response -> readRange(response, task, ranged, tracker, token));
                tracker.completed(task.getIndex());
                return data;
            } catch (RestClientException e) {
                last = e;
                if (attempt + 1 < attempts) {
                    long wait = cfg.getInitialBackoffMs() << attempt;
                    log.warn("range {} ({}) attempt {} failed: {}; retrying in {} ms",
                            task.getIndex(), task.rangeHeader(), attempt + 1, e.getMessage(), wait);
                    backoff(wait, token);
                }
            }
        }
        tracker.failed(task.getIndex());
        throw new DownloadException("Range " + task.getIndex() + " (" + task.rangeHeader() + ") failed after "
                + attempts + " attempts", last);
    }

    private byte[] readRange(ClientHttpResponse response, ChunkTask task, boolean ranged,
                             ProgressTracker tracker, CancellationToken token) throws IOException {
        int status = response.getRawStatusCode();
        // a 200 to a range request carries the whole file; count it only once sliced
        boolean wholeBody = ranged && status != 206;
        if (wholeBody) {
            log.warn("range {} expected 206 but got {}", task.getIndex(), status);
        }

        ByteArrayOutputStream buf = new ByteArrayOutputStream((int) Math.min(task.getLength(), Integer.MAX_VALUE - 8));
        InputStream in = response.getBody();
        byte[] chunk = new byte[READ_BUFFER];
        int n;
        while ((n = in.read(chunk)) != -1) {
            token.throwIfCancelled();
            buf.write(chunk, 0, n);
            if (!wholeBody) tracker.add(task.getIndex(), n);
        }

        byte[] data = buf.toByteArray();
        if (wholeBody && data.length > task.getEnd()) {
            data = Arrays.copyOfRange(data, (int) task.getStart(), (int) task.getEnd() + 1);
            tracker.add(task.getIndex(), data.length);
        }
        if (data.length != task.getLength()) {
            // surfaces as ResourceAccessException, so the range is retried
            throw new IOException("range " + task.getIndex() + " expected " + task.getLength()
                    + " bytes but received " + data.length);
        }
        return data;
    }

    private void backoff(long ms, CancellationToken token) {
        long remaining = ms;
        try {
            while (remaining > 0) {
                token.throwIfCancelled();
                long step = Math.min(BACKOFF_STEP_MS, remaining);
                Thread.sleep(step);
                remaining -= step;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransferCancelledException("Download interrupted");
        }
        token.throwIfCancelled();
    }
}
