package com.example.reelroom.transfer;

import com.example.reelroom.model.ChunkStatus;
import com.example.reelroom.model.ChunkTask;
import com.example.reelroom.model.DownloadProgress;

import java.util.ArrayList;
import java.util.List;

/**
 * Aggregates per-range progress. All mutation and reporting happens under this object's lock, so
 * the listener sees one consistent snapshot at a time and reported bytes never go backwards, even
 * when a retried range starts over.
 */
final class ProgressTracker {

    private final long total;
    private final List<ChunkTask> chunks;
    private final DownloadListener listener;

    private long firstByteNanos = -1;
    private long reported;

    ProgressTracker(long total, List<ChunkTask> chunks, DownloadListener listener) {
        this.total = total;
        this.chunks = chunks;
        this.listener = listener;
    }

    synchronized void started(int index) {
        ChunkTask c = chunks.get(index);
        c.setStatus(ChunkStatus.DOWNLOADING);
        c.setLoaded(0);
    }

    synchronized void add(int index, long bytes) {
        if (bytes <= 0) return;
        if (firstByteNanos < 0) firstByteNanos = System.nanoTime();
        ChunkTask c = chunks.get(index);
        c.setLoaded(c.getLoaded() + bytes);
        publish();
    }

    synchronized void completed(int index) {
        ChunkTask c = chunks.get(index);
        c.setStatus(ChunkStatus.COMPLETED);
        c.setLoaded(c.getLength());
        publish();
    }

    synchronized void failed(int index) {
        chunks.get(index).setStatus(ChunkStatus.ERROR);
        publish();
    }

    synchronized long getReported() { return reported; }

    private void publish() {
        long sum = 0;
        for (ChunkTask c : chunks) sum += c.getLoaded();
        reported = Math.min(total, Math.max(reported, sum));

        double elapsedSec = firstByteNanos < 0 ? 0 : (System.nanoTime() - firstByteNanos) / 1_000_000_000.0;
        double speed = elapsedSec > 0 ? reported / elapsedSec : 0;
        double remaining = speed > 0 ? (total - reported) / speed : 0;
        double pct = total == 0 ? 100 : reported * 100.0 / total;

        List<ChunkTask> copy = new ArrayList<>(chunks.size());
        for (ChunkTask c : chunks) copy.add(c.snapshot());
        listener.onProgress(new DownloadProgress(reported, total, pct, speed, remaining, copy));
    }
}
