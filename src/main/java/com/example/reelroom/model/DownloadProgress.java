package com.example.reelroom.model;

import java.util.List;

public class DownloadProgress {

    private final long loaded;
    private final long total;
    private final double percentage;
    // bytes per second
    private final double speed;
    // seconds
    private final double remainingTime;
    private final List<ChunkTask> chunks;

    public DownloadProgress(long loaded, long total, double percentage, double speed, double remainingTime, List<ChunkTask> chunks) {
        this.loaded = loaded;
        this.total = total;
        this.percentage = percentage;
        this.speed = speed;
        this.remainingTime = remainingTime;
        this.chunks = chunks;
    }

    public long getLoaded() { return loaded; }
    public long getTotal() { return total; }
    public double getPercentage() { return percentage; }
    public double getSpeed() { return speed; }
    public double getRemainingTime() { return remainingTime; }
    public List<ChunkTask> getChunks() { return chunks; }
}
