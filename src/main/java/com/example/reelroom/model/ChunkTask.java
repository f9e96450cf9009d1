package com.example.reelroom.model;

/**
 * One byte range [start, end] of a download. Both ends are inclusive.
 */
public class ChunkTask {

    private final int index;
    private final long start;
    private final long end;
    private ChunkStatus status = ChunkStatus.PENDING;
    private long loaded;

    public ChunkTask(int index, long start, long end) {
        this.index = index;
        this.start = start;
        this.end = end;
    }

    private ChunkTask(ChunkTask other) {
        this(other.index, other.start, other.end);
        this.status = other.status;
        this.loaded = other.loaded;
    }

    public int getIndex() { return index; }
    public long getStart() { return start; }
    public long getEnd() { return end; }
    public long getLength() { return end - start + 1; }

    public ChunkStatus getStatus() { return status; }
    public void setStatus(ChunkStatus status) { this.status = status; }

    public long getLoaded() { return loaded; }
    public void setLoaded(long loaded) { this.loaded = loaded; }

    public String rangeHeader() {
        return "bytes=" + start + "-" + end;
    }

    public ChunkTask snapshot() {
        return new ChunkTask(this);
    }
}
