package com.example.reelroom.archive;

public class PackagedArchive {

    private final byte[] bytes;
    private final String fileName;
    private final long uncompressedSize;
    private final int sessionCount;
    private final int eventCount;
    private final int traceEntryCount;
    private final int droppedEvents;

    public PackagedArchive(byte[] bytes, String fileName, long uncompressedSize, int sessionCount,
                           int eventCount, int traceEntryCount, int droppedEvents) {
        this.bytes = bytes;
        this.fileName = fileName;
        this.uncompressedSize = uncompressedSize;
        this.sessionCount = sessionCount;
        this.eventCount = eventCount;
        this.traceEntryCount = traceEntryCount;
        this.droppedEvents = droppedEvents;
    }

    public byte[] getBytes() { return bytes; }
    public String getFileName() { return fileName; }
    public long getSize() { return bytes.length; }
    public long getUncompressedSize() { return uncompressedSize; }
    public int getSessionCount() { return sessionCount; }
    public int getEventCount() { return eventCount; }
    public int getTraceEntryCount() { return traceEntryCount; }
    public int getDroppedEvents() { return droppedEvents; }
}
