package com.example.reelroom.transfer;

public class PayloadTooLargeException extends RuntimeException {

    private final long size;
    private final long limit;

    public PayloadTooLargeException(long size, long limit) {
        super("File too large: " + size + " bytes (limit " + limit + " bytes)");
        this.size = size;
        this.limit = limit;
    }

    public long getSize() { return size; }
    public long getLimit() { return limit; }
}
