package com.example.reelroom.transfer;

import java.time.Duration;

/**
 * Cooperative cancellation for a transfer, with an optional deadline. Checked by the transfer at
 * each request, read and backoff.
 */
public final class CancellationToken {

    private final long deadlineNanos;
    private final boolean hasDeadline;
    private volatile boolean cancelled;

    private CancellationToken(long deadlineNanos, boolean hasDeadline) {
        this.deadlineNanos = deadlineNanos;
        this.hasDeadline = hasDeadline;
    }

    public static CancellationToken create() {
        return new CancellationToken(0, false);
    }

    public static CancellationToken withTimeout(Duration timeout) {
        return new CancellationToken(System.nanoTime() + timeout.toNanos(), true);
    }

    public void cancel() {
        cancelled = true;
    }

    public boolean isCancelled() {
        return cancelled || isExpired();
    }

    public void throwIfCancelled() {
        if (cancelled) throw new TransferCancelledException("Transfer cancelled");
        if (isExpired()) throw new TransferCancelledException("Transfer deadline exceeded");
    }

    private boolean isExpired() {
        return hasDeadline && System.nanoTime() - deadlineNanos >= 0;
    }
}
