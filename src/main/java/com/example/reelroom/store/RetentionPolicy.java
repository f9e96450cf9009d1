package com.example.reelroom.store;

/**
 * How long stored sessions are kept, in whole days relative to the current session.
 * Negative keeps everything, zero keeps only the grace window, N keeps N days.
 */
public final class RetentionPolicy {

    public static final long DAY_MS = 24L * 60 * 60 * 1000;

    private final int days;

    private RetentionPolicy(int days) {
        this.days = days;
    }

    public static RetentionPolicy ofDays(int days) {
        return new RetentionPolicy(days);
    }

    public static RetentionPolicy keepForever() {
        return new RetentionPolicy(-1);
    }

    public int getDays() { return days; }

    public boolean isSweepEnabled() {
        return days >= 0;
    }

    /**
     * Sessions whose id is strictly below the returned value are expired.
     * The grace window always protects the session that just started.
     */
    public long cutoff(long currentTraceTime, long graceWindowMs) {
        if (!isSweepEnabled()) {
            throw new IllegalStateException("retention disabled, no cutoff");
        }
        return currentTraceTime - Math.max(days * DAY_MS, graceWindowMs);
    }

    @Override
    public String toString() {
        return isSweepEnabled() ? days + "d" : "forever";
    }
}
