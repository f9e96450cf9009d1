package com.example.reelroom.archive;

/**
 * Receives progress as a percentage in [0, 100].
 */
@FunctionalInterface
public interface ProgressListener {

    ProgressListener NONE = percent -> {};

    void onProgress(double percent);

    /**
     * Maps this listener's 0..100 onto {@code from..to} of the target, e.g. compression reporting
     * into the first half of a combined package-and-upload bar.
     */
    default ProgressListener scaled(double from, double to) {
        ProgressListener target = this;
        return percent -> target.onProgress(from + (to - from) * Math.max(0, Math.min(100, percent)) / 100.0);
    }
}
