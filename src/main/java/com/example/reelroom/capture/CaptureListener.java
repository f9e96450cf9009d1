package com.example.reelroom.capture;

import com.example.reelroom.model.TraceEntry;

/**
 * Receives captured calls. Invoked on the calling thread before the response is handed back.
 */
public interface CaptureListener {

    default void onRequestStart(PendingCall call) {}

    void onRequestComplete(TraceEntry entry);
}
