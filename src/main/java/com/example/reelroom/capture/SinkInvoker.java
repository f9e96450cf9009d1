package com.example.reelroom.capture;

import com.example.reelroom.model.TraceEntry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Calls the capture listener without ever letting it break the intercepted call.
 */
final class SinkInvoker {

    private static final Logger log = LoggerFactory.getLogger(SinkInvoker.class);

    private SinkInvoker() {}

    static void started(CaptureListener sink, PendingCall call) {
        try {
            sink.onRequestStart(call);
        } catch (RuntimeException e) {
            log.error("capture listener failed on start of {} {}", call.getMethod(), call.getUri(), e);
        }
    }

    static void completed(CaptureListener sink, TraceEntry entry) {
        try {
            sink.onRequestComplete(entry);
        } catch (RuntimeException e) {
            log.error("capture listener failed for {} {}", entry.getRequest().getMethod(), entry.getRequest().getUrl(), e);
        }
    }
}
