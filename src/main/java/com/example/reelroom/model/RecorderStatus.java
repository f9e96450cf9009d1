package com.example.reelroom.model;

import java.util.List;

public class RecorderStatus {
    private final Long currentSessionId;
    private final boolean networkCaptureActive;
    private final boolean navigationCaptureActive;
    private final List<Long> sessionIds;
    private final long renderEventCount;
    private final long traceEntryCount;
    private final long approxRenderEventBytes;
    private final long approxTraceEntryBytes;

    public RecorderStatus(Long currentSessionId, boolean networkCaptureActive, boolean navigationCaptureActive,
                          List<Long> sessionIds, long renderEventCount, long traceEntryCount,
                          long approxRenderEventBytes, long approxTraceEntryBytes) {
        this.currentSessionId = currentSessionId;
        this.networkCaptureActive = networkCaptureActive;
        this.navigationCaptureActive = navigationCaptureActive;
        this.sessionIds = sessionIds;
        this.renderEventCount = renderEventCount;
        this.traceEntryCount = traceEntryCount;
        this.approxRenderEventBytes = approxRenderEventBytes;
        this.approxTraceEntryBytes = approxTraceEntryBytes;
    }

    public Long getCurrentSessionId() { return currentSessionId; }
    public boolean isNetworkCaptureActive() { return networkCaptureActive; }
    public boolean isNavigationCaptureActive() { return navigationCaptureActive; }
    public List<Long> getSessionIds() { return sessionIds; }
    // counts are for the current session only
    public long getRenderEventCount() { return renderEventCount; }
    public long getTraceEntryCount() { return traceEntryCount; }
    public long getApproxRenderEventBytes() { return approxRenderEventBytes; }
    public long getApproxTraceEntryBytes() { return approxTraceEntryBytes; }
}
