package com.example.reelroom.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.ArrayList;
import java.util.List;

/**
 * Everything recorded for one session, in archive order.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonPropertyOrder({"eventData", "responseData"})
public class SessionData {

    private List<RenderEvent> eventData = new ArrayList<>();
    private List<TraceEntry> responseData = new ArrayList<>();

    public SessionData() {}

    public SessionData(List<RenderEvent> eventData, List<TraceEntry> responseData) {
        setEventData(eventData);
        setResponseData(responseData);
    }

    public List<RenderEvent> getEventData() { return eventData; }
    public void setEventData(List<RenderEvent> eventData) {
        this.eventData = eventData == null ? new ArrayList<>() : eventData;
    }

    public List<TraceEntry> getResponseData() { return responseData; }
    public void setResponseData(List<TraceEntry> responseData) {
        this.responseData = responseData == null ? new ArrayList<>() : responseData;
    }

    @JsonIgnore
    public boolean isEmpty() {
        return eventData.isEmpty() && responseData.isEmpty();
    }

    /** Replay can only start from a full DOM snapshot. */
    @JsonIgnore
    public boolean hasFullSnapshot() {
        for (RenderEvent e : eventData) {
            if (e.isFullSnapshot()) return true;
        }
        return false;
    }
}
