package com.example.reelroom.model;

import java.util.List;

public class RenderEventBatch {
    private String type; // "rrweb"
    private List<RenderEvent> events;

    public RenderEventBatch() {}

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }

    public List<RenderEvent> getEvents() { return events; }
    public void setEvents(List<RenderEvent> events) { this.events = events; }
}
