package com.example.reelroom.model;

import java.util.List;

public class ConsoleLogRequest {
    private String type; // "console"
    private String level; // log|info|warn|error|debug
    private List<String> payload;
    private Long ts;

    public ConsoleLogRequest() {}

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }

    public String getLevel() { return level; }
    public void setLevel(String level) { this.level = level; }

    public List<String> getPayload() { return payload; }
    public void setPayload(List<String> payload) { this.payload = payload; }

    public Long getTs() { return ts; }
    public void setTs(Long ts) { this.ts = ts; }
}
