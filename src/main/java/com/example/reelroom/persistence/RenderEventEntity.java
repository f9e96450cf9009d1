package com.example.reelroom.persistence;

import javax.persistence.*;

@Entity
@Table(name = "rr_render_event", indexes = {
        @Index(name = "idx_render_trace_time", columnList = "traceTime"),
        @Index(name = "idx_render_trace_ts", columnList = "traceTime,tsEpochMs")
})
public class RenderEventEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    // session id: epoch ms at which the recording session started
    private long traceTime;

    private int eventType;

    private long tsEpochMs;

    @Lob
    @Column
    private String payloadJson;

    protected RenderEventEntity() {}

    public RenderEventEntity(long traceTime, int eventType, long tsEpochMs, String payloadJson) {
        this.traceTime = traceTime;
        this.eventType = eventType;
        this.tsEpochMs = tsEpochMs;
        this.payloadJson = payloadJson;
    }

    public Long getId() { return id; }
    public long getTraceTime() { return traceTime; }
    public int getEventType() { return eventType; }
    public long getTsEpochMs() { return tsEpochMs; }
    public String getPayloadJson() { return payloadJson; }
}
