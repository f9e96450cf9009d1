package com.example.reelroom.persistence;

import javax.persistence.*;

@Entity
@Table(name = "rr_trace_entry", indexes = {
        @Index(name = "idx_trace_trace_time", columnList = "traceTime")
})
public class TraceEntryEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    private long traceTime;

    @Column(length = 80)
    private String clientRequestId;

    @Column(length = 16, nullable = false)
    private String method;

    @Column(length = 4096, nullable = false)
    private String url;

    private int status;

    private long startedAtEpochMs;

    @Lob
    @Column
    private String payloadJson;

    protected TraceEntryEntity() {}

    public TraceEntryEntity(long traceTime, String clientRequestId, String method, String url, int status,
                            long startedAtEpochMs, String payloadJson) {
        this.traceTime = traceTime;
        this.clientRequestId = clientRequestId;
        this.method = method;
        this.url = url;
        this.status = status;
        this.startedAtEpochMs = startedAtEpochMs;
        this.payloadJson = payloadJson;
    }

    public Long getId() { return id; }
    public long getTraceTime() { return traceTime; }
    public String getClientRequestId() { return clientRequestId; }
    public String getMethod() { return method; }
    public String getUrl() { return url; }
    public int getStatus() { return status; }
    public long getStartedAtEpochMs() { return startedAtEpochMs; }
    public String getPayloadJson() { return payloadJson; }
}
