package com.example.reelroom.capture;

import com.example.reelroom.model.TransportKind;
import org.springframework.http.HttpHeaders;

import java.net.URI;

/**
 * A call that has been sent but not yet answered. Carries what the entry needs from the
 * request side, so completion never has to look anything up.
 */
public final class PendingCall {

    private final String correlationId;
    private final TransportKind kind;
    private final String method;
    private final URI uri;
    private final HttpHeaders requestHeaders;
    private final byte[] requestBody;
    private final long startedAtEpochMs;

    PendingCall(String correlationId, TransportKind kind, String method, URI uri,
                HttpHeaders requestHeaders, byte[] requestBody, long startedAtEpochMs) {
        this.correlationId = correlationId;
        this.kind = kind;
        this.method = method;
        this.uri = uri;
        this.requestHeaders = requestHeaders;
        this.requestBody = requestBody;
        this.startedAtEpochMs = startedAtEpochMs;
    }

    public String getCorrelationId() { return correlationId; }
    public TransportKind getKind() { return kind; }
    public String getMethod() { return method; }
    public URI getUri() { return uri; }
    public HttpHeaders getRequestHeaders() { return requestHeaders; }
    public byte[] getRequestBody() { return requestBody; }
    public long getStartedAtEpochMs() { return startedAtEpochMs; }
}
