package com.example.reelroom.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which outbound primitive produced a trace entry.
 */
public enum TransportKind {

    /** low-level request object ({@code ClientHttpRequestFactory}) */
    REQUEST_OBJECT("xhr"),

    /** high-level call ({@code RestTemplate}) */
    FETCH("fetch");

    private final String harType;

    TransportKind(String harType) {
        this.harType = harType;
    }

    @JsonValue
    public String getHarType() { return harType; }

    @JsonCreator
    public static TransportKind fromHarType(String value) {
        for (TransportKind k : values()) {
            if (k.harType.equalsIgnoreCase(value)) return k;
        }
        throw new IllegalArgumentException("unknown transport kind: " + value);
    }
}
