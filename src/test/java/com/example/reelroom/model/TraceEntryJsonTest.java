package com.example.reelroom.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TraceEntryJsonTest {

    private final ObjectMapper om = new ObjectMapper();

    private static final String THIRD_PARTY_ENTRY = "{"
            + "\"pageref\":\"page_1\",\"_initiator\":{\"type\":\"script\"},"
            + "\"startedDateTime\":\"2023-11-14T22:13:20Z\",\"time\":12,"
            + "\"request\":{\"method\":\"GET\",\"url\":\"https://api.example.com/a\",\"comment\":\"first\","
            + "\"headers\":[{\"name\":\"Accept\",\"value\":\"*/*\",\"comment\":\"default\"}]},"
            + "\"response\":{\"status\":200,\"statusText\":\"OK\",\"_transferSize\":512,"
            + "\"content\":{\"size\":3,\"mimeType\":\"text/plain\",\"text\":\"abc\",\"compression\":0}},"
            + "\"timings\":{\"send\":1,\"wait\":10,\"receive\":1,\"ssl\":-1},"
            + "\"serverIPAddress\":\"10.0.0.1\"}";

    @Test
    void unknownHarMembersSurviveReadAndWrite() throws Exception {
        TraceEntry entry = om.readValue(THIRD_PARTY_ENTRY, TraceEntry.class);

        assertEquals(200, entry.getResponse().getStatus());
        assertEquals("page_1", entry.extraFields().get("pageref"));

        JsonNode out = om.readTree(om.writeValueAsString(entry));
        assertEquals("page_1", out.path("pageref").asText());
        assertEquals("script", out.at("/_initiator/type").asText());
        assertEquals("10.0.0.1", out.path("serverIPAddress").asText());
        assertEquals("first", out.at("/request/comment").asText());
        assertEquals("default", out.at("/request/headers/0/comment").asText());
        assertEquals(512, out.at("/response/_transferSize").asInt());
        assertEquals(0, out.at("/response/content/compression").asInt());
        assertEquals(-1, out.at("/timings/ssl").asInt());
    }

    @Test
    void capturedEntryHasNoExtraMembers() throws Exception {
        TraceEntry entry = new TraceEntry();
        entry.setKind(TransportKind.FETCH);
        entry.getRequest().setMethod("GET");
        entry.getRequest().setUrl("https://api.example.com/a");

        JsonNode out = om.readTree(om.writeValueAsString(entry));

        assertFalse(out.has("extraFields"));
        assertEquals("fetch", out.path("_type").asText());
        assertEquals(-1, out.at("/request/headersSize").asInt());
    }
}
