package com.example.reelroom.archive;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Clock;

/**
 * Older archives carry a single flat {@code {eventData, responseData}} document with no session key.
 * Those are wrapped under a synthesized session id so every reader sees the keyed layout.
 */
public class LegacyDocumentNormalizer {

    private final Clock clock;

    public LegacyDocumentNormalizer(Clock clock) {
        this.clock = clock;
    }

    public boolean isLegacy(JsonNode root) {
        return root != null && root.isObject() && root.path("eventData").isArray();
    }

    public ObjectNode normalize(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new ArchiveException("Archive data must be a JSON object");
        }
        if (!isLegacy(root)) return (ObjectNode) root;

        ObjectNode session = JsonNodeFactory.instance.objectNode();
        session.set("eventData", root.get("eventData"));
        JsonNode responses = root.path("responseData");
        session.set("responseData", responses.isArray() ? responses : JsonNodeFactory.instance.arrayNode());

        ObjectNode keyed = JsonNodeFactory.instance.objectNode();
        keyed.set(String.valueOf(clock.millis()), session);
        return keyed;
    }
}
