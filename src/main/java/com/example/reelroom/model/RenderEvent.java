package com.example.reelroom.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * An event emitted by the DOM recording engine. The payload is kept opaque; only the
 * handful of shapes the recorder itself produces or checks are recognized here.
 */
public final class RenderEvent {

    public static final int TYPE_FULL_SNAPSHOT = 2;
    public static final int TYPE_CUSTOM = 5;
    public static final int TYPE_PLUGIN = 6;

    public static final String CONSOLE_PLUGIN = "rrweb/console@1";
    public static final String URL_CHANGE_TAG = "url-change";

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ObjectNode node;

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public RenderEvent(ObjectNode node) {
        if (node == null) throw new IllegalArgumentException("render event must be a JSON object");
        this.node = node;
    }

    @JsonValue
    public ObjectNode toJson() { return node; }

    public int getType() { return node.path("type").asInt(-1); }
    public long getTimestamp() { return node.path("timestamp").asLong(0L); }

    public boolean isFullSnapshot() {
        return getType() == TYPE_FULL_SNAPSHOT;
    }

    public boolean isConsoleEvent() {
        return getType() == TYPE_PLUGIN && CONSOLE_PLUGIN.equals(node.path("data").path("plugin").asText());
    }

    public boolean isNavigationMarker() {
        return getType() == TYPE_CUSTOM && URL_CHANGE_TAG.equals(node.path("data").path("tag").asText());
    }

    public static RenderEvent custom(String tag, JsonNode payload, long timestamp) {
        ObjectNode data = NODES.objectNode();
        data.put("tag", tag);
        data.set("payload", payload == null ? NODES.objectNode() : payload);
        return of(TYPE_CUSTOM, data, timestamp);
    }

    public static RenderEvent navigation(String url, NavigationTrigger trigger, long timestamp) {
        ObjectNode payload = NODES.objectNode();
        payload.put("url", url);
        payload.put("trigger", trigger.getWireName());
        payload.put("timestamp", timestamp);
        return custom(URL_CHANGE_TAG, payload, timestamp);
    }

    public static RenderEvent consoleLog(String level, List<String> args, long timestamp) {
        ObjectNode inner = NODES.objectNode();
        inner.put("level", (level == null || level.isBlank()) ? "log" : level);
        inner.set("trace", NODES.arrayNode());
        ArrayNode values = inner.putArray("payload");
        if (args != null) {
            for (String a : args) values.add(a);
        }
        ObjectNode data = NODES.objectNode();
        data.put("plugin", CONSOLE_PLUGIN);
        data.set("payload", inner);
        return of(TYPE_PLUGIN, data, timestamp);
    }

    private static RenderEvent of(int type, ObjectNode data, long timestamp) {
        ObjectNode n = NODES.objectNode();
        n.put("type", type);
        n.set("data", data);
        n.put("timestamp", timestamp);
        return new RenderEvent(n);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof RenderEvent)) return false;
        return node.equals(((RenderEvent) o).node);
    }

    @Override
    public int hashCode() { return node.hashCode(); }

    @Override
    public String toString() { return node.toString(); }
}
