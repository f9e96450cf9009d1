package com.example.reelroom.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sessions keyed by session id, as they appear in an archive's {@code data.json}.
 */
public class RecordCollection {

    private final Map<String, SessionData> sessions;

    public RecordCollection(Map<String, SessionData> sessions) {
        this.sessions = new LinkedHashMap<>(sessions);
    }

    @JsonValue
    public Map<String, SessionData> getSessions() { return sessions; }

    public List<String> sessionIds() { return new ArrayList<>(sessions.keySet()); }

    public boolean isEmpty() { return sessions.isEmpty(); }

    /**
     * Session ids are start timestamps, so the numerically largest one is the newest.
     * Non-numeric ids fall back to document order.
     */
    public SessionData latestSession() {
        String best = null;
        long bestTs = Long.MIN_VALUE;
        for (String id : sessions.keySet()) {
            try {
                long ts = Long.parseLong(id);
                if (ts >= bestTs) {
                    bestTs = ts;
                    best = id;
                }
            } catch (NumberFormatException e) {
                if (best == null || bestTs == Long.MIN_VALUE) best = id;
            }
        }
        return best == null ? null : sessions.get(best);
    }
}
