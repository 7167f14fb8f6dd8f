package com.example.logrelay.delivery;

import java.util.Map;

/**
 * One event bound for a client: a type ("log", "progress", "error",
 * "complete", "heartbeat", ...) and a JSON-ready payload.
 */
public final class StreamEvent {
    private final String type;
    private final Map<String, Object> payload;

    public StreamEvent(String type, Map<String, Object> payload) {
        this.type = type;
        this.payload = payload;
    }

    public String getType() { return type; }
    public Map<String, Object> getPayload() { return payload; }

    @Override
    public String toString() {
        return "StreamEvent{type=" + type + '}';
    }
}
