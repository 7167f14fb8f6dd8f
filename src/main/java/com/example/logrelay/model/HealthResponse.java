package com.example.logrelay.model;

public class HealthResponse {
    private final String status;
    private final long timestampMs;
    private final int activeConnections;
    private final int activeStreams;

    public HealthResponse(String status, long timestampMs, int activeConnections, int activeStreams) {
        this.status = status;
        this.timestampMs = timestampMs;
        this.activeConnections = activeConnections;
        this.activeStreams = activeStreams;
    }

    public String getStatus() { return status; }
    public long getTimestampMs() { return timestampMs; }
    public int getActiveConnections() { return activeConnections; }
    public int getActiveStreams() { return activeStreams; }
}
