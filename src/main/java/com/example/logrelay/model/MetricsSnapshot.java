package com.example.logrelay.model;

public class MetricsSnapshot {
    private final int activeConnections;
    private final int activeStreams;
    private final double messagesPerSecond;
    private final double averageLatencyMs;
    private final double errorRate;        // errors per second over the last window
    private final double memoryUsageMb;
    private final long totalMessages;
    private final long totalErrors;
    private final long droppedMessages;
    private final long sampledAtEpochMs;

    public MetricsSnapshot(int activeConnections, int activeStreams, double messagesPerSecond, double averageLatencyMs,
                           double errorRate, double memoryUsageMb, long totalMessages, long totalErrors,
                           long droppedMessages, long sampledAtEpochMs) {
        this.activeConnections = activeConnections;
        this.activeStreams = activeStreams;
        this.messagesPerSecond = messagesPerSecond;
        this.averageLatencyMs = averageLatencyMs;
        this.errorRate = errorRate;
        this.memoryUsageMb = memoryUsageMb;
        this.totalMessages = totalMessages;
        this.totalErrors = totalErrors;
        this.droppedMessages = droppedMessages;
        this.sampledAtEpochMs = sampledAtEpochMs;
    }

    public int getActiveConnections() { return activeConnections; }
    public int getActiveStreams() { return activeStreams; }
    public double getMessagesPerSecond() { return messagesPerSecond; }
    public double getAverageLatencyMs() { return averageLatencyMs; }
    public double getErrorRate() { return errorRate; }
    public double getMemoryUsageMb() { return memoryUsageMb; }
    public long getTotalMessages() { return totalMessages; }
    public long getTotalErrors() { return totalErrors; }
    public long getDroppedMessages() { return droppedMessages; }
    public long getSampledAtEpochMs() { return sampledAtEpochMs; }
}
