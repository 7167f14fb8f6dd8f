package com.example.logrelay.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Progress of one pipeline stage. Immutable.
 */
public final class ProgressRecord {
    private final String pipelineId;
    private final String stageId;
    private final ProgressStatus status;
    private final int percentage;
    private final String message;
    private final Instant timestamp;
    private final Instant startedAt;    // optional
    private final Instant completedAt;  // optional
    private final String errorMessage;  // optional

    public ProgressRecord(String pipelineId, String stageId, ProgressStatus status, int percentage, String message,
                          Instant timestamp, Instant startedAt, Instant completedAt, String errorMessage) {
        if (percentage < 0 || percentage > 100) {
            throw new IllegalArgumentException("percentage out of range: " + percentage);
        }
        this.pipelineId = Objects.requireNonNull(pipelineId, "pipelineId");
        this.stageId = Objects.requireNonNull(stageId, "stageId");
        this.status = Objects.requireNonNull(status, "status");
        this.percentage = percentage;
        this.message = message == null ? "" : message;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.startedAt = startedAt;
        this.completedAt = completedAt;
        this.errorMessage = errorMessage;
    }

    public String getPipelineId() { return pipelineId; }
    public String getStageId() { return stageId; }
    public ProgressStatus getStatus() { return status; }
    public int getPercentage() { return percentage; }
    public String getMessage() { return message; }
    public Instant getTimestamp() { return timestamp; }
    public Instant getStartedAt() { return startedAt; }
    public Instant getCompletedAt() { return completedAt; }
    public String getErrorMessage() { return errorMessage; }

    /**
     * True when stage, status and percentage are the same as {@code other}'s.
     */
    public boolean sameStateAs(ProgressRecord other) {
        return other != null
                && stageId.equals(other.stageId)
                && status.equals(other.status)
                && percentage == other.percentage;
    }

    @Override
    public String toString() {
        return "ProgressRecord{pipelineId=" + pipelineId + ", stageId=" + stageId + ", status=" + status
                + ", percentage=" + percentage + '}';
    }
}
