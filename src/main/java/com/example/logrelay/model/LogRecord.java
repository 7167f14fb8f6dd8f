package com.example.logrelay.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One log line emitted by a worker for a job. Immutable.
 */
public final class LogRecord {
    private final String jobId;
    private final String workerId;
    private final LogLevel level;
    private final LogSource source;
    private final String message;
    private final Instant timestamp;
    private final Map<String, String> metadata;

    public LogRecord(String jobId, String workerId, LogLevel level, LogSource source,
                     String message, Instant timestamp, Map<String, String> metadata) {
        this.jobId = Objects.requireNonNull(jobId, "jobId");
        this.workerId = workerId == null ? "" : workerId;
        this.level = Objects.requireNonNull(level, "level");
        this.source = Objects.requireNonNull(source, "source");
        this.message = message == null ? "" : message;
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp");
        this.metadata = (metadata == null || metadata.isEmpty())
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public LogRecord(String jobId, String workerId, LogLevel level, LogSource source, String message, Instant timestamp) {
        this(jobId, workerId, level, source, message, timestamp, null);
    }

    public String getJobId() { return jobId; }
    public String getWorkerId() { return workerId; }
    public LogLevel getLevel() { return level; }
    public LogSource getSource() { return source; }
    public String getMessage() { return message; }
    public Instant getTimestamp() { return timestamp; }
    public Map<String, String> getMetadata() { return metadata; }

    @Override
    public String toString() {
        return "LogRecord{jobId=" + jobId + ", workerId=" + workerId + ", level=" + level
                + ", source=" + source + ", message=" + message + ", timestamp=" + timestamp + '}';
    }
}
