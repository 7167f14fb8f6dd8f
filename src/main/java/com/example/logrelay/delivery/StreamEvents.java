package com.example.logrelay.delivery;

import com.example.logrelay.model.LogRecord;
import com.example.logrelay.model.ProgressRecord;
import com.example.logrelay.upstream.UpstreamException;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds the payloads shared by the push-stream and socket transports.
 */
public final class StreamEvents {

    private StreamEvents() {}

    public static Map<String, Object> log(LogRecord r) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("jobId", r.getJobId());
        p.put("workerId", r.getWorkerId());
        p.put("timestamp", r.getTimestamp().toString());
        p.put("level", r.getLevel().name());
        p.put("source", r.getSource().wireName());
        p.put("message", r.getMessage());
        p.put("metadata", r.getMetadata());
        return p;
    }

    public static Map<String, Object> progress(ProgressRecord r) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("pipelineId", r.getPipelineId());
        p.put("stageId", r.getStageId());
        p.put("status", r.getStatus().getName());
        p.put("progressPercentage", r.getPercentage());
        p.put("message", r.getMessage());
        p.put("timestamp", r.getTimestamp().toString());
        p.put("startedAt", iso(r.getStartedAt()));
        p.put("completedAt", iso(r.getCompletedAt()));
        p.put("errorMessage", r.getErrorMessage());
        return p;
    }

    public static Map<String, Object> error(String key, UpstreamException e, Instant now) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("key", key);
        p.put("status", e.getStatus().name());
        p.put("message", e.getMessage());
        p.put("timestamp", now.toString());
        return p;
    }

    public static Map<String, Object> complete(String key, Instant now) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("key", key);
        p.put("message", "stream completed");
        p.put("timestamp", now.toString());
        return p;
    }

    public static Map<String, Object> heartbeat(Instant now) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("timestamp", now.toString());
        return p;
    }

    private static String iso(Instant t) {
        return t == null ? null : t.toString();
    }
}
