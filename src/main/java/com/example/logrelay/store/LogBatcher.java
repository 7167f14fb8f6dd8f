package com.example.logrelay.store;

import com.example.logrelay.metrics.StreamingMetricsCollector;
import com.example.logrelay.model.LogRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Groups live log records per job and hands full batches to a
 * {@link LogBatchSink} on a separate executor. Best effort: a failing sink is
 * logged and counted, never propagated to the stream.
 */
public class LogBatcher {
    private static final Logger log = LoggerFactory.getLogger(LogBatcher.class);

    private final LogBatchSink sink;
    private final Executor executor;
    private final StreamingMetricsCollector metrics;
    private final int batchSize;

    private final Map<String, List<LogRecord>> pending = new ConcurrentHashMap<>();

    public LogBatcher(LogBatchSink sink, Executor executor, StreamingMetricsCollector metrics, int batchSize) {
        if (batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1");
        this.sink = sink;
        this.executor = executor;
        this.metrics = metrics;
        this.batchSize = batchSize;
    }

    public void append(String jobId, LogRecord record) {
        List<List<LogRecord>> full = new ArrayList<>(1);
        // add and cut happen inside compute so a concurrent flush never sees half a buffer
        pending.compute(jobId, (k, buffer) -> {
            List<LogRecord> b = buffer == null ? new ArrayList<>() : buffer;
            b.add(record);
            if (b.size() >= batchSize) {
                full.add(b);
                return null;
            }
            return b;
        });
        if (!full.isEmpty()) submit(jobId, full.get(0));
    }

    /** Persists whatever is buffered for the job. */
    public void flush(String jobId) {
        List<LogRecord> rest = pending.remove(jobId);
        if (rest != null && !rest.isEmpty()) submit(jobId, rest);
    }

    public void flushAll() {
        for (String jobId : new ArrayList<>(pending.keySet())) {
            flush(jobId);
        }
    }

    private void submit(String jobId, List<LogRecord> batch) {
        try {
            executor.execute(() -> persist(jobId, batch));
        } catch (RejectedExecutionException e) {
            log.warn("Log batch for jobId={} dropped ({} records): executor rejected it", jobId, batch.size());
            metrics.recordError();
        }
    }

    private void persist(String jobId, List<LogRecord> batch) {
        try {
            sink.persistBatch(jobId, batch);
            log.debug("Persisted log batch: jobId={}, size={}", jobId, batch.size());
        } catch (RuntimeException e) {
            log.error("Failed to persist log batch: jobId={}, size={}", jobId, batch.size(), e);
            metrics.recordError();
        }
    }
}
