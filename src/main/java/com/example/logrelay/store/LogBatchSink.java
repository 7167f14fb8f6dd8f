package com.example.logrelay.store;

import com.example.logrelay.model.LogRecord;

import java.util.List;

/**
 * Durable destination for finished log batches. Called off the delivery
 * path; implementations may block.
 */
public interface LogBatchSink {
    void persistBatch(String jobId, List<LogRecord> records);
}
