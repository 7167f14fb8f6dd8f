package com.example.logrelay.store;

import com.example.logrelay.model.LogRecord;
import com.example.logrelay.model.LogSource;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * Keeps persisted log batches in memory, per job, in arrival order.
 */
public class InMemoryLogArchive implements LogBatchSink {

    private final Map<String, List<LogRecord>> recordsByJob = new ConcurrentHashMap<>();

    @Override
    public void persistBatch(String jobId, List<LogRecord> records) {
        if (records == null || records.isEmpty()) return;
        recordsByJob.computeIfAbsent(jobId, k -> Collections.synchronizedList(new ArrayList<>())).addAll(records);
    }

    /**
     * @param source optional; null returns every source
     */
    public List<LogRecord> list(String jobId, LogSource source, int offset, int limit) {
        return filtered(jobId, source).stream()
                .skip(Math.max(0, offset))
                .limit(Math.max(0, limit))
                .collect(Collectors.toList());
    }

    public long count(String jobId, LogSource source) {
        return filtered(jobId, source).size();
    }

    /**
     * @return number of records removed
     */
    public int deleteJob(String jobId) {
        List<LogRecord> removed = recordsByJob.remove(jobId);
        return removed == null ? 0 : removed.size();
    }

    private List<LogRecord> filtered(String jobId, LogSource source) {
        List<LogRecord> list = recordsByJob.getOrDefault(jobId, Collections.emptyList());
        List<LogRecord> copied;
        synchronized (list) {
            copied = new ArrayList<>(list);
        }
        if (source == null) return copied;
        return copied.stream().filter(r -> r.getSource() == source).collect(Collectors.toList());
    }
}
