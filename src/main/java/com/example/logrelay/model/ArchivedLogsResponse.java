package com.example.logrelay.model;

import java.util.List;

public class ArchivedLogsResponse {
    private final String jobId;
    private final int offset;
    private final int limit;
    private final long total;
    private final List<LogRecord> items;

    public ArchivedLogsResponse(String jobId, int offset, int limit, long total, List<LogRecord> items) {
        this.jobId = jobId;
        this.offset = offset;
        this.limit = limit;
        this.total = total;
        this.items = items;
    }

    public String getJobId() { return jobId; }
    public int getOffset() { return offset; }
    public int getLimit() { return limit; }
    public long getTotal() { return total; }
    public List<LogRecord> getItems() { return items; }
}
