package com.example.logrelay.model;

import java.util.Set;

public class SessionView {
    private final String sessionId;
    private final String state;
    private final Set<String> jobIds;
    private final Set<String> pipelineIds;
    private final LogFilter filter;
    private final long createdAtEpochMs;
    private final long lastActivityEpochMs;

    public SessionView(String sessionId, String state, Set<String> jobIds, Set<String> pipelineIds,
                       LogFilter filter, long createdAtEpochMs, long lastActivityEpochMs) {
        this.sessionId = sessionId;
        this.state = state;
        this.jobIds = jobIds;
        this.pipelineIds = pipelineIds;
        this.filter = filter;
        this.createdAtEpochMs = createdAtEpochMs;
        this.lastActivityEpochMs = lastActivityEpochMs;
    }

    public String getSessionId() { return sessionId; }
    public String getState() { return state; }
    public Set<String> getJobIds() { return jobIds; }
    public Set<String> getPipelineIds() { return pipelineIds; }
    public LogFilter getFilter() { return filter; }
    public long getCreatedAtEpochMs() { return createdAtEpochMs; }
    public long getLastActivityEpochMs() { return lastActivityEpochMs; }
}
