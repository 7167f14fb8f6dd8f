package com.example.logrelay.model;

import java.util.List;

/**
 * Filter as sent by clients (JSON body or socket frame). Values are strings;
 * conversion and validation happen in {@code LogFilters.fromRequest}.
 */
public class FilterRequest {
    private List<String> levels;     // "DEBUG" | "INFO" | "WARN" | "ERROR"
    private List<String> sources;    // "stdout" | "stderr" | "system"
    private List<String> keywords;
    private List<String> workerIds;
    private List<String> jobIds;
    private Long fromTs;             // epoch ms, inclusive
    private Long toTs;               // epoch ms, inclusive

    public FilterRequest() {}

    public List<String> getLevels() { return levels; }
    public void setLevels(List<String> levels) { this.levels = levels; }

    public List<String> getSources() { return sources; }
    public void setSources(List<String> sources) { this.sources = sources; }

    public List<String> getKeywords() { return keywords; }
    public void setKeywords(List<String> keywords) { this.keywords = keywords; }

    public List<String> getWorkerIds() { return workerIds; }
    public void setWorkerIds(List<String> workerIds) { this.workerIds = workerIds; }

    public List<String> getJobIds() { return jobIds; }
    public void setJobIds(List<String> jobIds) { this.jobIds = jobIds; }

    public Long getFromTs() { return fromTs; }
    public void setFromTs(Long fromTs) { this.fromTs = fromTs; }

    public Long getToTs() { return toTs; }
    public void setToTs(Long toTs) { this.toTs = toTs; }
}
