package com.example.logrelay.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Closed set of optional filter dimensions. An empty collection or a null
 * bound means "no constraint" for that dimension. Immutable; replace the
 * whole value to change a session's filter.
 */
public final class LogFilter {

    public static final LogFilter NONE = builder().build();

    private final Set<LogLevel> levels;
    private final Set<LogSource> sources;
    private final List<String> keywords;
    private final Set<String> workerIds;
    private final Set<String> jobIds;
    private final Instant from;
    private final Instant to;

    private LogFilter(Builder b) {
        this.levels = b.levels.isEmpty() ? Collections.emptySet() : Collections.unmodifiableSet(EnumSet.copyOf(b.levels));
        this.sources = b.sources.isEmpty() ? Collections.emptySet() : Collections.unmodifiableSet(EnumSet.copyOf(b.sources));
        this.keywords = Collections.unmodifiableList(new ArrayList<>(b.keywords));
        this.workerIds = Collections.unmodifiableSet(new LinkedHashSet<>(b.workerIds));
        this.jobIds = Collections.unmodifiableSet(new LinkedHashSet<>(b.jobIds));
        this.from = b.from;
        this.to = b.to;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .levels(levels)
                .sources(sources)
                .keywords(keywords)
                .workerIds(workerIds)
                .jobIds(jobIds)
                .from(from)
                .to(to);
    }

    public Set<LogLevel> getLevels() { return levels; }
    public Set<LogSource> getSources() { return sources; }
    public List<String> getKeywords() { return keywords; }
    public Set<String> getWorkerIds() { return workerIds; }
    public Set<String> getJobIds() { return jobIds; }
    public Instant getFrom() { return from; }
    public Instant getTo() { return to; }

    public boolean isEmpty() {
        return levels.isEmpty() && sources.isEmpty() && keywords.isEmpty()
                && workerIds.isEmpty() && jobIds.isEmpty() && from == null && to == null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof LogFilter)) return false;
        LogFilter that = (LogFilter) o;
        return levels.equals(that.levels) && sources.equals(that.sources) && keywords.equals(that.keywords)
                && workerIds.equals(that.workerIds) && jobIds.equals(that.jobIds)
                && Objects.equals(from, that.from) && Objects.equals(to, that.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(levels, sources, keywords, workerIds, jobIds, from, to);
    }

    @Override
    public String toString() {
        return "LogFilter{levels=" + levels + ", sources=" + sources + ", keywords=" + keywords
                + ", workerIds=" + workerIds + ", jobIds=" + jobIds + ", from=" + from + ", to=" + to + '}';
    }

    public static final class Builder {
        private final Set<LogLevel> levels = EnumSet.noneOf(LogLevel.class);
        private final Set<LogSource> sources = EnumSet.noneOf(LogSource.class);
        private final List<String> keywords = new ArrayList<>();
        private final Set<String> workerIds = new LinkedHashSet<>();
        private final Set<String> jobIds = new LinkedHashSet<>();
        private Instant from;
        private Instant to;

        private Builder() {}

        public Builder levels(Collection<LogLevel> v) { levels.clear(); if (v != null) levels.addAll(v); return this; }
        public Builder level(LogLevel v) { levels.add(v); return this; }
        public Builder sources(Collection<LogSource> v) { sources.clear(); if (v != null) sources.addAll(v); return this; }
        public Builder source(LogSource v) { sources.add(v); return this; }
        public Builder keywords(Collection<String> v) { keywords.clear(); if (v != null) keywords.addAll(v); return this; }
        public Builder keyword(String v) { keywords.add(v); return this; }
        public Builder workerIds(Collection<String> v) { workerIds.clear(); if (v != null) workerIds.addAll(v); return this; }
        public Builder workerId(String v) { workerIds.add(v); return this; }
        public Builder jobIds(Collection<String> v) { jobIds.clear(); if (v != null) jobIds.addAll(v); return this; }
        public Builder jobId(String v) { jobIds.add(v); return this; }
        public Builder from(Instant v) { this.from = v; return this; }
        public Builder to(Instant v) { this.to = v; return this; }

        public LogFilter build() {
            return new LogFilter(this);
        }
    }
}
