package com.example.logrelay.filter;

import com.example.logrelay.model.FilterRequest;
import com.example.logrelay.model.LogFilter;
import com.example.logrelay.model.LogLevel;
import com.example.logrelay.model.LogSource;

import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Converts client filter requests into {@link LogFilter} values.
 */
public final class LogFilters {

    private LogFilters() {}

    /**
     * @throws InvalidFilterException on unknown levels/sources, blank entries or an inverted time range
     */
    public static LogFilter fromRequest(FilterRequest req) {
        if (req == null) return LogFilter.NONE;

        LogFilter.Builder b = LogFilter.builder();
        for (String level : nonNull(req.getLevels())) {
            try {
                b.level(LogLevel.parse(level));
            } catch (IllegalArgumentException e) {
                throw new InvalidFilterException(e.getMessage());
            }
        }
        for (String source : nonNull(req.getSources())) {
            try {
                b.source(LogSource.parse(source));
            } catch (IllegalArgumentException e) {
                throw new InvalidFilterException(e.getMessage());
            }
        }
        for (String keyword : nonNull(req.getKeywords())) {
            b.keyword(requireText(keyword, "keyword"));
        }
        for (String workerId : nonNull(req.getWorkerIds())) {
            b.workerId(requireText(workerId, "workerId"));
        }
        for (String jobId : nonNull(req.getJobIds())) {
            b.jobId(requireText(jobId, "jobId"));
        }

        Instant from = req.getFromTs() == null ? null : Instant.ofEpochMilli(req.getFromTs());
        Instant to = req.getToTs() == null ? null : Instant.ofEpochMilli(req.getToTs());
        if (from != null && to != null && from.isAfter(to)) {
            throw new InvalidFilterException("fromTs must not be after toTs");
        }
        return b.from(from).to(to).build();
    }

    /**
     * Builds a filter from the comma-separated query parameters used by the
     * push-stream endpoints. Blank parameters are ignored.
     */
    public static LogFilter fromQuery(String levels, String sources, String keywords, String workerIds) {
        FilterRequest req = new FilterRequest();
        req.setLevels(splitCsv(levels));
        req.setSources(splitCsv(sources));
        req.setKeywords(splitCsv(keywords));
        req.setWorkerIds(splitCsv(workerIds));
        return fromRequest(req);
    }

    static List<String> splitCsv(String value) {
        if (value == null || value.isBlank()) return List.of();
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }

    private static List<String> nonNull(List<String> values) {
        return values == null ? List.of() : values;
    }

    private static String requireText(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new InvalidFilterException(field + " must not be blank");
        }
        return value.trim();
    }
}
