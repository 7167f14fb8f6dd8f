package com.example.logrelay.filter;

import com.example.logrelay.model.LogFilter;
import com.example.logrelay.model.LogRecord;
import com.example.logrelay.model.ProgressRecord;

import java.time.Instant;
import java.util.List;
import java.util.Locale;

/**
 * Stateless filter predicates.
 * <p>
 * Every configured dimension must pass (AND). Keywords are OR-combined,
 * case-insensitive substring matches. A null or empty filter passes
 * everything.
 */
public final class LogFilterEvaluator {

    private LogFilterEvaluator() {}

    public static boolean matches(LogRecord record, LogFilter filter) {
        if (filter == null || filter.isEmpty()) return true;

        if (!filter.getLevels().isEmpty() && !filter.getLevels().contains(record.getLevel())) return false;
        if (!filter.getSources().isEmpty() && !filter.getSources().contains(record.getSource())) return false;
        if (!filter.getWorkerIds().isEmpty() && !filter.getWorkerIds().contains(record.getWorkerId())) return false;
        if (!filter.getJobIds().isEmpty() && !filter.getJobIds().contains(record.getJobId())) return false;
        if (!inRange(record.getTimestamp(), filter.getFrom(), filter.getTo())) return false;
        return anyKeyword(filter.getKeywords(), record.getMessage());
    }

    /**
     * Progress records only carry the keyword and time-range dimensions;
     * keywords are checked against the message and the error message.
     */
    public static boolean matches(ProgressRecord record, LogFilter filter) {
        if (filter == null || filter.isEmpty()) return true;

        if (!inRange(record.getTimestamp(), filter.getFrom(), filter.getTo())) return false;
        if (filter.getKeywords().isEmpty()) return true;
        return anyKeyword(filter.getKeywords(), record.getMessage())
                || (record.getErrorMessage() != null && anyKeyword(filter.getKeywords(), record.getErrorMessage()));
    }

    private static boolean inRange(Instant ts, Instant from, Instant to) {
        if (from != null && ts.isBefore(from)) return false;
        return to == null || !ts.isAfter(to);
    }

    private static boolean anyKeyword(List<String> keywords, String text) {
        if (keywords.isEmpty()) return true;
        String haystack = text.toLowerCase(Locale.ROOT);
        for (String k : keywords) {
            if (haystack.contains(k.toLowerCase(Locale.ROOT))) return true;
        }
        return false;
    }
}
