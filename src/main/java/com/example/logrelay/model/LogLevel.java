package com.example.logrelay.model;

import java.util.Locale;

public enum LogLevel {
    DEBUG, INFO, WARN, ERROR;

    /**
     * Parses a level name case-insensitively. "WARNING" is accepted as WARN.
     *
     * @throws IllegalArgumentException for an unknown name
     */
    public static LogLevel parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("log level must not be blank");
        }
        String v = value.trim().toUpperCase(Locale.ROOT);
        if ("WARNING".equals(v)) return WARN;
        try {
            return LogLevel.valueOf(v);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown log level: " + value);
        }
    }
}
