package com.example.logrelay.model;

import java.util.Locale;

public enum LogSource {
    STDOUT, STDERR, SYSTEM;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static LogSource parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("log source must not be blank");
        }
        try {
            return LogSource.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown log source: " + value);
        }
    }
}
