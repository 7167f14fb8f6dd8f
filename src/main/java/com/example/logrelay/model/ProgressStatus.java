package com.example.logrelay.model;

import java.util.Locale;
import java.util.Objects;

/**
 * Stage status reported by the upstream source. The well-known values are
 * constants; anything else the upstream sends is kept as a custom status.
 */
public final class ProgressStatus {
    public static final ProgressStatus PENDING = new ProgressStatus("PENDING");
    public static final ProgressStatus RUNNING = new ProgressStatus("RUNNING");
    public static final ProgressStatus COMPLETED = new ProgressStatus("COMPLETED");
    public static final ProgressStatus FAILED = new ProgressStatus("FAILED");
    public static final ProgressStatus CANCELLED = new ProgressStatus("CANCELLED");

    private final String name;

    private ProgressStatus(String name) {
        this.name = name;
    }

    /**
     * Accepts both bare names and the upstream's "STAGE_" prefixed form.
     */
    public static ProgressStatus of(String value) {
        if (value == null || value.isBlank()) return PENDING;
        String v = value.trim().toUpperCase(Locale.ROOT);
        if (v.startsWith("STAGE_")) v = v.substring("STAGE_".length());
        switch (v) {
            case "PENDING": return PENDING;
            case "RUNNING": return RUNNING;
            case "COMPLETED": return COMPLETED;
            case "FAILED": return FAILED;
            case "CANCELLED": return CANCELLED;
            default: return new ProgressStatus(v);
        }
    }

    public String getName() { return name; }

    public boolean isCustom() {
        return this != PENDING && this != RUNNING && this != COMPLETED && this != FAILED && this != CANCELLED;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ProgressStatus)) return false;
        return name.equals(((ProgressStatus) o).name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name);
    }

    @Override
    public String toString() {
        return name;
    }
}
