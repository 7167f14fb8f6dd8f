package com.example.logrelay.upstream;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Outcome classes of a failed upstream call. Retryable statuses describe
 * transient transport trouble; the rest end the stream immediately.
 */
public enum UpstreamStatus {
    UNAVAILABLE(true),
    DEADLINE_EXCEEDED(true),
    RESOURCE_EXHAUSTED(true),
    ABORTED(true),
    INTERNAL(true),
    UNKNOWN(true),
    NOT_FOUND(false),
    UNAUTHENTICATED(false),
    PERMISSION_DENIED(false),
    ALREADY_COMPLETED(false),
    INSUFFICIENT_RESOURCES(false),
    INVALID_ARGUMENT(false),
    CANCELLED(false);

    // "14 UNAVAILABLE: io exception" or "NOT_FOUND: job x"
    private static final Pattern LEADING_STATUS = Pattern.compile("^\\s*(?:\\d+\\s+)?([A-Z_]+):");

    private final boolean retryable;

    UpstreamStatus(boolean retryable) {
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }

    /**
     * Maps an arbitrary failure to a status. Upstream clients usually put the
     * status name in the message ("14 UNAVAILABLE: ..."). The leading status
     * token wins; only without one is the rest of the message scanned.
     */
    public static UpstreamStatus classify(Throwable t) {
        if (t instanceof UpstreamException) {
            return ((UpstreamException) t).getStatus();
        }
        String msg = t == null ? null : t.getMessage();
        if (msg != null) {
            Matcher m = LEADING_STATUS.matcher(msg);
            if (m.find()) {
                for (UpstreamStatus s : values()) {
                    if (s.name().equals(m.group(1))) return s;
                }
            }
            for (UpstreamStatus s : values()) {
                if (s != UNKNOWN && msg.contains(s.name())) return s;
            }
        }
        return UNKNOWN;
    }
}
