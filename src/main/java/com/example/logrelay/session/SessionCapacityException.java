package com.example.logrelay.session;

/**
 * The configured ceiling of live sessions has been reached.
 */
public class SessionCapacityException extends RuntimeException {
    private final int maxSessions;

    public SessionCapacityException(int maxSessions) {
        super("maximum number of sessions reached (" + maxSessions + ")");
        this.maxSessions = maxSessions;
    }

    public int getMaxSessions() {
        return maxSessions;
    }
}
