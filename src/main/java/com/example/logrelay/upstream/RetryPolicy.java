package com.example.logrelay.upstream;

import java.time.Duration;

/**
 * Bounded retry with linear backoff: after the n-th consecutive failure the
 * next attempt waits {@code n * retryDelay}.
 */
public final class RetryPolicy {
    private final int maxAttempts;
    private final Duration retryDelay;

    public RetryPolicy(int maxAttempts, Duration retryDelay) {
        if (maxAttempts < 1) throw new IllegalArgumentException("maxAttempts must be >= 1");
        if (retryDelay == null || retryDelay.isNegative()) throw new IllegalArgumentException("retryDelay must be >= 0");
        this.maxAttempts = maxAttempts;
        this.retryDelay = retryDelay;
    }

    public int getMaxAttempts() { return maxAttempts; }
    public Duration getRetryDelay() { return retryDelay; }

    public boolean allowsAnotherAttempt(int consecutiveFailures) {
        return consecutiveFailures < maxAttempts;
    }

    public Duration delayAfter(int consecutiveFailures) {
        return retryDelay.multipliedBy(Math.max(1, consecutiveFailures));
    }

    @Override
    public String toString() {
        return "RetryPolicy{maxAttempts=" + maxAttempts + ", retryDelay=" + retryDelay + '}';
    }
}
