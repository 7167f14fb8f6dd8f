package com.example.logrelay.stream;

/**
 * Handle returned by {@link SharedStreamMultiplexer#subscribe}.
 */
public interface Subscription {
    String getKey();

    boolean isActive();

    /**
     * Idempotent. When this returns, no further record reaches the subscriber.
     */
    void unsubscribe();
}
