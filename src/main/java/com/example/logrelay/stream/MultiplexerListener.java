package com.example.logrelay.stream;

import com.example.logrelay.upstream.UpstreamException;

/**
 * Observes a {@link SharedStreamMultiplexer}. Implementations must be quick
 * and must not call back into the multiplexer.
 */
public interface MultiplexerListener<T> {

    default void onStreamOpened(String key) {}

    /** Once per upstream record, before fan-out. */
    default void onRecord(String key, T record) {}

    /** Once per record handed to a subscriber. */
    default void onDelivered(String key, T record) {}

    default void onSubscriberError(String key, Throwable error) {}

    default void onStreamError(String key, UpstreamException error) {}

    /** Exactly once per shared stream, however it ended. */
    default void onStreamClosed(String key) {}
}
