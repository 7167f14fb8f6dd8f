package com.example.logrelay.upstream;

/**
 * Receives the output of an {@link UpstreamStreamAdapter}. After
 * {@link #onError} or {@link #onComplete} nothing else is delivered.
 */
public interface StreamListener<T> {
    void onRecord(T record);

    void onError(UpstreamException error);

    void onComplete();
}
