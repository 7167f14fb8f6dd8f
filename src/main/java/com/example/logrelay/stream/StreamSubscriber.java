package com.example.logrelay.stream;

import com.example.logrelay.upstream.UpstreamException;

/**
 * Receives records for one subscription. Calls for one subscription never
 * overlap. {@link #onError} and {@link #onComplete} are final: at most one of
 * them is called, once.
 */
public interface StreamSubscriber<T> {
    void onRecord(T record);

    void onError(UpstreamException error);

    void onComplete();
}
