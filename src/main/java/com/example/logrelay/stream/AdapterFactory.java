package com.example.logrelay.stream;

import com.example.logrelay.upstream.StreamListener;
import com.example.logrelay.upstream.UpstreamStreamAdapter;

/**
 * Creates the (unopened) upstream adapter for a key.
 */
@FunctionalInterface
public interface AdapterFactory<T> {
    UpstreamStreamAdapter<T> create(String key, StreamListener<T> listener);
}
