package com.example.logrelay.upstream;

/**
 * Callback side of one upstream call. An implementation of
 * {@link UpstreamSource} calls these serially for a given call, and calls
 * exactly one of {@link #onError} / {@link #onCompleted} at most once.
 */
public interface UpstreamObserver<T> {
    void onNext(T value);

    void onError(Throwable error);

    void onCompleted();
}
