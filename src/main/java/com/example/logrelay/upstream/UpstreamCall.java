package com.example.logrelay.upstream;

/**
 * Handle to a running upstream call.
 */
public interface UpstreamCall {
    /** Releases the call. Must tolerate being called after the call ended. */
    void cancel();
}
