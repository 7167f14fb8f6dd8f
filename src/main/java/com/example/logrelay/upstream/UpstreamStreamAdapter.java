package com.example.logrelay.upstream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Wraps one upstream stream for one key (job id or pipeline id).
 * <p>
 * Records are passed to the listener in the order the upstream produced
 * them. Retryable failures reopen the call according to the
 * {@link RetryPolicy}; terminal failures, or running out of attempts, end the
 * adapter with a single {@link StreamListener#onError}. {@link #cancel()} is
 * idempotent and releases the current call.
 */
public final class UpstreamStreamAdapter<T> {
    private static final Logger log = LoggerFactory.getLogger(UpstreamStreamAdapter.class);

    /**
     * Opens one call against the upstream source.
     */
    @FunctionalInterface
    public interface Opener<T> {
        UpstreamCall open(UpstreamObserver<T> observer);
    }

    private final String key;
    private final String kind;
    private final Opener<T> opener;
    private final RetryPolicy retryPolicy;
    private final ScheduledExecutorService scheduler;
    private final StreamListener<T> listener;

    private final AtomicBoolean started = new AtomicBoolean(false);
    private final AtomicInteger openCalls = new AtomicInteger();

    // guarded by this
    private boolean closed;
    private long generation;
    private int consecutiveFailures;
    private UpstreamCall currentCall;
    private ScheduledFuture<?> pendingRetry;

    public UpstreamStreamAdapter(String key, String kind, Opener<T> opener, RetryPolicy retryPolicy,
                                 ScheduledExecutorService scheduler, StreamListener<T> listener) {
        this.key = Objects.requireNonNull(key, "key");
        this.kind = Objects.requireNonNull(kind, "kind");
        this.opener = Objects.requireNonNull(opener, "opener");
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "retryPolicy");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    public String getKey() { return key; }

    /** Number of times the upstream call has been opened, retries included. */
    public int getOpenCalls() { return openCalls.get(); }

    public synchronized boolean isClosed() { return closed; }

    /**
     * Opens the first upstream call. May be called once.
     */
    public void open() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException(kind + " stream already opened: " + key);
        }
        log.info("Opening upstream {} stream key={}", kind, key);
        attempt();
    }

    /**
     * Stops the stream and releases the current upstream call.
     *
     * @return true if this call closed the adapter, false if it was already closed
     */
    public boolean cancel() {
        UpstreamCall call;
        synchronized (this) {
            if (closed) return false;
            closed = true;
            generation++;
            call = currentCall;
            currentCall = null;
            if (pendingRetry != null) {
                pendingRetry.cancel(false);
                pendingRetry = null;
            }
        }
        log.info("Cancelled upstream {} stream key={}", kind, key);
        release(call);
        return true;
    }

    private void attempt() {
        long gen;
        synchronized (this) {
            if (closed) return;
            pendingRetry = null;
            gen = ++generation;
        }
        openCalls.incrementAndGet();

        UpstreamCall call;
        try {
            call = opener.open(new CallObserver(gen));
        } catch (RuntimeException e) {
            onCallFailed(gen, e);
            return;
        }

        boolean stale;
        synchronized (this) {
            stale = closed || gen != generation;
            if (!stale) currentCall = call;
        }
        if (stale) release(call);
    }

    private void onCallFailed(long gen, Throwable error) {
        UpstreamException ex = UpstreamException.wrap(error);
        boolean retry;
        int failures;
        synchronized (this) {
            if (closed || gen != generation) return;
            generation++;
            currentCall = null;
            failures = ++consecutiveFailures;
            retry = ex.isRetryable() && retryPolicy.allowsAnotherAttempt(failures);
            if (retry) {
                Duration delay = retryPolicy.delayAfter(failures);
                log.warn("Upstream {} stream key={} failed ({}/{}), retrying in {} ms: {}",
                        kind, key, failures, retryPolicy.getMaxAttempts(), delay.toMillis(), ex.getMessage());
                try {
                    pendingRetry = scheduler.schedule(this::attempt, delay.toMillis(), TimeUnit.MILLISECONDS);
                } catch (RejectedExecutionException rejected) {
                    log.warn("Retry scheduler unavailable for {} stream key={}", kind, key);
                    retry = false;
                }
            }
            if (!retry) {
                closed = true;
            }
        }
        if (retry) return;

        if (ex.isRetryable()) {
            log.error("Upstream {} stream key={} gave up after {} attempts: {}", kind, key, failures, ex.getMessage());
        } else {
            log.error("Upstream {} stream key={} failed with terminal status {}: {}",
                    kind, key, ex.getStatus(), ex.getMessage());
        }
        listener.onError(ex);
    }

    private void release(UpstreamCall call) {
        if (call == null) return;
        try {
            call.cancel();
        } catch (RuntimeException e) {
            log.warn("Failed to cancel upstream {} call key={}: {}", kind, key, e.toString());
        }
    }

    private final class CallObserver implements UpstreamObserver<T> {
        private final long gen;

        CallObserver(long gen) {
            this.gen = gen;
        }

        @Override
        public void onNext(T value) {
            synchronized (UpstreamStreamAdapter.this) {
                if (closed || gen != generation) return;
                consecutiveFailures = 0;
            }
            listener.onRecord(value);
        }

        @Override
        public void onError(Throwable error) {
            onCallFailed(gen, error);
        }

        @Override
        public void onCompleted() {
            synchronized (UpstreamStreamAdapter.this) {
                if (closed || gen != generation) return;
                closed = true;
                currentCall = null;
            }
            log.info("Upstream {} stream key={} completed", kind, key);
            listener.onComplete();
        }
    }
}
