package com.example.logrelay.session;

import com.example.logrelay.filter.LogFilterEvaluator;
import com.example.logrelay.metrics.StreamingMetricsCollector;
import com.example.logrelay.model.LogFilter;
import com.example.logrelay.model.LogRecord;
import com.example.logrelay.model.ProgressRecord;
import com.example.logrelay.model.SessionView;
import com.example.logrelay.stream.SharedStreamMultiplexer;
import com.example.logrelay.stream.StreamSubscriber;
import com.example.logrelay.stream.Subscription;
import com.example.logrelay.upstream.UpstreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Predicate;

/**
 * Owns every client session: its filter, its subscriptions and its activity
 * clock. Sessions idle for longer than the timeout are closed by a periodic
 * sweep exactly as {@link #closeSession} would close them. Closing is
 * idempotent and safe to race against the sweep.
 */
public class SessionRegistry {
    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    private final SharedStreamMultiplexer<LogRecord> logStreams;
    private final SharedStreamMultiplexer<ProgressRecord> progressStreams;
    private final StreamingMetricsCollector metrics;
    private final Clock clock;
    private final int maxSessions;
    private final Duration idleTimeout;

    private final Map<String, StreamSession> sessions = new ConcurrentHashMap<>();
    private ScheduledFuture<?> sweeper;

    public SessionRegistry(SharedStreamMultiplexer<LogRecord> logStreams,
                           SharedStreamMultiplexer<ProgressRecord> progressStreams,
                           StreamingMetricsCollector metrics,
                           Clock clock,
                           int maxSessions,
                           Duration idleTimeout) {
        if (maxSessions < 1) throw new IllegalArgumentException("maxSessions must be >= 1");
        this.logStreams = logStreams;
        this.progressStreams = progressStreams;
        this.metrics = metrics;
        this.clock = clock;
        this.maxSessions = maxSessions;
        this.idleTimeout = idleTimeout;
    }

    /** Runs {@link #sweepExpired()} every {@code interval} until {@link #shutdown()}. */
    public synchronized void start(ScheduledExecutorService scheduler, Duration interval) {
        if (sweeper != null) return;
        long ms = interval.toMillis();
        sweeper = scheduler.scheduleAtFixedRate(() -> {
            try {
                sweepExpired();
            } catch (RuntimeException e) {
                log.error("Session sweep failed", e);
            }
        }, ms, ms, TimeUnit.MILLISECONDS);
        log.info("Session sweep scheduled every {}s, idle timeout {}m", interval.getSeconds(), idleTimeout.toMinutes());
    }

    /**
     * @throws SessionCapacityException when {@code maxSessions} live sessions already exist
     */
    public synchronized SessionView createSession(LogFilter filter) {
        if (sessions.size() >= maxSessions) {
            metrics.recordError();
            log.warn("Session rejected: {} live sessions (max {})", sessions.size(), maxSessions);
            throw new SessionCapacityException(maxSessions);
        }
        String sessionId = UUID.randomUUID().toString();
        StreamSession session = new StreamSession(sessionId, filter, clock.instant());
        sessions.put(sessionId, session);
        metrics.setActiveConnections(sessions.size());
        log.info("Session created: {} (active sessions: {})", sessionId, sessions.size());
        return session.view();
    }

    /**
     * Closes the session and unsubscribes everything it watches.
     *
     * @return false if the session was unknown or already closed
     */
    public boolean closeSession(String sessionId) {
        StreamSession session = sessions.get(sessionId);
        if (session == null) {
            log.debug("Close for unknown session ignored: {}", sessionId);
            return false;
        }
        boolean closed = terminate(session, SessionState.CLOSED);
        if (closed) {
            log.info("Session closed: {} (active sessions: {})", sessionId, sessions.size());
        }
        return closed;
    }

    /**
     * Replaces the session's filter. Existing subscriptions stay open and use
     * the new filter from the next record on.
     */
    public void updateFilter(String sessionId, LogFilter filter) {
        StreamSession session = require(sessionId);
        synchronized (session) {
            if (session.getState().isTerminal()) throw new SessionNotFoundException(sessionId);
            session.setFilter(filter == null ? LogFilter.NONE : filter);
        }
        session.touch(clock.instant());
        log.debug("Session filter updated: {} -> {}", sessionId, filter);
    }

    /** Keep-alive from the client. */
    public void touch(String sessionId) {
        require(sessionId).touch(clock.instant());
    }

    /**
     * Subscribes the session to a job's log stream, filtered by the session's current filter.
     *
     * @return false if the session already watches this job
     */
    public boolean subscribeLogs(String sessionId, String jobId, StreamSubscriber<LogRecord> subscriber) {
        StreamSession session = require(sessionId);
        Predicate<LogRecord> filter = r -> LogFilterEvaluator.matches(r, session.getFilter());
        return subscribe(session, jobId, session.logSubscriptions(), logStreams, filter, subscriber);
    }

    public boolean unsubscribeLogs(String sessionId, String jobId) {
        StreamSession session = require(sessionId);
        return unsubscribe(session, session.logSubscriptions(), jobId);
    }

    /**
     * Subscribes the session to a pipeline's progress stream (keyword and time-range filtering only).
     *
     * @return false if the session already watches this pipeline
     */
    public boolean subscribeProgress(String sessionId, String pipelineId, StreamSubscriber<ProgressRecord> subscriber) {
        StreamSession session = require(sessionId);
        Predicate<ProgressRecord> filter = r -> LogFilterEvaluator.matches(r, session.getFilter());
        return subscribe(session, pipelineId, session.progressSubscriptions(), progressStreams, filter, subscriber);
    }

    public boolean unsubscribeProgress(String sessionId, String pipelineId) {
        StreamSession session = require(sessionId);
        return unsubscribe(session, session.progressSubscriptions(), pipelineId);
    }

    public Optional<SessionView> getSession(String sessionId) {
        StreamSession session = sessions.get(sessionId);
        return session == null ? Optional.empty() : Optional.of(session.view());
    }

    public int activeSessionCount() {
        return sessions.size();
    }

    /**
     * Expires every session whose last activity is older than the idle timeout.
     *
     * @return number of sessions expired by this call
     */
    public int sweepExpired() {
        Instant cutoff = clock.instant().minus(idleTimeout);
        int expired = 0;
        for (StreamSession session : new ArrayList<>(sessions.values())) {
            if (session.getLastActivity().isBefore(cutoff) && terminate(session, SessionState.EXPIRED)) {
                expired++;
                log.debug("Expired idle session: {}", session.getSessionId());
            }
        }
        if (expired > 0) {
            log.info("Expired {} idle sessions (active sessions: {})", expired, sessions.size());
        }
        return expired;
    }

    /** Stops the sweep and closes every session. */
    public void shutdown() {
        synchronized (this) {
            if (sweeper != null) {
                sweeper.cancel(false);
                sweeper = null;
            }
        }
        int closed = 0;
        for (StreamSession session : new ArrayList<>(sessions.values())) {
            if (terminate(session, SessionState.CLOSED)) closed++;
        }
        log.info("Session registry shut down, {} sessions closed", closed);
    }

    private <T> boolean subscribe(StreamSession session,
                                  String key,
                                  Map<String, Subscription> subscriptions,
                                  SharedStreamMultiplexer<T> streams,
                                  Predicate<T> filter,
                                  StreamSubscriber<T> subscriber) {
        Subscription placeholder = new Reservation(key);
        synchronized (session) {
            if (session.getState().isTerminal()) throw new SessionNotFoundException(session.getSessionId());
            Subscription existing = subscriptions.get(key);
            if (existing != null && existing.isActive()) {
                return false;
            }
            subscriptions.put(key, placeholder);
        }

        // the multiplexer may open the upstream here, so no session lock is held
        SubscriptionSlot<T> slot = new SubscriptionSlot<>(subscriptions, key, subscriber);
        Subscription sub;
        try {
            sub = streams.subscribe(key, filter, slot);
        } catch (RuntimeException e) {
            subscriptions.remove(key, placeholder);
            throw e;
        }
        slot.bind(sub);

        boolean terminated;
        boolean installed;
        synchronized (session) {
            terminated = session.getState().isTerminal();
            installed = !terminated && subscriptions.get(key) == placeholder && sub.isActive();
            if (installed) {
                subscriptions.put(key, sub);
            } else {
                subscriptions.remove(key, placeholder);
            }
        }
        if (!installed) {
            // closed, unsubscribed or ended while the stream was opening
            sub.unsubscribe();
            if (terminated) throw new SessionNotFoundException(session.getSessionId());
        }
        session.touch(clock.instant());
        log.debug("Session {} subscribed to {}", session.getSessionId(), key);
        return true;
    }

    private boolean unsubscribe(StreamSession session, Map<String, Subscription> subscriptions, String key) {
        Subscription sub = subscriptions.remove(key);
        session.touch(clock.instant());
        if (sub == null) return false;
        sub.unsubscribe();
        log.debug("Session {} unsubscribed from {}", session.getSessionId(), key);
        return true;
    }

    private boolean terminate(StreamSession session, SessionState terminal) {
        List<Subscription> subs = session.terminate(terminal);
        if (subs == null) return false;
        sessions.remove(session.getSessionId(), session);
        metrics.setActiveConnections(sessions.size());
        for (Subscription sub : subs) {
            sub.unsubscribe();
        }
        return true;
    }

    private StreamSession require(String sessionId) {
        StreamSession session = sessionId == null ? null : sessions.get(sessionId);
        if (session == null) throw new SessionNotFoundException(sessionId);
        return session;
    }

    /** Holds a key while its subscription is being opened. */
    private static final class Reservation implements Subscription {
        private final String key;

        Reservation(String key) {
            this.key = key;
        }

        @Override
        public String getKey() {
            return key;
        }

        @Override
        public boolean isActive() {
            return true;
        }

        @Override
        public void unsubscribe() {
        }
    }

    /**
     * Forwards to the transport's subscriber and forgets the subscription once
     * the shared stream ends on its own.
     */
    private static final class SubscriptionSlot<T> implements StreamSubscriber<T> {
        private final Map<String, Subscription> owner;
        private final String key;
        private final StreamSubscriber<T> delegate;
        private volatile Subscription subscription;

        SubscriptionSlot(Map<String, Subscription> owner, String key, StreamSubscriber<T> delegate) {
            this.owner = owner;
            this.key = key;
            this.delegate = delegate;
        }

        void bind(Subscription subscription) {
            this.subscription = subscription;
        }

        @Override
        public void onRecord(T record) {
            delegate.onRecord(record);
        }

        @Override
        public void onError(UpstreamException error) {
            forget();
            delegate.onError(error);
        }

        @Override
        public void onComplete() {
            forget();
            delegate.onComplete();
        }

        private void forget() {
            Subscription s = subscription;
            if (s != null) owner.remove(key, s);
        }
    }
}
