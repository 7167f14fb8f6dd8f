package com.example.logrelay.session;

import com.example.logrelay.model.LogFilter;
import com.example.logrelay.model.SessionView;
import com.example.logrelay.stream.Subscription;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * A client's subscription context. Only {@link SessionRegistry} creates or
 * mutates sessions; it holds subscription handles, never other sessions' state.
 */
final class StreamSession {
    private final String sessionId;
    private final Instant createdAt;

    private final Map<String, Subscription> logSubscriptions = new ConcurrentHashMap<>();
    private final Map<String, Subscription> progressSubscriptions = new ConcurrentHashMap<>();

    private volatile LogFilter filter;
    private volatile Instant lastActivity;
    private volatile SessionState state = SessionState.CREATED;

    StreamSession(String sessionId, LogFilter filter, Instant now) {
        this.sessionId = sessionId;
        this.filter = filter == null ? LogFilter.NONE : filter;
        this.createdAt = now;
        this.lastActivity = now;
    }

    String getSessionId() { return sessionId; }
    LogFilter getFilter() { return filter; }
    Instant getLastActivity() { return lastActivity; }
    SessionState getState() { return state; }

    Map<String, Subscription> logSubscriptions() { return logSubscriptions; }
    Map<String, Subscription> progressSubscriptions() { return progressSubscriptions; }

    /** Caller holds the session lock. */
    void setFilter(LogFilter filter) {
        this.filter = filter;
    }

    synchronized void touch(Instant now) {
        if (state.isTerminal()) return;
        lastActivity = now;
        state = SessionState.ACTIVE;
    }

    /**
     * Moves the session to a terminal state and hands back its subscriptions.
     *
     * @return null if the session was already closed or expired
     */
    synchronized List<Subscription> terminate(SessionState terminal) {
        if (state.isTerminal()) return null;
        state = terminal;
        List<Subscription> subs = new ArrayList<>(logSubscriptions.values());
        subs.addAll(progressSubscriptions.values());
        logSubscriptions.clear();
        progressSubscriptions.clear();
        return subs;
    }

    SessionView view() {
        return new SessionView(
                sessionId,
                state.name(),
                new LinkedHashSet<>(logSubscriptions.keySet()),
                new LinkedHashSet<>(progressSubscriptions.keySet()),
                filter,
                createdAt.toEpochMilli(),
                lastActivity.toEpochMilli());
    }
}
