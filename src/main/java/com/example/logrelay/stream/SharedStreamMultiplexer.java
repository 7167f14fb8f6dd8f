package com.example.logrelay.stream;

import com.example.logrelay.upstream.StreamListener;
import com.example.logrelay.upstream.UpstreamException;
import com.example.logrelay.upstream.UpstreamStreamAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;

/**
 * Shares one upstream stream per key among any number of subscribers.
 * <p>
 * The first subscriber for a key creates the upstream adapter and opens it once
 * the map lock is released; the last unsubscribe cancels it and drops the
 * entry. Creating and tearing down happen under one lock, so at most one
 * adapter per key is ever live. A late
 * subscriber first receives the most recent record of the stream (if any),
 * then live records. Each record is filtered and delivered per subscriber; a
 * failing filter or callback only affects that delivery.
 * <p>
 * Lock order: subscription, then the stream map, then the stream.
 */
public final class SharedStreamMultiplexer<T> {
    private static final Logger log = LoggerFactory.getLogger(SharedStreamMultiplexer.class);

    private final String kind;
    private final AdapterFactory<T> adapterFactory;
    private final MultiplexerListener<T> events;

    // guarded by itself
    private final Map<String, SharedStream> streams = new HashMap<>();
    private boolean shutdown;

    public SharedStreamMultiplexer(String kind, AdapterFactory<T> adapterFactory, MultiplexerListener<T> events) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.adapterFactory = Objects.requireNonNull(adapterFactory, "adapterFactory");
        this.events = events == null ? new MultiplexerListener<T>() {} : events;
    }

    public SharedStreamMultiplexer(String kind, AdapterFactory<T> adapterFactory) {
        this(kind, adapterFactory, null);
    }

    /**
     * Registers {@code subscriber} for {@code key}, opening the upstream if this is the first subscriber.
     *
     * @param filter evaluated for every record before it reaches the subscriber
     * @throws IllegalStateException after {@link #shutdown()}
     */
    public Subscription subscribe(String key, Predicate<? super T> filter, StreamSubscriber<T> subscriber) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(subscriber, "subscriber");
        Handle handle = new Handle(key, filter == null ? r -> true : filter, subscriber);

        SharedStream toOpen = null;
        synchronized (handle) {
            T replay;
            synchronized (streams) {
                if (shutdown) {
                    throw new IllegalStateException(kind + " multiplexer is shut down");
                }
                SharedStream stream = streams.get(key);
                if (stream == null) {
                    stream = new SharedStream(key);
                    stream.adapter = adapterFactory.create(key, stream);
                    streams.put(key, stream);
                    toOpen = stream;
                }
                handle.stream = stream;
                replay = stream.join(handle);
                if (toOpen != null) {
                    events.onStreamOpened(key);
                }
            }
            if (replay != null) {
                handle.deliver(replay);
            }
        }
        if (toOpen != null) {
            // outside every lock; a cancel that lands first makes this a no-op
            log.info("Shared {} stream created: key={}", kind, key);
            toOpen.adapter.open();
        } else {
            log.debug("Joined shared {} stream: key={}", kind, key);
        }
        return handle;
    }

    public int activeStreamCount() {
        synchronized (streams) {
            return streams.size();
        }
    }

    public boolean hasStream(String key) {
        synchronized (streams) {
            return streams.containsKey(key);
        }
    }

    public int subscriberCount(String key) {
        SharedStream stream;
        synchronized (streams) {
            stream = streams.get(key);
        }
        return stream == null ? 0 : stream.size();
    }

    /**
     * Cancels every upstream adapter and completes every subscriber. Later subscribe calls fail.
     */
    public void shutdown() {
        List<SharedStream> all;
        synchronized (streams) {
            if (shutdown) return;
            shutdown = true;
            all = new ArrayList<>(streams.values());
            streams.clear();
            for (SharedStream s : all) {
                s.adapter.cancel();
            }
        }
        for (SharedStream s : all) {
            for (Handle h : s.drain()) {
                h.complete();
            }
            s.notifyClosed();
        }
        log.info("Shared {} multiplexer shut down, {} streams cancelled", kind, all.size());
    }

    private void leave(Handle handle) {
        SharedStream stream = handle.stream;
        boolean tornDown = false;
        synchronized (streams) {
            boolean empty = stream.leave(handle);
            if (empty && streams.get(handle.key) == stream) {
                streams.remove(handle.key);
                stream.adapter.cancel();
                tornDown = true;
            }
        }
        if (tornDown) {
            log.info("Shared {} stream released: key={}", kind, handle.key);
            stream.notifyClosed();
        }
    }

    private final class SharedStream implements StreamListener<T> {
        private final String key;
        private final AtomicBoolean closeNotified = new AtomicBoolean(false);
        private UpstreamStreamAdapter<T> adapter;

        // guarded by this
        private final List<Handle> subscribers = new ArrayList<>();
        private T last;

        SharedStream(String key) {
            this.key = key;
        }

        synchronized T join(Handle h) {
            subscribers.add(h);
            return last;
        }

        synchronized boolean leave(Handle h) {
            subscribers.remove(h);
            return subscribers.isEmpty();
        }

        synchronized int size() {
            return subscribers.size();
        }

        synchronized List<Handle> drain() {
            List<Handle> copy = new ArrayList<>(subscribers);
            subscribers.clear();
            return copy;
        }

        private synchronized List<Handle> publish(T record) {
            last = record;
            return new ArrayList<>(subscribers);
        }

        @Override
        public void onRecord(T record) {
            events.onRecord(key, record);
            for (Handle h : publish(record)) {
                h.deliver(record);
            }
        }

        @Override
        public void onError(UpstreamException error) {
            events.onStreamError(key, error);
            List<Handle> subs = detach();
            log.warn("Shared {} stream failed: key={}, notifying {} subscribers: {}",
                    kind, key, subs.size(), error.getMessage());
            for (Handle h : subs) {
                h.fail(error);
            }
            notifyClosed();
        }

        @Override
        public void onComplete() {
            List<Handle> subs = detach();
            log.info("Shared {} stream completed: key={}, subscribers={}", kind, key, subs.size());
            for (Handle h : subs) {
                h.complete();
            }
            notifyClosed();
        }

        private List<Handle> detach() {
            synchronized (streams) {
                if (streams.get(key) == this) {
                    streams.remove(key);
                }
                return drain();
            }
        }

        void notifyClosed() {
            if (closeNotified.compareAndSet(false, true)) {
                events.onStreamClosed(key);
            }
        }
    }

    private final class Handle implements Subscription {
        private final String key;
        private final Predicate<? super T> filter;
        private final StreamSubscriber<T> subscriber;
        private SharedStream stream;

        // guarded by this
        private boolean active = true;

        Handle(String key, Predicate<? super T> filter, StreamSubscriber<T> subscriber) {
            this.key = key;
            this.filter = filter;
            this.subscriber = subscriber;
        }

        @Override
        public String getKey() {
            return key;
        }

        @Override
        public synchronized boolean isActive() {
            return active;
        }

        @Override
        public void unsubscribe() {
            synchronized (this) {
                if (!active) return;
                active = false;
            }
            leave(this);
        }

        synchronized void deliver(T record) {
            if (!active) return;
            boolean pass;
            try {
                pass = filter.test(record);
            } catch (RuntimeException e) {
                log.warn("Filter failed for {} subscriber key={}: {}", kind, key, e.toString());
                events.onSubscriberError(key, e);
                return;
            }
            if (!pass) return;
            try {
                subscriber.onRecord(record);
                events.onDelivered(key, record);
            } catch (RuntimeException e) {
                log.error("Subscriber callback failed for {} stream key={}", kind, key, e);
                events.onSubscriberError(key, e);
            }
        }

        synchronized void fail(UpstreamException error) {
            if (!active) return;
            active = false;
            try {
                subscriber.onError(error);
            } catch (RuntimeException e) {
                log.error("Subscriber error callback failed for {} stream key={}", kind, key, e);
                events.onSubscriberError(key, e);
            }
        }

        synchronized void complete() {
            if (!active) return;
            active = false;
            try {
                subscriber.onComplete();
            } catch (RuntimeException e) {
                log.error("Subscriber completion callback failed for {} stream key={}", kind, key, e);
                events.onSubscriberError(key, e);
            }
        }
    }
}
