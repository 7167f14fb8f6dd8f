package com.example.logrelay.delivery;

import com.example.logrelay.metrics.StreamingMetricsCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Bounded per-client buffer between the streaming core and a slow network
 * write. {@link #offer} never blocks: when the buffer is full the oldest
 * event is dropped. Events are written in order by at most one drain task at
 * a time on the given executor. The first write failure closes the outbox
 * and runs the failure callback once.
 */
public class SubscriberOutbox<E> {
    private static final Logger log = LoggerFactory.getLogger(SubscriberOutbox.class);

    @FunctionalInterface
    public interface Writer<E> {
        void write(E event) throws IOException;
    }

    private final String name;
    private final int capacity;
    private final Executor executor;
    private final Writer<E> writer;
    private final Runnable onFailure;
    private final StreamingMetricsCollector metrics;

    private final AtomicBoolean failed = new AtomicBoolean(false);

    // guarded by queue
    private final Deque<E> queue = new ArrayDeque<>();
    private boolean draining;
    private boolean closed;
    private long dropped;

    public SubscriberOutbox(String name, int capacity, Executor executor, Writer<E> writer,
                            Runnable onFailure, StreamingMetricsCollector metrics) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
        this.name = name;
        this.capacity = capacity;
        this.executor = executor;
        this.writer = writer;
        this.onFailure = onFailure;
        this.metrics = metrics;
    }

    /**
     * @return false if the outbox is closed
     */
    public boolean offer(E event) {
        boolean schedule = false;
        boolean evicted = false;
        synchronized (queue) {
            if (closed) return false;
            if (queue.size() >= capacity) {
                queue.pollFirst();
                dropped++;
                evicted = true;
            }
            queue.addLast(event);
            if (!draining) {
                draining = true;
                schedule = true;
            }
        }
        if (evicted) {
            metrics.recordDropped(1);
            log.debug("Outbox {} full ({}), dropped oldest event", name, capacity);
        }
        if (schedule) {
            try {
                executor.execute(this::drain);
            } catch (RejectedExecutionException e) {
                fail(new IOException("delivery executor rejected drain", e));
            }
        }
        return true;
    }

    /** Discards anything still buffered; later offers are ignored. */
    public void close() {
        synchronized (queue) {
            closed = true;
            queue.clear();
        }
    }

    public boolean isClosed() {
        synchronized (queue) {
            return closed;
        }
    }

    public int size() {
        synchronized (queue) {
            return queue.size();
        }
    }

    public long droppedCount() {
        synchronized (queue) {
            return dropped;
        }
    }

    private void drain() {
        while (true) {
            E next;
            synchronized (queue) {
                next = closed ? null : queue.pollFirst();
                if (next == null) {
                    draining = false;
                    return;
                }
            }
            try {
                writer.write(next);
            } catch (IOException | RuntimeException e) {
                fail(e);
                return;
            }
        }
    }

    private void fail(Exception e) {
        synchronized (queue) {
            closed = true;
            draining = false;
            queue.clear();
        }
        if (failed.compareAndSet(false, true)) {
            log.debug("Outbox {} write failed, closing: {}", name, e.toString());
            onFailure.run();
        }
    }
}
