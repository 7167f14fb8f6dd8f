package com.example.logrelay.support;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.Delayed;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * A {@link ScheduledExecutorService} whose one-shot tasks run only when the test says so.
 */
public class ManualScheduler {

    private final Deque<Task> pending = new ArrayDeque<>();
    private final ScheduledExecutorService executor = mock(ScheduledExecutorService.class);
    private long lastDelayMs = -1;

    public ManualScheduler() {
        when(executor.schedule(any(Runnable.class), anyLong(), any(TimeUnit.class))).thenAnswer(inv -> {
            Runnable runnable = inv.getArgument(0);
            long delay = inv.getArgument(1);
            TimeUnit unit = inv.getArgument(2);
            Task task = new Task(runnable, unit.toMillis(delay));
            synchronized (this) {
                pending.addLast(task);
                lastDelayMs = task.delayMs;
            }
            return task;
        });
    }

    public ScheduledExecutorService executor() {
        return executor;
    }

    public synchronized int pendingCount() {
        return (int) pending.stream().filter(t -> !t.cancelled).count();
    }

    public synchronized long lastDelayMs() {
        return lastDelayMs;
    }

    /** Runs the oldest task that is still scheduled. */
    public boolean runNext() {
        Task next;
        synchronized (this) {
            do {
                next = pending.pollFirst();
            } while (next != null && next.cancelled);
        }
        if (next == null) return false;
        next.done = true;
        next.runnable.run();
        return true;
    }

    private static final class Task implements ScheduledFuture<Object> {
        final Runnable runnable;
        final long delayMs;
        volatile boolean cancelled;
        volatile boolean done;

        Task(Runnable runnable, long delayMs) {
            this.runnable = runnable;
            this.delayMs = delayMs;
        }

        @Override
        public long getDelay(TimeUnit unit) {
            return unit.convert(delayMs, TimeUnit.MILLISECONDS);
        }

        @Override
        public int compareTo(Delayed o) {
            return Long.compare(getDelay(TimeUnit.MILLISECONDS), o.getDelay(TimeUnit.MILLISECONDS));
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            if (done) return false;
            cancelled = true;
            return true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public boolean isDone() {
            return done || cancelled;
        }

        @Override
        public Object get() {
            return null;
        }

        @Override
        public Object get(long timeout, TimeUnit unit) {
            return null;
        }
    }
}
