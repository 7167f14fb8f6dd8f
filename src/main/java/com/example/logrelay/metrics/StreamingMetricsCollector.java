package com.example.logrelay.metrics;

import com.example.logrelay.model.MetricsSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;
import java.util.function.IntSupplier;

/**
 * In-memory counters for the streaming core.
 * <p>
 * Producers only touch adders and atomics. A periodic {@link #sample()} turns
 * the window counters into rates and publishes an immutable snapshot;
 * {@link #snapshot()} never blocks.
 */
public class StreamingMetricsCollector {
    private static final Logger log = LoggerFactory.getLogger(StreamingMetricsCollector.class);
    private static final double MB = 1024.0 * 1024.0;

    private final Clock clock;

    private final LongAdder totalMessages = new LongAdder();
    private final LongAdder totalErrors = new LongAdder();
    private final LongAdder droppedMessages = new LongAdder();

    private final LongAdder windowMessages = new LongAdder();
    private final LongAdder windowErrors = new LongAdder();
    private final LongAdder windowLatencyMs = new LongAdder();
    private final LongAdder windowLatencySamples = new LongAdder();

    private final AtomicInteger activeConnections = new AtomicInteger();
    private final List<IntSupplier> streamGauges = new CopyOnWriteArrayList<>();

    private volatile Rates rates = new Rates(0, 0, 0, 0);
    private volatile long windowStartedMs;

    private ScheduledFuture<?> sampling;

    public StreamingMetricsCollector(Clock clock) {
        this.clock = clock;
        this.windowStartedMs = clock.millis();
    }

    /** Samples every {@code interval} on {@code scheduler} until {@link #shutdown()}. */
    public synchronized void start(ScheduledExecutorService scheduler, Duration interval) {
        if (sampling != null) return;
        long ms = interval.toMillis();
        sampling = scheduler.scheduleAtFixedRate(() -> {
            try {
                sample();
            } catch (RuntimeException e) {
                log.warn("Metrics sampling failed: {}", e.toString());
            }
        }, ms, ms, TimeUnit.MILLISECONDS);
    }

    public synchronized void shutdown() {
        if (sampling != null) {
            sampling.cancel(false);
            sampling = null;
        }
    }

    /**
     * Counts one record handed to a subscriber.
     *
     * @param producedAt upstream timestamp of the record, used for the latency average; may be null
     */
    public void recordMessage(Instant producedAt) {
        totalMessages.increment();
        windowMessages.increment();
        if (producedAt != null) {
            long latency = clock.millis() - producedAt.toEpochMilli();
            if (latency >= 0) {
                windowLatencyMs.add(latency);
                windowLatencySamples.increment();
            }
        }
    }

    public void recordError() {
        totalErrors.increment();
        windowErrors.increment();
    }

    public void recordDropped(int count) {
        if (count > 0) droppedMessages.add(count);
    }

    public void setActiveConnections(int count) {
        activeConnections.set(count);
    }

    public void registerStreamGauge(IntSupplier gauge) {
        streamGauges.add(gauge);
    }

    /**
     * Closes the current window: computes per-second rates and resets the window counters.
     */
    public void sample() {
        long now = clock.millis();
        long elapsed = Math.max(1L, now - windowStartedMs);
        windowStartedMs = now;

        long messages = windowMessages.sumThenReset();
        long errors = windowErrors.sumThenReset();
        long latency = windowLatencyMs.sumThenReset();
        long samples = windowLatencySamples.sumThenReset();

        Runtime rt = Runtime.getRuntime();
        double memoryMb = (rt.totalMemory() - rt.freeMemory()) / MB;

        rates = new Rates(
                messages * 1000.0 / elapsed,
                errors * 1000.0 / elapsed,
                samples == 0 ? 0 : (double) latency / samples,
                memoryMb);
    }

    public MetricsSnapshot snapshot() {
        Rates r = rates;
        int streams = 0;
        for (IntSupplier g : streamGauges) {
            streams += g.getAsInt();
        }
        return new MetricsSnapshot(
                activeConnections.get(),
                streams,
                r.messagesPerSecond,
                r.averageLatencyMs,
                r.errorsPerSecond,
                r.memoryMb,
                totalMessages.sum(),
                totalErrors.sum(),
                droppedMessages.sum(),
                clock.millis());
    }

    private static final class Rates {
        final double messagesPerSecond;
        final double errorsPerSecond;
        final double averageLatencyMs;
        final double memoryMb;

        Rates(double messagesPerSecond, double errorsPerSecond, double averageLatencyMs, double memoryMb) {
            this.messagesPerSecond = messagesPerSecond;
            this.errorsPerSecond = errorsPerSecond;
            this.averageLatencyMs = averageLatencyMs;
            this.memoryMb = memoryMb;
        }
    }
}
