package com.example.logrelay.api;

import com.example.logrelay.delivery.StreamEvent;
import com.example.logrelay.delivery.StreamEvents;
import com.example.logrelay.delivery.SubscriberOutbox;
import com.example.logrelay.metrics.StreamingMetricsCollector;
import com.example.logrelay.model.LogRecord;
import com.example.logrelay.model.ProgressRecord;
import com.example.logrelay.stream.StreamSubscriber;
import com.example.logrelay.upstream.UpstreamException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.concurrent.Executor;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * One push-stream client: an {@link SseEmitter} fed through a bounded outbox,
 * with a periodic heartbeat. Whatever ends the emitter (client gone, timeout,
 * write failure, upstream end) runs the close callback exactly once.
 */
class SseChannel {
    private static final Logger log = LoggerFactory.getLogger(SseChannel.class);
    private static final String END = "__end";

    private final String sessionId;
    private final SseEmitter emitter;
    private final SubscriberOutbox<StreamEvent> outbox;
    private final Clock clock;
    private final Consumer<String> onClose;
    private final AtomicBoolean closed = new AtomicBoolean(false);
    private volatile ScheduledFuture<?> heartbeat;

    SseChannel(String sessionId,
               Duration timeout,
               int bufferSize,
               Executor deliveryExecutor,
               StreamingMetricsCollector metrics,
               Clock clock,
               Consumer<String> onClose) {
        this.sessionId = sessionId;
        this.clock = clock;
        this.onClose = onClose;
        this.emitter = new SseEmitter(timeout.toMillis());
        this.outbox = new SubscriberOutbox<>("sse-" + sessionId, bufferSize, deliveryExecutor,
                this::write, this::close, metrics);

        emitter.onCompletion(this::close);
        emitter.onTimeout(this::close);
        emitter.onError(e -> {
            log.debug("SSE error: sessionId={}, {}", sessionId, e.toString());
            close();
        });
    }

    SseEmitter emitter() {
        return emitter;
    }

    /**
     * @param keepAlive runs before each beat; a failure (session gone) closes the channel
     */
    void startHeartbeat(ScheduledExecutorService scheduler, Duration interval, Runnable keepAlive) {
        long ms = interval.toMillis();
        if (ms <= 0) return;
        heartbeat = scheduler.scheduleAtFixedRate(() -> {
            try {
                keepAlive.run();
            } catch (RuntimeException e) {
                log.debug("Heartbeat stopped: sessionId={}, {}", sessionId, e.toString());
                close();
                return;
            }
            send("heartbeat", StreamEvents.heartbeat(clock.instant()));
        }, ms, ms, TimeUnit.MILLISECONDS);
        // the stream may have ended before the beat was scheduled
        if (closed.get()) heartbeat.cancel(false);
    }

    void send(String type, Map<String, Object> payload) {
        outbox.offer(new StreamEvent(type, payload));
    }

    StreamSubscriber<LogRecord> logSubscriber(String jobId) {
        return new StreamSubscriber<LogRecord>() {
            @Override
            public void onRecord(LogRecord record) {
                send("log", StreamEvents.log(record));
            }

            @Override
            public void onError(UpstreamException error) {
                send("error", StreamEvents.error(jobId, error, clock.instant()));
                finish();
            }

            @Override
            public void onComplete() {
                send("complete", StreamEvents.complete(jobId, clock.instant()));
                finish();
            }
        };
    }

    StreamSubscriber<ProgressRecord> progressSubscriber(String pipelineId) {
        return new StreamSubscriber<ProgressRecord>() {
            @Override
            public void onRecord(ProgressRecord record) {
                send("progress", StreamEvents.progress(record));
            }

            @Override
            public void onError(UpstreamException error) {
                send("error", StreamEvents.error(pipelineId, error, clock.instant()));
                finish();
            }

            @Override
            public void onComplete() {
                send("complete", StreamEvents.complete(pipelineId, clock.instant()));
                finish();
            }
        };
    }

    /** Completes the emitter once the last queued event has been written. */
    private void finish() {
        outbox.offer(new StreamEvent(END, null));
    }

    private void write(StreamEvent event) throws IOException {
        if (END.equals(event.getType())) {
            emitter.complete();
            return;
        }
        emitter.send(SseEmitter.event()
                .name(event.getType())
                .data(event.getPayload(), MediaType.APPLICATION_JSON));
    }

    void close() {
        if (!closed.compareAndSet(false, true)) return;
        ScheduledFuture<?> hb = heartbeat;
        if (hb != null) hb.cancel(false);
        outbox.close();
        try {
            emitter.complete();
        } catch (IllegalStateException e) {
            log.trace("Emitter already completed: sessionId={}", sessionId);
        }
        onClose.accept(sessionId);
    }
}
