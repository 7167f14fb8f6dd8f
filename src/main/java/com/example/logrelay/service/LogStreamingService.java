package com.example.logrelay.service;

import com.example.logrelay.config.LogRelayProperties;
import com.example.logrelay.filter.LogFilters;
import com.example.logrelay.metrics.StreamingMetricsCollector;
import com.example.logrelay.model.ArchivedLogsResponse;
import com.example.logrelay.model.FilterRequest;
import com.example.logrelay.model.LogFilter;
import com.example.logrelay.model.LogRecord;
import com.example.logrelay.model.LogSource;
import com.example.logrelay.model.MetricsSnapshot;
import com.example.logrelay.model.ProgressRecord;
import com.example.logrelay.model.SessionView;
import com.example.logrelay.session.SessionNotFoundException;
import com.example.logrelay.session.SessionRegistry;
import com.example.logrelay.store.InMemoryLogArchive;
import com.example.logrelay.store.LogBatcher;
import com.example.logrelay.stream.MultiplexerListener;
import com.example.logrelay.stream.SharedStreamMultiplexer;
import com.example.logrelay.stream.StreamSubscriber;
import com.example.logrelay.upstream.DistinctProgressListener;
import com.example.logrelay.upstream.RetryPolicy;
import com.example.logrelay.upstream.UpstreamException;
import com.example.logrelay.upstream.UpstreamSource;
import com.example.logrelay.upstream.UpstreamStreamAdapter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import javax.annotation.PreDestroy;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Entry point for the transports. Builds and owns the log and progress
 * multiplexers, the session registry, the archive batcher and the metrics
 * sampler, and shuts them down together.
 */
@Service
public class LogStreamingService {
    private static final Logger log = LoggerFactory.getLogger(LogStreamingService.class);

    private static final int MAX_ARCHIVE_PAGE = 500;

    private final SharedStreamMultiplexer<LogRecord> logStreams;
    private final SharedStreamMultiplexer<ProgressRecord> progressStreams;
    private final SessionRegistry sessions;
    private final StreamingMetricsCollector metrics;
    private final LogBatcher batcher;
    private final InMemoryLogArchive archive;
    private final Clock clock;
    private final AtomicBoolean shutdown = new AtomicBoolean(false);

    public LogStreamingService(LogRelayProperties properties,
                               UpstreamSource upstream,
                               InMemoryLogArchive archive,
                               StreamingMetricsCollector metrics,
                               Clock clock,
                               @Qualifier("streamingScheduler") ScheduledExecutorService streamingScheduler,
                               @Qualifier("deliveryExecutor") ExecutorService deliveryExecutor) {
        this.archive = archive;
        this.metrics = metrics;
        this.clock = clock;
        this.batcher = new LogBatcher(archive, deliveryExecutor, metrics, properties.getArchive().getBatchSize());

        LogRelayProperties.Retry logRetry = properties.getUpstream().getLog();
        RetryPolicy logPolicy = new RetryPolicy(logRetry.getMaxAttempts(), logRetry.getRetryDelay());
        this.logStreams = new SharedStreamMultiplexer<>(
                "log",
                (jobId, listener) -> new UpstreamStreamAdapter<>(jobId, "log",
                        observer -> upstream.openLogStream(jobId, observer),
                        logPolicy, streamingScheduler, listener),
                new LogStreamEvents());

        LogRelayProperties.Retry progressRetry = properties.getUpstream().getProgress();
        RetryPolicy progressPolicy = new RetryPolicy(progressRetry.getMaxAttempts(), progressRetry.getRetryDelay());
        this.progressStreams = new SharedStreamMultiplexer<>(
                "progress",
                (pipelineId, listener) -> new UpstreamStreamAdapter<>(pipelineId, "progress",
                        observer -> upstream.openProgressStream(pipelineId, observer),
                        progressPolicy, streamingScheduler, new DistinctProgressListener(listener)),
                new ProgressStreamEvents());

        metrics.registerStreamGauge(logStreams::activeStreamCount);
        metrics.registerStreamGauge(progressStreams::activeStreamCount);

        LogRelayProperties.Session s = properties.getSession();
        this.sessions = new SessionRegistry(logStreams, progressStreams, metrics, clock,
                s.getMaxSessions(), s.getIdleTimeout());

        sessions.start(streamingScheduler, s.getSweepInterval());
        metrics.start(streamingScheduler, properties.getMetrics().getSampleInterval());
        log.info("LogStreamingService initialized: maxSessions={}, idleTimeout={}, logRetry={}, progressRetry={}",
                s.getMaxSessions(), s.getIdleTimeout(), logPolicy, progressPolicy);
    }

    // ---------- sessions ----------

    public SessionView createSession(LogFilter filter) {
        return sessions.createSession(filter);
    }

    /**
     * @throws com.example.logrelay.filter.InvalidFilterException before a session is created
     */
    public SessionView createSession(FilterRequest filter) {
        return sessions.createSession(LogFilters.fromRequest(filter));
    }

    public boolean closeSession(String sessionId) {
        return sessions.closeSession(sessionId);
    }

    /**
     * Validates first; a rejected filter leaves the previous one in effect.
     */
    public void updateFilter(String sessionId, FilterRequest filter) {
        sessions.updateFilter(sessionId, LogFilters.fromRequest(filter));
    }

    public void updateFilter(String sessionId, LogFilter filter) {
        sessions.updateFilter(sessionId, filter);
    }

    public void touch(String sessionId) {
        sessions.touch(sessionId);
    }

    public SessionView getSession(String sessionId) {
        return sessions.getSession(sessionId).orElseThrow(() -> new SessionNotFoundException(sessionId));
    }

    // ---------- subscriptions ----------

    public boolean subscribeLogs(String sessionId, String jobId, StreamSubscriber<LogRecord> subscriber) {
        requireId(jobId, "jobId");
        return sessions.subscribeLogs(sessionId, jobId, subscriber);
    }

    public boolean unsubscribeLogs(String sessionId, String jobId) {
        return sessions.unsubscribeLogs(sessionId, jobId);
    }

    public boolean subscribeProgress(String sessionId, String pipelineId, StreamSubscriber<ProgressRecord> subscriber) {
        requireId(pipelineId, "pipelineId");
        return sessions.subscribeProgress(sessionId, pipelineId, subscriber);
    }

    public boolean unsubscribeProgress(String sessionId, String pipelineId) {
        return sessions.unsubscribeProgress(sessionId, pipelineId);
    }

    // ---------- metrics / archive ----------

    public MetricsSnapshot getMetrics() {
        return metrics.snapshot();
    }

    /** Counts a transport-side drop-oldest eviction. */
    public StreamingMetricsCollector metrics() {
        return metrics;
    }

    public int activeStreamCount() {
        return logStreams.activeStreamCount() + progressStreams.activeStreamCount();
    }

    public ArchivedLogsResponse listArchivedLogs(String jobId, String source, int offset, int limit) {
        requireId(jobId, "jobId");
        LogSource src = (source == null || source.isBlank()) ? null : LogSource.parse(source);
        int safeOffset = Math.max(0, offset);
        int safeLimit = Math.max(1, Math.min(limit, MAX_ARCHIVE_PAGE));
        List<LogRecord> items = archive.list(jobId, src, safeOffset, safeLimit);
        return new ArchivedLogsResponse(jobId, safeOffset, safeLimit, archive.count(jobId, src), items);
    }

    public int deleteArchivedLogs(String jobId) {
        requireId(jobId, "jobId");
        int removed = archive.deleteJob(jobId);
        log.info("Archived logs deleted: jobId={}, count={}", jobId, removed);
        return removed;
    }

    public Clock clock() {
        return clock;
    }

    @PreDestroy
    public void shutdown() {
        if (!shutdown.compareAndSet(false, true)) return;
        log.info("LogStreamingService shutting down...");
        sessions.shutdown();
        logStreams.shutdown();
        progressStreams.shutdown();
        batcher.flushAll();
        metrics.shutdown();
        log.info("LogStreamingService shut down");
    }

    private static void requireId(String id, String name) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }

    private final class LogStreamEvents implements MultiplexerListener<LogRecord> {
        @Override
        public void onRecord(String jobId, LogRecord record) {
            batcher.append(jobId, record);
        }

        @Override
        public void onDelivered(String jobId, LogRecord record) {
            metrics.recordMessage(record.getTimestamp());
        }

        @Override
        public void onSubscriberError(String jobId, Throwable error) {
            metrics.recordError();
        }

        @Override
        public void onStreamError(String jobId, UpstreamException error) {
            metrics.recordError();
        }

        @Override
        public void onStreamClosed(String jobId) {
            batcher.flush(jobId);
        }
    }

    private final class ProgressStreamEvents implements MultiplexerListener<ProgressRecord> {
        @Override
        public void onDelivered(String pipelineId, ProgressRecord record) {
            metrics.recordMessage(record.getTimestamp());
        }

        @Override
        public void onSubscriberError(String pipelineId, Throwable error) {
            metrics.recordError();
        }

        @Override
        public void onStreamError(String pipelineId, UpstreamException error) {
            metrics.recordError();
        }
    }
}
