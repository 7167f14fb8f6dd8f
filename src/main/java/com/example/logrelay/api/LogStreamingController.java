package com.example.logrelay.api;

import com.example.logrelay.config.LogRelayProperties;
import com.example.logrelay.filter.LogFilters;
import com.example.logrelay.model.ArchivedLogsResponse;
import com.example.logrelay.model.FilterRequest;
import com.example.logrelay.model.HealthResponse;
import com.example.logrelay.model.LogFilter;
import com.example.logrelay.model.MetricsSnapshot;
import com.example.logrelay.model.SessionView;
import com.example.logrelay.service.LogStreamingService;
import com.example.logrelay.session.SessionNotFoundException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;

@RestController
@RequestMapping("/api/log-streaming")
public class LogStreamingController {
    private static final Logger log = LoggerFactory.getLogger(LogStreamingController.class);

    private final LogStreamingService service;
    private final LogRelayProperties properties;
    private final ScheduledExecutorService streamingScheduler;
    private final ExecutorService deliveryExecutor;

    public LogStreamingController(LogStreamingService service,
                                  LogRelayProperties properties,
                                  @Qualifier("streamingScheduler") ScheduledExecutorService streamingScheduler,
                                  @Qualifier("deliveryExecutor") ExecutorService deliveryExecutor) {
        this.service = service;
        this.properties = properties;
        this.streamingScheduler = streamingScheduler;
        this.deliveryExecutor = deliveryExecutor;
    }

    /**
     * Live log stream for one job.
     * - level/source/keywords/workerId: comma separated, any match within a dimension
     * No produces attribute, so a rejected filter still renders as a JSON error.
     */
    @GetMapping("/logs/{jobId}/stream")
    public SseEmitter streamLogs(
            @PathVariable String jobId,
            @RequestParam(required = false) String level,
            @RequestParam(required = false) String source,
            @RequestParam(required = false) String keywords,
            @RequestParam(required = false) String workerId
    ) {
        LogFilter filter = LogFilters.fromQuery(level, source, keywords, workerId);
        SessionView session = service.createSession(filter);
        SseChannel channel = openChannel(session.getSessionId());
        channel.send("connected", connected(session.getSessionId(), "jobId", jobId));
        try {
            service.subscribeLogs(session.getSessionId(), jobId, channel.logSubscriber(jobId));
        } catch (RuntimeException e) {
            channel.close();
            throw e;
        }
        channel.startHeartbeat(streamingScheduler, properties.getDelivery().getHeartbeatInterval(),
                () -> service.touch(session.getSessionId()));
        log.info("SSE log stream opened: sessionId={}, jobId={}, filter={}", session.getSessionId(), jobId, filter);
        return channel.emitter();
    }

    @GetMapping("/pipelines/{pipelineId}/progress")
    public SseEmitter streamProgress(@PathVariable String pipelineId) {
        SessionView session = service.createSession(LogFilter.NONE);
        SseChannel channel = openChannel(session.getSessionId());
        channel.send("connected", connected(session.getSessionId(), "pipelineId", pipelineId));
        try {
            service.subscribeProgress(session.getSessionId(), pipelineId, channel.progressSubscriber(pipelineId));
        } catch (RuntimeException e) {
            channel.close();
            throw e;
        }
        channel.startHeartbeat(streamingScheduler, properties.getDelivery().getHeartbeatInterval(),
                () -> service.touch(session.getSessionId()));
        log.info("SSE progress stream opened: sessionId={}, pipelineId={}", session.getSessionId(), pipelineId);
        return channel.emitter();
    }

    @GetMapping(value = "/sessions/{sessionId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public SessionView getSession(@PathVariable String sessionId) {
        return service.getSession(sessionId);
    }

    @PutMapping(value = "/sessions/{sessionId}/filter", produces = MediaType.APPLICATION_JSON_VALUE)
    public SessionView updateFilter(@PathVariable String sessionId, @RequestBody FilterRequest req) {
        service.updateFilter(sessionId, req);
        return service.getSession(sessionId);
    }

    @DeleteMapping(value = "/sessions/{sessionId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> closeSession(@PathVariable String sessionId) {
        if (!service.closeSession(sessionId)) {
            throw new SessionNotFoundException(sessionId);
        }
        Map<String, Object> out = new HashMap<>();
        out.put("sessionId", sessionId);
        out.put("closed", true);
        return out;
    }

    /**
     * Archived log page for a job.
     * - source: stdout/stderr/system, optional
     * - limit: rows to return (max 500)
     */
    @GetMapping(value = "/logs/{jobId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public ArchivedLogsResponse archivedLogs(
            @PathVariable String jobId,
            @RequestParam(required = false) String source,
            @RequestParam(required = false, defaultValue = "0") int offset,
            @RequestParam(required = false, defaultValue = "100") int limit
    ) {
        return service.listArchivedLogs(jobId, source, offset, limit);
    }

    @DeleteMapping(value = "/logs/{jobId}", produces = MediaType.APPLICATION_JSON_VALUE)
    public Map<String, Object> deleteArchivedLogs(@PathVariable String jobId) {
        Map<String, Object> out = new HashMap<>();
        out.put("jobId", jobId);
        out.put("deleted", service.deleteArchivedLogs(jobId));
        return out;
    }

    @GetMapping(value = "/health", produces = MediaType.APPLICATION_JSON_VALUE)
    public HealthResponse health() {
        MetricsSnapshot m = service.getMetrics();
        return new HealthResponse("UP", service.clock().millis(), m.getActiveConnections(), m.getActiveStreams());
    }

    @GetMapping(value = "/metrics", produces = MediaType.APPLICATION_JSON_VALUE)
    public MetricsSnapshot metrics() {
        return service.getMetrics();
    }

    private SseChannel openChannel(String sessionId) {
        LogRelayProperties.Delivery d = properties.getDelivery();
        return new SseChannel(sessionId, d.getSseTimeout(), d.getBufferSize(), deliveryExecutor,
                service.metrics(), service.clock(), this::onChannelClosed);
    }

    private void onChannelClosed(String sessionId) {
        if (service.closeSession(sessionId)) {
            log.info("SSE stream closed: sessionId={}", sessionId);
        }
    }

    private Map<String, Object> connected(String sessionId, String keyName, String key) {
        Map<String, Object> p = new HashMap<>();
        p.put("sessionId", sessionId);
        p.put(keyName, key);
        p.put("timestamp", service.clock().instant().toString());
        return p;
    }
}
