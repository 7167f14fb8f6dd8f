package com.example.logrelay.ws;

import com.example.logrelay.config.LogRelayProperties;
import com.example.logrelay.delivery.StreamEvents;
import com.example.logrelay.delivery.SubscriberOutbox;
import com.example.logrelay.model.FilterRequest;
import com.example.logrelay.model.LogFilter;
import com.example.logrelay.model.LogRecord;
import com.example.logrelay.model.ProgressRecord;
import com.example.logrelay.model.SessionView;
import com.example.logrelay.service.LogStreamingService;
import com.example.logrelay.session.SessionCapacityException;
import com.example.logrelay.session.SessionNotFoundException;
import com.example.logrelay.stream.StreamSubscriber;
import com.example.logrelay.upstream.UpstreamException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;

/**
 * Socket transport. Each connection owns one streaming session; frames are
 * JSON objects with a {@code type} field. All outgoing frames, replies
 * included, go through the connection's outbox so the socket is written by
 * one drain at a time.
 */
@Component
public class LogStreamingWebSocketHandler extends TextWebSocketHandler {
    private static final Logger log = LoggerFactory.getLogger(LogStreamingWebSocketHandler.class);

    private final LogStreamingService service;
    private final LogRelayProperties properties;
    private final ExecutorService deliveryExecutor;
    private final ObjectMapper om;

    private final Map<String, Connection> connections = new ConcurrentHashMap<>();

    public LogStreamingWebSocketHandler(LogStreamingService service,
                                        LogRelayProperties properties,
                                        @Qualifier("deliveryExecutor") ExecutorService deliveryExecutor,
                                        ObjectMapper om) {
        this.service = service;
        this.properties = properties;
        this.deliveryExecutor = deliveryExecutor;
        this.om = om;
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession ws) throws Exception {
        SessionView session;
        try {
            session = service.createSession(LogFilter.NONE);
        } catch (SessionCapacityException e) {
            Map<String, Object> p = frame("connection_error");
            p.put("message", "server is at capacity");
            p.put("details", e.getMessage());
            ws.sendMessage(new TextMessage(om.writeValueAsString(p)));
            ws.close(CloseStatus.SERVICE_OVERLOAD);
            log.warn("WS connection rejected: wsId={}, {}", ws.getId(), e.getMessage());
            return;
        }

        Connection c = new Connection(ws, session.getSessionId());
        connections.put(ws.getId(), c);

        Map<String, Object> p = frame("connected");
        p.put("sessionId", session.getSessionId());
        p.put("message", "connected to log streaming");
        p.put("features", Arrays.asList("real-time-logs", "pipeline-progress", "log-filtering", "job-subscription"));
        c.send(p);
        log.info("WS connected. wsId={} sessionId={} total={}", ws.getId(), session.getSessionId(), connections.size());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession ws, CloseStatus status) {
        Connection c = connections.remove(ws.getId());
        if (c == null) return;
        c.outbox.close();
        service.closeSession(c.sessionId);
        log.info("WS closed. wsId={} sessionId={} status={} total={}", ws.getId(), c.sessionId, status, connections.size());
    }

    @Override
    public void handleTransportError(WebSocketSession ws, Throwable exception) {
        log.debug("WS transport error: wsId={}, {}", ws.getId(), exception.toString());
    }

    @Override
    protected void handleTextMessage(WebSocketSession ws, TextMessage message) {
        Connection c = connections.get(ws.getId());
        if (c == null) return;

        JsonNode root;
        try {
            root = om.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            log.warn("WS bad json: wsId={}", ws.getId());
            Map<String, Object> p = frame("error");
            p.put("message", "malformed frame");
            c.send(p);
            return;
        }
        String type = root.path("type").asText("");

        try {
            switch (type) {
                case "subscribe-to-logs":
                    subscribeLogs(c, root);
                    break;
                case "unsubscribe-from-logs":
                    unsubscribe(c, type, "jobId", text(root, "jobId"), false);
                    break;
                case "update-log-filter":
                    updateFilter(c, root);
                    break;
                case "subscribe-to-pipeline":
                    subscribePipeline(c, root);
                    break;
                case "unsubscribe-from-pipeline":
                    unsubscribe(c, type, "pipelineId", text(root, "pipelineId"), true);
                    break;
                case "get-server-stats": {
                    service.touch(c.sessionId);
                    Map<String, Object> p = frame("server-stats");
                    p.put("stats", service.getMetrics());
                    c.send(p);
                    break;
                }
                case "heartbeat": {
                    service.touch(c.sessionId);
                    Map<String, Object> p = frame("heartbeat");
                    p.putAll(StreamEvents.heartbeat(service.clock().instant()));
                    c.send(p);
                    break;
                }
                default: {
                    Map<String, Object> p = frame("error");
                    p.put("message", "unknown frame type: " + type);
                    c.send(p);
                }
            }
        } catch (SessionNotFoundException e) {
            // expired by the sweep while the socket stayed open
            Map<String, Object> p = frame("connection_error");
            p.put("message", "session expired");
            c.send(p);
            closeQuietly(ws, CloseStatus.SESSION_NOT_RELIABLE);
        }
    }

    private void subscribeLogs(Connection c, JsonNode root) {
        String event = "subscribe-to-logs";
        String jobId = text(root, "jobId");
        if (jobId == null) {
            c.send(error("subscription_error", event, "jobId is required"));
            return;
        }
        try {
            if (root.hasNonNull("filter")) {
                service.updateFilter(c.sessionId, readFilter(root.get("filter")));
            }
            boolean added = service.subscribeLogs(c.sessionId, jobId, c.logSubscriber(jobId));
            Map<String, Object> p = frame("subscription_success");
            p.put("event", event);
            p.put("jobId", jobId);
            p.put("alreadySubscribed", !added);
            c.send(p);
            log.debug("WS log subscription: sessionId={}, jobId={}", c.sessionId, jobId);
        } catch (IllegalArgumentException e) {
            c.send(error("subscription_error", event, e.getMessage()));
        }
    }

    private void subscribePipeline(Connection c, JsonNode root) {
        String event = "subscribe-to-pipeline";
        String pipelineId = text(root, "pipelineId");
        if (pipelineId == null) {
            c.send(error("subscription_error", event, "pipelineId is required"));
            return;
        }
        boolean added = service.subscribeProgress(c.sessionId, pipelineId, c.progressSubscriber(pipelineId));
        Map<String, Object> p = frame("subscription_success");
        p.put("event", event);
        p.put("pipelineId", pipelineId);
        p.put("alreadySubscribed", !added);
        c.send(p);
        log.debug("WS pipeline subscription: sessionId={}, pipelineId={}", c.sessionId, pipelineId);
    }

    private void unsubscribe(Connection c, String event, String keyName, String key, boolean pipeline) {
        if (key == null) {
            c.send(error("unsubscription_error", event, keyName + " is required"));
            return;
        }
        boolean removed = pipeline
                ? service.unsubscribeProgress(c.sessionId, key)
                : service.unsubscribeLogs(c.sessionId, key);
        if (!removed) {
            c.send(error("unsubscription_error", event, "not subscribed to " + key));
            return;
        }
        Map<String, Object> p = frame("unsubscription_success");
        p.put("event", event);
        p.put(keyName, key);
        c.send(p);
    }

    private void updateFilter(Connection c, JsonNode root) {
        String event = "update-log-filter";
        try {
            FilterRequest req = readFilter(root.path("filter"));
            service.updateFilter(c.sessionId, req);
            Map<String, Object> p = frame("filter_update_success");
            p.put("event", event);
            p.put("filter", service.getSession(c.sessionId).getFilter());
            c.send(p);
        } catch (IllegalArgumentException e) {
            c.send(error("filter_update_error", event, e.getMessage()));
        }
    }

    private FilterRequest readFilter(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return new FilterRequest();
        }
        try {
            return om.treeToValue(node, FilterRequest.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("malformed filter: " + e.getOriginalMessage());
        }
    }

    private Map<String, Object> frame(String type) {
        Map<String, Object> p = new LinkedHashMap<>();
        p.put("type", type);
        p.put("timestamp", service.clock().instant().toString());
        return p;
    }

    private Map<String, Object> error(String type, String event, String message) {
        Map<String, Object> p = frame(type);
        p.put("event", event);
        p.put("message", message);
        return p;
    }

    private static String text(JsonNode root, String field) {
        JsonNode n = root.get(field);
        if (n == null || n.isNull()) return null;
        String v = n.asText().trim();
        return v.isEmpty() ? null : v;
    }

    private static void closeQuietly(WebSocketSession ws, CloseStatus status) {
        try {
            if (ws.isOpen()) ws.close(status);
        } catch (IOException e) {
            log.debug("WS close failed: wsId={}, {}", ws.getId(), e.toString());
        }
    }

    private final class Connection {
        private final WebSocketSession ws;
        private final String sessionId;
        private final SubscriberOutbox<Map<String, Object>> outbox;

        Connection(WebSocketSession ws, String sessionId) {
            this.ws = ws;
            this.sessionId = sessionId;
            this.outbox = new SubscriberOutbox<>("ws-" + ws.getId(), properties.getDelivery().getBufferSize(),
                    deliveryExecutor, this::write, () -> closeQuietly(ws, CloseStatus.SERVER_ERROR),
                    service.metrics());
        }

        void send(Map<String, Object> payload) {
            outbox.offer(payload);
        }

        private void write(Map<String, Object> payload) throws IOException {
            if (!ws.isOpen()) throw new IOException("socket closed");
            ws.sendMessage(new TextMessage(om.writeValueAsString(payload)));
        }

        StreamSubscriber<LogRecord> logSubscriber(String jobId) {
            return new StreamSubscriber<LogRecord>() {
                @Override
                public void onRecord(LogRecord record) {
                    Map<String, Object> p = frame("log-entry");
                    p.putAll(StreamEvents.log(record));
                    send(p);
                }

                @Override
                public void onError(UpstreamException error) {
                    Map<String, Object> p = frame("stream-error");
                    p.put("jobId", jobId);
                    p.putAll(StreamEvents.error(jobId, error, service.clock().instant()));
                    send(p);
                }

                @Override
                public void onComplete() {
                    Map<String, Object> p = frame("stream-complete");
                    p.put("jobId", jobId);
                    p.putAll(StreamEvents.complete(jobId, service.clock().instant()));
                    send(p);
                }
            };
        }

        StreamSubscriber<ProgressRecord> progressSubscriber(String pipelineId) {
            return new StreamSubscriber<ProgressRecord>() {
                @Override
                public void onRecord(ProgressRecord record) {
                    Map<String, Object> p = frame("pipeline-progress");
                    p.putAll(StreamEvents.progress(record));
                    send(p);
                }

                @Override
                public void onError(UpstreamException error) {
                    Map<String, Object> p = frame("stream-error");
                    p.put("pipelineId", pipelineId);
                    p.putAll(StreamEvents.error(pipelineId, error, service.clock().instant()));
                    send(p);
                }

                @Override
                public void onComplete() {
                    Map<String, Object> p = frame("stream-complete");
                    p.put("pipelineId", pipelineId);
                    p.putAll(StreamEvents.complete(pipelineId, service.clock().instant()));
                    send(p);
                }
            };
        }
    }
}
