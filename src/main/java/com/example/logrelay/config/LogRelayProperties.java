package com.example.logrelay.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * {@code logrelay.*} settings. Defaults match application.properties.
 */
@ConfigurationProperties(prefix = "logrelay")
public class LogRelayProperties {

    private final Session session = new Session();
    private final Upstream upstream = new Upstream();
    private final Delivery delivery = new Delivery();
    private final Metrics metrics = new Metrics();
    private final Archive archive = new Archive();
    private final Simulator simulator = new Simulator();

    public Session getSession() { return session; }
    public Upstream getUpstream() { return upstream; }
    public Delivery getDelivery() { return delivery; }
    public Metrics getMetrics() { return metrics; }
    public Archive getArchive() { return archive; }
    public Simulator getSimulator() { return simulator; }

    public static class Session {
        private int maxSessions = 1000;
        private Duration idleTimeout = Duration.ofMinutes(30);
        private Duration sweepInterval = Duration.ofSeconds(60);

        public int getMaxSessions() { return maxSessions; }
        public void setMaxSessions(int maxSessions) { this.maxSessions = maxSessions; }

        public Duration getIdleTimeout() { return idleTimeout; }
        public void setIdleTimeout(Duration idleTimeout) { this.idleTimeout = idleTimeout; }

        public Duration getSweepInterval() { return sweepInterval; }
        public void setSweepInterval(Duration sweepInterval) { this.sweepInterval = sweepInterval; }
    }

    public static class Upstream {
        private final Retry log = new Retry(3, Duration.ofSeconds(1));
        private final Retry progress = new Retry(2, Duration.ofSeconds(2));

        public Retry getLog() { return log; }
        public Retry getProgress() { return progress; }
    }

    public static class Retry {
        private int maxAttempts;
        private Duration retryDelay;

        public Retry() {
            this(1, Duration.ZERO);
        }

        public Retry(int maxAttempts, Duration retryDelay) {
            this.maxAttempts = maxAttempts;
            this.retryDelay = retryDelay;
        }

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }

        public Duration getRetryDelay() { return retryDelay; }
        public void setRetryDelay(Duration retryDelay) { this.retryDelay = retryDelay; }
    }

    public static class Delivery {
        private int bufferSize = 500;
        private Duration heartbeatInterval = Duration.ofSeconds(30);
        private Duration sseTimeout = Duration.ZERO; // 0 = never time out

        public int getBufferSize() { return bufferSize; }
        public void setBufferSize(int bufferSize) { this.bufferSize = bufferSize; }

        public Duration getHeartbeatInterval() { return heartbeatInterval; }
        public void setHeartbeatInterval(Duration heartbeatInterval) { this.heartbeatInterval = heartbeatInterval; }

        public Duration getSseTimeout() { return sseTimeout; }
        public void setSseTimeout(Duration sseTimeout) { this.sseTimeout = sseTimeout; }
    }

    public static class Metrics {
        private Duration sampleInterval = Duration.ofSeconds(1);

        public Duration getSampleInterval() { return sampleInterval; }
        public void setSampleInterval(Duration sampleInterval) { this.sampleInterval = sampleInterval; }
    }

    public static class Archive {
        private int batchSize = 50;

        public int getBatchSize() { return batchSize; }
        public void setBatchSize(int batchSize) { this.batchSize = batchSize; }
    }

    public static class Simulator {
        private boolean enabled = true;
        private Duration interval = Duration.ofSeconds(1);
        private int totalLogs = 100;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public Duration getInterval() { return interval; }
        public void setInterval(Duration interval) { this.interval = interval; }

        public int getTotalLogs() { return totalLogs; }
        public void setTotalLogs(int totalLogs) { this.totalLogs = totalLogs; }
    }
}
