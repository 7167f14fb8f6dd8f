package com.example.logrelay.config;

import com.example.logrelay.metrics.StreamingMetricsCollector;
import com.example.logrelay.store.InMemoryLogArchive;
import com.example.logrelay.upstream.SimulatedUpstreamSource;
import com.example.logrelay.upstream.UpstreamSource;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

@Configuration
@EnableConfigurationProperties(LogRelayProperties.class)
public class StreamingConfig {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Timers: upstream retries, session sweep, metrics sampling, heartbeats.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService streamingScheduler() {
        return Executors.newScheduledThreadPool(2, new CustomizableThreadFactory("logrelay-timer-"));
    }

    /**
     * Client writes (outbox drains) and archive batches.
     */
    @Bean(destroyMethod = "shutdown")
    public ExecutorService deliveryExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("logrelay-delivery-"));
    }

    @Bean
    public StreamingMetricsCollector streamingMetricsCollector(Clock clock) {
        return new StreamingMetricsCollector(clock);
    }

    @Bean
    public InMemoryLogArchive logArchive() {
        return new InMemoryLogArchive();
    }

    /**
     * Development upstream. A real deployment disables the simulator and
     * provides its own {@link UpstreamSource} bean.
     */
    @Bean
    @ConditionalOnMissingBean(UpstreamSource.class)
    @ConditionalOnProperty(prefix = "logrelay.simulator", name = "enabled", havingValue = "true", matchIfMissing = true)
    public UpstreamSource simulatedUpstreamSource(ScheduledExecutorService streamingScheduler,
                                                  LogRelayProperties properties,
                                                  Clock clock) {
        LogRelayProperties.Simulator sim = properties.getSimulator();
        return new SimulatedUpstreamSource(streamingScheduler, sim.getInterval(), sim.getTotalLogs(), clock);
    }
}
