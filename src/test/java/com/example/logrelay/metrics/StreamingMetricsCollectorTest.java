package com.example.logrelay.metrics;

import com.example.logrelay.model.MetricsSnapshot;
import com.example.logrelay.support.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class StreamingMetricsCollectorTest {

    private ManualClock clock;
    private StreamingMetricsCollector metrics;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(Instant.parse("2025-09-01T10:00:00Z"));
        metrics = new StreamingMetricsCollector(clock);
    }

    @Test
    void ratesComeFromTheLastWindow() {
        Instant produced = clock.instant();
        clock.advance(Duration.ofMillis(40));
        for (int i = 0; i < 10; i++) {
            metrics.recordMessage(produced);
        }
        metrics.recordError();
        clock.advance(Duration.ofMillis(1960));

        metrics.sample();
        MetricsSnapshot s = metrics.snapshot();

        assertThat(s.getMessagesPerSecond()).isCloseTo(5.0, within(0.001));
        assertThat(s.getErrorRate()).isCloseTo(0.5, within(0.001));
        assertThat(s.getAverageLatencyMs()).isCloseTo(40.0, within(0.001));
        assertThat(s.getTotalMessages()).isEqualTo(10);
        assertThat(s.getTotalErrors()).isEqualTo(1);
        assertThat(s.getMemoryUsageMb()).isPositive();
    }

    @Test
    void windowResetsButTotalsDoNot() {
        metrics.recordMessage(null);
        clock.advance(Duration.ofSeconds(1));
        metrics.sample();
        clock.advance(Duration.ofSeconds(1));
        metrics.sample();

        MetricsSnapshot s = metrics.snapshot();
        assertThat(s.getMessagesPerSecond()).isZero();
        assertThat(s.getTotalMessages()).isEqualTo(1);
    }

    @Test
    void gaugesAndCountersAreLive() {
        metrics.setActiveConnections(3);
        metrics.registerStreamGauge(() -> 2);
        metrics.registerStreamGauge(() -> 1);
        metrics.recordDropped(4);
        metrics.recordDropped(0);

        MetricsSnapshot s = metrics.snapshot();
        assertThat(s.getActiveConnections()).isEqualTo(3);
        assertThat(s.getActiveStreams()).isEqualTo(3);
        assertThat(s.getDroppedMessages()).isEqualTo(4);
        assertThat(s.getSampledAtEpochMs()).isEqualTo(clock.millis());
    }
}
