package com.example.logrelay.store;

import com.example.logrelay.metrics.StreamingMetricsCollector;
import com.example.logrelay.model.LogLevel;
import com.example.logrelay.model.LogRecord;
import com.example.logrelay.model.LogSource;
import com.example.logrelay.support.ManualClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.example.logrelay.support.TestRecords.T0;
import static com.example.logrelay.support.TestRecords.log;
import static org.assertj.core.api.Assertions.assertThat;

class LogBatcherTest {

    private InMemoryLogArchive archive;
    private StreamingMetricsCollector metrics;
    private LogBatcher batcher;

    @BeforeEach
    void setUp() {
        archive = new InMemoryLogArchive();
        metrics = new StreamingMetricsCollector(new ManualClock(Instant.EPOCH));
        batcher = new LogBatcher(archive, Runnable::run, metrics, 3);
    }

    private LogRecord line(int i, LogSource source) {
        return log("job-1", "worker-1", LogLevel.INFO, source, "line " + i, T0.plusSeconds(i));
    }

    @Test
    void persistsFullBatchesOnly() {
        batcher.append("job-1", line(0, LogSource.STDOUT));
        batcher.append("job-1", line(1, LogSource.STDOUT));
        assertThat(archive.count("job-1", null)).isZero();

        batcher.append("job-1", line(2, LogSource.STDOUT));
        assertThat(archive.count("job-1", null)).isEqualTo(3);
    }

    @Test
    void flushPersistsRemainder() {
        batcher.append("job-1", line(0, LogSource.STDOUT));
        batcher.append("job-2", log("job-2", LogLevel.INFO, "other"));

        batcher.flush("job-1");
        assertThat(archive.count("job-1", null)).isEqualTo(1);
        assertThat(archive.count("job-2", null)).isZero();

        batcher.flushAll();
        assertThat(archive.count("job-2", null)).isEqualTo(1);
    }

    @Test
    void archivePagesAndFiltersBySource() {
        for (int i = 0; i < 6; i++) {
            batcher.append("job-1", line(i, i % 2 == 0 ? LogSource.STDOUT : LogSource.STDERR));
        }

        assertThat(archive.list("job-1", null, 1, 2)).extracting(LogRecord::getMessage).containsExactly("line 1", "line 2");
        assertThat(archive.list("job-1", LogSource.STDERR, 0, 10)).extracting(LogRecord::getMessage)
                .containsExactly("line 1", "line 3", "line 5");
        assertThat(archive.count("job-1", LogSource.STDOUT)).isEqualTo(3);
        assertThat(archive.list("job-1", null, 10, 5)).isEmpty();

        assertThat(archive.deleteJob("job-1")).isEqualTo(6);
        assertThat(archive.count("job-1", null)).isZero();
    }

    @Test
    void sinkFailureIsCountedNotThrown() {
        LogBatcher failing = new LogBatcher((jobId, records) -> {
            throw new IllegalStateException("disk full");
        }, Runnable::run, metrics, 1);

        failing.append("job-1", line(0, LogSource.STDOUT));

        assertThat(metrics.snapshot().getTotalErrors()).isEqualTo(1);
    }

    @Test
    void concurrentFlushNeverLosesAppendedRecords() throws Exception {
        int writers = 4;
        int perWriter = 500;
        ExecutorService pool = Executors.newFixedThreadPool(writers + 1);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int w = 0; w < writers; w++) {
                futures.add(pool.submit(() -> {
                    start.await();
                    for (int i = 0; i < perWriter; i++) {
                        batcher.append("job-1", line(i, LogSource.STDOUT));
                    }
                    return null;
                }));
            }
            futures.add(pool.submit(() -> {
                start.await();
                for (int i = 0; i < perWriter; i++) {
                    batcher.flush("job-1");
                }
                return null;
            }));
            start.countDown();
            for (Future<?> f : futures) {
                f.get(10, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        batcher.flushAll();

        assertThat(archive.count("job-1", null)).isEqualTo((long) writers * perWriter);
    }
}
