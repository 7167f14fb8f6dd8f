package com.example.logrelay.filter;

import com.example.logrelay.model.LogFilter;
import com.example.logrelay.model.LogLevel;
import com.example.logrelay.model.LogRecord;
import com.example.logrelay.model.LogSource;
import com.example.logrelay.model.ProgressRecord;
import com.example.logrelay.model.ProgressStatus;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.Random;

import static com.example.logrelay.support.TestRecords.T0;
import static com.example.logrelay.support.TestRecords.log;
import static org.assertj.core.api.Assertions.assertThat;

class LogFilterEvaluatorTest {

    private final LogRecord infoOut = log("job-1", "worker-1", LogLevel.INFO, LogSource.STDOUT, "Compiling module core", T0);
    private final LogRecord errorErr = log("job-1", "worker-2", LogLevel.ERROR, LogSource.STDERR, "Test FAILED: timeout", T0.plusSeconds(10));

    @Test
    void emptyFilterPassesEverything() {
        assertThat(LogFilterEvaluator.matches(infoOut, LogFilter.NONE)).isTrue();
        assertThat(LogFilterEvaluator.matches(errorErr, (LogFilter) null)).isTrue();
    }

    @Test
    void levelAndSourceMustBothMatch() {
        LogFilter f = LogFilter.builder().level(LogLevel.ERROR).source(LogSource.STDOUT).build();

        assertThat(LogFilterEvaluator.matches(errorErr, f)).isFalse();
        assertThat(LogFilterEvaluator.matches(infoOut, f)).isFalse();
        assertThat(LogFilterEvaluator.matches(
                log("job-1", "worker-2", LogLevel.ERROR, LogSource.STDOUT, "x", T0), f)).isTrue();
    }

    @Test
    void keywordsAreCaseInsensitiveAndAnyMatchIsEnough() {
        LogFilter f = LogFilter.builder().keyword("failed").keyword("deploy").build();

        assertThat(LogFilterEvaluator.matches(errorErr, f)).isTrue();
        assertThat(LogFilterEvaluator.matches(infoOut, f)).isFalse();
    }

    @Test
    void workerAndJobDimensions() {
        assertThat(LogFilterEvaluator.matches(infoOut, LogFilter.builder().workerId("worker-2").build())).isFalse();
        assertThat(LogFilterEvaluator.matches(errorErr, LogFilter.builder().workerId("worker-2").build())).isTrue();
        assertThat(LogFilterEvaluator.matches(infoOut, LogFilter.builder().jobId("job-9").build())).isFalse();
    }

    @Test
    void timeRangeIncludesBothEnds() {
        LogFilter f = LogFilter.builder().from(T0).to(T0.plusSeconds(10)).build();

        assertThat(LogFilterEvaluator.matches(infoOut, f)).isTrue();
        assertThat(LogFilterEvaluator.matches(errorErr, f)).isTrue();
        assertThat(LogFilterEvaluator.matches(
                log("job-1", "worker-1", LogLevel.INFO, LogSource.STDOUT, "late", T0.plusSeconds(11)), f)).isFalse();
    }

    @Test
    void progressIgnoresLevelButChecksKeywordsInErrorMessage() {
        ProgressRecord failed = new ProgressRecord("p-1", "test", ProgressStatus.FAILED, 50, "Stage test",
                T0, T0, T0, "OutOfMemory in worker");

        assertThat(LogFilterEvaluator.matches(failed, LogFilter.builder().level(LogLevel.DEBUG).build())).isTrue();
        assertThat(LogFilterEvaluator.matches(failed, LogFilter.builder().keyword("outofmemory").build())).isTrue();
        assertThat(LogFilterEvaluator.matches(failed, LogFilter.builder().keyword("deploy").build())).isFalse();
        assertThat(LogFilterEvaluator.matches(failed, LogFilter.builder().from(T0.plusSeconds(1)).build())).isFalse();
    }

    @Test
    void agreesWithPlainConjunctionOnRandomInputs() {
        Random rnd = new Random(42);
        List<String> words = List.of("build", "test", "deploy", "error", "cache");
        for (int i = 0; i < 2000; i++) {
            LogRecord r = log("job-" + rnd.nextInt(2), "worker-" + rnd.nextInt(3),
                    LogLevel.values()[rnd.nextInt(4)], LogSource.values()[rnd.nextInt(3)],
                    words.get(rnd.nextInt(5)).toUpperCase(Locale.ROOT) + " step " + i,
                    T0.plusSeconds(rnd.nextInt(100)));

            LogFilter.Builder b = LogFilter.builder();
            if (rnd.nextBoolean()) b.level(LogLevel.values()[rnd.nextInt(4)]);
            if (rnd.nextBoolean()) b.source(LogSource.values()[rnd.nextInt(3)]);
            if (rnd.nextBoolean()) b.workerId("worker-" + rnd.nextInt(3));
            if (rnd.nextBoolean()) b.keyword(words.get(rnd.nextInt(5))).keyword(words.get(rnd.nextInt(5)));
            Instant from = rnd.nextBoolean() ? T0.plusSeconds(rnd.nextInt(50)) : null;
            Instant to = rnd.nextBoolean() ? T0.plusSeconds(50 + rnd.nextInt(50)) : null;
            LogFilter f = b.from(from).to(to).build();

            assertThat(LogFilterEvaluator.matches(r, f)).as("record %s filter %s", r, f).isEqualTo(reference(r, f));
        }
    }

    private static boolean reference(LogRecord r, LogFilter f) {
        boolean level = f.getLevels().isEmpty() || f.getLevels().contains(r.getLevel());
        boolean source = f.getSources().isEmpty() || f.getSources().contains(r.getSource());
        boolean worker = f.getWorkerIds().isEmpty() || f.getWorkerIds().contains(r.getWorkerId());
        boolean from = f.getFrom() == null || !r.getTimestamp().isBefore(f.getFrom());
        boolean to = f.getTo() == null || !r.getTimestamp().isAfter(f.getTo());
        boolean keyword = f.getKeywords().isEmpty() || f.getKeywords().stream()
                .anyMatch(k -> r.getMessage().toLowerCase(Locale.ROOT).contains(k.toLowerCase(Locale.ROOT)));
        return level && source && worker && from && to && keyword;
    }
}
