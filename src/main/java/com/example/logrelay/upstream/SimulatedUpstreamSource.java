package com.example.logrelay.upstream;

import com.example.logrelay.model.LogLevel;
import com.example.logrelay.model.LogRecord;
import com.example.logrelay.model.LogSource;
import com.example.logrelay.model.ProgressRecord;
import com.example.logrelay.model.ProgressStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Development upstream that fabricates build output. Each log stream emits
 * {@code totalLogs} templated lines, one per {@code interval}, then
 * completes; each progress stream walks a fixed list of stages to 100%.
 */
public class SimulatedUpstreamSource implements UpstreamSource {
    private static final Logger log = LoggerFactory.getLogger(SimulatedUpstreamSource.class);

    private static final List<String> TEMPLATES = List.of(
            "=== build started ===",
            "Installing project dependencies...",
            "Downloading package: {package}@{version}",
            "Compiling sources",
            "Compilation finished: {fileCount} files processed",
            "=== build finished ===",
            "=== test run started ===",
            "Running test suite...",
            "Found test file: {testFile}",
            "Test passed: {testName}",
            "Test failed: {testName}",
            "Generating coverage report...",
            "=== test run finished ===",
            "=== deploy started ===",
            "Building container image...",
            "Pushing image to registry...",
            "Updating service...",
            "Running health check...",
            "Deploy finished: {deploymentId}",
            "WARNING: deprecated package detected",
            "ERROR: compilation failed",
            "FATAL: out of memory",
            "INFO: process completed successfully",
            "Processing file: {filename}",
            "Connecting to database...",
            "Authentication successful",
            "Cache miss for key: {cacheKey}",
            "API request: {method} {path}"
    );

    private static final List<String> STAGES = List.of("checkout", "build", "test", "deploy");
    private static final String[] PHASES = {"setup", "build", "test", "deploy", "cleanup"};

    private final ScheduledExecutorService scheduler;
    private final Duration interval;
    private final int totalLogs;
    private final Clock clock;

    public SimulatedUpstreamSource(ScheduledExecutorService scheduler, Duration interval, int totalLogs, Clock clock) {
        this.scheduler = scheduler;
        this.interval = interval;
        this.totalLogs = totalLogs;
        this.clock = clock;
    }

    @Override
    public UpstreamCall openLogStream(String jobId, UpstreamObserver<LogRecord> observer) {
        log.info("Simulated log stream started: jobId={}, interval={}ms, total={}", jobId, interval.toMillis(), totalLogs);
        AtomicInteger index = new AtomicInteger();
        return schedule(done -> {
            int i = index.getAndIncrement();
            if (i >= totalLogs) {
                done.set(true);
                observer.onCompleted();
                return;
            }
            observer.onNext(mockRecord(jobId, i));
        });
    }

    @Override
    public UpstreamCall openProgressStream(String pipelineId, UpstreamObserver<ProgressRecord> observer) {
        log.info("Simulated progress stream started: pipelineId={}", pipelineId);
        AtomicInteger step = new AtomicInteger();
        Map<String, Instant> startedAt = new LinkedHashMap<>();
        return schedule(done -> {
            int s = step.getAndIncrement();
            int stageIndex = s / 5;
            if (stageIndex >= STAGES.size()) {
                done.set(true);
                observer.onCompleted();
                return;
            }
            String stage = STAGES.get(stageIndex);
            int pct = (s % 5) * 25;
            Instant now = clock.instant();
            Instant started = startedAt.computeIfAbsent(stage, k -> now);
            boolean finished = pct == 100;
            observer.onNext(new ProgressRecord(
                    pipelineId,
                    stage,
                    finished ? ProgressStatus.COMPLETED : ProgressStatus.RUNNING,
                    pct,
                    "Stage " + stage + " at " + pct + "%",
                    now,
                    started,
                    finished ? now : null,
                    null));
        });
    }

    private UpstreamCall schedule(Tick tick) {
        AtomicBoolean done = new AtomicBoolean(false);
        ScheduledFuture<?>[] holder = new ScheduledFuture<?>[1];
        holder[0] = scheduler.scheduleAtFixedRate(() -> {
            if (done.get()) return;
            try {
                tick.run(done);
            } catch (RuntimeException e) {
                log.warn("Simulated stream tick failed: {}", e.toString());
            }
            if (done.get() && holder[0] != null) holder[0].cancel(false);
        }, interval.toMillis(), interval.toMillis(), TimeUnit.MILLISECONDS);
        return () -> {
            done.set(true);
            holder[0].cancel(false);
        };
    }

    private LogRecord mockRecord(String jobId, int index) {
        ThreadLocalRandom rnd = ThreadLocalRandom.current();
        String template = TEMPLATES.get(index % TEMPLATES.size());
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put("step", "step-" + (index / 10 + 1));
        metadata.put("phase", PHASES[rnd.nextInt(PHASES.length)]);
        return new LogRecord(
                jobId,
                "worker-" + (rnd.nextInt(3) + 1),
                randomLevel(rnd),
                rnd.nextDouble() > 0.8 ? LogSource.STDERR : LogSource.STDOUT,
                String.format("[LOG-%03d] %s", index + 1, fill(template, rnd)),
                clock.instant(),
                metadata);
    }

    // INFO 60%, DEBUG 25%, WARN 10%, ERROR 5%
    private static LogLevel randomLevel(ThreadLocalRandom rnd) {
        double r = rnd.nextDouble();
        if (r < 0.60) return LogLevel.INFO;
        if (r < 0.85) return LogLevel.DEBUG;
        if (r < 0.95) return LogLevel.WARN;
        return LogLevel.ERROR;
    }

    private static String fill(String template, ThreadLocalRandom rnd) {
        return template
                .replace("{package}", pick(rnd, "lodash", "axios", "moment", "uuid", "express"))
                .replace("{version}", (rnd.nextInt(5) + 1) + "." + rnd.nextInt(10) + "." + rnd.nextInt(10))
                .replace("{fileCount}", String.valueOf(rnd.nextInt(100) + 50))
                .replace("{testFile}", pick(rnd, "auth.test.ts", "user.test.ts", "api.test.ts", "util.test.ts"))
                .replace("{testName}", pick(rnd, "should authenticate user", "should validate input", "should handle errors"))
                .replace("{deploymentId}", "deploy-" + System.currentTimeMillis())
                .replace("{filename}", pick(rnd, "index.ts", "main.js", "config.json", "package.json"))
                .replace("{cacheKey}", "cache-" + Long.toString(rnd.nextLong() & Long.MAX_VALUE, 36))
                .replace("{method}", pick(rnd, "GET", "POST", "PUT", "DELETE"))
                .replace("{path}", pick(rnd, "/api/users", "/api/auth", "/api/logs", "/health"));
    }

    private static String pick(ThreadLocalRandom rnd, String... options) {
        return options[rnd.nextInt(options.length)];
    }

    @FunctionalInterface
    private interface Tick {
        void run(AtomicBoolean done);
    }
}
