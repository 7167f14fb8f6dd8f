package com.example.logrelay.stream;

import com.example.logrelay.filter.LogFilterEvaluator;
import com.example.logrelay.model.LogFilter;
import com.example.logrelay.model.LogLevel;
import com.example.logrelay.model.LogRecord;
import com.example.logrelay.support.ManualScheduler;
import com.example.logrelay.support.ScriptedUpstreamSource;
import com.example.logrelay.upstream.RetryPolicy;
import com.example.logrelay.upstream.UpstreamException;
import com.example.logrelay.upstream.UpstreamStatus;
import com.example.logrelay.upstream.UpstreamStreamAdapter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static com.example.logrelay.support.TestRecords.log;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SharedStreamMultiplexerTest {

    private ScriptedUpstreamSource upstream;
    private ManualScheduler scheduler;
    private List<String> closedKeys;
    private List<Throwable> subscriberErrors;
    private SharedStreamMultiplexer<LogRecord> mux;

    @BeforeEach
    void setUp() {
        upstream = new ScriptedUpstreamSource();
        scheduler = new ManualScheduler();
        closedKeys = new CopyOnWriteArrayList<>();
        subscriberErrors = new CopyOnWriteArrayList<>();
        RetryPolicy policy = new RetryPolicy(3, Duration.ofSeconds(1));
        mux = new SharedStreamMultiplexer<>("log",
                (jobId, listener) -> new UpstreamStreamAdapter<>(jobId, "log",
                        observer -> upstream.openLogStream(jobId, observer),
                        policy, scheduler.executor(), listener),
                new MultiplexerListener<LogRecord>() {
                    @Override
                    public void onSubscriberError(String key, Throwable error) {
                        subscriberErrors.add(error);
                    }

                    @Override
                    public void onStreamClosed(String key) {
                        closedKeys.add(key);
                    }
                });
    }

    @Test
    void filterSelectsMatchingRecordsInOrder() {
        CollectingSubscriber<LogRecord> sub = new CollectingSubscriber<>();
        LogFilter errorsOnly = LogFilter.builder().level(LogLevel.ERROR).build();
        mux.subscribe("build-1", r -> LogFilterEvaluator.matches(r, errorsOnly), sub);

        ScriptedUpstreamSource.Call<LogRecord> call = upstream.lastLogCall("build-1");
        call.emit(log("build-1", LogLevel.INFO, "i1"));
        call.emit(log("build-1", LogLevel.ERROR, "e1"));
        call.emit(log("build-1", LogLevel.INFO, "i2"));
        call.emit(log("build-1", LogLevel.INFO, "i3"));
        call.emit(log("build-1", LogLevel.ERROR, "e2"));
        call.emit(log("build-1", LogLevel.INFO, "i4"));
        call.emit(log("build-1", LogLevel.INFO, "i5"));

        assertThat(sub.records).extracting(LogRecord::getMessage).containsExactly("e1", "e2");
    }

    @Test
    void subscribersShareOneUpstream() {
        CollectingSubscriber<LogRecord> a = new CollectingSubscriber<>();
        CollectingSubscriber<LogRecord> b = new CollectingSubscriber<>();
        mux.subscribe("build-2", null, a);
        mux.subscribe("build-2", null, b);

        ScriptedUpstreamSource.Call<LogRecord> call = upstream.lastLogCall("build-2");
        call.emit(log("build-2", LogLevel.INFO, "1"));
        call.emit(log("build-2", LogLevel.INFO, "2"));
        call.emit(log("build-2", LogLevel.INFO, "3"));

        assertThat(upstream.logOpenCount("build-2")).isEqualTo(1);
        assertThat(a.records).extracting(LogRecord::getMessage).containsExactly("1", "2", "3");
        assertThat(b.records).extracting(LogRecord::getMessage).containsExactly("1", "2", "3");
        assertThat(mux.subscriberCount("build-2")).isEqualTo(2);
    }

    @Test
    void lastUnsubscribeCancelsAndNextSubscribeReopens() {
        Subscription s = mux.subscribe("build-3", null, new CollectingSubscriber<>());
        ScriptedUpstreamSource.Call<LogRecord> first = upstream.lastLogCall("build-3");

        s.unsubscribe();

        assertThat(first.isCancelled()).isTrue();
        assertThat(mux.hasStream("build-3")).isFalse();
        assertThat(closedKeys).containsExactly("build-3");

        mux.subscribe("build-3", null, new CollectingSubscriber<>());
        assertThat(upstream.logOpenCount("build-3")).isEqualTo(2);
        assertThat(upstream.lastLogCall("build-3")).isNotSameAs(first);
    }

    @Test
    void exhaustedRetriesReachEverySubscriberOnce() {
        CollectingSubscriber<LogRecord> a = new CollectingSubscriber<>();
        CollectingSubscriber<LogRecord> b = new CollectingSubscriber<>();
        mux.subscribe("build-4", null, a);
        mux.subscribe("build-4", null, b);

        upstream.lastLogCall("build-4").fail(UpstreamStatus.UNAVAILABLE);
        scheduler.runNext();
        upstream.lastLogCall("build-4").fail(UpstreamStatus.UNAVAILABLE);
        scheduler.runNext();
        upstream.lastLogCall("build-4").fail(UpstreamStatus.UNAVAILABLE);

        assertThat(a.errors).hasSize(1);
        assertThat(b.errors).hasSize(1);
        assertThat(a.errors.get(0).getStatus()).isEqualTo(UpstreamStatus.UNAVAILABLE);
        assertThat(mux.hasStream("build-4")).isFalse();
        assertThat(mux.activeStreamCount()).isZero();
        assertThat(closedKeys).containsExactly("build-4");
    }

    @Test
    void unsubscribeAfterUpstreamErrorIsHarmless() {
        Subscription s = mux.subscribe("job-e", null, new CollectingSubscriber<>());
        upstream.lastLogCall("job-e").fail(UpstreamStatus.NOT_FOUND);

        assertThat(s.isActive()).isFalse();
        s.unsubscribe();
        s.unsubscribe();

        assertThat(closedKeys).containsExactly("job-e");
    }

    @Test
    void lateSubscriberGetsLastRecordThenLiveOnes() {
        CollectingSubscriber<LogRecord> early = new CollectingSubscriber<>();
        mux.subscribe("job-r", null, early);
        ScriptedUpstreamSource.Call<LogRecord> call = upstream.lastLogCall("job-r");
        call.emit(log("job-r", LogLevel.INFO, "r1"));
        call.emit(log("job-r", LogLevel.INFO, "r2"));

        CollectingSubscriber<LogRecord> late = new CollectingSubscriber<>();
        mux.subscribe("job-r", null, late);
        call.emit(log("job-r", LogLevel.INFO, "r3"));

        assertThat(early.records).extracting(LogRecord::getMessage).containsExactly("r1", "r2", "r3");
        assertThat(late.records).extracting(LogRecord::getMessage).containsExactly("r2", "r3");
    }

    @Test
    void failingSubscriberDoesNotAffectOthers() {
        CollectingSubscriber<LogRecord> healthy = new CollectingSubscriber<>();
        mux.subscribe("job-x", null, new CollectingSubscriber<LogRecord>() {
            @Override
            public void onRecord(LogRecord record) {
                throw new IllegalStateException("client gone");
            }
        });
        mux.subscribe("job-x", r -> {
            throw new IllegalArgumentException("bad filter");
        }, new CollectingSubscriber<>());
        mux.subscribe("job-x", null, healthy);

        upstream.lastLogCall("job-x").emit(log("job-x", LogLevel.INFO, "m"));

        assertThat(healthy.records).hasSize(1);
        assertThat(subscriberErrors).hasSize(2);
        assertThat(mux.subscriberCount("job-x")).isEqualTo(3);
    }

    @Test
    void noDeliveryAfterUnsubscribeReturns() {
        CollectingSubscriber<LogRecord> a = new CollectingSubscriber<>();
        CollectingSubscriber<LogRecord> b = new CollectingSubscriber<>();
        Subscription sa = mux.subscribe("job-u", null, a);
        mux.subscribe("job-u", null, b);
        ScriptedUpstreamSource.Call<LogRecord> call = upstream.lastLogCall("job-u");

        call.emit(log("job-u", LogLevel.INFO, "before"));
        sa.unsubscribe();
        call.emit(log("job-u", LogLevel.INFO, "after"));

        assertThat(a.records).extracting(LogRecord::getMessage).containsExactly("before");
        assertThat(b.records).extracting(LogRecord::getMessage).containsExactly("before", "after");
        assertThat(call.isCancelled()).isFalse();
    }

    @Test
    void upstreamCompletionCompletesSubscribers() {
        CollectingSubscriber<LogRecord> a = new CollectingSubscriber<>();
        mux.subscribe("job-c", null, a);

        upstream.lastLogCall("job-c").complete();

        assertThat(a.completions.get()).isEqualTo(1);
        assertThat(mux.hasStream("job-c")).isFalse();
        assertThat(closedKeys).containsExactly("job-c");
    }

    @Test
    void shutdownCancelsEverythingAndRejectsNewSubscribers() {
        CollectingSubscriber<LogRecord> a = new CollectingSubscriber<>();
        mux.subscribe("job-1", null, a);
        mux.subscribe("job-2", null, new CollectingSubscriber<>());

        mux.shutdown();

        assertThat(upstream.lastLogCall("job-1").isCancelled()).isTrue();
        assertThat(upstream.lastLogCall("job-2").isCancelled()).isTrue();
        assertThat(a.completions.get()).isEqualTo(1);
        assertThat(closedKeys).containsExactlyInAnyOrder("job-1", "job-2");
        assertThatThrownBy(() -> mux.subscribe("job-3", null, new CollectingSubscriber<>()))
                .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void neverMoreThanOneUpstreamPerKeyUnderConcurrency() throws Exception {
        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<List<Subscription>>> results = new ArrayList<>();
        for (int t = 0; t < threads; t++) {
            long seed = t;
            results.add(pool.submit(() -> {
                Random rnd = new Random(seed);
                List<Subscription> kept = new ArrayList<>();
                start.await();
                for (int i = 0; i < 500; i++) {
                    Subscription s = mux.subscribe("hot", null, new CollectingSubscriber<>());
                    if (rnd.nextInt(4) == 0) {
                        kept.add(s);
                    } else {
                        s.unsubscribe();
                    }
                    if (!kept.isEmpty() && rnd.nextBoolean()) {
                        kept.remove(rnd.nextInt(kept.size())).unsubscribe();
                    }
                }
                return kept;
            }));
        }
        start.countDown();
        List<Subscription> leftovers = new ArrayList<>();
        for (Future<List<Subscription>> f : results) {
            leftovers.addAll(f.get(30, TimeUnit.SECONDS));
        }
        pool.shutdown();
        for (Subscription s : leftovers) {
            s.unsubscribe();
        }

        assertThat(upstream.maxConcurrentCalls()).isEqualTo(1);
        assertThat(mux.hasStream("hot")).isFalse();
        assertThat(upstream.lastLogCall("hot").isCancelled()).isTrue();
        assertThat(closedKeys).hasSize(upstream.logOpenCount("hot"));
    }

    @Test
    void errorsCarryStatusToEachSubscriber() {
        CollectingSubscriber<LogRecord> a = new CollectingSubscriber<>();
        mux.subscribe("job-t", null, a);

        upstream.lastLogCall("job-t").fail(UpstreamStatus.PERMISSION_DENIED);

        assertThat(a.errors).extracting(UpstreamException::getStatus).containsExactly(UpstreamStatus.PERMISSION_DENIED);
        assertThat(upstream.logOpenCount("job-t")).isEqualTo(1);
    }

    private SharedStreamMultiplexer<LogRecord> muxWithSlowOpen(String slowKey, CountDownLatch opening, CountDownLatch release) {
        RetryPolicy policy = new RetryPolicy(1, Duration.ZERO);
        return new SharedStreamMultiplexer<>("log",
                (jobId, listener) -> new UpstreamStreamAdapter<>(jobId, "log",
                        observer -> {
                            if (jobId.equals(slowKey)) {
                                opening.countDown();
                                try {
                                    release.await(10, TimeUnit.SECONDS);
                                } catch (InterruptedException e) {
                                    Thread.currentThread().interrupt();
                                }
                            }
                            return upstream.openLogStream(jobId, observer);
                        },
                        policy, scheduler.executor(), listener));
    }

    @Test
    void slowUpstreamOpenDoesNotBlockOtherKeys() throws Exception {
        CountDownLatch opening = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        SharedStreamMultiplexer<LogRecord> slowMux = muxWithSlowOpen("slow", opening, release);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        try {
            Future<Subscription> slow = pool.submit(() -> slowMux.subscribe("slow", null, new CollectingSubscriber<>()));
            assertThat(opening.await(5, TimeUnit.SECONDS)).isTrue();

            Future<Boolean> fast = pool.submit(() -> {
                Subscription s = slowMux.subscribe("fast", null, new CollectingSubscriber<>());
                s.unsubscribe();
                return slowMux.hasStream("fast");
            });
            assertThat(fast.get(2, TimeUnit.SECONDS)).isFalse();
            assertThat(slowMux.subscriberCount("slow")).isEqualTo(1);

            release.countDown();
            assertThat(slow.get(5, TimeUnit.SECONDS).isActive()).isTrue();
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    void shutdownDuringSlowOpenReleasesTheLateCall() throws Exception {
        CountDownLatch opening = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        SharedStreamMultiplexer<LogRecord> slowMux = muxWithSlowOpen("slow", opening, release);
        CollectingSubscriber<LogRecord> sub = new CollectingSubscriber<>();
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<Subscription> slow = pool.submit(() -> slowMux.subscribe("slow", null, sub));
            assertThat(opening.await(5, TimeUnit.SECONDS)).isTrue();

            slowMux.shutdown();
            assertThat(sub.completions.get()).isEqualTo(1);

            release.countDown();
            assertThat(slow.get(5, TimeUnit.SECONDS).isActive()).isFalse();
            assertThat(upstream.lastLogCall("slow").isCancelled()).isTrue();
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }

    @Test
    void terminalFailureOnOpenIsDeliveredWithoutHoldingTheStreamMap() throws Exception {
        SharedStreamMultiplexer<LogRecord> failing = new SharedStreamMultiplexer<>("log",
                (jobId, listener) -> new UpstreamStreamAdapter<>(jobId, "log",
                        observer -> {
                            throw new UpstreamException(UpstreamStatus.NOT_FOUND, "no such job");
                        },
                        new RetryPolicy(3, Duration.ofSeconds(1)), scheduler.executor(), listener));
        ExecutorService pool = Executors.newSingleThreadExecutor();
        List<Boolean> otherThreadSawMap = new CopyOnWriteArrayList<>();
        try {
            CollectingSubscriber<LogRecord> sub = new CollectingSubscriber<LogRecord>() {
                @Override
                public void onError(UpstreamException error) {
                    super.onError(error);
                    try {
                        otherThreadSawMap.add(pool.submit(() -> failing.hasStream("other")).get(2, TimeUnit.SECONDS) != null);
                    } catch (Exception e) {
                        otherThreadSawMap.add(false);
                    }
                }
            };

            Subscription s = failing.subscribe("missing", null, sub);

            assertThat(s.isActive()).isFalse();
            assertThat(sub.errors).extracting(UpstreamException::getStatus).containsExactly(UpstreamStatus.NOT_FOUND);
            assertThat(otherThreadSawMap).containsExactly(true);
            assertThat(failing.hasStream("missing")).isFalse();
        } finally {
            pool.shutdownNow();
        }
    }
}
