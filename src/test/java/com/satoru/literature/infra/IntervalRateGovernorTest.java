package com.satoru.literature.infra;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class IntervalRateGovernorTest {

    private static final Duration INTERVAL = Duration.ofMillis(50);

    @Test
    @DisplayName("Sequential callers return at least one interval apart")
    void shouldSpaceSequentialCalls() {
        IntervalRateGovernor governor = new IntervalRateGovernor(INTERVAL);

        governor.acquire();
        long firstReturned = System.nanoTime();
        governor.acquire();
        long secondReturned = System.nanoTime();

        assertThat(secondReturned - firstReturned).isGreaterThanOrEqualTo(INTERVAL.toNanos());
    }

    @Test
    @DisplayName("First call does not wait")
    void shouldNotDelayFirstCall() {
        IntervalRateGovernor governor = new IntervalRateGovernor(Duration.ofSeconds(10));

        long start = System.nanoTime();
        governor.acquire();

        assertThat(System.nanoTime() - start).isLessThan(Duration.ofSeconds(1).toNanos());
    }

    @Test
    @DisplayName("Interval counts from when the previous caller proceeded")
    void shouldWaitOnlyTheRemainderOfTheInterval() throws InterruptedException {
        IntervalRateGovernor governor = new IntervalRateGovernor(INTERVAL);

        long first = governor.acquire();
        Thread.sleep(INTERVAL.toMillis() / 2);
        long second = governor.acquire();

        assertThat(second - first).isGreaterThanOrEqualTo(INTERVAL.toNanos());
        assertThat(second - first).isLessThan(INTERVAL.toNanos() * 2);
    }

    @Test
    @DisplayName("Concurrent callers under load complete one interval apart")
    void shouldSpaceConcurrentCompletions() throws Exception {
        Duration interval = Duration.ofMillis(5);
        int callers = 16;

        for (int round = 0; round < 5; round++) {
            IntervalRateGovernor governor = new IntervalRateGovernor(interval);
            ExecutorService pool = Executors.newFixedThreadPool(callers);
            List<Long> completions = Collections.synchronizedList(new ArrayList<>());

            try {
                CompletableFuture<?>[] futures = new CompletableFuture[callers];
                for (int i = 0; i < callers; i++) {
                    futures[i] = CompletableFuture.runAsync(() -> {
                        governor.acquire();
                        completions.add(System.nanoTime());
                        busyWork();
                    }, pool);
                }
                CompletableFuture.allOf(futures).get(10, TimeUnit.SECONDS);
            } finally {
                pool.shutdownNow();
            }

            List<Long> sorted = new ArrayList<>(completions);
            Collections.sort(sorted);
            assertThat(sorted).hasSize(callers);
            for (int i = 1; i < sorted.size(); i++) {
                assertThat(sorted.get(i) - sorted.get(i - 1)).isGreaterThanOrEqualTo(interval.toNanos());
            }
        }
    }

    @Test
    @DisplayName("Interrupt during the wait is kept until the caller is let through")
    void shouldRestoreInterruptAfterWaiting() {
        IntervalRateGovernor governor = new IntervalRateGovernor(INTERVAL);
        long first = governor.acquire();

        Thread.currentThread().interrupt();
        long second = governor.acquire();

        assertThat(Thread.interrupted()).isTrue();
        assertThat(second - first).isGreaterThanOrEqualTo(INTERVAL.toNanos());
    }

    @Test
    @DisplayName("Zero interval never blocks")
    void zeroIntervalShouldBeNoOp() {
        IntervalRateGovernor governor = new IntervalRateGovernor(Duration.ZERO);
        AtomicInteger counter = new AtomicInteger();

        long start = System.nanoTime();
        for (int i = 0; i < 1000; i++) {
            governor.execute(counter::incrementAndGet);
        }

        assertThat(counter.get()).isEqualTo(1000);
        assertThat(System.nanoTime() - start).isLessThan(Duration.ofSeconds(1).toNanos());
    }

    @Test
    void shouldRejectNegativeInterval() {
        assertThrows(IllegalArgumentException.class, () -> new IntervalRateGovernor(Duration.ofMillis(-1)));
    }

    private static void busyWork() {
        long until = System.nanoTime() + Duration.ofMillis(2).toNanos();
        double sink = 0;
        while (System.nanoTime() < until) {
            sink += Math.sqrt(sink + 1);
        }
        if (sink < 0) {
            throw new IllegalStateException();
        }
    }
}
