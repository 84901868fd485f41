package net.convertcompress.support.concurrency;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import net.convertcompress.support.concurrency.BoundedWorkerPool.UnitOutcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class BoundedWorkerPoolTest {

    private final ExecutorService executor = Executors.newFixedThreadPool(16);

    @AfterEach
    void tearDown() {
        executor.shutdownNow();
    }

    @Test
    void should_KeepAtMostNInFlight_When_RunningManyUnits() throws Exception {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        List<Integer> units = IntStream.range(0, 100).boxed().collect(Collectors.toList());

        List<UnitOutcome<Integer, Integer>> outcomes = BoundedWorkerPool.<Integer, Integer>run(units, 4, executor, unit -> {
            peak.accumulateAndGet(active.incrementAndGet(), Math::max);
            try {
                Thread.sleep(2);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            active.decrementAndGet();
            return unit * 2;
        }, null).get(30, TimeUnit.SECONDS);

        assertThat(outcomes).hasSize(100).allMatch(UnitOutcome::succeeded);
        assertThat(peak.get()).isBetween(1, 4);
    }

    @Test
    void should_IsolateFailures_When_SomeUnitsThrow() throws Exception {
        List<UnitOutcome<Integer, String>> outcomes = BoundedWorkerPool.<Integer, String>run(List.of(1, 2, 3, 4), 2, executor,
            unit -> {
                if (unit % 2 == 0) {
                    throw new IllegalArgumentException("even " + unit);
                }
                return "ok " + unit;
            }, null).get(5, TimeUnit.SECONDS);

        assertThat(outcomes).filteredOn(UnitOutcome::succeeded)
            .extracting(UnitOutcome::result)
            .containsExactlyInAnyOrder("ok 1", "ok 3");
        assertThat(outcomes).filteredOn(outcome -> !outcome.succeeded())
            .extracting(UnitOutcome::unit)
            .containsExactlyInAnyOrder(2, 4);
    }

    @Test
    void should_RecordFailureAndKeepDraining_When_UnitThrowsError() throws Exception {
        List<UnitOutcome<Integer, Integer>> outcomes = BoundedWorkerPool.<Integer, Integer>run(List.of(1, 2, 3), 1, executor,
            unit -> {
                if (unit == 1) {
                    throw new StackOverflowError("unit " + unit);
                }
                return unit;
            }, outcome -> {
                if (outcome.unit() == 2) {
                    throw new AssertionError("callback");
                }
            }).get(5, TimeUnit.SECONDS);

        assertThat(outcomes).hasSize(3);
        assertThat(outcomes).filteredOn(outcome -> !outcome.succeeded())
            .singleElement()
            .satisfies(outcome -> assertThat(outcome.failure()).isInstanceOf(StackOverflowError.class));
        assertThat(outcomes).filteredOn(UnitOutcome::succeeded)
            .extracting(UnitOutcome::result)
            .containsExactly(2, 3);
    }

    @Test
    void should_InvokeCallbackForEveryUnit_When_PoolCompletes() throws Exception {
        List<Integer> seen = new CopyOnWriteArrayList<>();

        BoundedWorkerPool.<Integer, Integer>run(List.of(1, 2, 3), 1, executor, unit -> unit,
            outcome -> seen.add(outcome.unit())).get(5, TimeUnit.SECONDS);

        assertThat(seen).containsExactly(1, 2, 3);
    }

    @Test
    void should_CompleteImmediately_When_NoUnits() {
        assertThat(BoundedWorkerPool.<Integer, Integer>run(List.of(), 4, executor, unit -> unit, null))
            .isCompletedWithValue(List.of());
    }

    @Test
    void should_RunInline_When_ExecutorIsDirect() throws Exception {
        List<UnitOutcome<Integer, Integer>> outcomes = BoundedWorkerPool.<Integer, Integer>run(
            List.of(5, 6), 3, Runnable::run, unit -> unit + 1, null).get(1, TimeUnit.SECONDS);

        assertThat(outcomes).extracting(UnitOutcome::result).containsExactly(6, 7);
    }
}
