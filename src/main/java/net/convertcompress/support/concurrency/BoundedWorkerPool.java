package net.convertcompress.support.concurrency;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Consumer;
import java.util.function.Function;
import lombok.extern.slf4j.Slf4j;
import net.convertcompress.util.LoggingUtils;

/**
 * Keeps at most N units of work in flight: the first N start immediately and each
 * completion launches the next queued unit until the queue is drained.
 *
 * <p>Every unit produces a {@link UnitOutcome}, including units that end in an
 * {@link Error}; a failing unit never stops the others.
 * The completion callback runs for each unit before the returned future completes.</p>
 *
 * @param <T> unit of work
 * @param <R> per-unit result
 */
@Slf4j
public final class BoundedWorkerPool<T, R> {

    private final int maxInFlight;
    private final Executor executor;
    private final Function<T, R> work;
    private final Consumer<UnitOutcome<T, R>> onCompletion;
    private final Deque<T> pending;
    private final List<UnitOutcome<T, R>> outcomes;
    private final CompletableFuture<List<UnitOutcome<T, R>>> done = new CompletableFuture<>();
    private final int total;

    private int runningCount;
    private int peakRunning;

    private BoundedWorkerPool(List<T> units, int maxInFlight, Executor executor,
                              Function<T, R> work, Consumer<UnitOutcome<T, R>> onCompletion) {
        this.maxInFlight = Math.max(1, maxInFlight);
        this.executor = executor;
        this.work = work;
        this.onCompletion = onCompletion == null ? outcome -> { } : onCompletion;
        this.pending = new ArrayDeque<>(units);
        this.outcomes = new ArrayList<>(units.size());
        this.total = units.size();
    }

    /**
     * Runs {@code work} over {@code units} with at most {@code maxInFlight} running at once.
     *
     * @return outcomes in completion order, once every unit has finished
     */
    public static <T, R> CompletableFuture<List<UnitOutcome<T, R>>> run(List<T> units, int maxInFlight,
                                                                       Executor executor, Function<T, R> work,
                                                                       Consumer<UnitOutcome<T, R>> onCompletion) {
        BoundedWorkerPool<T, R> pool = new BoundedWorkerPool<>(units, maxInFlight, executor, work, onCompletion);
        pool.start();
        return pool.done;
    }

    private void start() {
        synchronized (this) {
            if (total == 0) {
                done.complete(List.of());
                return;
            }
            drain();
        }
    }

    private synchronized void drain() {
        while (runningCount < maxInFlight && !pending.isEmpty()) {
            T next = pending.pollFirst();
            runningCount += 1;
            peakRunning = Math.max(peakRunning, runningCount);
            try {
                executor.execute(() -> executeUnit(next));
            } catch (RejectedExecutionException e) {
                LoggingUtils.warn(log, e, "Executor rejected a unit of work");
                runningCount -= 1;
                outcomes.add(UnitOutcome.failure(next, e));
            }
        }
        completeIfFinished();
    }

    // Errors count as unit failures too.
    private void executeUnit(T unit) {
        UnitOutcome<T, R> outcome;
        try {
            outcome = UnitOutcome.success(unit, work.apply(unit));
        } catch (Throwable t) {
            outcome = UnitOutcome.failure(unit, t);
        }
        try {
            onCompletion.accept(outcome);
        } catch (Throwable t) {
            LoggingUtils.warn(log, t, "Completion callback failed");
        } finally {
            synchronized (this) {
                outcomes.add(outcome);
                runningCount -= 1;
                drain();
            }
        }
    }

    private void completeIfFinished() {
        if (runningCount == 0 && pending.isEmpty() && !done.isDone()) {
            log.debug("Worker pool finished {} units, peak in flight {}", total, peakRunning);
            done.complete(List.copyOf(outcomes));
        }
    }

    /**
     * Result of one unit.
     *
     * @param unit the unit of work
     * @param result value produced, null on failure
     * @param failure exception thrown, null on success
     */
    public record UnitOutcome<T, R>(T unit, R result, Throwable failure) {

        static <T, R> UnitOutcome<T, R> success(T unit, R result) {
            return new UnitOutcome<>(unit, result, null);
        }

        static <T, R> UnitOutcome<T, R> failure(T unit, Throwable failure) {
            return new UnitOutcome<>(unit, null, failure);
        }

        public boolean succeeded() {
            return failure == null;
        }
    }
}
