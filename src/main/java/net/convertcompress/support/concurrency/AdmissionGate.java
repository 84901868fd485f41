package net.convertcompress.support.concurrency;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Counting permit pool with FIFO hand-off.
 *
 * <p>{@link #acquire()} completes immediately while permits remain, otherwise the caller
 * is queued. {@link #release()} hands its permit straight to the longest-waiting caller,
 * so a newly arriving caller can never overtake one already queued.</p>
 */
public final class AdmissionGate {

    private final int capacity;
    private final Deque<CompletableFuture<Void>> waiters = new ArrayDeque<>();
    private int available;

    public AdmissionGate(int capacity) {
        this.capacity = Math.max(1, capacity);
        this.available = this.capacity;
    }

    /**
     * Requests a permit. The returned future completes once the permit is held; cancelling
     * it before then withdraws the request.
     */
    public CompletableFuture<Void> acquire() {
        synchronized (this) {
            if (available > 0 && waiters.isEmpty()) {
                available -= 1;
                return CompletableFuture.completedFuture(null);
            }
            CompletableFuture<Void> waiter = new CompletableFuture<>();
            waiters.addLast(waiter);
            return waiter;
        }
    }

    /**
     * Blocks until a permit is held.
     *
     * @throws InterruptedException if interrupted while queued; no permit is held afterwards
     */
    public void acquireBlocking() throws InterruptedException {
        CompletableFuture<Void> permit = acquire();
        try {
            permit.get();
        } catch (InterruptedException e) {
            if (!permit.cancel(false)) {
                release();
            }
            throw e;
        } catch (ExecutionException | CancellationException e) {
            throw new IllegalStateException("Permit request failed", e);
        }
    }

    /** Returns a permit, waking the oldest queued caller if there is one. */
    public void release() {
        CompletableFuture<Void> next;
        synchronized (this) {
            next = waiters.pollFirst();
            while (next != null && next.isCancelled()) {
                next = waiters.pollFirst();
            }
            if (next == null) {
                available = Math.min(available + 1, capacity);
                return;
            }
        }
        if (!next.complete(null)) {
            // cancelled between poll and complete; pass the permit on
            release();
        }
    }

    /** Runs {@code work} while holding a permit, blocking the caller until one is free. */
    public <T> T withPermit(Supplier<T> work) throws InterruptedException {
        acquireBlocking();
        try {
            return work.get();
        } finally {
            release();
        }
    }

    /**
     * Queues {@code work} for a permit and runs it on {@code executor} once admitted.
     * The permit is released when the work finishes, successfully or not.
     */
    public <T> CompletableFuture<T> submit(Supplier<T> work, Executor executor) {
        return acquire().thenApplyAsync(ignored -> {
            try {
                return work.get();
            } finally {
                release();
            }
        }, executor);
    }

    public int capacity() {
        return capacity;
    }

    public synchronized int availablePermits() {
        return available;
    }

    public synchronized int queuedCount() {
        return (int) waiters.stream().filter(waiter -> !waiter.isCancelled()).count();
    }
}
