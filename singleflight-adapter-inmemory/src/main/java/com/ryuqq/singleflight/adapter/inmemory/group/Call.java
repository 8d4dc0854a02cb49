package com.ryuqq.singleflight.adapter.inmemory.group;

import com.ryuqq.singleflight.application.group.FlightInterruptedException;
import com.ryuqq.singleflight.core.outcome.Outcome;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * Bookkeeping for one in-flight execution of a key's work.
 *
 * <p>The completion signal is a one-shot broadcast: {@link #finish} records the single
 * outcome and releases every current waiter, and any later {@link #await} returns at once.</p>
 *
 * <p><strong>Guarded by the owning group's lock:</strong> {@link #attach()} and
 * {@link #markForgotten()}. Both fields are volatile so that reads outside the lock
 * see the latest value.</p>
 *
 * @param <T> result type
 * @author SingleFlight Team
 * @since 1.0.0
 */
final class Call<T> {

    private final CompletableFuture<Outcome<T>> completion = new CompletableFuture<>();

    private volatile int waiterCount = 1;
    private volatile boolean forgotten;

    /**
     * Registers one more caller on this call. Must hold the group lock.
     */
    void attach() {
        waiterCount++;
    }

    /**
     * Records the outcome and wakes all waiters. Invoked exactly once, by the executor.
     *
     * @param outcome the outcome of the work
     * @throws IllegalArgumentException if outcome is null
     * @throws IllegalStateException if the call was already finished
     */
    void finish(Outcome<T> outcome) {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        if (!completion.complete(outcome)) {
            throw new IllegalStateException("Call already finished");
        }
    }

    /**
     * Blocks until the call is finished.
     *
     * @return the recorded outcome
     * @throws FlightInterruptedException if the waiting thread is interrupted
     */
    Outcome<T> await() {
        try {
            return completion.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FlightInterruptedException("Interrupted while awaiting in-flight call", e);
        } catch (ExecutionException e) {
            // completion is only ever completed normally
            throw new IllegalStateException("Call completion failed", e.getCause());
        }
    }

    /**
     * Derives a private future for one caller. Cancelling it leaves the call untouched.
     */
    <R> CompletableFuture<R> observe(Function<Outcome<T>, R> mapper) {
        return completion.thenApply(mapper);
    }

    boolean isDone() {
        return completion.isDone();
    }

    int waiterCount() {
        return waiterCount;
    }

    void markForgotten() {
        forgotten = true;
    }

    boolean isForgotten() {
        return forgotten;
    }
}
