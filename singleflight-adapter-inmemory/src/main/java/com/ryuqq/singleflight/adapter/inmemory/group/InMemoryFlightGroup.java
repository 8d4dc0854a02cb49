package com.ryuqq.singleflight.adapter.inmemory.group;

import com.ryuqq.singleflight.application.group.FlightGroup;
import com.ryuqq.singleflight.application.group.FlightHandle;
import com.ryuqq.singleflight.application.group.FlightResult;
import com.ryuqq.singleflight.core.outcome.Fail;
import com.ryuqq.singleflight.core.outcome.Ok;
import com.ryuqq.singleflight.core.outcome.Outcome;
import com.ryuqq.singleflight.core.work.Work;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory implementation of {@link FlightGroup}.
 *
 * <p>Keeps a registry of in-flight {@link Call}s keyed by request identity. The first
 * caller for a key registers a call and runs the work; callers arriving while it is
 * registered attach to it and receive the same outcome.</p>
 *
 * <p><strong>Locking:</strong></p>
 * <ul>
 *   <li>One monitor guards the registry map and every call's waiter count</li>
 *   <li>Critical sections are limited to lookup, insert, remove and attach</li>
 *   <li>Work runs outside the lock, so a slow key never blocks other keys</li>
 * </ul>
 *
 * <p><strong>Cleanup:</strong></p>
 * <ul>
 *   <li>The executor finishes the call before removing it from the registry</li>
 *   <li>Removal is identity-checked: an entry is removed only while it still maps to
 *       the exact call the executor created, so a newer call registered after
 *       {@link #forget} is never evicted by the older one's cleanup</li>
 *   <li>Callers may still attach between finish and removal; the executor's shared flag
 *       is computed after removal, on both the blocking and the async path</li>
 * </ul>
 *
 * <p><strong>Failures:</strong> every {@link Throwable} thrown by the work is recorded as
 * a {@link Fail} outcome before cleanup, including throwables that are neither an
 * {@link Exception} nor an {@link Error}. When the work dies with an {@link Error} and
 * {@link FlightGroupConfig#rethrowFaults()} is set, the blocking executor re-raises that
 * error after cleanup; attached waiters still receive the {@link Fail} outcome.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryFlightGroup&lt;String&gt; group = new InMemoryFlightGroup&lt;&gt;();
 *
 * FlightResult&lt;Profile&gt; result = group.execute("profile:42", () -&gt; profiles.fetch(42));
 * if (result.isShared()) {
 *     // another caller asked for profile:42 at the same time
 * }
 *
 * group.shutdown();
 * </pre>
 *
 * @param <K> key type
 * @author SingleFlight Team
 * @since 1.0.0
 */
public class InMemoryFlightGroup<K> implements FlightGroup<K> {

    private static final Logger log = LoggerFactory.getLogger(InMemoryFlightGroup.class);

    static final String ASYNC_THREAD_PREFIX = "singleflight-async-";

    private final Object lock = new Object();

    /**
     * Key → in-flight call. Guarded by {@link #lock}.
     */
    private final Map<K, Call<?>> calls = new HashMap<>();

    private final FlightGroupConfig config;
    private final ExecutorService asyncExecutor;

    /**
     * Creates a group with the default {@link FlightGroupConfig}.
     */
    public InMemoryFlightGroup() {
        this(new FlightGroupConfig());
    }

    /**
     * Creates a group whose async pool is sized by {@link FlightGroupConfig#asyncConcurrency()}.
     *
     * <p>The pool's threads are daemons, so a group that is never shut down does not keep
     * the JVM alive.</p>
     *
     * @param config group configuration
     * @throws IllegalArgumentException if config is null
     */
    public InMemoryFlightGroup(FlightGroupConfig config) {
        this(config, newAsyncExecutor(config));
    }

    /**
     * Creates a group that dispatches {@link #executeAsync} work to the given executor.
     *
     * <p>The caller owns the executor's thread configuration; {@link #shutdown()} still
     * shuts it down.</p>
     *
     * @param config group configuration
     * @param asyncExecutor executor for non-blocking work
     * @throws IllegalArgumentException if any argument is null
     */
    public InMemoryFlightGroup(FlightGroupConfig config, ExecutorService asyncExecutor) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (asyncExecutor == null) {
            throw new IllegalArgumentException("asyncExecutor cannot be null");
        }
        this.config = config;
        this.asyncExecutor = asyncExecutor;
    }

    @Override
    public <T> FlightResult<T> execute(K key, Work<T> work) {
        validateInput(key, work);

        Registration<T> registration = register(key);
        Call<T> call = registration.call();

        if (!registration.executor()) {
            log.debug("Attached to in-flight call for key={}", key);
            return FlightResult.joined(call.await());
        }

        Outcome<T> outcome = runWork(key, work);
        int waiters = complete(key, call, outcome);
        FlightResult<T> result = FlightResult.executed(outcome, waiters > 1);

        if (config.rethrowFaults() && outcome instanceof Fail<T> fail && fail.isFault()) {
            throw (Error) fail.cause();
        }
        return result;
    }

    @Override
    public <T> FlightHandle<T> executeAsync(K key, Work<T> work) {
        validateInput(key, work);

        Registration<T> registration = register(key);
        Call<T> call = registration.call();

        if (!registration.executor()) {
            log.debug("Attached async caller to in-flight call for key={}", key);
            return FlightHandle.of(call.observe(FlightResult::joined));
        }

        // Completed after cleanup, once the waiter count is final.
        CompletableFuture<FlightResult<T>> executed = new CompletableFuture<>();
        dispatch(key, call, work, executed);
        return FlightHandle.of(executed);
    }

    @Override
    public void forget(K key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        Call<?> removed;
        synchronized (lock) {
            removed = calls.remove(key);
            if (removed != null) {
                removed.markForgotten();
            }
        }
        if (removed != null) {
            log.debug("Forgot in-flight call for key={} ({} waiter(s) keep their attachment)", key, removed.waiterCount());
        }
    }

    @Override
    public boolean isInFlight(K key) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        synchronized (lock) {
            return calls.containsKey(key);
        }
    }

    @Override
    public int inFlightCount() {
        synchronized (lock) {
            return calls.size();
        }
    }

    /**
     * Shuts down the async executor, waiting up to 60 seconds for running work.
     *
     * @throws InterruptedException if interrupted while waiting
     */
    public void shutdown() throws InterruptedException {
        asyncExecutor.shutdown();
        if (!asyncExecutor.awaitTermination(60, TimeUnit.SECONDS)) {
            asyncExecutor.shutdownNow();
        }
    }

    /**
     * Attaches to the registered call for the key, or registers a new one.
     *
     * <p>Callers sharing a key must share a result type; the cast relies on it.</p>
     */
    @SuppressWarnings("unchecked")
    private <T> Registration<T> register(K key) {
        synchronized (lock) {
            Call<T> existing = (Call<T>) calls.get(key);
            if (existing != null) {
                existing.attach();
                return new Registration<>(existing, false);
            }
            Call<T> created = new Call<>();
            calls.put(key, created);
            return new Registration<>(created, true);
        }
    }

    /**
     * Runs the work and converts every exit path into an outcome.
     */
    private <T> Outcome<T> runWork(K key, Work<T> work) {
        try {
            return Ok.of(work.call());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Fail.failure(e);
        } catch (Exception e) {
            log.debug("Work failed for key={}: {}", key, e.toString());
            return Fail.failure(e);
        } catch (Error e) {
            log.error("Work faulted for key={}", key, e);
            return Fail.fault(e);
        } catch (Throwable t) {
            // checked throwable smuggled past the compiler (neither Exception nor Error)
            log.error("Work threw a non-Exception throwable for key={}", key, t);
            return Fail.failure(t);
        }
    }

    /**
     * Finishes the call, then removes it from the registry if it is still the registered one.
     *
     * @return the final waiter count
     */
    private <T> int complete(K key, Call<T> call, Outcome<T> outcome) {
        call.finish(outcome);
        synchronized (lock) {
            if (!call.isForgotten()) {
                calls.remove(key, call);
            }
            return call.waiterCount();
        }
    }

    private <T> void dispatch(K key, Call<T> call, Work<T> work, CompletableFuture<FlightResult<T>> executed) {
        try {
            asyncExecutor.execute(() -> settle(key, call, runWork(key, work), executed));
        } catch (RejectedExecutionException e) {
            log.warn("Async executor rejected work for key={}, failing the call", key);
            settle(key, call, Fail.failure(e), executed);
        }
    }

    /**
     * Completes the call and cleans it up, then resolves the async executor's own handle
     * with the final waiter count.
     */
    private <T> void settle(K key, Call<T> call, Outcome<T> outcome, CompletableFuture<FlightResult<T>> executed) {
        int waiters = complete(key, call, outcome);
        executed.complete(FlightResult.executed(outcome, waiters > 1));
    }

    private void validateInput(K key, Work<?> work) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
    }

    private static ExecutorService newAsyncExecutor(FlightGroupConfig config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        AtomicInteger threadNumber = new AtomicInteger();
        return Executors.newFixedThreadPool(config.asyncConcurrency(), runnable -> {
            Thread thread = new Thread(runnable, ASYNC_THREAD_PREFIX + threadNumber.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Result of the routing decision made under the lock.
     */
    private record Registration<T>(Call<T> call, boolean executor) {
    }
}
