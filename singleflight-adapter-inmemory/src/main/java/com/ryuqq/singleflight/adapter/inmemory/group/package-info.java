/**
 * In-memory FlightGroup adapter deduplicating concurrent calls that share a key.
 *
 * <p>This package contains the reference implementation of the
 * {@link com.ryuqq.singleflight.application.group.FlightGroup} port. Concurrent callers with
 * the same key are coalesced onto one in-flight {@code Call}; exactly one of them runs the
 * work and every caller receives the same outcome.</p>
 *
 * <h2>Architecture</h2>
 *
 * <ul>
 *   <li><strong>Registry:</strong> a {@link java.util.HashMap} of key to in-flight call, guarded
 *       by a single monitor</li>
 *   <li><strong>Call:</strong> one execution, backed by a one-shot
 *       {@link java.util.concurrent.CompletableFuture} that broadcasts the outcome</li>
 *   <li><strong>Async pool:</strong> an {@link java.util.concurrent.ExecutorService} running
 *       {@code executeAsync} work</li>
 * </ul>
 *
 * <h2>Call Lifecycle</h2>
 *
 * <pre>
 * ┌──────────────┐
 * │   register   │ (first caller for the key, under the lock)
 * └──────┬───────┘
 *        │
 *        ├──► attach() ──────────────► [Waiter: await outcome]
 *        │
 *        ▼
 * ┌──────────────┐
 * │  run work    │ (executor only, outside the lock)
 * └──────┬───────┘
 *        │
 *        ▼
 * ┌──────────────┐
 * │   finish     │ → every waiter and handle observes the outcome
 * └──────┬───────┘
 *        │
 *        ├──► forgotten ─────────────► [Already absent, nothing to remove]
 *        │
 *        └──► remove(key, call) ─────► [Key idle]
 * </pre>
 *
 * <h2>Limitations</h2>
 *
 * <ul>
 *   <li><strong>No result caching:</strong> a key becomes idle as soon as its call completes</li>
 *   <li><strong>No intrinsic timeout:</strong> waiters block until the work returns; use
 *       {@code BoundedWaitRunner} for bounded waits</li>
 *   <li><strong>Single JVM:</strong> calls are only deduplicated within one group instance</li>
 * </ul>
 *
 * @see com.ryuqq.singleflight.application.group.FlightGroup
 * @see com.ryuqq.singleflight.adapter.inmemory.group.InMemoryFlightGroup
 * @author SingleFlight Team
 * @since 1.0.0
 */
package com.ryuqq.singleflight.adapter.inmemory.group;
