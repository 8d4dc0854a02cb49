/**
 * Reusable contract tests for {@link com.ryuqq.singleflight.application.group.FlightGroup} implementations.
 *
 * <h2>Contracts</h2>
 * <ul>
 *   <li>{@link com.ryuqq.singleflight.testkit.contract.DeduplicationContractTest} - single execution, sharing, independent keys, no leaks</li>
 *   <li>{@link com.ryuqq.singleflight.testkit.contract.ForgetContractTest} - eviction of in-flight registrations</li>
 *   <li>{@link com.ryuqq.singleflight.testkit.contract.FaultIsolationContractTest} - failure and fault fan-out</li>
 *   <li>{@link com.ryuqq.singleflight.testkit.contract.AsyncContractTest} - per-caller handles</li>
 * </ul>
 *
 * @author SingleFlight Team
 * @since 1.0.0
 */
package com.ryuqq.singleflight.testkit.contract;
