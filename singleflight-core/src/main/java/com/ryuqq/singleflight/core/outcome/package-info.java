/**
 * In-flight call outcome package.
 *
 * <p>This package defines the sealed interface hierarchy for the single, shared
 * result of one deduplicated execution.</p>
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.singleflight.core.outcome.Outcome} - Sealed interface (permits Ok, Fail)</li>
 * </ul>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.singleflight.core.outcome.Ok} - Work returned a value</li>
 *   <li>{@link com.ryuqq.singleflight.core.outcome.Fail} - Work threw; see {@link com.ryuqq.singleflight.core.outcome.FailureKind}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author SingleFlight Team
 */
package com.ryuqq.singleflight.core.outcome;
