/**
 * Runner Adapter Layer - FlightGroup 위에서 동작하는 호출자 계층 헬퍼.
 *
 * <p>이 패키지는 FlightGroup 포트를 사용하는 호출자 측 구성요소를 포함합니다.</p>
 *
 * <h2>구현체</h2>
 * <ul>
 *   <li>{@link com.ryuqq.singleflight.adapter.runner.BoundedWaitRunner} - timeBudget 기반 제한 시간 대기 러너</li>
 *   <li>{@link com.ryuqq.singleflight.adapter.runner.BoundedWaitAttempt} - 완료/대기 중 결과</li>
 *   <li>{@link com.ryuqq.singleflight.adapter.runner.BoundedWaitConfig} - timeBudget 허용 범위</li>
 * </ul>
 *
 * <h2>아키텍처 위치</h2>
 * <pre>
 * adapter-runner (BoundedWaitRunner)
 *   ↓ uses
 * application (FlightGroup, FlightHandle, FlightResult)
 *   ↓ depends on
 * core (Work, Outcome)
 * </pre>
 *
 * @author SingleFlight Team
 * @since 1.0.0
 */
package com.ryuqq.singleflight.adapter.runner;
