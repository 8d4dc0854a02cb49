package com.ryuqq.singleflight.adapter.runner;

import com.ryuqq.singleflight.application.group.FlightHandle;
import com.ryuqq.singleflight.application.group.FlightResult;

/**
 * 제한 시간 대기 결과.
 *
 * <p>{@link BoundedWaitRunner#run}이 timeBudget 안에 결과를 받았는지 여부를 표현합니다.</p>
 *
 * <p><strong>두 가지 가능한 상태:</strong></p>
 * <ul>
 *   <li><strong>시간 내 완료 (completedFast = true):</strong>
 *       <ul>
 *         <li>resultOrNull: 공유된 실행 결과</li>
 *         <li>pendingHandleOrNull: null</li>
 *       </ul>
 *   </li>
 *   <li><strong>대기 중 (completedFast = false):</strong>
 *       <ul>
 *         <li>resultOrNull: null</li>
 *         <li>pendingHandleOrNull: 이후 결과를 받을 수 있는 호출자 전용 핸들</li>
 *       </ul>
 *   </li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 상태 변경 불가</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * BoundedWaitAttempt&lt;Price&gt; attempt = runner.run(sku, () -&gt; pricing.quote(sku), 200);
 * if (attempt.isCompletedFast()) {
 *     Price price = attempt.getResultOrNull().getOrThrow();
 * } else {
 *     // 작업은 계속 실행 중, 나중에 결과 수신
 *     attempt.getPendingHandleOrNull().toCompletableFuture().thenAccept(this::publish);
 * }
 * </pre>
 *
 * @param <T> 결과 값 타입
 * @author SingleFlight Team
 * @since 1.0.0
 */
public final class BoundedWaitAttempt<T> {

    private final boolean completedFast;
    private final FlightResult<T> resultOrNull;
    private final FlightHandle<T> pendingHandleOrNull;

    private BoundedWaitAttempt(boolean completedFast,
                               FlightResult<T> resultOrNull, FlightHandle<T> pendingHandleOrNull) {
        this.completedFast = completedFast;
        this.resultOrNull = resultOrNull;
        this.pendingHandleOrNull = pendingHandleOrNull;
    }

    /**
     * 시간 내 완료 결과 생성.
     *
     * @param result 실행 결과
     * @param <T> 결과 값 타입
     * @return BoundedWaitAttempt (completedFast=true)
     * @throws IllegalArgumentException result가 null인 경우
     */
    public static <T> BoundedWaitAttempt<T> completed(FlightResult<T> result) {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null for completed attempt");
        }
        return new BoundedWaitAttempt<>(true, result, null);
    }

    /**
     * 대기 중 결과 생성.
     *
     * @param handle 아직 완료되지 않은 호출자 전용 핸들
     * @param <T> 결과 값 타입
     * @return BoundedWaitAttempt (completedFast=false)
     * @throws IllegalArgumentException handle이 null인 경우
     */
    public static <T> BoundedWaitAttempt<T> pending(FlightHandle<T> handle) {
        if (handle == null) {
            throw new IllegalArgumentException("handle cannot be null for pending attempt");
        }
        return new BoundedWaitAttempt<>(false, null, handle);
    }

    /**
     * timeBudget 안에 완료되었는지 확인.
     *
     * @return 완료된 경우 true, 시간 초과한 경우 false
     */
    public boolean isCompletedFast() {
        return completedFast;
    }

    /**
     * 실행 결과 조회.
     *
     * <p><strong>주의:</strong> completedFast=true인 경우에만 non-null 반환</p>
     *
     * @return 실행 결과 또는 null
     */
    public FlightResult<T> getResultOrNull() {
        return resultOrNull;
    }

    /**
     * 대기 중인 핸들 조회.
     *
     * <p><strong>주의:</strong> completedFast=false인 경우에만 non-null 반환</p>
     *
     * @return 호출자 전용 핸들 또는 null
     */
    public FlightHandle<T> getPendingHandleOrNull() {
        return pendingHandleOrNull;
    }

    @Override
    public String toString() {
        if (completedFast) {
            return "BoundedWaitAttempt{completed=true, result=" + resultOrNull + "}";
        } else {
            return "BoundedWaitAttempt{completed=false, pending=" + pendingHandleOrNull + "}";
        }
    }
}
