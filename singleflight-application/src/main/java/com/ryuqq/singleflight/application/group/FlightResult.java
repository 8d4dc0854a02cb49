package com.ryuqq.singleflight.application.group;

import com.ryuqq.singleflight.core.outcome.Fail;
import com.ryuqq.singleflight.core.outcome.Ok;
import com.ryuqq.singleflight.core.outcome.Outcome;

/**
 * 호출자 한 명이 받는 실행 결과.
 *
 * <p><strong>구성:</strong></p>
 * <ul>
 *   <li>outcome: 작업의 결과 (모든 호출자가 동일한 인스턴스 관찰)</li>
 *   <li>shared: 결과가 둘 이상의 호출자에게 전달되었는지 여부</li>
 *   <li>executor: 이 호출자가 직접 작업을 실행했는지 여부</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 상태 변경 불가</p>
 *
 * @param <T> 결과 값 타입
 * @author SingleFlight Team
 * @since 1.0.0
 */
public final class FlightResult<T> {

    private final Outcome<T> outcome;
    private final boolean shared;
    private final boolean executor;

    private FlightResult(Outcome<T> outcome, boolean shared, boolean executor) {
        if (outcome == null) {
            throw new IllegalArgumentException("outcome cannot be null");
        }
        this.outcome = outcome;
        this.shared = shared;
        this.executor = executor;
    }

    /**
     * 실행자 결과 생성.
     *
     * @param outcome 작업 결과
     * @param shared 다른 호출자와 결과를 공유했는지 여부
     * @param <T> 결과 값 타입
     * @return FlightResult (executor=true)
     * @throws IllegalArgumentException outcome이 null인 경우
     */
    public static <T> FlightResult<T> executed(Outcome<T> outcome, boolean shared) {
        return new FlightResult<>(outcome, shared, true);
    }

    /**
     * 합류한 대기자 결과 생성.
     *
     * <p>대기자는 정의상 실행자와 결과를 공유하므로 shared는 항상 true입니다.</p>
     *
     * @param outcome 작업 결과
     * @param <T> 결과 값 타입
     * @return FlightResult (shared=true, executor=false)
     * @throws IllegalArgumentException outcome이 null인 경우
     */
    public static <T> FlightResult<T> joined(Outcome<T> outcome) {
        return new FlightResult<>(outcome, true, false);
    }

    public Outcome<T> getOutcome() {
        return outcome;
    }

    public boolean isShared() {
        return shared;
    }

    public boolean isExecutor() {
        return executor;
    }

    /**
     * 성공 값 조회.
     *
     * @return 작업이 반환한 값 (null 가능)
     * @throws FlightFailedException 결과가 {@link Fail}인 경우
     */
    public T getOrThrow() {
        if (outcome instanceof Ok<T> ok) {
            return ok.value();
        }
        Fail<T> fail = (Fail<T>) outcome;
        throw new FlightFailedException(fail.kind(), fail.cause());
    }

    @Override
    public String toString() {
        return "FlightResult{outcome=" + outcome + ", shared=" + shared + ", executor=" + executor + "}";
    }
}
