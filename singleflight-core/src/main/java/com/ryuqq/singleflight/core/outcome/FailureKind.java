package com.ryuqq.singleflight.core.outcome;

/**
 * 실패 유형.
 *
 * <ul>
 *   <li>{@link #FAILURE}: 작업이 {@link Exception}을 던짐 (명시적 실패)</li>
 *   <li>{@link #FAULT}: 작업이 {@link Error}로 비정상 종료됨 (복구 불가 런타임 오류)</li>
 * </ul>
 *
 * @author SingleFlight Team
 * @since 1.0.0
 */
public enum FailureKind {

    /**
     * 명시적 실패.
     */
    FAILURE,

    /**
     * 복구 불가 런타임 오류.
     */
    FAULT;

    /**
     * 예외 타입으로 실패 유형 판별.
     *
     * @param cause 작업이 던진 예외
     * @return {@link Error}이면 FAULT, 그 외 FAILURE
     * @throws IllegalArgumentException cause가 null인 경우
     */
    public static FailureKind classify(Throwable cause) {
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
        return cause instanceof Error ? FAULT : FAILURE;
    }
}
