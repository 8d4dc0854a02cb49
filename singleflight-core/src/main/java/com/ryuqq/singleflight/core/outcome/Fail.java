package com.ryuqq.singleflight.core.outcome;

/**
 * 실패 결과.
 *
 * <p>작업이 값을 반환하지 못하고 종료되었음을 나타냅니다.
 * 자동 재시도는 없으며, 재시도 정책은 호출자의 책임입니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>FAILURE: 원격 호출 타임아웃, 조회 대상 없음, 검증 실패</li>
 *   <li>FAULT: StackOverflowError, OutOfMemoryError 등 작업 내부의 치명적 오류</li>
 * </ul>
 *
 * @param kind 실패 유형
 * @param cause 작업이 던진 원인 예외
 * @param <T> 결과 값 타입 (실패 시 값은 없음)
 *
 * @author SingleFlight Team
 * @since 1.0.0
 */
public record Fail<T>(
    FailureKind kind,
    Throwable cause
) implements Outcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind 또는 cause가 null이거나, FAULT인데 cause가 Error가 아닌 경우
     */
    public Fail {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (cause == null) {
            throw new IllegalArgumentException("cause cannot be null");
        }
        if (kind == FailureKind.FAULT && !(cause instanceof Error)) {
            throw new IllegalArgumentException("FAULT requires an Error cause, but was: " + cause.getClass().getName());
        }
    }

    /**
     * 원인 예외 타입에 따라 FAILURE/FAULT를 판별하여 Fail 생성.
     *
     * @param cause 원인 예외
     * @param <T> 결과 값 타입
     * @return Fail 인스턴스
     * @throws IllegalArgumentException cause가 null인 경우
     */
    public static <T> Fail<T> of(Throwable cause) {
        return new Fail<>(FailureKind.classify(cause), cause);
    }

    /**
     * 명시적 실패 생성.
     *
     * @param cause 원인 예외
     * @param <T> 결과 값 타입
     * @return FAILURE 유형의 Fail
     */
    public static <T> Fail<T> failure(Throwable cause) {
        return new Fail<>(FailureKind.FAILURE, cause);
    }

    /**
     * 치명적 오류 생성.
     *
     * @param error 원인 오류
     * @param <T> 결과 값 타입
     * @return FAULT 유형의 Fail
     */
    public static <T> Fail<T> fault(Error error) {
        return new Fail<>(FailureKind.FAULT, error);
    }

    /**
     * FAULT 여부 확인.
     *
     * @return 치명적 오류로 종료된 경우 true
     */
    public boolean isFault() {
        return kind == FailureKind.FAULT;
    }
}
