package com.ryuqq.singleflight.core.outcome;

/**
 * 성공 결과.
 *
 * <p>작업이 정상적으로 값을 반환했음을 나타냅니다.</p>
 *
 * @param value 작업이 반환한 값 (null 허용)
 * @param <T> 결과 값 타입
 *
 * @author SingleFlight Team
 * @since 1.0.0
 */
public record Ok<T>(T value) implements Outcome<T> {

    /**
     * Ok 생성.
     *
     * @param value 결과 값
     * @param <T> 결과 값 타입
     * @return Ok 인스턴스
     */
    public static <T> Ok<T> of(T value) {
        return new Ok<>(value);
    }
}
