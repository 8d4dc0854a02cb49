package com.ryuqq.singleflight.core.outcome;

/**
 * In-flight 호출의 최종 결과.
 *
 * <p>Outcome은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 작업이 값을 반환함</li>
 *   <li>{@link Fail}: 작업이 예외(FAILURE) 또는 치명적 오류(FAULT)로 종료됨</li>
 * </ul>
 *
 * <p>하나의 호출에 대해 정확히 한 번 기록되며, 실행자와 모든 대기자가
 * 동일한 Outcome 인스턴스를 관찰합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * if (outcome instanceof Ok&lt;User&gt; ok) {
 *     render(ok.value());
 * } else if (outcome instanceof Fail&lt;User&gt; fail) {
 *     log.warn("load failed: {}", fail.kind(), fail.cause());
 * }
 * </pre>
 *
 * @param <T> 결과 값 타입
 * @author SingleFlight Team
 * @since 1.0.0
 */
public sealed interface Outcome<T> permits Ok, Fail {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패(FAILURE 또는 FAULT)인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }
}
