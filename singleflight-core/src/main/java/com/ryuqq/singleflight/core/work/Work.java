package com.ryuqq.singleflight.core.work;

/**
 * 중복 제거 대상 작업.
 *
 * <p>동일 키로 동시에 들어온 요청들 중 단 하나의 호출자(Executor)만
 * 이 작업을 실행하며, 나머지 호출자는 그 결과를 공유합니다.</p>
 *
 * <p><strong>결과 규칙:</strong></p>
 * <ul>
 *   <li>정상 반환: {@code Ok} 결과로 기록 (null 반환 허용)</li>
 *   <li>{@link Exception} 발생: {@code Fail(FAILURE)} 결과로 기록</li>
 *   <li>{@link Error} 발생: {@code Fail(FAULT)} 결과로 기록</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Work&lt;User&gt; work = () -&gt; userRepository.load(userId);
 * FlightResult&lt;User&gt; result = group.execute("user:" + userId, work);
 * </pre>
 *
 * @param <T> 작업 결과 타입
 * @author SingleFlight Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Work<T> {

    /**
     * 작업 실행.
     *
     * @return 작업 결과 (null 가능)
     * @throws Exception 작업 실패 시
     */
    T call() throws Exception;
}
