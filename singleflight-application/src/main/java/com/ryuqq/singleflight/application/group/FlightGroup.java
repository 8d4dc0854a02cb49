package com.ryuqq.singleflight.application.group;

import com.ryuqq.singleflight.core.work.Work;

/**
 * 키 단위 호출 중복 제거 그룹.
 *
 * <p>동일 키로 동시에 들어온 요청 중 단 하나만 작업을 실행하고,
 * 나머지 호출자는 실행 중인 호출에 합류(attach)하여 같은 결과를 받습니다.</p>
 *
 * <p><strong>정책:</strong> 키당 실행 중인 호출은 최대 하나.
 * 결과는 호출 완료 후 보관되지 않습니다 (캐시 아님).</p>
 *
 * <p><strong>키 규칙:</strong> 키의 동등성({@code equals}/{@code hashCode})만이
 * 중복 판단 기준입니다. 같은 키를 공유하는 호출자는 같은 결과 타입을 사용해야 합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * FlightGroup&lt;String&gt; group = new InMemoryFlightGroup&lt;&gt;();
 *
 * // 동기: 실행하거나 합류하여 결과 대기
 * FlightResult&lt;Config&gt; result = group.execute("config:prod", () -&gt; loader.load("prod"));
 * Config config = result.getOrThrow();
 *
 * // 비동기: 호출자별 핸들 즉시 반환
 * FlightHandle&lt;Config&gt; handle = group.executeAsync("config:prod", () -&gt; loader.load("prod"));
 *
 * // 다음 호출자는 새 실행을 시작
 * group.forget("config:prod");
 * </pre>
 *
 * @param <K> 키 타입
 * @author SingleFlight Team
 * @since 1.0.0
 */
public interface FlightGroup<K> {

    /**
     * 작업 실행 또는 실행 중인 호출에 합류 (블로킹).
     *
     * <p><strong>동작 방식:</strong></p>
     * <ol>
     *   <li>키에 해당하는 호출이 있으면 합류 후 완료까지 대기 → shared=true, executor=false</li>
     *   <li>없으면 새 호출을 등록하고 잠금 밖에서 작업 실행 → executor=true</li>
     *   <li>실행자는 결과를 기록하고 모든 대기자를 깨운 뒤 등록을 해제</li>
     * </ol>
     *
     * <p>작업이 {@link Error}로 종료되면 대기자에게는 FAULT 결과가 전달되며,
     * 구현체 설정에 따라 실행자 자신에게는 정리 완료 후 해당 Error가 다시 던져질 수 있습니다.</p>
     *
     * @param key 호출 식별 키
     * @param work 실행할 작업
     * @param <T> 결과 타입
     * @return 실행 결과 (outcome, shared, executor)
     * @throws IllegalArgumentException key 또는 work가 null인 경우
     * @throws FlightInterruptedException 대기 중 인터럽트 발생 시
     */
    <T> FlightResult<T> execute(K key, Work<T> work);

    /**
     * 작업 실행 또는 합류 (논블로킹).
     *
     * <p>{@link #execute(Object, Work)}와 동일한 합류/실행 규칙을 따르되,
     * 호출자를 블로킹하지 않고 호출자 전용 핸들을 즉시 반환합니다.
     * 같은 키로 여러 번 호출하면 서로 다른 핸들이 반환되며 모두 같은 결과로 완료됩니다.</p>
     *
     * @param key 호출 식별 키
     * @param work 실행할 작업
     * @param <T> 결과 타입
     * @return 호출자 전용 핸들
     * @throws IllegalArgumentException key 또는 work가 null인 경우
     */
    <T> FlightHandle<T> executeAsync(K key, Work<T> work);

    /**
     * 키의 현재 등록 해제.
     *
     * <p>다음 호출자가 실행 중인 호출에 합류하지 않고 새 실행을 시작하도록 합니다.
     * 이미 합류한 대기자는 영향을 받지 않습니다. 등록이 없으면 아무 일도 하지 않습니다.</p>
     *
     * @param key 호출 식별 키
     * @throws IllegalArgumentException key가 null인 경우
     */
    void forget(K key);

    /**
     * 키에 실행 중인 호출이 등록되어 있는지 확인.
     *
     * @param key 호출 식별 키
     * @return 등록되어 있으면 true
     * @throws IllegalArgumentException key가 null인 경우
     */
    boolean isInFlight(K key);

    /**
     * 현재 등록된 호출 수.
     *
     * @return 등록된 호출 수 (유휴 상태면 0)
     */
    int inFlightCount();
}
