package com.ryuqq.singleflight.adapter.runner;

import com.ryuqq.singleflight.application.group.FlightGroup;
import com.ryuqq.singleflight.application.group.FlightHandle;
import com.ryuqq.singleflight.application.group.FlightResult;
import com.ryuqq.singleflight.core.work.Work;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * 제한 시간 대기 Runner.
 *
 * <p>timeBudget 기반 동기/비동기 분기를 수행합니다. 실행은 취소하지 않고
 * 호출자의 대기만 제한합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>timeBudget 범위 검증</li>
 *   <li>{@link FlightGroup#executeAsync}로 실행 시작 또는 진행 중인 실행에 합류</li>
 *   <li>timeBudget 동안 핸들 대기</li>
 *   <li>완료 시: BoundedWaitAttempt.completed(result)</li>
 *   <li>타임아웃 시: BoundedWaitAttempt.pending(handle), 작업은 계속 실행</li>
 * </ol>
 *
 * <p>Runner 자체는 상태를 갖지 않으며 thread-safe합니다.</p>
 *
 * @param <K> 키 타입
 * @author SingleFlight Team
 * @since 1.0.0
 */
public final class BoundedWaitRunner<K> {

    private static final Logger log = LoggerFactory.getLogger(BoundedWaitRunner.class);

    private final FlightGroup<K> group;
    private final BoundedWaitConfig config;

    /**
     * 생성자 (기본 설정).
     *
     * @param group 실행을 위임할 FlightGroup
     * @throws IllegalArgumentException group이 null인 경우
     */
    public BoundedWaitRunner(FlightGroup<K> group) {
        this(group, new BoundedWaitConfig());
    }

    /**
     * 생성자.
     *
     * @param group 실행을 위임할 FlightGroup
     * @param config timeBudget 허용 범위
     * @throws IllegalArgumentException group 또는 config가 null인 경우
     */
    public BoundedWaitRunner(FlightGroup<K> group, BoundedWaitConfig config) {
        if (group == null) {
            throw new IllegalArgumentException("group cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.group = group;
        this.config = config;
    }

    /**
     * 작업을 시작(또는 합류)하고 최대 timeBudgetMs 동안 결과를 기다립니다.
     *
     * @param key 요청 식별 키
     * @param work 실행할 작업
     * @param timeBudgetMs 최대 대기 시간 (밀리초)
     * @param <T> 결과 값 타입
     * @return 완료 결과 또는 대기 중 핸들
     * @throws IllegalArgumentException key/work가 null이거나 timeBudgetMs가 허용 범위를 벗어난 경우
     * @throws com.ryuqq.singleflight.application.group.FlightInterruptedException 대기 중 인터럽트 발생 시
     */
    public <T> BoundedWaitAttempt<T> run(K key, Work<T> work, long timeBudgetMs) {
        validateInput(key, work, timeBudgetMs);

        FlightHandle<T> handle = group.executeAsync(key, work);
        Optional<FlightResult<T>> result = handle.await(Duration.ofMillis(timeBudgetMs));

        if (result.isPresent()) {
            return BoundedWaitAttempt.completed(result.get());
        }

        log.debug("Time budget of {}ms exceeded for key={}, returning pending handle", timeBudgetMs, key);
        return BoundedWaitAttempt.pending(handle);
    }

    private void validateInput(K key, Work<?> work, long timeBudgetMs) {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        if (!config.accepts(timeBudgetMs)) {
            throw new IllegalArgumentException(
                String.format("timeBudgetMs must be between %d and %d ms (current: %d)",
                    config.minTimeBudgetMs(), config.maxTimeBudgetMs(), timeBudgetMs));
        }
    }
}
