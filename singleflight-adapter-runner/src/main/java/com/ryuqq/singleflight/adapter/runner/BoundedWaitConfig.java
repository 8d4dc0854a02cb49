package com.ryuqq.singleflight.adapter.runner;

/**
 * BoundedWaitRunner 설정 (불변 record).
 *
 * <p>호출자가 요청할 수 있는 timeBudget의 허용 범위를 정의합니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>minTimeBudgetMs: 허용되는 최소 대기 시간 (기본 50ms)</li>
 *   <li>maxTimeBudgetMs: 허용되는 최대 대기 시간 (기본 5000ms)</li>
 * </ul>
 *
 * @author SingleFlight Team
 * @since 1.0.0
 * @param minTimeBudgetMs 최소 대기 시간 (밀리초, 양수여야 함)
 * @param maxTimeBudgetMs 최대 대기 시간 (밀리초, minTimeBudgetMs 이상이어야 함)
 */
public record BoundedWaitConfig(long minTimeBudgetMs, long maxTimeBudgetMs) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: minTimeBudgetMs=50ms, maxTimeBudgetMs=5000ms</p>
     */
    public BoundedWaitConfig() {
        this(50, 5000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BoundedWaitConfig {
        if (minTimeBudgetMs <= 0) {
            throw new IllegalArgumentException(
                "minTimeBudgetMs must be positive (current: " + minTimeBudgetMs + ")"
            );
        }
        if (maxTimeBudgetMs < minTimeBudgetMs) {
            throw new IllegalArgumentException(
                "maxTimeBudgetMs must be >= minTimeBudgetMs (min: " + minTimeBudgetMs
                    + ", max: " + maxTimeBudgetMs + ")"
            );
        }
    }

    /**
     * minTimeBudgetMs만 변경한 새 인스턴스 생성.
     *
     * @param minTimeBudgetMs 새로운 최소 대기 시간 (밀리초)
     * @return 새 BoundedWaitConfig 인스턴스
     */
    public BoundedWaitConfig withMinTimeBudgetMs(long minTimeBudgetMs) {
        return new BoundedWaitConfig(minTimeBudgetMs, this.maxTimeBudgetMs);
    }

    /**
     * maxTimeBudgetMs만 변경한 새 인스턴스 생성.
     *
     * @param maxTimeBudgetMs 새로운 최대 대기 시간 (밀리초)
     * @return 새 BoundedWaitConfig 인스턴스
     */
    public BoundedWaitConfig withMaxTimeBudgetMs(long maxTimeBudgetMs) {
        return new BoundedWaitConfig(this.minTimeBudgetMs, maxTimeBudgetMs);
    }

    /**
     * timeBudget이 허용 범위 안에 있는지 확인.
     *
     * @param timeBudgetMs 검사할 대기 시간 (밀리초)
     * @return 범위 안이면 true
     */
    public boolean accepts(long timeBudgetMs) {
        return timeBudgetMs >= minTimeBudgetMs && timeBudgetMs <= maxTimeBudgetMs;
    }
}
