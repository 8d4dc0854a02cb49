package com.ryuqq.singleflight.adapter.inmemory.group;

/**
 * InMemoryFlightGroup 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>asyncConcurrency: executeAsync 작업을 실행할 스레드 수 (기본 8)</li>
 *   <li>rethrowFaults: 작업이 Error로 종료된 경우, 정리 완료 후 블로킹 실행자에게 Error를 다시 던질지 여부 (기본 true)</li>
 * </ul>
 *
 * <p>rethrowFaults 값과 무관하게 합류한 대기자는 항상 FAULT 결과를 받습니다.</p>
 *
 * @author SingleFlight Team
 * @since 1.0.0
 * @param asyncConcurrency 비동기 실행 스레드 수 (1 이상이어야 함)
 * @param rethrowFaults 실행자에게 Error 재전파 여부
 */
public record FlightGroupConfig(
    int asyncConcurrency,
    boolean rethrowFaults
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: asyncConcurrency=8, rethrowFaults=true</p>
     */
    public FlightGroupConfig() {
        this(8, true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public FlightGroupConfig {
        if (asyncConcurrency <= 0) {
            throw new IllegalArgumentException(
                "asyncConcurrency must be positive (current: " + asyncConcurrency + ")"
            );
        }
    }

    /**
     * asyncConcurrency만 변경한 새 인스턴스 생성.
     */
    public FlightGroupConfig withAsyncConcurrency(int asyncConcurrency) {
        return new FlightGroupConfig(asyncConcurrency, rethrowFaults);
    }

    /**
     * rethrowFaults만 변경한 새 인스턴스 생성.
     */
    public FlightGroupConfig withRethrowFaults(boolean rethrowFaults) {
        return new FlightGroupConfig(asyncConcurrency, rethrowFaults);
    }
}
