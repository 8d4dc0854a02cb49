package com.ryuqq.singleflight.application.group;

/**
 * 결과 대기 중 스레드가 인터럽트되었을 때 던져지는 예외.
 *
 * <p>던지기 전에 현재 스레드의 인터럽트 플래그를 복원합니다.
 * 실행 중인 작업은 계속 진행되며 다른 대기자에게는 영향이 없습니다.</p>
 *
 * @author SingleFlight Team
 * @since 1.0.0
 */
public class FlightInterruptedException extends RuntimeException {

    public FlightInterruptedException(String message, InterruptedException cause) {
        super(message, cause);
    }
}
