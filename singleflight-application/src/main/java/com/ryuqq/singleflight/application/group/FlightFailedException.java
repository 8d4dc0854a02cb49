package com.ryuqq.singleflight.application.group;

import com.ryuqq.singleflight.core.outcome.FailureKind;

/**
 * 공유된 결과가 실패일 때 {@link FlightResult#getOrThrow()}가 던지는 예외.
 *
 * <p>원인 예외는 {@link #getCause()}로, 실패 유형은 {@link #getKind()}로 조회합니다.</p>
 *
 * @author SingleFlight Team
 * @since 1.0.0
 */
public class FlightFailedException extends RuntimeException {

    private final FailureKind kind;

    public FlightFailedException(FailureKind kind, Throwable cause) {
        super("Flight failed (" + kind + "): " + cause, cause);
        this.kind = kind;
    }

    public FailureKind getKind() {
        return kind;
    }
}
