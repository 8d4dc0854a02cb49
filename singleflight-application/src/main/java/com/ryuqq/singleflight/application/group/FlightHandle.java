package com.ryuqq.singleflight.application.group;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 비동기 호출자 전용 결과 핸들.
 *
 * <p>{@link FlightGroup#executeAsync}가 호출자마다 새로 발급합니다.
 * 핸들을 취소하거나 대기를 포기해도 실행 중인 작업과 다른 호출자의 핸들에는
 * 영향을 주지 않습니다 (이 호출자의 대기만 중단).</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * FlightHandle&lt;Price&gt; handle = group.executeAsync(sku, () -&gt; pricing.quote(sku));
 *
 * // 호출자 계층의 타임아웃
 * Optional&lt;FlightResult&lt;Price&gt;&gt; result = handle.await(Duration.ofMillis(200));
 * if (result.isEmpty()) {
 *     handle.cancel(); // 작업은 계속 실행됨
 * }
 * </pre>
 *
 * @param <T> 결과 값 타입
 * @author SingleFlight Team
 * @since 1.0.0
 */
public final class FlightHandle<T> {

    private final CompletableFuture<FlightResult<T>> future;

    private FlightHandle(CompletableFuture<FlightResult<T>> future) {
        if (future == null) {
            throw new IllegalArgumentException("future cannot be null");
        }
        this.future = future;
    }

    /**
     * 호출자 전용 future로 핸들 생성.
     *
     * <p>전달된 future는 이 핸들만 소유해야 합니다.</p>
     *
     * @param future 호출자 전용 future
     * @param <T> 결과 값 타입
     * @return FlightHandle
     * @throws IllegalArgumentException future가 null인 경우
     */
    public static <T> FlightHandle<T> of(CompletableFuture<FlightResult<T>> future) {
        return new FlightHandle<>(future);
    }

    /**
     * 결과가 나올 때까지 대기.
     *
     * @return 실행 결과
     * @throws FlightInterruptedException 대기 중 인터럽트 발생 시
     * @throws java.util.concurrent.CancellationException 이 핸들이 취소된 경우
     */
    public FlightResult<T> await() {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FlightInterruptedException("Interrupted while awaiting flight result", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Flight handle completed exceptionally", e.getCause());
        }
    }

    /**
     * 최대 timeout 동안 결과 대기.
     *
     * <p>기한을 넘겨도 작업은 취소되지 않으며, 이후 다시 대기할 수 있습니다.</p>
     *
     * @param timeout 최대 대기 시간
     * @return 결과 (기한 내 완료 시), 빈 Optional (기한 초과 시)
     * @throws IllegalArgumentException timeout이 null이거나 음수인 경우
     * @throws FlightInterruptedException 대기 중 인터럽트 발생 시
     * @throws java.util.concurrent.CancellationException 이 핸들이 취소된 경우
     */
    public Optional<FlightResult<T>> await(Duration timeout) {
        if (timeout == null || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout cannot be null or negative");
        }
        try {
            return Optional.of(future.get(timeout.toNanos(), TimeUnit.NANOSECONDS));
        } catch (TimeoutException e) {
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FlightInterruptedException("Interrupted while awaiting flight result", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Flight handle completed exceptionally", e.getCause());
        }
    }

    public boolean isDone() {
        return future.isDone();
    }

    public boolean isCancelled() {
        return future.isCancelled();
    }

    /**
     * 이 호출자의 대기 중단.
     *
     * @return 이 호출로 핸들이 취소된 경우 true
     */
    public boolean cancel() {
        return future.cancel(false);
    }

    /**
     * 조합용 future 조회.
     *
     * <p>반환된 future를 취소해도 다른 호출자에게는 영향이 없습니다.</p>
     *
     * @return 호출자 전용 future
     */
    public CompletableFuture<FlightResult<T>> toCompletableFuture() {
        return future;
    }

    @Override
    public String toString() {
        return "FlightHandle{done=" + future.isDone() + "}";
    }
}
