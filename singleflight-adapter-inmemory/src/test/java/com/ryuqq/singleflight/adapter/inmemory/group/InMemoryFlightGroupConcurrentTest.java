package com.ryuqq.singleflight.adapter.inmemory.group;

import com.ryuqq.singleflight.application.group.FlightHandle;
import com.ryuqq.singleflight.application.group.FlightResult;
import com.ryuqq.singleflight.core.outcome.Outcome;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.RepeatedTest;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * InMemoryFlightGroup 멀티스레드 안전성 테스트.
 *
 * <p>실제 스레드 스케줄링에서 다음을 검증합니다:</p>
 * <ul>
 *   <li>같은 키의 동시 호출은 작업을 한 번만 실행</li>
 *   <li>서로 다른 키는 독립적으로 실행</li>
 *   <li>execute / executeAsync / forget이 섞여도 레지스트리 누수 없음</li>
 *   <li>기본 비동기 풀은 데몬 스레드 사용</li>
 * </ul>
 *
 * @author SingleFlight Team
 * @since 1.0.0
 */
class InMemoryFlightGroupConcurrentTest {

    private static final long ATTACH_GRACE_MS = 200;

    private InMemoryFlightGroup<String> group;
    private ExecutorService callers;

    @BeforeEach
    void setUp() {
        group = new InMemoryFlightGroup<>(new FlightGroupConfig().withAsyncConcurrency(4));
        callers = Executors.newFixedThreadPool(16);
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        callers.shutdownNow();
        group.shutdown();
    }

    @RepeatedTest(3)  // Race condition 검증을 위해 3회 반복
    void execute_50개_스레드_같은_키_동시_호출시_작업은_1회만_실행() throws Exception {
        // given
        int threadCount = 50;
        ExecutorService pool = Executors.newFixedThreadPool(threadCount);
        AtomicInteger invocations = new AtomicInteger(0);
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch arrivals = new CountDownLatch(threadCount);
        List<Future<FlightResult<Integer>>> futures = new ArrayList<>();

        try {
            // when - 모든 스레드가 도착할 때까지 작업이 끝나지 않음
            for (int i = 0; i < threadCount; i++) {
                futures.add(pool.submit(() -> {
                    startLatch.await();
                    arrivals.countDown();
                    return group.execute("hot-key", () -> {
                        arrivals.await(10, TimeUnit.SECONDS);
                        Thread.sleep(ATTACH_GRACE_MS);
                        return invocations.incrementAndGet();
                    });
                }));
            }
            startLatch.countDown();

            // then
            List<FlightResult<Integer>> results = new ArrayList<>();
            for (Future<FlightResult<Integer>> future : futures) {
                results.add(future.get(10, TimeUnit.SECONDS));
            }

            assertThat(invocations.get()).isEqualTo(1);
            assertThat(results).extracting(FlightResult::getOrThrow).containsOnly(1);
            assertThat(results).filteredOn(FlightResult::isExecutor).hasSize(1);
            assertThat(results).allMatch(FlightResult::isShared);
            assertThat(group.inFlightCount()).isZero();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void execute_10개_키_각각_10개_스레드_동시_호출시_키마다_1회_실행() throws Exception {
        // given
        int keyCount = 10;
        int callersPerKey = 10;
        ExecutorService pool = Executors.newFixedThreadPool(keyCount * callersPerKey);
        Map<String, AtomicInteger> invocations = new ConcurrentHashMap<>();
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch arrivals = new CountDownLatch(keyCount * callersPerKey);
        Map<String, List<Future<FlightResult<String>>>> futuresByKey = new HashMap<>();

        try {
            // when
            for (int k = 0; k < keyCount; k++) {
                String key = "key-" + k;
                invocations.put(key, new AtomicInteger(0));
                List<Future<FlightResult<String>>> futures = new ArrayList<>();
                for (int c = 0; c < callersPerKey; c++) {
                    futures.add(pool.submit(() -> {
                        startLatch.await();
                        arrivals.countDown();
                        return group.execute(key, () -> {
                            arrivals.await(10, TimeUnit.SECONDS);
                            Thread.sleep(ATTACH_GRACE_MS);
                            invocations.get(key).incrementAndGet();
                            return "value-of-" + key;
                        });
                    }));
                }
                futuresByKey.put(key, futures);
            }
            startLatch.countDown();

            // then - 키 간 결과 섞임 없음
            for (Map.Entry<String, List<Future<FlightResult<String>>>> entry : futuresByKey.entrySet()) {
                for (Future<FlightResult<String>> future : entry.getValue()) {
                    assertThat(future.get(10, TimeUnit.SECONDS).getOrThrow())
                        .isEqualTo("value-of-" + entry.getKey());
                }
                assertThat(invocations.get(entry.getKey()).get()).isEqualTo(1);
            }
            assertThat(group.inFlightCount()).isZero();
        } finally {
            pool.shutdownNow();
        }
    }

    @RepeatedTest(3)
    void execute_executeAsync_forget_혼합_호출후_레지스트리_누수_없음() throws Exception {
        // given
        int rounds = 200;
        String[] keys = {"a", "b", "c", "d"};
        List<Future<Outcome<Integer>>> futures = new ArrayList<>();

        // when
        for (int i = 0; i < rounds; i++) {
            String key = keys[i % keys.length];
            int value = i;
            if (i % 3 == 0) {
                futures.add(callers.submit(() -> group.execute(key, () -> value).getOutcome()));
            } else if (i % 3 == 1) {
                futures.add(callers.submit(() -> {
                    FlightHandle<Integer> handle = group.executeAsync(key, () -> value);
                    return handle.await().getOutcome();
                }));
            } else {
                futures.add(callers.submit(() -> {
                    group.forget(key);
                    return group.execute(key, () -> value).getOutcome();
                }));
            }
        }

        // then - 모든 호출이 결과를 받고 레지스트리는 비어 있음
        for (Future<Outcome<Integer>> future : futures) {
            assertThat(future.get(10, TimeUnit.SECONDS).isOk()).isTrue();
        }
        // 비동기 실행의 정리는 풀 스레드에서 결과 전달 직후 수행됨
        awaitIdle(group);
        assertThat(group.inFlightCount()).isZero();
    }

    @Test
    void executeAsync_기본_풀은_이름_있는_데몬_스레드에서_실행() {
        // when
        Thread worker = group.executeAsync("thread", Thread::currentThread).await().getOrThrow();

        // then: shutdown을 호출하지 않아도 JVM 종료를 막지 않음
        assertThat(worker.isDaemon()).isTrue();
        assertThat(worker.getName()).startsWith(InMemoryFlightGroup.ASYNC_THREAD_PREFIX);
    }

    private void awaitIdle(InMemoryFlightGroup<String> target) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(10);
        while (target.inFlightCount() > 0 && System.nanoTime() < deadline) {
            Thread.sleep(5);
        }
    }
}
