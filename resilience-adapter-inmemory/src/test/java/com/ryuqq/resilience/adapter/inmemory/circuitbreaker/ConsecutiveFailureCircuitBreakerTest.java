package com.ryuqq.resilience.adapter.inmemory.circuitbreaker;

import com.ryuqq.resilience.core.model.DependencyName;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.testkit.MutableClock;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ConsecutiveFailureCircuitBreaker 동시성/생성 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
class ConsecutiveFailureCircuitBreakerTest {

    private static final DependencyName NAME = DependencyName.of("payment-api");

    @Test
    void 생성자_null_인자는_예외() {
        assertThatThrownBy(() -> new ConsecutiveFailureCircuitBreaker(null, new CircuitBreakerConfig()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("name");
        assertThatThrownBy(() -> new ConsecutiveFailureCircuitBreaker(NAME, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("config");
    }

    @Test
    void 동시_실패_기록이_유실되지_않음() throws Exception {
        // given: 임계치가 충분히 커서 OPEN 되지 않는 설정
        MutableClock clock = MutableClock.atEpoch();
        ConsecutiveFailureCircuitBreaker cb =
            new ConsecutiveFailureCircuitBreaker(NAME, new CircuitBreakerConfig(10_000, 1, 60), clock);
        ExecutorService executorService = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        // when: 8개 스레드가 각각 500번 실패 기록
        for (int t = 0; t < 8; t++) {
            futures.add(executorService.submit(() -> {
                start.await();
                for (int i = 0; i < 500; i++) {
                    cb.recordFailure(new IOException("fail"));
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        executorService.shutdown();

        // then
        assertThat(cb.getStats().failureCount()).isEqualTo(4000);
        assertThat(cb.getStats().failedCalls()).isEqualTo(4000);
        assertThat(cb.getState()).isEqualTo(CircuitBreakerState.CLOSED);
    }

    @Test
    void 동시_실패가_임계치를_넘으면_정확히_한번_OPEN() throws Exception {
        // given
        MutableClock clock = MutableClock.atEpoch();
        ConsecutiveFailureCircuitBreaker cb =
            new ConsecutiveFailureCircuitBreaker(NAME, new CircuitBreakerConfig(5, 1, 60), clock);
        ExecutorService executorService = Executors.newFixedThreadPool(4);

        // when
        List<Future<?>> futures = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            futures.add(executorService.submit(() -> cb.recordFailure(new IOException("fail"))));
        }
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        executorService.shutdown();

        // then
        assertThat(cb.getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(cb.getStats().openedAt()).isEqualTo(clock.instant());
    }
}
