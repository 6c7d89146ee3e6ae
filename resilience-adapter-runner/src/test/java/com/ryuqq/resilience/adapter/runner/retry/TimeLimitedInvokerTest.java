package com.ryuqq.resilience.adapter.runner.retry;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TimeLimitedInvoker 테스트")
class TimeLimitedInvokerTest {

    private final ExecutorService workers = Executors.newCachedThreadPool();
    private final TimeLimitedInvoker invoker = new TimeLimitedInvoker(workers);

    @AfterEach
    void tearDown() {
        workers.shutdownNow();
    }

    @Test
    @DisplayName("마감 전에 끝나면 결과 반환")
    void completesInTime_ReturnsResult() throws Exception {
        assertThat(invoker.invoke(() -> "ok", 1000)).isEqualTo("ok");
    }

    @Test
    @DisplayName("마감 초과 시 TimeoutException과 워커 인터럽트")
    void exceedsDeadline_CancelsWorker() throws Exception {
        // given
        CountDownLatch interrupted = new CountDownLatch(1);

        // when & then
        assertThatThrownBy(() -> invoker.invoke(() -> {
            try {
                Thread.sleep(10_000);
            } catch (InterruptedException e) {
                interrupted.countDown();
                throw e;
            }
            return "late";
        }, 50))
            .isInstanceOf(TimeoutException.class)
            .hasMessageContaining("50ms");

        assertThat(interrupted.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("작업 예외는 그대로 전파 (checked 포함)")
    void workThrows_SameExceptionPropagates() {
        IOException failure = new IOException("connection reset");
        IllegalStateException unchecked = new IllegalStateException("bad state");

        assertThatThrownBy(() -> invoker.invoke(() -> {
            throw failure;
        }, 1000)).isSameAs(failure);
        assertThatThrownBy(() -> invoker.invoke(() -> {
            throw unchecked;
        }, 1000)).isSameAs(unchecked);
    }

    @Test
    @DisplayName("마감 시간은 양수")
    void nonPositiveTimeout_ThrowsException() {
        assertThatThrownBy(() -> invoker.invoke(() -> "x", 0))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("timeoutMs must be positive");
    }

    @Test
    @DisplayName("공용 인스턴스는 데몬 스레드에서 실행")
    void shared_RunsOnDaemonThread() throws Exception {
        Boolean daemon = TimeLimitedInvoker.shared().invoke(() -> Thread.currentThread().isDaemon(), 1000);

        assertThat(daemon).isTrue();
    }
}
