package com.ryuqq.resilience.adapter.runner.retry;

import com.ryuqq.resilience.core.protection.RetryBudgetStats;
import com.ryuqq.resilience.testkit.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * RetryBudget 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@DisplayName("RetryBudget 테스트")
class RetryBudgetTest {

    private MutableClock clock;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
    }

    @Test
    @DisplayName("재시도 비율이 상한에 닿으면 다음 재시도 거부")
    void retryRateAtCeiling_RejectsNextRetry() {
        // given
        RetryBudget budget = new RetryBudget(10.0, 60, 0, clock);
        for (int i = 0; i < 10; i++) {
            budget.recordCall();
        }

        // when
        boolean first = budget.tryAcquireRetry();
        boolean second = budget.tryAcquireRetry();

        // then
        assertThat(first).isTrue();
        assertThat(second).isFalse();
        RetryBudgetStats stats = budget.snapshot();
        assertThat(stats.totalCalls()).isEqualTo(10);
        assertThat(stats.totalRetries()).isEqualTo(1);
        assertThat(stats.retryRatePercent()).isEqualTo(10.0);
        assertThat(stats.withinBudget()).isTrue();
    }

    @Test
    @DisplayName("최소 호출 수 미만에서는 상한 미적용")
    void belowMinCalls_RetriesAllowed() {
        // given
        RetryBudget budget = new RetryBudget(10.0, 60, 10, clock);
        for (int i = 0; i < 3; i++) {
            budget.recordCall();
        }

        // when & then
        assertThat(budget.tryAcquireRetry()).isTrue();
        assertThat(budget.tryAcquireRetry()).isTrue();

        for (int i = 0; i < 7; i++) {
            budget.recordCall();
        }
        // 10 calls, 2 retries → 3/10 = 30% > 10%
        assertThat(budget.tryAcquireRetry()).isFalse();
    }

    @Test
    @DisplayName("윈도우가 지나면 카운터 초기화")
    void afterWindow_CountersExpire() {
        // given
        RetryBudget budget = new RetryBudget(10.0, 60, 0, clock);
        for (int i = 0; i < 10; i++) {
            budget.recordCall();
        }
        budget.tryAcquireRetry();

        // when
        clock.advanceSeconds(61);

        // then
        RetryBudgetStats stats = budget.snapshot();
        assertThat(stats.totalCalls()).isZero();
        assertThat(stats.totalRetries()).isZero();
        assertThat(stats.retryRatePercent()).isZero();
    }

    @Test
    @DisplayName("윈도우 안의 1초 버킷은 누적 유지")
    void withinWindow_BucketsAccumulate() {
        // given
        RetryBudget budget = new RetryBudget(50.0, 60, 0, clock);

        // when
        budget.recordCall();
        clock.advanceSeconds(30);
        budget.recordCall();
        clock.advanceSeconds(29);

        // then
        assertThat(budget.snapshot().totalCalls()).isEqualTo(2);
        clock.advanceSeconds(1);
        assertThat(budget.snapshot().totalCalls()).isEqualTo(1);
    }

    @Test
    @DisplayName("호출량과 무관하게 retries/calls는 상한 이하")
    void anyCallVolume_RetryRateNeverExceedsCeiling() {
        // given
        RetryBudget budget = new RetryBudget(10.0, 60, 0, clock);
        Random random = new Random(7);

        // when & then
        for (int i = 0; i < 2000; i++) {
            budget.recordCall();
            int wanted = random.nextInt(4);
            for (int r = 0; r < wanted; r++) {
                budget.tryAcquireRetry();
            }
            assertThat(budget.snapshot().retryRatePercent()).isLessThanOrEqualTo(10.0);
        }
        assertThat(budget.snapshot().totalRetries()).isGreaterThan(0);
    }

    @Test
    @DisplayName("잘못된 파라미터는 거부")
    void invalidArguments_ThrowException() {
        assertThatThrownBy(() -> new RetryBudget(120.0, 60, 0, clock))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryBudget(10.0, 0, 0, clock))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("windowSeconds must be positive");
        assertThatThrownBy(() -> new RetryBudget(10.0, 60, -1, clock))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new RetryBudget(10.0, 60, 0, null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
