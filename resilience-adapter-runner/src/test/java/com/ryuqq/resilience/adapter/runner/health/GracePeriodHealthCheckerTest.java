package com.ryuqq.resilience.adapter.runner.health;

import com.ryuqq.resilience.adapter.runner.retry.TimeLimitedInvoker;
import com.ryuqq.resilience.core.health.HealthCheckConfig;
import com.ryuqq.resilience.core.health.HealthCheckResult;
import com.ryuqq.resilience.core.health.HealthCheckType;
import com.ryuqq.resilience.core.health.HealthProbe;
import com.ryuqq.resilience.core.health.HealthStatus;
import com.ryuqq.resilience.testkit.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * GracePeriodHealthChecker 테스트.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@DisplayName("GracePeriodHealthChecker 테스트")
class GracePeriodHealthCheckerTest {

    private static final HealthProbe FAILING = () -> {
        throw new IOException("connection refused");
    };
    private static final HealthProbe PASSING = () -> Map.of("pool", "ok");

    private MutableClock clock;
    private GracePeriodHealthChecker checker;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        checker = new GracePeriodHealthChecker(
            "order-db",
            HealthCheckConfig.forType(HealthCheckType.READINESS),
            clock,
            TimeLimitedInvoker.shared()
        );
    }

    @Test
    @DisplayName("연속 실패 2회는 HEALTHY 유지, 3회째 UNHEALTHY, 성공 1회로 즉시 HEALTHY")
    void gracePeriod_SlowCondemnationFastRecovery() {
        // when & then
        HealthCheckResult first = checker.check(FAILING);
        assertThat(first.status()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(first.consecutiveFailures()).isEqualTo(1);
        assertThat(first.error()).contains("connection refused");

        HealthCheckResult second = checker.check(FAILING);
        assertThat(second.status()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(checker.isHealthy()).isTrue();

        HealthCheckResult third = checker.check(FAILING);
        assertThat(third.status()).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(third.consecutiveFailures()).isEqualTo(3);
        assertThat(checker.isHealthy()).isFalse();

        HealthCheckResult recovered = checker.check(PASSING);
        assertThat(recovered.status()).isEqualTo(HealthStatus.HEALTHY);
        assertThat(recovered.consecutiveFailures()).isZero();
        assertThat(recovered.error()).isNull();
    }

    @Test
    @DisplayName("성공 결과에 프로브 상세와 검사 시각 기록")
    void success_RecordsDetailsAndTime() {
        // given
        clock.advanceSeconds(30);

        // when
        HealthCheckResult result = checker.check(PASSING);

        // then
        assertThat(result.checkType()).isEqualTo(HealthCheckType.READINESS);
        assertThat(result.details()).containsEntry("pool", "ok");
        assertThat(result.lastCheckTime()).isEqualTo(Instant.parse("2024-01-01T00:00:30Z"));
        assertThat(result.latencyMs()).isGreaterThanOrEqualTo(0);
        assertThat(checker.getLastResult()).contains(result);
    }

    @Test
    @DisplayName("검사 전에는 UNKNOWN, 최근 결과 없음")
    void beforeFirstCheck_Unknown() {
        assertThat(checker.getStatus()).isEqualTo(HealthStatus.UNKNOWN);
        assertThat(checker.getLastResult()).isEmpty();
    }

    @Test
    @DisplayName("프로브가 마감 시간을 넘으면 실패로 처리")
    void slowProbe_CountsAsFailure() {
        // given
        GracePeriodHealthChecker liveness = new GracePeriodHealthChecker(
            "order-db",
            HealthCheckConfig.forType(HealthCheckType.LIVENESS).withGracePeriodFailures(1),
            clock,
            TimeLimitedInvoker.shared()
        );

        // when
        HealthCheckResult result = liveness.check(() -> {
            Thread.sleep(5_000);
            return Map.of();
        });

        // then
        assertThat(result.status()).isEqualTo(HealthStatus.UNHEALTHY);
        assertThat(result.error()).contains("timed out");
    }

    @Test
    @DisplayName("null 인자 거부")
    void nullArguments_ThrowException() {
        assertThatThrownBy(() -> checker.check(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GracePeriodHealthChecker(null, HealthCheckConfig.forType(HealthCheckType.DEEP)))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
