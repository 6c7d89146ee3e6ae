package com.ryuqq.resilience.core.health;

/**
 * 헬스 체크 설정 (불변 record).
 *
 * <p>체크 종류마다 독립적으로 설정합니다. {@link #forType(HealthCheckType)}은 종류별 기본값을 제공합니다.</p>
 *
 * <ul>
 *   <li>LIVENESS: interval 10초, timeout 1초, grace 3회</li>
 *   <li>READINESS: interval 15초, timeout 3초, grace 3회</li>
 *   <li>DEEP: interval 60초, timeout 5초, grace 3회</li>
 * </ul>
 *
 * @param checkType 체크 종류
 * @param intervalSeconds 주기 실행 간격 (초, 양수)
 * @param timeoutSeconds 프로브 타임아웃 (초, 양수)
 * @param gracePeriodFailures UNHEALTHY 전환까지 허용하는 연속 실패 수 (양수)
 * @author Resilience Team
 * @since 1.0.0
 */
public record HealthCheckConfig(
    HealthCheckType checkType,
    long intervalSeconds,
    long timeoutSeconds,
    int gracePeriodFailures
) {

    public HealthCheckConfig {
        if (checkType == null) {
            throw new IllegalArgumentException("checkType cannot be null");
        }
        if (intervalSeconds <= 0) {
            throw new IllegalArgumentException(
                "intervalSeconds must be positive (current: " + intervalSeconds + ")"
            );
        }
        if (timeoutSeconds <= 0) {
            throw new IllegalArgumentException(
                "timeoutSeconds must be positive (current: " + timeoutSeconds + ")"
            );
        }
        if (gracePeriodFailures <= 0) {
            throw new IllegalArgumentException(
                "gracePeriodFailures must be positive (current: " + gracePeriodFailures + ")"
            );
        }
    }

    /**
     * 종류별 기본 설정.
     *
     * @param checkType 체크 종류
     * @return 기본 설정
     */
    public static HealthCheckConfig forType(HealthCheckType checkType) {
        if (checkType == null) {
            throw new IllegalArgumentException("checkType cannot be null");
        }
        return switch (checkType) {
            case LIVENESS -> new HealthCheckConfig(checkType, 10, 1, 3);
            case READINESS -> new HealthCheckConfig(checkType, 15, 3, 3);
            case DEEP -> new HealthCheckConfig(checkType, 60, 5, 3);
        };
    }

    public HealthCheckConfig withTimeoutSeconds(long timeoutSeconds) {
        return new HealthCheckConfig(checkType, intervalSeconds, timeoutSeconds, gracePeriodFailures);
    }

    public HealthCheckConfig withGracePeriodFailures(int gracePeriodFailures) {
        return new HealthCheckConfig(checkType, intervalSeconds, timeoutSeconds, gracePeriodFailures);
    }

    public HealthCheckConfig withIntervalSeconds(long intervalSeconds) {
        return new HealthCheckConfig(checkType, intervalSeconds, timeoutSeconds, gracePeriodFailures);
    }
}
