package com.ryuqq.resilience.core.health;

/**
 * 외부에 보고되는 헬스 상태.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public enum HealthStatus {

    /** 아직 한 번도 검사하지 않음. */
    UNKNOWN,

    HEALTHY,

    /** 연속 실패가 유예 횟수에 도달함. */
    UNHEALTHY
}
