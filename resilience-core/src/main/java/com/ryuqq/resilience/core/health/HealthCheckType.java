package com.ryuqq.resilience.core.health;

/**
 * 헬스 체크 종류.
 *
 * <ul>
 *   <li>LIVENESS: 프로세스가 살아 있는지 (가볍고 빈번)</li>
 *   <li>READINESS: 트래픽을 받을 준비가 되었는지 (의존성 연결 확인)</li>
 *   <li>DEEP: 의존성까지 실제 왕복 확인 (무겁고 드묾)</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public enum HealthCheckType {
    LIVENESS,
    READINESS,
    DEEP
}
