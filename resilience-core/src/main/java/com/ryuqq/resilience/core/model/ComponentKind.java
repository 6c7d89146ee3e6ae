package com.ryuqq.resilience.core.model;

/**
 * Registry에 등록되는 보호 컴포넌트 종류.
 *
 * <p>Registry는 (DependencyName, ComponentKind) 쌍마다 인스턴스를 하나만 생성합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public enum ComponentKind {
    CIRCUIT_BREAKER,
    RETRY_MANAGER,
    BULKHEAD,
    TIMEOUT_POLICY,
    RATE_LIMITER,
    HEALTH_CHECKER
}
