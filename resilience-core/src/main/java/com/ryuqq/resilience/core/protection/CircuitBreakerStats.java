package com.ryuqq.resilience.core.protection;

import java.time.Instant;

/**
 * Circuit Breaker 통계 스냅샷.
 *
 * <p>보호 대상 호출 없이 조회할 수 있으며, 외부 메트릭 수집기가 폴링합니다.</p>
 *
 * @param name 의존성 이름
 * @param state 현재 상태
 * @param failureCount 현재 연속 실패 수 (CLOSED)
 * @param successCount 현재 연속 성공 수 (HALF_OPEN)
 * @param lastFailureTime 마지막 실패 시각 (없으면 null)
 * @param openedAt 마지막 OPEN 전이 시각 (없으면 null)
 * @param totalCalls 통과 허용된 전체 호출 수
 * @param successfulCalls 성공 호출 수
 * @param failedCalls 실패로 집계된 호출 수
 * @param rejectedCalls OPEN 상태로 거부된 호출 수
 * @author Resilience Team
 * @since 1.0.0
 */
public record CircuitBreakerStats(
    String name,
    CircuitBreakerState state,
    int failureCount,
    int successCount,
    Instant lastFailureTime,
    Instant openedAt,
    long totalCalls,
    long successfulCalls,
    long failedCalls,
    long rejectedCalls
) {
}
