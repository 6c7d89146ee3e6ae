package com.ryuqq.resilience.core.protection;

/**
 * Rate Limiter 통계 스냅샷.
 *
 * @param name 리미터 이름
 * @param algorithm 알고리즘
 * @param allowedCount 허용된 요청 수
 * @param deniedCount 거부된 요청 수
 * @param available 현재 여유량 (남은 토큰, 윈도우 잔여 슬롯, 또는 capacity - 수위)
 * @author Resilience Team
 * @since 1.0.0
 */
public record RateLimiterStats(
    String name,
    RateLimiterAlgorithm algorithm,
    long allowedCount,
    long deniedCount,
    double available
) {
}
