package com.ryuqq.resilience.core.protection;

/**
 * Rate Limiting 알고리즘.
 *
 * <ul>
 *   <li>TOKEN_BUCKET: 일정 속도로 토큰 충전, capacity까지 버스트 허용</li>
 *   <li>SLIDING_WINDOW: 최근 windowSeconds 동안 허용된 요청 수로 제한 (경계 버스트 없음)</li>
 *   <li>LEAKY_BUCKET: 일정 속도로 비워지는 수위로 제한, 평탄한 처리율</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public enum RateLimiterAlgorithm {
    TOKEN_BUCKET,
    SLIDING_WINDOW,
    LEAKY_BUCKET
}
