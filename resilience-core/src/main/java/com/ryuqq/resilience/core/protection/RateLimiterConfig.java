package com.ryuqq.resilience.core.protection;

/**
 * Rate Limiter 설정.
 *
 * <p>알고리즘별 의미:</p>
 * <ul>
 *   <li>TOKEN_BUCKET: capacity = 버킷 크기, ratePerSecond = 초당 충전 토큰 수</li>
 *   <li>SLIDING_WINDOW: capacity = 윈도우당 허용 수(limit), windowSeconds = 윈도우 길이</li>
 *   <li>LEAKY_BUCKET: capacity = 최대 수위, ratePerSecond = 초당 누수량</li>
 * </ul>
 *
 * @param algorithm 알고리즘
 * @param capacity 버킷 크기 또는 윈도우당 허용 수 (양수)
 * @param ratePerSecond 충전/누수 속도 (TOKEN_BUCKET, LEAKY_BUCKET에서 양수)
 * @param windowSeconds 윈도우 길이 (SLIDING_WINDOW에서 양수)
 * @author Resilience Team
 * @since 1.0.0
 */
public record RateLimiterConfig(
    RateLimiterAlgorithm algorithm,
    int capacity,
    double ratePerSecond,
    long windowSeconds
) {

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException 알고리즘에 필요한 값이 유효하지 않은 경우
     */
    public RateLimiterConfig {
        if (algorithm == null) {
            throw new IllegalArgumentException("algorithm cannot be null");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive (current: " + capacity + ")");
        }
        if (algorithm == RateLimiterAlgorithm.SLIDING_WINDOW) {
            if (windowSeconds <= 0) {
                throw new IllegalArgumentException("windowSeconds must be positive (current: " + windowSeconds + ")");
            }
        } else if (ratePerSecond <= 0) {
            throw new IllegalArgumentException("ratePerSecond must be positive (current: " + ratePerSecond + ")");
        }
    }

    /**
     * Token Bucket 설정.
     *
     * @param capacity 버킷 크기
     * @param refillRate 초당 충전 토큰 수
     * @return 설정
     */
    public static RateLimiterConfig tokenBucket(int capacity, double refillRate) {
        return new RateLimiterConfig(RateLimiterAlgorithm.TOKEN_BUCKET, capacity, refillRate, 0);
    }

    /**
     * Sliding Window 설정.
     *
     * @param limit 윈도우당 허용 수
     * @param windowSeconds 윈도우 길이 (초)
     * @return 설정
     */
    public static RateLimiterConfig slidingWindow(int limit, long windowSeconds) {
        return new RateLimiterConfig(RateLimiterAlgorithm.SLIDING_WINDOW, limit, 0, windowSeconds);
    }

    /**
     * Leaky Bucket 설정.
     *
     * @param capacity 최대 수위
     * @param leakRate 초당 누수량
     * @return 설정
     */
    public static RateLimiterConfig leakyBucket(int capacity, double leakRate) {
        return new RateLimiterConfig(RateLimiterAlgorithm.LEAKY_BUCKET, capacity, leakRate, 0);
    }
}
