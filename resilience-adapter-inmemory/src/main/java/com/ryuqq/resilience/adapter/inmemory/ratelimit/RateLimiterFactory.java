package com.ryuqq.resilience.adapter.inmemory.ratelimit;

import com.ryuqq.resilience.core.protection.RateLimiter;
import com.ryuqq.resilience.core.protection.RateLimiterConfig;

import java.time.Clock;

/**
 * {@link RateLimiterConfig}로부터 알고리즘별 구현체를 생성.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class RateLimiterFactory {

    private RateLimiterFactory() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 레이트 리미터 생성.
     *
     * @param name 리미터 이름
     * @param config 설정
     * @param clock 시간 소스
     * @return 설정된 알고리즘의 구현체
     */
    public static RateLimiter create(String name, RateLimiterConfig config, Clock clock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        return switch (config.algorithm()) {
            case TOKEN_BUCKET -> new TokenBucketRateLimiter(name, config.capacity(), config.ratePerSecond(), clock);
            case SLIDING_WINDOW -> new SlidingWindowRateLimiter(name, config.capacity(), config.windowSeconds(), clock);
            case LEAKY_BUCKET -> new LeakyBucketRateLimiter(name, config.capacity(), config.ratePerSecond(), clock);
        };
    }
}
