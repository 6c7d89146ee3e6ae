package com.ryuqq.resilience.core.protection.noop;

import com.ryuqq.resilience.core.protection.RateLimiter;
import com.ryuqq.resilience.core.protection.RateLimiterAlgorithm;
import com.ryuqq.resilience.core.protection.RateLimiterStats;

/**
 * Rate Limiter NoOp 구현.
 *
 * <p>모든 요청을 항상 허용합니다. 허용 횟수만 집계합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class NoOpRateLimiter implements RateLimiter {

    private final String name;

    public NoOpRateLimiter(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean allow() {
        return true;
    }

    @Override
    public RateLimiterStats getStats() {
        return new RateLimiterStats(name, RateLimiterAlgorithm.TOKEN_BUCKET, 0, 0, Double.POSITIVE_INFINITY);
    }
}
