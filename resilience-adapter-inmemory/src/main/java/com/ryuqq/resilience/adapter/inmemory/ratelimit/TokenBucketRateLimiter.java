package com.ryuqq.resilience.adapter.inmemory.ratelimit;

import com.ryuqq.resilience.core.protection.RateLimiter;
import com.ryuqq.resilience.core.protection.RateLimiterAlgorithm;
import com.ryuqq.resilience.core.protection.RateLimiterStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Token Bucket 레이트 리미터.
 *
 * <p>호출 시마다 {@code tokens += 경과초 × refillRate} (capacity 상한)로 지연 충전한 뒤,
 * 토큰이 1개 이상이면 하나를 소비하고 허용합니다. 가득 찬 상태에서 시작하므로
 * capacity만큼의 순간 burst를 허용합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class TokenBucketRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(TokenBucketRateLimiter.class);

    private final String name;
    private final int capacity;
    private final double refillRatePerSecond;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private double tokens;
    private long lastRefillMillis;
    private long allowedCount;
    private long deniedCount;

    /**
     * 생성자.
     *
     * @param name 리미터 이름
     * @param capacity 버킷 용량 (양수)
     * @param refillRatePerSecond 초당 충전 토큰 수 (양수)
     * @param clock 시간 소스
     */
    public TokenBucketRateLimiter(String name, int capacity, double refillRatePerSecond, Clock clock) {
        RateLimiterArguments.validate(name, capacity, clock);
        if (refillRatePerSecond <= 0) {
            throw new IllegalArgumentException(
                "refillRatePerSecond must be positive (current: " + refillRatePerSecond + ")"
            );
        }
        this.name = name;
        this.capacity = capacity;
        this.refillRatePerSecond = refillRatePerSecond;
        this.clock = clock;
        this.tokens = capacity;
        this.lastRefillMillis = clock.millis();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean allow() {
        lock.lock();
        try {
            refill();
            if (tokens >= 1.0) {
                tokens -= 1.0;
                allowedCount++;
                return true;
            }
            deniedCount++;
            log.debug("Token bucket '{}' denied (tokens: {})", name, tokens);
            return false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public RateLimiterStats getStats() {
        lock.lock();
        try {
            refill();
            return new RateLimiterStats(name, RateLimiterAlgorithm.TOKEN_BUCKET, allowedCount, deniedCount, tokens);
        } finally {
            lock.unlock();
        }
    }

    private void refill() {
        long now = clock.millis();
        long elapsedMillis = now - lastRefillMillis;
        if (elapsedMillis > 0) {
            tokens = Math.min(capacity, tokens + elapsedMillis / 1000.0 * refillRatePerSecond);
            lastRefillMillis = now;
        }
    }
}
