package com.ryuqq.resilience.adapter.inmemory.ratelimit;

import com.ryuqq.resilience.core.protection.RateLimiter;
import com.ryuqq.resilience.core.protection.RateLimiterAlgorithm;
import com.ryuqq.resilience.core.protection.RateLimiterStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Leaky Bucket 레이트 리미터.
 *
 * <p>버킷 수위(level)는 호출 시마다 {@code 경과초 × leakRate}만큼 줄어들고(0 하한),
 * 수위가 capacity 미만이면 허용 후 1 증가합니다. 출력 속도가 leakRate로 평탄화됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class LeakyBucketRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(LeakyBucketRateLimiter.class);

    private final String name;
    private final int capacity;
    private final double leakRatePerSecond;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private double level;
    private long lastLeakMillis;
    private long allowedCount;
    private long deniedCount;

    /**
     * 생성자.
     *
     * @param name 리미터 이름
     * @param capacity 버킷 용량 (양수)
     * @param leakRatePerSecond 초당 배출량 (양수)
     * @param clock 시간 소스
     */
    public LeakyBucketRateLimiter(String name, int capacity, double leakRatePerSecond, Clock clock) {
        RateLimiterArguments.validate(name, capacity, clock);
        if (leakRatePerSecond <= 0) {
            throw new IllegalArgumentException(
                "leakRatePerSecond must be positive (current: " + leakRatePerSecond + ")"
            );
        }
        this.name = name;
        this.capacity = capacity;
        this.leakRatePerSecond = leakRatePerSecond;
        this.clock = clock;
        this.lastLeakMillis = clock.millis();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean allow() {
        lock.lock();
        try {
            leak();
            if (level < capacity) {
                level += 1.0;
                allowedCount++;
                return true;
            }
            deniedCount++;
            log.debug("Leaky bucket '{}' denied (level: {})", name, level);
            return false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public RateLimiterStats getStats() {
        lock.lock();
        try {
            leak();
            return new RateLimiterStats(
                name, RateLimiterAlgorithm.LEAKY_BUCKET, allowedCount, deniedCount, capacity - level
            );
        } finally {
            lock.unlock();
        }
    }

    private void leak() {
        long now = clock.millis();
        long elapsedMillis = now - lastLeakMillis;
        if (elapsedMillis > 0) {
            level = Math.max(0.0, level - elapsedMillis / 1000.0 * leakRatePerSecond);
            lastLeakMillis = now;
        }
    }
}
