package com.ryuqq.resilience.adapter.inmemory.ratelimit;

import com.ryuqq.resilience.core.protection.RateLimiter;
import com.ryuqq.resilience.core.protection.RateLimiterAlgorithm;
import com.ryuqq.resilience.core.protection.RateLimiterStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sliding Window Counter 레이트 리미터.
 *
 * <p>최근 windowSeconds 동안 허용된 호출 시각을 보관하고, 그 수가 limit 미만일 때만 허용합니다.
 * 고정 윈도우와 달리 경계 직전/직후에 limit의 두 배가 몰리는 문제가 없습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class SlidingWindowRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(SlidingWindowRateLimiter.class);

    private final String name;
    private final int limit;
    private final long windowMillis;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Long> admitted = new ArrayDeque<>();

    private long allowedCount;
    private long deniedCount;

    /**
     * 생성자.
     *
     * @param name 리미터 이름
     * @param limit 윈도우당 최대 허용 수 (양수)
     * @param windowSeconds 윈도우 길이 (초, 양수)
     * @param clock 시간 소스
     */
    public SlidingWindowRateLimiter(String name, int limit, long windowSeconds, Clock clock) {
        RateLimiterArguments.validate(name, limit, clock);
        if (windowSeconds <= 0) {
            throw new IllegalArgumentException("windowSeconds must be positive (current: " + windowSeconds + ")");
        }
        this.name = name;
        this.limit = limit;
        this.windowMillis = windowSeconds * 1000L;
        this.clock = clock;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public boolean allow() {
        lock.lock();
        try {
            long now = clock.millis();
            evictOlderThan(now - windowMillis);
            if (admitted.size() < limit) {
                admitted.addLast(now);
                allowedCount++;
                return true;
            }
            deniedCount++;
            log.debug("Sliding window '{}' denied ({} calls in last {}ms)", name, admitted.size(), windowMillis);
            return false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public RateLimiterStats getStats() {
        lock.lock();
        try {
            evictOlderThan(clock.millis() - windowMillis);
            return new RateLimiterStats(
                name, RateLimiterAlgorithm.SLIDING_WINDOW, allowedCount, deniedCount, limit - admitted.size()
            );
        } finally {
            lock.unlock();
        }
    }

    private void evictOlderThan(long boundary) {
        while (!admitted.isEmpty() && admitted.peekFirst() <= boundary) {
            admitted.pollFirst();
        }
    }
}
