package com.ryuqq.resilience.adapter.runner.retry;

import com.ryuqq.resilience.core.protection.RetryBudgetStats;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 슬라이딩 윈도우 재시도 예산.
 *
 * <p>1초 단위 버킷에 호출 수와 재시도 수를 누적하고, 윈도우 밖 버킷은 조회 시 제거합니다.
 * 재시도를 허용하면 {@code retries / calls}가 상한을 넘는 경우 거부합니다.</p>
 *
 * <p>윈도우 내 호출 수가 {@code minCallsBeforeEnforcement} 미만이면 상한을 적용하지 않습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class RetryBudget {

    private final double budgetPercent;
    private final long windowSeconds;
    private final int minCallsBeforeEnforcement;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<Bucket> buckets = new ArrayDeque<>();

    public RetryBudget(double budgetPercent, long windowSeconds, int minCallsBeforeEnforcement, Clock clock) {
        if (budgetPercent < 0.0 || budgetPercent > 100.0) {
            throw new IllegalArgumentException(
                "budgetPercent must be between 0.0 and 100.0 (current: " + budgetPercent + ")"
            );
        }
        if (windowSeconds <= 0) {
            throw new IllegalArgumentException(
                "windowSeconds must be positive (current: " + windowSeconds + ")"
            );
        }
        if (minCallsBeforeEnforcement < 0) {
            throw new IllegalArgumentException(
                "minCallsBeforeEnforcement cannot be negative (current: " + minCallsBeforeEnforcement + ")"
            );
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.budgetPercent = budgetPercent;
        this.windowSeconds = windowSeconds;
        this.minCallsBeforeEnforcement = minCallsBeforeEnforcement;
        this.clock = clock;
    }

    /**
     * 호출 1건 기록.
     */
    public void recordCall() {
        lock.lock();
        try {
            currentBucket().calls++;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 재시도 1건 허용 여부 판단 후, 허용 시 기록.
     *
     * @return 허용되면 true
     */
    public boolean tryAcquireRetry() {
        lock.lock();
        try {
            Bucket bucket = currentBucket();
            long calls = 0;
            long retries = 0;
            for (Bucket b : buckets) {
                calls += b.calls;
                retries += b.retries;
            }
            if (calls >= minCallsBeforeEnforcement) {
                if (calls == 0 || (retries + 1) * 100.0 / calls > budgetPercent) {
                    return false;
                }
            }
            bucket.retries++;
            return true;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 현재 윈도우 스냅샷.
     *
     * @return 통계
     */
    public RetryBudgetStats snapshot() {
        lock.lock();
        try {
            evict(clock.millis() / 1000);
            long calls = 0;
            long retries = 0;
            for (Bucket b : buckets) {
                calls += b.calls;
                retries += b.retries;
            }
            double rate = calls > 0 ? retries * 100.0 / calls : 0.0;
            return new RetryBudgetStats(calls, retries, rate, budgetPercent, rate <= budgetPercent);
        } finally {
            lock.unlock();
        }
    }

    private Bucket currentBucket() {
        long second = clock.millis() / 1000;
        evict(second);
        Bucket last = buckets.peekLast();
        if (last == null || last.second != second) {
            last = new Bucket(second);
            buckets.addLast(last);
        }
        return last;
    }

    private void evict(long nowSecond) {
        while (!buckets.isEmpty() && buckets.peekFirst().second <= nowSecond - windowSeconds) {
            buckets.pollFirst();
        }
    }

    private static final class Bucket {

        private final long second;
        private long calls;
        private long retries;

        private Bucket(long second) {
            this.second = second;
        }
    }
}
