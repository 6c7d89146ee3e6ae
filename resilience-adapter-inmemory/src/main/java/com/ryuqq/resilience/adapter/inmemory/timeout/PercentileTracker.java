package com.ryuqq.resilience.adapter.inmemory.timeout;

import java.util.Arrays;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 최근 N개 지연 시간 샘플의 링 버퍼.
 *
 * <p>백분위수는 조회 시점에 정렬된 복사본에서 nearest-rank 방식으로 계산합니다
 * ({@code rank = ceil(p/100 × n)}). 버퍼가 가득 차면 가장 오래된 샘플을 덮어씁니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class PercentileTracker {

    private final long[] samples;
    private final ReentrantLock lock = new ReentrantLock();
    private int next;
    private int count;

    /**
     * 생성자.
     *
     * @param windowSize 보관할 샘플 수 (양수)
     */
    public PercentileTracker(int windowSize) {
        if (windowSize <= 0) {
            throw new IllegalArgumentException("windowSize must be positive (current: " + windowSize + ")");
        }
        this.samples = new long[windowSize];
    }

    /**
     * 샘플 기록. 음수는 0으로 기록합니다.
     *
     * @param latencyMs 지연 시간 (밀리초)
     */
    public void record(long latencyMs) {
        lock.lock();
        try {
            samples[next] = Math.max(0L, latencyMs);
            next = (next + 1) % samples.length;
            if (count < samples.length) {
                count++;
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * 현재 샘플 수.
     *
     * @return 샘플 수 (windowSize 이하)
     */
    public int size() {
        lock.lock();
        try {
            return count;
        } finally {
            lock.unlock();
        }
    }

    /**
     * 단일 백분위수.
     *
     * @param percentile 0 초과 100 이하
     * @return 백분위 값 (샘플이 없으면 0)
     */
    public long percentile(double percentile) {
        return snapshot().valueAt(percentile);
    }

    /**
     * 현재 샘플의 정렬된 스냅샷.
     *
     * @return 스냅샷
     */
    public Snapshot snapshot() {
        long[] copy;
        lock.lock();
        try {
            copy = Arrays.copyOf(samples, count);
        } finally {
            lock.unlock();
        }
        Arrays.sort(copy);
        return new Snapshot(copy);
    }

    /**
     * 정렬된 샘플 스냅샷.
     */
    public static final class Snapshot {

        private final long[] sorted;

        private Snapshot(long[] sorted) {
            this.sorted = sorted;
        }

        public int size() {
            return sorted.length;
        }

        /**
         * nearest-rank 백분위 값.
         *
         * @param percentile 0 초과 100 이하
         * @return 백분위 값 (샘플이 없으면 0)
         */
        public long valueAt(double percentile) {
            if (percentile <= 0.0 || percentile > 100.0) {
                throw new IllegalArgumentException(
                    "percentile must be in (0, 100] (current: " + percentile + ")"
                );
            }
            if (sorted.length == 0) {
                return 0L;
            }
            int rank = (int) Math.ceil(percentile / 100.0 * sorted.length);
            return sorted[Math.max(0, rank - 1)];
        }
    }
}
