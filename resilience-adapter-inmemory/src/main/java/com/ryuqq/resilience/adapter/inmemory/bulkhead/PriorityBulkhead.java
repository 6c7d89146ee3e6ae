package com.ryuqq.resilience.adapter.inmemory.bulkhead;

import com.ryuqq.resilience.core.exception.BulkheadFullException;
import com.ryuqq.resilience.core.exception.BulkheadTimeoutException;
import com.ryuqq.resilience.core.model.DependencyName;
import com.ryuqq.resilience.core.model.PriorityLevel;
import com.ryuqq.resilience.core.protection.Bulkhead;
import com.ryuqq.resilience.core.protection.BulkheadConfig;
import com.ryuqq.resilience.core.protection.BulkheadStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.PriorityQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 우선순위 대기열을 가진 Bulkhead.
 *
 * <p><strong>입장 알고리즘:</strong></p>
 * <pre>
 * 1. 빈 permit이 있고 대기자가 없으면 즉시 실행
 * 2. 대기열에 자리가 있으면 대기 (priorityEnabled면 우선순위 → 도착순, 아니면 도착순)
 * 3. 대기열도 가득 차면 BulkheadFullException (작업 실행 안 함)
 * 4. timeoutMs 안에 permit을 받지 못하면 BulkheadTimeoutException + 대기열에서 제거
 * </pre>
 *
 * <p>permit 반환 시 대기열 맨 앞의 대기자에게 permit을 직접 넘깁니다. 새로 도착한 호출이
 * 대기 중인 호출을 앞지르지 못하므로 우선순위와 도착 순서가 지켜집니다.</p>
 *
 * <p>대기자마다 별도 {@link Condition}을 사용하므로 permit 하나당 정확히 한 스레드만 깨어납니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class PriorityBulkhead implements Bulkhead {

    private static final Logger log = LoggerFactory.getLogger(PriorityBulkhead.class);

    private final DependencyName name;
    private final BulkheadConfig config;
    private final ReentrantLock lock = new ReentrantLock();
    private final PriorityQueue<Waiter> waiters;

    private int availablePermits;
    private int activeCalls;
    private int peakActiveCalls;
    private long sequence;

    private long totalCalls;
    private long successfulCalls;
    private long failedCalls;
    private long rejectedCalls;
    private long timedOutCalls;

    /**
     * 생성자.
     *
     * @param name 의존성 이름
     * @param config 설정
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public PriorityBulkhead(DependencyName name, BulkheadConfig config) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.name = name;
        this.config = config;
        this.availablePermits = config.maxConcurrentCalls();

        Comparator<Waiter> order = config.priorityEnabled()
            ? Comparator.comparingInt((Waiter w) -> -w.weight).thenComparingLong(w -> w.sequence)
            : Comparator.comparingLong((Waiter w) -> w.sequence);
        this.waiters = new PriorityQueue<>(order);
    }

    @Override
    public DependencyName getName() {
        return name;
    }

    /**
     * {@inheritDoc}
     *
     * @throws BulkheadFullException permit과 대기열이 모두 찬 경우
     * @throws BulkheadTimeoutException 대기 시간이 timeoutMs를 넘은 경우
     * @throws InterruptedException 대기 중 인터럽트된 경우 (인터럽트 플래그 복원)
     */
    @Override
    public <T> T execute(Callable<T> work, PriorityLevel priority) throws Exception {
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        acquire(priority == null ? PriorityLevel.NORMAL : priority);
        boolean succeeded = false;
        try {
            T result = work.call();
            succeeded = true;
            return result;
        } finally {
            release(succeeded);
        }
    }

    private void acquire(PriorityLevel priority) throws InterruptedException {
        lock.lock();
        try {
            totalCalls++;
            if (availablePermits > 0 && waiters.isEmpty()) {
                availablePermits--;
                activeCalls++;
                peakActiveCalls = Math.max(peakActiveCalls, activeCalls);
                return;
            }
            if (waiters.size() >= config.maxQueueSize()) {
                rejectedCalls++;
                log.warn("Bulkhead '{}' full (active: {}, queued: {}), rejecting {} call",
                    name, activeCalls, waiters.size(), priority);
                throw new BulkheadFullException(name.getValue(), config.maxConcurrentCalls(), config.maxQueueSize());
            }
            awaitPermit(new Waiter(priority.weight(), sequence++, lock.newCondition()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * 대기열에 들어가 permit을 기다림 (락 보유 상태에서 호출).
     */
    private void awaitPermit(Waiter waiter) throws InterruptedException {
        waiters.add(waiter);
        long remaining = TimeUnit.MILLISECONDS.toNanos(config.timeoutMs());
        try {
            while (!waiter.granted) {
                if (remaining <= 0L) {
                    waiters.remove(waiter);
                    timedOutCalls++;
                    log.warn("Bulkhead '{}' queue wait timed out after {}ms", name, config.timeoutMs());
                    throw new BulkheadTimeoutException(name.getValue(), config.timeoutMs());
                }
                remaining = waiter.condition.awaitNanos(remaining);
            }
        } catch (InterruptedException e) {
            if (waiter.granted) {
                // 인터럽트와 permit 인계가 겹친 경우 받은 permit을 다음 대기자에게 넘긴다
                handOffOrFree();
            } else {
                waiters.remove(waiter);
            }
            Thread.currentThread().interrupt();
            throw e;
        }
    }

    private void release(boolean succeeded) {
        lock.lock();
        try {
            if (succeeded) {
                successfulCalls++;
            } else {
                failedCalls++;
            }
            handOffOrFree();
        } finally {
            lock.unlock();
        }
    }

    /**
     * 대기자가 있으면 permit을 넘기고, 없으면 반환 (락 보유 상태에서 호출).
     */
    private void handOffOrFree() {
        Waiter next = waiters.poll();
        if (next != null) {
            next.granted = true;
            next.condition.signal();
            return;
        }
        activeCalls--;
        availablePermits++;
    }

    @Override
    public int getCurrentConcurrency() {
        lock.lock();
        try {
            return activeCalls;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public int getQueuedCalls() {
        lock.lock();
        try {
            return waiters.size();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public BulkheadConfig getConfig() {
        return config;
    }

    @Override
    public BulkheadStats getStats() {
        lock.lock();
        try {
            return BulkheadStats.of(
                name.getValue(),
                config,
                activeCalls,
                waiters.size(),
                peakActiveCalls,
                totalCalls,
                successfulCalls,
                failedCalls,
                rejectedCalls,
                timedOutCalls
            );
        } finally {
            lock.unlock();
        }
    }

    private static final class Waiter {
        private final int weight;
        private final long sequence;
        private final Condition condition;
        private boolean granted;

        private Waiter(int weight, long sequence, Condition condition) {
            this.weight = weight;
            this.sequence = sequence;
            this.condition = condition;
        }
    }
}
