package com.ryuqq.resilience.core.protection.noop;

import com.ryuqq.resilience.core.model.DependencyName;
import com.ryuqq.resilience.core.model.PriorityLevel;
import com.ryuqq.resilience.core.protection.Bulkhead;
import com.ryuqq.resilience.core.protection.BulkheadConfig;
import com.ryuqq.resilience.core.protection.BulkheadStats;

import java.util.concurrent.Callable;

/**
 * Bulkhead NoOp 구현.
 *
 * <p>동시 실행 수를 제한하지 않으며, 작업을 호출 스레드에서 바로 실행합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>execute(): 작업을 그대로 실행 (우선순위 무시)</li>
 *   <li>getCurrentConcurrency() / getQueuedCalls(): 항상 0 반환</li>
 *   <li>getConfig(): Integer.MAX_VALUE 동시 실행, 대기열 없음</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class NoOpBulkhead implements Bulkhead {

    private static final BulkheadConfig UNLIMITED = new BulkheadConfig(Integer.MAX_VALUE, 0, 0, false);

    private final DependencyName name;

    public NoOpBulkhead(DependencyName name) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        this.name = name;
    }

    @Override
    public DependencyName getName() {
        return name;
    }

    @Override
    public <T> T execute(Callable<T> work, PriorityLevel priority) throws Exception {
        return work.call();
    }

    @Override
    public int getCurrentConcurrency() {
        return 0;
    }

    @Override
    public int getQueuedCalls() {
        return 0;
    }

    @Override
    public BulkheadConfig getConfig() {
        return UNLIMITED;
    }

    @Override
    public BulkheadStats getStats() {
        return BulkheadStats.of(name.getValue(), UNLIMITED, 0, 0, 0, 0, 0, 0, 0, 0);
    }
}
