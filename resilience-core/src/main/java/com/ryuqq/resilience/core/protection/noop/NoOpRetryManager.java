package com.ryuqq.resilience.core.protection.noop;

import com.ryuqq.resilience.core.model.DependencyName;
import com.ryuqq.resilience.core.model.IdempotencyKey;
import com.ryuqq.resilience.core.protection.RetryBudgetStats;
import com.ryuqq.resilience.core.protection.RetryConfig;
import com.ryuqq.resilience.core.protection.RetryManager;
import com.ryuqq.resilience.core.protection.RetryStats;

import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Retry Manager NoOp 구현.
 *
 * <p>작업을 정확히 한 번 실행하며, 재시도와 멱등성 캐시를 사용하지 않습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class NoOpRetryManager implements RetryManager {

    private static final RetryConfig SINGLE_ATTEMPT = new RetryConfig().withMaxRetries(0);

    private final DependencyName name;

    public NoOpRetryManager(DependencyName name) {
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
    public <T> T executeWithRetry(Callable<T> work) throws Exception {
        return work.call();
    }

    @Override
    public <T> T executeWithRetry(Callable<T> work, IdempotencyKey idempotencyKey) throws Exception {
        return work.call();
    }

    @Override
    public <T> T executeWithRetry(Callable<T> work, IdempotencyKey idempotencyKey, Set<Integer> retryOnStatus) throws Exception {
        return work.call();
    }

    @Override
    public RetryConfig getConfig() {
        return SINGLE_ATTEMPT;
    }

    @Override
    public RetryStats getStats() {
        RetryBudgetStats budget = new RetryBudgetStats(0, 0, 0.0, SINGLE_ATTEMPT.retryBudgetPercent(), true);
        return new RetryStats(name.getValue(), 0, 0, 0, 0, 0, budget, List.of());
    }
}
