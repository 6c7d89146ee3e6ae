package com.ryuqq.resilience.core.protection.noop;

import com.ryuqq.resilience.core.protection.TimeoutPolicy;
import com.ryuqq.resilience.core.protection.TimeoutStats;

/**
 * Timeout Policy NoOp 구현.
 *
 * <p>타임아웃을 적용하지 않으며 (항상 0 반환), 지연 기록을 무시합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class NoOpTimeoutPolicy implements TimeoutPolicy {

    private final String name;

    public NoOpTimeoutPolicy(String name) {
        this.name = name;
    }

    @Override
    public long getTimeoutMs() {
        return 0;
    }

    @Override
    public void recordLatency(long latencyMs) {
        // NoOp
    }

    @Override
    public void recordTimeout(long elapsedMs) {
        // NoOp
    }

    @Override
    public TimeoutStats getStats() {
        return new TimeoutStats(name, false, 0, 0, 0, 0, 0, 0, 0);
    }
}
