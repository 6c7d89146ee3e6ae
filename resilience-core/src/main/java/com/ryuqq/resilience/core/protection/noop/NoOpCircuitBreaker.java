package com.ryuqq.resilience.core.protection.noop;

import com.ryuqq.resilience.core.model.DependencyName;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.protection.CircuitBreakerStats;

import java.util.concurrent.Callable;

/**
 * Circuit Breaker NoOp 구현.
 *
 * <p>모든 요청을 항상 허용하며, 상태 추적을 하지 않습니다.
 * 호출 옵션에 Circuit Breaker 설정이 없을 때 사용됩니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>call(): 작업을 그대로 실행</li>
 *   <li>tryAcquire(): 항상 true 반환</li>
 *   <li>recordSuccess() / recordFailure(): 아무 동작 안 함</li>
 *   <li>getState(): 항상 CLOSED 반환</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class NoOpCircuitBreaker implements CircuitBreaker {

    private final DependencyName name;

    public NoOpCircuitBreaker(DependencyName name) {
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
    public <T> T call(Callable<T> work) throws Exception {
        return work.call();
    }

    @Override
    public boolean tryAcquire() {
        return true;
    }

    @Override
    public void recordSuccess() {
        // NoOp
    }

    @Override
    public void recordFailure(Throwable throwable) {
        // NoOp
    }

    @Override
    public CircuitBreakerState getState() {
        return CircuitBreakerState.CLOSED;
    }

    @Override
    public CircuitBreakerStats getStats() {
        return new CircuitBreakerStats(name.getValue(), CircuitBreakerState.CLOSED, 0, 0, null, null, 0, 0, 0, 0);
    }

    @Override
    public void reset() {
        // NoOp
    }
}
