package com.ryuqq.resilience.application.executor;

import com.ryuqq.resilience.core.model.IdempotencyKey;
import com.ryuqq.resilience.core.model.PriorityLevel;
import com.ryuqq.resilience.core.protection.BulkheadConfig;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.RetryConfig;
import com.ryuqq.resilience.core.protection.TimeoutConfig;

/**
 * 보호 호출 옵션.
 *
 * <p>각 설정은 해당 의존성의 컴포넌트를 최초 생성할 때만 사용됩니다.
 * 설정이 null이면 그 계층은 적용하지 않습니다(NoOp).</p>
 *
 * <ul>
 *   <li>{@link #defaults()}: 모든 계층을 기본 설정으로 적용</li>
 *   <li>{@link #none()}: 모든 계층 미적용, 작업만 실행</li>
 * </ul>
 *
 * @param circuitBreaker Circuit Breaker 설정 (nullable)
 * @param retry Retry 설정 (nullable)
 * @param bulkhead Bulkhead 설정 (nullable)
 * @param timeout 시도별 타임아웃 설정 (nullable)
 * @param idempotencyKey 멱등성 키 (nullable)
 * @param priority Bulkhead 대기 우선순위 (null이면 NORMAL)
 * @author Resilience Team
 * @since 1.0.0
 */
public record CallOptions(
    CircuitBreakerConfig circuitBreaker,
    RetryConfig retry,
    BulkheadConfig bulkhead,
    TimeoutConfig timeout,
    IdempotencyKey idempotencyKey,
    PriorityLevel priority
) {

    public CallOptions {
        if (priority == null) {
            priority = PriorityLevel.NORMAL;
        }
    }

    public static CallOptions defaults() {
        return new CallOptions(
            new CircuitBreakerConfig(),
            new RetryConfig(),
            new BulkheadConfig(),
            new TimeoutConfig(),
            null,
            PriorityLevel.NORMAL
        );
    }

    public static CallOptions none() {
        return new CallOptions(null, null, null, null, null, PriorityLevel.NORMAL);
    }

    public CallOptions withCircuitBreaker(CircuitBreakerConfig circuitBreaker) {
        return new CallOptions(circuitBreaker, retry, bulkhead, timeout, idempotencyKey, priority);
    }

    public CallOptions withRetry(RetryConfig retry) {
        return new CallOptions(circuitBreaker, retry, bulkhead, timeout, idempotencyKey, priority);
    }

    public CallOptions withBulkhead(BulkheadConfig bulkhead) {
        return new CallOptions(circuitBreaker, retry, bulkhead, timeout, idempotencyKey, priority);
    }

    public CallOptions withTimeout(TimeoutConfig timeout) {
        return new CallOptions(circuitBreaker, retry, bulkhead, timeout, idempotencyKey, priority);
    }

    public CallOptions withIdempotencyKey(IdempotencyKey idempotencyKey) {
        return new CallOptions(circuitBreaker, retry, bulkhead, timeout, idempotencyKey, priority);
    }

    public CallOptions withPriority(PriorityLevel priority) {
        return new CallOptions(circuitBreaker, retry, bulkhead, timeout, idempotencyKey, priority);
    }
}
