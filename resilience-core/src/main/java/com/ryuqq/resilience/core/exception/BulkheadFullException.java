package com.ryuqq.resilience.core.exception;

/**
 * 동시 실행 슬롯과 대기열이 모두 가득 차 호출을 시도하지 않았음을 나타냅니다.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class BulkheadFullException extends ResilienceException {

    public static final String ERROR_CODE = "BULKHEAD-FULL";

    public BulkheadFullException(String dependency, int maxConcurrentCalls, int maxQueueSize) {
        super(ERROR_CODE, dependency,
            String.format("Bulkhead '%s' is full (maxConcurrentCalls: %d, maxQueueSize: %d)",
                dependency, maxConcurrentCalls, maxQueueSize));
    }
}
