package com.ryuqq.resilience.core.exception;

import java.time.Instant;

/**
 * Circuit Breaker가 OPEN 상태여서 호출을 시도하지 않았음을 나타냅니다.
 *
 * <p>Breaker가 이미 대기 시간으로 백오프를 표현하므로 호출자가 즉시 재시도해서는 안 됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class CircuitOpenException extends ResilienceException {

    public static final String ERROR_CODE = "CB-OPEN";

    private final Instant retryAfter;

    public CircuitOpenException(String dependency, Instant retryAfter) {
        super(ERROR_CODE, dependency,
            "Circuit breaker '" + dependency + "' is OPEN (half-open probe allowed after " + retryAfter + ")");
        this.retryAfter = retryAfter;
    }

    /**
     * HALF_OPEN 전이가 가능해지는 시각.
     *
     * @return 재시도 가능 시각
     */
    public Instant getRetryAfter() {
        return retryAfter;
    }
}
