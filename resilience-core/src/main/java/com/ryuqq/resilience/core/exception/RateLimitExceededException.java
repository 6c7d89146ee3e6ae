package com.ryuqq.resilience.core.exception;

/**
 * Rate Limiter가 요청 진입을 거부했음을 나타냅니다.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class RateLimitExceededException extends ResilienceException {

    public static final String ERROR_CODE = "RATE-LIMIT";

    public RateLimitExceededException(String limiter) {
        super(ERROR_CODE, limiter, "Rate limit exceeded for '" + limiter + "'");
    }
}
