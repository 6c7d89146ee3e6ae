package com.ryuqq.resilience.core.protection;

import java.util.Set;

/**
 * 재시도 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxRetries: 최초 시도 이후 최대 재시도 횟수 (기본 3)</li>
 *   <li>baseDelayMs / maxDelayMs: 백오프 기준값과 상한 (기본 100ms / 60000ms)</li>
 *   <li>multiplier: 지수 백오프 배수 (기본 2.0)</li>
 *   <li>jitterPercent: ±무작위화 비율 (기본 0.5 = ±50%)</li>
 *   <li>retryBudgetPercent: 윈도우 내 전체 호출 대비 재시도 비율 상한 (기본 10.0%)</li>
 *   <li>budgetWindowSeconds: 재시도 예산 슬라이딩 윈도우 (기본 60초)</li>
 *   <li>minCallsBeforeEnforcement: 예산을 적용하기 시작하는 윈도우 내 최소 호출 수 (기본 0 = 항상 적용)</li>
 *   <li>strategy: 지연 증가 전략 (기본 EXPONENTIAL_BACKOFF)</li>
 *   <li>idempotencyTtlSeconds: 멱등성 결과 보관 시간 (기본 3600초)</li>
 *   <li>retryOnStatus: 재시도 대상 상태 코드 (기본 429, 500, 502, 503, 504)</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public record RetryConfig(
    int maxRetries,
    long baseDelayMs,
    long maxDelayMs,
    double multiplier,
    double jitterPercent,
    double retryBudgetPercent,
    long budgetWindowSeconds,
    int minCallsBeforeEnforcement,
    RetryStrategy strategy,
    long idempotencyTtlSeconds,
    Set<Integer> retryOnStatus
) {

    public static final Set<Integer> DEFAULT_RETRY_ON_STATUS = Set.of(429, 500, 502, 503, 504);

    public static final long DEFAULT_IDEMPOTENCY_TTL_SECONDS = 3600;

    /**
     * 기본 설정 생성자.
     */
    public RetryConfig() {
        this(3, 100, 60000, 2.0, 0.5, 10.0, 60, 0, RetryStrategy.EXPONENTIAL_BACKOFF,
            DEFAULT_IDEMPOTENCY_TTL_SECONDS, DEFAULT_RETRY_ON_STATUS);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryConfig {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries cannot be negative (current: " + maxRetries + ")");
        }
        if (baseDelayMs < 0) {
            throw new IllegalArgumentException("baseDelayMs cannot be negative (current: " + baseDelayMs + ")");
        }
        if (maxDelayMs < baseDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= baseDelayMs (base: " + baseDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0 (current: " + multiplier + ")");
        }
        if (jitterPercent < 0.0 || jitterPercent > 1.0) {
            throw new IllegalArgumentException(
                "jitterPercent must be between 0.0 and 1.0 (current: " + jitterPercent + ")"
            );
        }
        if (retryBudgetPercent < 0.0 || retryBudgetPercent > 100.0) {
            throw new IllegalArgumentException(
                "retryBudgetPercent must be between 0.0 and 100.0 (current: " + retryBudgetPercent + ")"
            );
        }
        if (budgetWindowSeconds <= 0) {
            throw new IllegalArgumentException(
                "budgetWindowSeconds must be positive (current: " + budgetWindowSeconds + ")"
            );
        }
        if (minCallsBeforeEnforcement < 0) {
            throw new IllegalArgumentException(
                "minCallsBeforeEnforcement cannot be negative (current: " + minCallsBeforeEnforcement + ")"
            );
        }
        if (strategy == null) {
            throw new IllegalArgumentException("strategy cannot be null");
        }
        if (idempotencyTtlSeconds <= 0) {
            throw new IllegalArgumentException(
                "idempotencyTtlSeconds must be positive (current: " + idempotencyTtlSeconds + ")"
            );
        }
        retryOnStatus = retryOnStatus == null ? DEFAULT_RETRY_ON_STATUS : Set.copyOf(retryOnStatus);
    }

    public RetryConfig withMaxRetries(int maxRetries) {
        return new RetryConfig(maxRetries, baseDelayMs, maxDelayMs, multiplier, jitterPercent, retryBudgetPercent,
            budgetWindowSeconds, minCallsBeforeEnforcement, strategy, idempotencyTtlSeconds, retryOnStatus);
    }

    public RetryConfig withDelays(long baseDelayMs, long maxDelayMs) {
        return new RetryConfig(maxRetries, baseDelayMs, maxDelayMs, multiplier, jitterPercent, retryBudgetPercent,
            budgetWindowSeconds, minCallsBeforeEnforcement, strategy, idempotencyTtlSeconds, retryOnStatus);
    }

    public RetryConfig withMultiplier(double multiplier) {
        return new RetryConfig(maxRetries, baseDelayMs, maxDelayMs, multiplier, jitterPercent, retryBudgetPercent,
            budgetWindowSeconds, minCallsBeforeEnforcement, strategy, idempotencyTtlSeconds, retryOnStatus);
    }

    public RetryConfig withJitterPercent(double jitterPercent) {
        return new RetryConfig(maxRetries, baseDelayMs, maxDelayMs, multiplier, jitterPercent, retryBudgetPercent,
            budgetWindowSeconds, minCallsBeforeEnforcement, strategy, idempotencyTtlSeconds, retryOnStatus);
    }

    public RetryConfig withRetryBudgetPercent(double retryBudgetPercent) {
        return new RetryConfig(maxRetries, baseDelayMs, maxDelayMs, multiplier, jitterPercent, retryBudgetPercent,
            budgetWindowSeconds, minCallsBeforeEnforcement, strategy, idempotencyTtlSeconds, retryOnStatus);
    }

    public RetryConfig withMinCallsBeforeEnforcement(int minCallsBeforeEnforcement) {
        return new RetryConfig(maxRetries, baseDelayMs, maxDelayMs, multiplier, jitterPercent, retryBudgetPercent,
            budgetWindowSeconds, minCallsBeforeEnforcement, strategy, idempotencyTtlSeconds, retryOnStatus);
    }

    public RetryConfig withStrategy(RetryStrategy strategy) {
        return new RetryConfig(maxRetries, baseDelayMs, maxDelayMs, multiplier, jitterPercent, retryBudgetPercent,
            budgetWindowSeconds, minCallsBeforeEnforcement, strategy, idempotencyTtlSeconds, retryOnStatus);
    }

    public RetryConfig withIdempotencyTtlSeconds(long idempotencyTtlSeconds) {
        return new RetryConfig(maxRetries, baseDelayMs, maxDelayMs, multiplier, jitterPercent, retryBudgetPercent,
            budgetWindowSeconds, minCallsBeforeEnforcement, strategy, idempotencyTtlSeconds, retryOnStatus);
    }

    public RetryConfig withRetryOnStatus(Set<Integer> retryOnStatus) {
        return new RetryConfig(maxRetries, baseDelayMs, maxDelayMs, multiplier, jitterPercent, retryBudgetPercent,
            budgetWindowSeconds, minCallsBeforeEnforcement, strategy, idempotencyTtlSeconds, retryOnStatus);
    }
}
