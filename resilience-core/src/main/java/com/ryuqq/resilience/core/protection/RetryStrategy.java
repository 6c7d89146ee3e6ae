package com.ryuqq.resilience.core.protection;

/**
 * 재시도 지연 증가 전략.
 *
 * <p>k는 0부터 시작하는 재시도 인덱스입니다 (첫 재시도 k=0).</p>
 * <ul>
 *   <li>EXPONENTIAL_BACKOFF: base × multiplier^k</li>
 *   <li>LINEAR: base × (k + 1)</li>
 *   <li>FIBONACCI: base × fib(k + 2) → base, 2×base, 3×base, 5×base, ...</li>
 *   <li>CONSTANT: base</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public enum RetryStrategy {
    EXPONENTIAL_BACKOFF,
    LINEAR,
    FIBONACCI,
    CONSTANT
}
