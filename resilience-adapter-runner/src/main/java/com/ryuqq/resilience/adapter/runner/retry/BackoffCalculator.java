package com.ryuqq.resilience.adapter.runner.retry;

import com.ryuqq.resilience.core.protection.RetryConfig;
import com.ryuqq.resilience.core.protection.RetryStrategy;

import java.util.Random;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Backoff with Jitter 계산기.
 *
 * <p>재시도 간격을 전략에 따라 증가시키되, ±Jitter를 추가하여
 * 여러 호출자가 같은 일정으로 재시도하는 Thundering Herd Problem을 방지합니다.</p>
 *
 * <p><strong>알고리즘 (k = retryNumber - 1):</strong></p>
 * <pre>
 * raw    = EXPONENTIAL_BACKOFF: base * multiplier^k
 *          LINEAR:              base * (k + 1)
 *          FIBONACCI:           base * fib(k)   (fib(0) = fib(1) = 1)
 *          CONSTANT:            base
 * capped = min(raw, maxDelay)
 * delay  = clamp(capped + random(-capped * jitter, +capped * jitter), 0, maxDelay)
 * </pre>
 *
 * <p><strong>예시 (base=100ms, multiplier=2.0, jitter=0.5):</strong></p>
 * <ul>
 *   <li>retryNumber=1: 100ms → 50-150ms</li>
 *   <li>retryNumber=2: 200ms → 100-300ms</li>
 *   <li>retryNumber=3: 400ms → 200-600ms</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    private final RetryStrategy strategy;
    private final long baseDelayMs;
    private final long maxDelayMs;
    private final double multiplier;
    private final double jitterPercent;
    private final Random random;

    /**
     * RetryConfig로 생성 (ThreadLocalRandom 사용).
     *
     * @param config 재시도 설정
     */
    public BackoffCalculator(RetryConfig config) {
        this(config, null);
    }

    /**
     * 난수 생성기 주입 생성자.
     *
     * @param config 재시도 설정
     * @param random 난수 생성기 (null이면 ThreadLocalRandom)
     * @throws IllegalArgumentException config가 null인 경우
     */
    public BackoffCalculator(RetryConfig config, Random random) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.strategy = config.strategy();
        this.baseDelayMs = config.baseDelayMs();
        this.maxDelayMs = config.maxDelayMs();
        this.multiplier = config.multiplier();
        this.jitterPercent = config.jitterPercent();
        this.random = random;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param retryNumber 재시도 번호 (첫 재시도가 1)
     * @return 재시도 전 대기 시간 (밀리초, 0 이상 maxDelayMs 이하)
     * @throws IllegalArgumentException retryNumber가 양수가 아닌 경우
     */
    public long calculate(int retryNumber) {
        if (retryNumber <= 0) {
            throw new IllegalArgumentException(
                "retryNumber must be positive (current: " + retryNumber + ")"
            );
        }

        // 1. 전략별 기본 지연 (overflow 방지를 위해 double로 계산 후 maxDelay로 제한)
        double capped = Math.min(rawDelay(retryNumber - 1), maxDelayMs);

        // 2. ±Jitter
        double jitterAmount = capped * jitterPercent;
        double jittered = capped + (nextDouble() * 2.0 - 1.0) * jitterAmount;

        // 3. [0, maxDelay] 범위 제한
        return Math.round(Math.max(0.0, Math.min(jittered, maxDelayMs)));
    }

    /**
     * Jitter 적용 전 지연 시간 (maxDelay 제한 적용).
     *
     * @param retryNumber 재시도 번호 (첫 재시도가 1)
     * @return 지연 시간 (밀리초)
     */
    public long nominalDelay(int retryNumber) {
        if (retryNumber <= 0) {
            throw new IllegalArgumentException(
                "retryNumber must be positive (current: " + retryNumber + ")"
            );
        }
        return Math.round(Math.min(rawDelay(retryNumber - 1), maxDelayMs));
    }

    private double rawDelay(int k) {
        switch (strategy) {
            case LINEAR:
                return (double) baseDelayMs * (k + 1);
            case FIBONACCI:
                return (double) baseDelayMs * fibonacci(k);
            case CONSTANT:
                return baseDelayMs;
            case EXPONENTIAL_BACKOFF:
            default:
                return baseDelayMs * Math.pow(multiplier, k);
        }
    }

    private double fibonacci(int k) {
        double previous = 1;
        double current = 1;
        for (int i = 1; i < k; i++) {
            double next = previous + current;
            previous = current;
            current = next;
            if (baseDelayMs * current >= maxDelayMs) {
                break;
            }
        }
        return current;
    }

    private double nextDouble() {
        return random != null ? random.nextDouble() : ThreadLocalRandom.current().nextDouble();
    }

    public RetryStrategy getStrategy() {
        return strategy;
    }

    public long getBaseDelayMs() {
        return baseDelayMs;
    }

    public long getMaxDelayMs() {
        return maxDelayMs;
    }

    public double getJitterPercent() {
        return jitterPercent;
    }
}
