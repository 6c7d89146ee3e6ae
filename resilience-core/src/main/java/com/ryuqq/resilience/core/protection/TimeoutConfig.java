package com.ryuqq.resilience.core.protection;

/**
 * 타임아웃 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>adaptiveEnabled: P95 기반 적응형 타임아웃 사용 여부 (기본 true)</li>
 *   <li>defaultTimeoutMs: 정적 타임아웃, 샘플 부족 시에도 사용 (기본 30000ms)</li>
 *   <li>minTimeoutMs / maxTimeoutMs: 적응형 값의 하한/상한 (기본 10ms / 120000ms)</li>
 *   <li>p95Multiplier: P95에 곱하는 배수 (기본 1.5)</li>
 *   <li>minSamples: 적응형 값을 쓰기 위한 최소 샘플 수 (기본 20)</li>
 *   <li>windowSize: 보관할 최근 지연 샘플 수 (기본 1000)</li>
 * </ul>
 *
 * @param adaptiveEnabled 적응형 사용 여부
 * @param defaultTimeoutMs 정적 타임아웃 (밀리초, 양수)
 * @param minTimeoutMs 하한 (밀리초, 양수)
 * @param maxTimeoutMs 상한 (밀리초, minTimeoutMs 이상)
 * @param p95Multiplier P95 배수 (1.0 이상)
 * @param minSamples 최소 샘플 수 (양수)
 * @param windowSize 샘플 윈도우 크기 (양수)
 * @author Resilience Team
 * @since 1.0.0
 */
public record TimeoutConfig(
    boolean adaptiveEnabled,
    long defaultTimeoutMs,
    long minTimeoutMs,
    long maxTimeoutMs,
    double p95Multiplier,
    int minSamples,
    int windowSize
) {

    /**
     * 기본 설정 생성자.
     */
    public TimeoutConfig() {
        this(true, 30000, 10, 120000, 1.5, 20, 1000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public TimeoutConfig {
        if (defaultTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "defaultTimeoutMs must be positive (current: " + defaultTimeoutMs + ")"
            );
        }
        if (minTimeoutMs <= 0) {
            throw new IllegalArgumentException(
                "minTimeoutMs must be positive (current: " + minTimeoutMs + ")"
            );
        }
        if (maxTimeoutMs < minTimeoutMs) {
            throw new IllegalArgumentException(
                "maxTimeoutMs must be >= minTimeoutMs (min: " + minTimeoutMs + ", max: " + maxTimeoutMs + ")"
            );
        }
        if (p95Multiplier < 1.0) {
            throw new IllegalArgumentException(
                "p95Multiplier must be >= 1.0 (current: " + p95Multiplier + ")"
            );
        }
        if (minSamples <= 0) {
            throw new IllegalArgumentException(
                "minSamples must be positive (current: " + minSamples + ")"
            );
        }
        if (windowSize < minSamples) {
            throw new IllegalArgumentException(
                "windowSize must be >= minSamples (minSamples: " + minSamples + ", windowSize: " + windowSize + ")"
            );
        }
    }

    /**
     * 적응형을 끄고 고정 타임아웃만 사용하는 설정.
     *
     * @param timeoutMs 고정 타임아웃 (밀리초)
     * @return 설정
     */
    public static TimeoutConfig fixed(long timeoutMs) {
        return new TimeoutConfig().withAdaptiveEnabled(false).withDefaultTimeoutMs(timeoutMs);
    }

    public TimeoutConfig withAdaptiveEnabled(boolean adaptiveEnabled) {
        return new TimeoutConfig(adaptiveEnabled, defaultTimeoutMs, minTimeoutMs, maxTimeoutMs, p95Multiplier, minSamples, windowSize);
    }

    public TimeoutConfig withDefaultTimeoutMs(long defaultTimeoutMs) {
        return new TimeoutConfig(adaptiveEnabled, defaultTimeoutMs, minTimeoutMs, maxTimeoutMs, p95Multiplier, minSamples, windowSize);
    }

    public TimeoutConfig withBounds(long minTimeoutMs, long maxTimeoutMs) {
        return new TimeoutConfig(adaptiveEnabled, defaultTimeoutMs, minTimeoutMs, maxTimeoutMs, p95Multiplier, minSamples, windowSize);
    }

    public TimeoutConfig withMinSamples(int minSamples) {
        return new TimeoutConfig(adaptiveEnabled, defaultTimeoutMs, minTimeoutMs, maxTimeoutMs, p95Multiplier, minSamples, windowSize);
    }
}
