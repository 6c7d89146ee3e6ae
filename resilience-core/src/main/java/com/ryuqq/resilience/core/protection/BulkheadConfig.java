package com.ryuqq.resilience.core.protection;

/**
 * Bulkhead 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxConcurrentCalls: 최대 동시 실행 수 (기본 100)</li>
 *   <li>maxQueueSize: 최대 대기열 크기 (기본 200, 0이면 대기 없이 즉시 거부)</li>
 *   <li>timeoutMs: 대기열 최대 대기 시간 (기본 30000ms)</li>
 *   <li>priorityEnabled: 우선순위 기반 대기열 사용 여부 (기본 true)</li>
 * </ul>
 *
 * @param maxConcurrentCalls 최대 동시 실행 수 (양수)
 * @param maxQueueSize 최대 대기열 크기 (0 이상)
 * @param timeoutMs 대기열 최대 대기 시간 (밀리초, 0 이상)
 * @param priorityEnabled 우선순위 대기열 사용 여부
 * @author Resilience Team
 * @since 1.0.0
 */
public record BulkheadConfig(
    int maxConcurrentCalls,
    int maxQueueSize,
    long timeoutMs,
    boolean priorityEnabled
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxConcurrentCalls=100, maxQueueSize=200, timeoutMs=30000, priorityEnabled=true</p>
     */
    public BulkheadConfig() {
        this(100, 200, 30000, true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public BulkheadConfig {
        if (maxConcurrentCalls <= 0) {
            throw new IllegalArgumentException(
                "maxConcurrentCalls must be positive (current: " + maxConcurrentCalls + ")"
            );
        }
        if (maxQueueSize < 0) {
            throw new IllegalArgumentException(
                "maxQueueSize cannot be negative (current: " + maxQueueSize + ")"
            );
        }
        if (timeoutMs < 0) {
            throw new IllegalArgumentException(
                "timeoutMs cannot be negative (current: " + timeoutMs + ")"
            );
        }
    }

    /**
     * maxConcurrentCalls만 변경한 새 인스턴스 생성.
     */
    public BulkheadConfig withMaxConcurrentCalls(int maxConcurrentCalls) {
        return new BulkheadConfig(maxConcurrentCalls, maxQueueSize, timeoutMs, priorityEnabled);
    }

    /**
     * maxQueueSize만 변경한 새 인스턴스 생성.
     */
    public BulkheadConfig withMaxQueueSize(int maxQueueSize) {
        return new BulkheadConfig(maxConcurrentCalls, maxQueueSize, timeoutMs, priorityEnabled);
    }

    /**
     * timeoutMs만 변경한 새 인스턴스 생성.
     */
    public BulkheadConfig withTimeoutMs(long timeoutMs) {
        return new BulkheadConfig(maxConcurrentCalls, maxQueueSize, timeoutMs, priorityEnabled);
    }

    /**
     * priorityEnabled만 변경한 새 인스턴스 생성.
     */
    public BulkheadConfig withPriorityEnabled(boolean priorityEnabled) {
        return new BulkheadConfig(maxConcurrentCalls, maxQueueSize, timeoutMs, priorityEnabled);
    }
}
