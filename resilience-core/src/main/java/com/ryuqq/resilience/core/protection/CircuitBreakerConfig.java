package com.ryuqq.resilience.core.protection;

import java.util.function.Predicate;

/**
 * Circuit Breaker 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>failureThreshold: CLOSED에서 OPEN으로 전이하는 연속 실패 수 (기본 5)</li>
 *   <li>successThreshold: HALF_OPEN에서 CLOSED로 전이하는 연속 성공 수 (기본 3)</li>
 *   <li>timeoutSeconds: OPEN 유지 시간, 경과 후 HALF_OPEN 허용 (기본 60)</li>
 *   <li>expectedExceptions: 실패로 집계할 예외 판별자 (기본: 모든 예외)</li>
 * </ul>
 *
 * <p>expectedExceptions에 해당하지 않는 예외는 상태에 영향을 주지 않고 그대로 전파됩니다.</p>
 *
 * @param failureThreshold 연속 실패 임계값 (양수)
 * @param successThreshold 연속 성공 임계값 (양수)
 * @param timeoutSeconds OPEN 유지 시간 (초, 0 이상)
 * @param expectedExceptions 실패로 집계할 예외 판별자
 * @author Resilience Team
 * @since 1.0.0
 */
public record CircuitBreakerConfig(
    int failureThreshold,
    int successThreshold,
    long timeoutSeconds,
    Predicate<Throwable> expectedExceptions
) {

    private static final Predicate<Throwable> ALL_EXCEPTIONS = throwable -> true;

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: failureThreshold=5, successThreshold=3, timeoutSeconds=60, 모든 예외 집계</p>
     */
    public CircuitBreakerConfig() {
        this(5, 3, 60, ALL_EXCEPTIONS);
    }

    /**
     * 모든 예외를 실패로 집계하는 설정.
     *
     * @param failureThreshold 연속 실패 임계값
     * @param successThreshold 연속 성공 임계값
     * @param timeoutSeconds OPEN 유지 시간 (초)
     */
    public CircuitBreakerConfig(int failureThreshold, int successThreshold, long timeoutSeconds) {
        this(failureThreshold, successThreshold, timeoutSeconds, ALL_EXCEPTIONS);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CircuitBreakerConfig {
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException(
                "failureThreshold must be positive (current: " + failureThreshold + ")"
            );
        }
        if (successThreshold <= 0) {
            throw new IllegalArgumentException(
                "successThreshold must be positive (current: " + successThreshold + ")"
            );
        }
        if (timeoutSeconds < 0) {
            throw new IllegalArgumentException(
                "timeoutSeconds cannot be negative (current: " + timeoutSeconds + ")"
            );
        }
        if (expectedExceptions == null) {
            throw new IllegalArgumentException("expectedExceptions cannot be null");
        }
    }

    /**
     * failureThreshold만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, timeoutSeconds, expectedExceptions);
    }

    /**
     * successThreshold만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withSuccessThreshold(int successThreshold) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, timeoutSeconds, expectedExceptions);
    }

    /**
     * timeoutSeconds만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withTimeoutSeconds(long timeoutSeconds) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, timeoutSeconds, expectedExceptions);
    }

    /**
     * expectedExceptions만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withExpectedExceptions(Predicate<Throwable> expectedExceptions) {
        return new CircuitBreakerConfig(failureThreshold, successThreshold, timeoutSeconds, expectedExceptions);
    }

    /**
     * 주어진 예외 타입(하위 타입 포함)만 실패로 집계하는 설정 생성.
     *
     * @param exceptionTypes 집계 대상 예외 타입
     * @return 새 설정
     */
    @SafeVarargs
    public final CircuitBreakerConfig recordingOnly(Class<? extends Throwable>... exceptionTypes) {
        Predicate<Throwable> predicate = throwable -> {
            for (Class<? extends Throwable> type : exceptionTypes) {
                if (type.isInstance(throwable)) {
                    return true;
                }
            }
            return false;
        };
        return withExpectedExceptions(predicate);
    }
}
