package com.ryuqq.resilience.core.protection;

/**
 * Circuit Breaker 상태 전이 검증.
 *
 * <p>구현체는 상태를 바꾸기 전에 이 클래스로 전이를 검증하여
 * 허용되지 않은 전이(예: CLOSED → HALF_OPEN)가 일어나지 않도록 보장합니다.</p>
 *
 * <p><strong>허용되는 전이:</strong></p>
 * <ul>
 *   <li>CLOSED → OPEN</li>
 *   <li>OPEN → HALF_OPEN</li>
 *   <li>HALF_OPEN → CLOSED</li>
 *   <li>HALF_OPEN → OPEN</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class CircuitBreakerTransition {

    private CircuitBreakerTransition() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static void validate(CircuitBreakerState from, CircuitBreakerState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }
        if (!from.canTransitionTo(to)) {
            throw new IllegalStateException(
                String.format("Invalid circuit breaker transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static CircuitBreakerState transition(CircuitBreakerState current, CircuitBreakerState next) {
        validate(current, next);
        return next;
    }
}
