package com.ryuqq.resilience.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p>Circuit Breaker는 의존성 호출의 연속 실패를 추적하고,
 * 임계값에 도달하면 요청을 차단하여 장애 전파를 방지합니다.</p>
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (연속 실패 ≥ failureThreshold)
 * OPEN (차단)
 *   │
 *   ▼ (timeoutSeconds 경과, 다음 호출 시 지연 평가)
 * HALF_OPEN (반개방)
 *   │
 *   ├─► 연속 성공 ≥ successThreshold → CLOSED
 *   └─► 실패 1회 → OPEN
 * </pre>
 *
 * <p>수동 {@code reset()}은 어떤 상태에서든 CLOSED로 전이합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과).
     *
     * <p>모든 요청이 통과하며 연속 실패 횟수를 추적합니다.</p>
     */
    CLOSED,

    /**
     * 차단 상태 (요청 즉시 거부).
     *
     * <p>작업을 호출하지 않고 즉시 실패합니다.
     * 대기 시간이 경과하면 다음 호출 시점에 HALF_OPEN으로 전이합니다.</p>
     */
    OPEN,

    /**
     * 반개방 상태 (복구 여부 테스트).
     *
     * <p>요청을 통과시켜 복구 여부를 확인합니다.
     * 연속 성공이 임계값에 도달하면 CLOSED, 한 번이라도 실패하면 OPEN으로 전이합니다.</p>
     */
    HALF_OPEN;

    /**
     * 자동 전이 허용 여부.
     *
     * @param next 다음 상태
     * @return 허용된 전이인 경우 true
     */
    public boolean canTransitionTo(CircuitBreakerState next) {
        if (next == null) {
            return false;
        }
        return switch (this) {
            case CLOSED -> next == OPEN;
            case OPEN -> next == HALF_OPEN;
            case HALF_OPEN -> next == CLOSED || next == OPEN;
        };
    }
}
