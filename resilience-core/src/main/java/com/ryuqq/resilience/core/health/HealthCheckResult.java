package com.ryuqq.resilience.core.health;

import java.time.Instant;
import java.util.Map;

/**
 * 헬스 체크 결과.
 *
 * <p>외부 HTTP 계층이 liveness/readiness 프로브 응답으로 그대로 노출할 수 있는 형태입니다.</p>
 *
 * @param checkType 체크 종류
 * @param status 보고 상태 (유예 기간 반영)
 * @param latencyMs 이번 프로브 소요 시간 (밀리초)
 * @param consecutiveFailures 현재 연속 실패 수
 * @param lastCheckTime 이번 검사 시각
 * @param details 프로브가 반환한 상세 정보 (실패 시 빈 맵)
 * @param error 이번 프로브의 실패 메시지 (성공 시 null)
 * @author Resilience Team
 * @since 1.0.0
 */
public record HealthCheckResult(
    HealthCheckType checkType,
    HealthStatus status,
    long latencyMs,
    int consecutiveFailures,
    Instant lastCheckTime,
    Map<String, Object> details,
    String error
) {

    public HealthCheckResult {
        details = details == null ? Map.of() : Map.copyOf(details);
    }

    /**
     * 보고 상태가 HEALTHY인지 여부.
     *
     * @return HEALTHY이면 true
     */
    public boolean isHealthy() {
        return status == HealthStatus.HEALTHY;
    }
}
