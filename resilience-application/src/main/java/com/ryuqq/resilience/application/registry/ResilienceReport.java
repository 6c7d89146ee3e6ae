package com.ryuqq.resilience.application.registry;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.ryuqq.resilience.core.health.HealthCheckResult;
import com.ryuqq.resilience.core.protection.BulkheadStats;
import com.ryuqq.resilience.core.protection.CircuitBreakerStats;
import com.ryuqq.resilience.core.protection.RateLimiterStats;
import com.ryuqq.resilience.core.protection.RetryStats;
import com.ryuqq.resilience.core.protection.TimeoutStats;

import java.time.Instant;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * 레지스트리 전체 통계 스냅샷.
 *
 * <p>섹션별로 의존성 이름을 키로 하는 맵을 가집니다. 맵은 이름순으로 정렬된 불변 사본입니다.</p>
 *
 * @param generatedAt 스냅샷 생성 시각
 * @param circuitBreakers Circuit Breaker 통계
 * @param retryManagers RetryManager 통계
 * @param bulkheads Bulkhead 통계
 * @param timeouts 타임아웃 정책 통계
 * @param rateLimiters 레이트 리미터 통계
 * @param healthChecks 최근 헬스 체크 결과
 * @author Resilience Team
 * @since 1.0.0
 */
public record ResilienceReport(
    Instant generatedAt,
    Map<String, CircuitBreakerStats> circuitBreakers,
    Map<String, RetryStats> retryManagers,
    Map<String, BulkheadStats> bulkheads,
    Map<String, TimeoutStats> timeouts,
    Map<String, RateLimiterStats> rateLimiters,
    Map<String, HealthCheckResult> healthChecks
) {

    public ResilienceReport {
        if (generatedAt == null) {
            throw new IllegalArgumentException("generatedAt cannot be null");
        }
        circuitBreakers = sorted(circuitBreakers);
        retryManagers = sorted(retryManagers);
        bulkheads = sorted(bulkheads);
        timeouts = sorted(timeouts);
        rateLimiters = sorted(rateLimiters);
        healthChecks = sorted(healthChecks);
    }

    /**
     * 등록된 컴포넌트가 하나도 없는지 여부.
     *
     * @return 모든 섹션이 비었으면 true
     */
    @JsonIgnore
    public boolean isEmpty() {
        return circuitBreakers.isEmpty()
            && retryManagers.isEmpty()
            && bulkheads.isEmpty()
            && timeouts.isEmpty()
            && rateLimiters.isEmpty()
            && healthChecks.isEmpty();
    }

    private static <V> Map<String, V> sorted(Map<String, V> section) {
        if (section == null || section.isEmpty()) {
            return Collections.emptyMap();
        }
        return Collections.unmodifiableMap(new TreeMap<>(section));
    }
}
