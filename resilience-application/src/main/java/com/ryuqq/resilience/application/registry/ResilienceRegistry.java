package com.ryuqq.resilience.application.registry;

import com.ryuqq.resilience.core.health.HealthChecker;
import com.ryuqq.resilience.core.model.DependencyName;
import com.ryuqq.resilience.core.protection.Bulkhead;
import com.ryuqq.resilience.core.protection.BulkheadConfig;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.RateLimiter;
import com.ryuqq.resilience.core.protection.RateLimiterConfig;
import com.ryuqq.resilience.core.protection.RetryConfig;
import com.ryuqq.resilience.core.protection.RetryManager;
import com.ryuqq.resilience.core.protection.TimeoutConfig;
import com.ryuqq.resilience.core.protection.TimeoutPolicy;
import com.ryuqq.resilience.core.spi.IdempotencyStore;

import java.util.Optional;

/**
 * 의존성별 보호 컴포넌트 레지스트리.
 *
 * <p>{@code (DependencyName, ComponentKind)} 쌍마다 인스턴스 하나를 지연 생성하고
 * 프로세스 수명 동안 유지합니다. 같은 이름으로 다시 요청하면 같은 인스턴스를 반환하므로
 * Circuit Breaker/Bulkhead 상태가 호출 사이에 누적됩니다.</p>
 *
 * <p><strong>설정 우선순위:</strong> 최초 생성 시 전달된 설정만 사용됩니다. 이후 다른 설정으로
 * 요청해도 기존 인스턴스가 반환됩니다.</p>
 *
 * <p>전역 싱글턴이 아니라 명시적으로 생성해 주입합니다. 테스트마다 독립된 레지스트리를 만들 수 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ResilienceRegistry registry = new DefaultResilienceRegistry();
 * CircuitBreaker cb = registry.getOrCreateCircuitBreaker(DependencyName.of("payment-api"), new CircuitBreakerConfig());
 * ResilienceReport report = registry.getComprehensiveStats();
 * </pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface ResilienceRegistry {

    /**
     * Circuit Breaker 조회 또는 생성.
     *
     * @param name 의존성 이름
     * @param config 최초 생성 시 사용할 설정
     * @return Circuit Breaker
     */
    CircuitBreaker getOrCreateCircuitBreaker(DependencyName name, CircuitBreakerConfig config);

    /**
     * RetryManager 조회 또는 생성.
     *
     * <p>생성되는 RetryManager는 같은 의존성의 {@link TimeoutPolicy}를 시도별 타임아웃으로 사용합니다.</p>
     *
     * @param name 의존성 이름
     * @param config 최초 생성 시 사용할 설정
     * @return RetryManager
     */
    RetryManager getOrCreateRetryManager(DependencyName name, RetryConfig config);

    /**
     * Bulkhead 조회 또는 생성.
     *
     * @param name 의존성 이름
     * @param config 최초 생성 시 사용할 설정
     * @return Bulkhead
     */
    Bulkhead getOrCreateBulkhead(DependencyName name, BulkheadConfig config);

    /**
     * TimeoutPolicy 조회 또는 생성.
     *
     * @param name 의존성 이름
     * @param config 최초 생성 시 사용할 설정
     * @return TimeoutPolicy
     */
    TimeoutPolicy getOrCreateTimeoutPolicy(DependencyName name, TimeoutConfig config);

    /**
     * RateLimiter 조회 또는 생성.
     *
     * @param name 의존성 이름
     * @param config 최초 생성 시 사용할 설정
     * @return RateLimiter
     */
    RateLimiter getOrCreateRateLimiter(DependencyName name, RateLimiterConfig config);

    /**
     * 의존성 전용 멱등성 저장소 조회 또는 생성.
     *
     * <p>멱등성 레코드는 의존성 단위로 분리됩니다. 다른 의존성이 같은 키를 사용해도
     * 서로의 결과를 돌려받지 않습니다. 같은 의존성의 RetryManager도 이 저장소를 사용합니다.</p>
     *
     * @param name 의존성 이름
     * @return 멱등성 저장소
     */
    IdempotencyStore getOrCreateIdempotencyStore(DependencyName name);

    /**
     * 헬스 체커 등록.
     *
     * <p>{@link HealthChecker#getName()}이 키입니다. 같은 이름이 이미 있으면 기존 체커를 유지하고 반환합니다.
     * 체커의 최근 결과가 {@link ResilienceReport#healthChecks()}에 포함됩니다.</p>
     *
     * @param checker 헬스 체커
     * @return 등록된 체커
     */
    HealthChecker registerHealthChecker(HealthChecker checker);

    Optional<CircuitBreaker> findCircuitBreaker(DependencyName name);

    Optional<RetryManager> findRetryManager(DependencyName name);

    Optional<Bulkhead> findBulkhead(DependencyName name);

    /**
     * 모든 컴포넌트의 통계 스냅샷.
     *
     * <p>보호 대상 호출을 일으키지 않는 pull 방식 조회입니다.</p>
     *
     * @return 스냅샷
     */
    ResilienceReport getComprehensiveStats();
}
