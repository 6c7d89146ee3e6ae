package com.ryuqq.resilience.adapter.runner.registry;

import com.ryuqq.resilience.adapter.inmemory.bulkhead.PriorityBulkhead;
import com.ryuqq.resilience.adapter.inmemory.circuitbreaker.ConsecutiveFailureCircuitBreaker;
import com.ryuqq.resilience.adapter.inmemory.ratelimit.RateLimiterFactory;
import com.ryuqq.resilience.adapter.inmemory.store.InMemoryIdempotencyStore;
import com.ryuqq.resilience.adapter.inmemory.timeout.AdaptiveTimeoutPolicy;
import com.ryuqq.resilience.adapter.runner.retry.BackoffCalculator;
import com.ryuqq.resilience.adapter.runner.retry.BudgetedRetryManager;
import com.ryuqq.resilience.adapter.runner.retry.Sleeper;
import com.ryuqq.resilience.adapter.runner.retry.TimeLimitedInvoker;
import com.ryuqq.resilience.application.registry.ResilienceReport;
import com.ryuqq.resilience.application.registry.ResilienceRegistry;
import com.ryuqq.resilience.core.health.HealthCheckResult;
import com.ryuqq.resilience.core.health.HealthChecker;
import com.ryuqq.resilience.core.model.ComponentKind;
import com.ryuqq.resilience.core.model.DependencyName;
import com.ryuqq.resilience.core.protection.Bulkhead;
import com.ryuqq.resilience.core.protection.BulkheadConfig;
import com.ryuqq.resilience.core.protection.BulkheadStats;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.CircuitBreakerStats;
import com.ryuqq.resilience.core.protection.RateLimiter;
import com.ryuqq.resilience.core.protection.RateLimiterConfig;
import com.ryuqq.resilience.core.protection.RateLimiterStats;
import com.ryuqq.resilience.core.protection.RetryConfig;
import com.ryuqq.resilience.core.protection.RetryManager;
import com.ryuqq.resilience.core.protection.RetryStats;
import com.ryuqq.resilience.core.protection.TimeoutConfig;
import com.ryuqq.resilience.core.protection.TimeoutPolicy;
import com.ryuqq.resilience.core.protection.TimeoutStats;
import com.ryuqq.resilience.core.spi.IdempotencyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * 인메모리 컴포넌트로 구성되는 기본 레지스트리.
 *
 * <p>{@code (DependencyName, ComponentKind)} 키마다 {@link ConcurrentHashMap#computeIfAbsent}로
 * 한 번만 생성합니다. 동시에 처음 요청해도 인스턴스는 하나입니다.</p>
 *
 * <p><strong>생성 구현체:</strong></p>
 * <ul>
 *   <li>Circuit Breaker: {@link ConsecutiveFailureCircuitBreaker}</li>
 *   <li>Bulkhead: {@link PriorityBulkhead}</li>
 *   <li>TimeoutPolicy: {@link AdaptiveTimeoutPolicy}</li>
 *   <li>RateLimiter: {@link RateLimiterFactory} (알고리즘별)</li>
 *   <li>RetryManager: {@link BudgetedRetryManager} (같은 의존성의 TimeoutPolicy 사용, 없으면 기본 설정으로 생성)</li>
 *   <li>IdempotencyStore: 의존성마다 별도 인스턴스 (기본 {@link InMemoryIdempotencyStore})</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class DefaultResilienceRegistry implements ResilienceRegistry {

    private static final Logger log = LoggerFactory.getLogger(DefaultResilienceRegistry.class);

    private final Clock clock;
    private final Supplier<IdempotencyStore> idempotencyStoreFactory;
    private final TimeLimitedInvoker invoker;
    private final Sleeper sleeper;
    private final Map<ComponentKey, Object> components = new ConcurrentHashMap<>();
    private final Map<DependencyName, IdempotencyStore> idempotencyStores = new ConcurrentHashMap<>();
    private final Map<String, HealthChecker> healthCheckers = new ConcurrentHashMap<>();

    /**
     * 기본 생성자 (시스템 시계, 인메모리 멱등성 저장소).
     */
    public DefaultResilienceRegistry() {
        this(Clock.systemUTC());
    }

    public DefaultResilienceRegistry(Clock clock) {
        this(clock, () -> new InMemoryIdempotencyStore(clock), TimeLimitedInvoker.shared(), Sleeper.THREAD_SLEEP);
    }

    /**
     * 생성자 (전체 주입).
     *
     * @param clock Circuit Breaker, 재시도 예산, 레이트 리미터가 공유하는 시계
     * @param idempotencyStoreFactory 의존성별 멱등성 저장소 생성기 (의존성마다 한 번 호출)
     * @param invoker 시도별 마감 시간 실행기
     * @param sleeper 재시도 대기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public DefaultResilienceRegistry(
        Clock clock,
        Supplier<IdempotencyStore> idempotencyStoreFactory,
        TimeLimitedInvoker invoker,
        Sleeper sleeper
    ) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (idempotencyStoreFactory == null) {
            throw new IllegalArgumentException("idempotencyStoreFactory cannot be null");
        }
        if (invoker == null) {
            throw new IllegalArgumentException("invoker cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }
        this.clock = clock;
        this.idempotencyStoreFactory = idempotencyStoreFactory;
        this.invoker = invoker;
        this.sleeper = sleeper;
    }

    @Override
    public CircuitBreaker getOrCreateCircuitBreaker(DependencyName name, CircuitBreakerConfig config) {
        requireConfig(config);
        return getOrCreate(name, ComponentKind.CIRCUIT_BREAKER, CircuitBreaker.class,
            () -> new ConsecutiveFailureCircuitBreaker(name, config, clock));
    }

    @Override
    public RetryManager getOrCreateRetryManager(DependencyName name, RetryConfig config) {
        requireConfig(config);
        // 같은 의존성의 TimeoutPolicy (없으면 기본 설정으로 먼저 생성)
        TimeoutPolicy timeoutPolicy = getOrCreateTimeoutPolicy(name, new TimeoutConfig());
        IdempotencyStore idempotencyStore = getOrCreateIdempotencyStore(name);
        return getOrCreate(name, ComponentKind.RETRY_MANAGER, RetryManager.class,
            () -> new BudgetedRetryManager(
                name,
                config,
                timeoutPolicy,
                idempotencyStore,
                clock,
                new BackoffCalculator(config),
                invoker,
                sleeper
            ));
    }

    @Override
    public Bulkhead getOrCreateBulkhead(DependencyName name, BulkheadConfig config) {
        requireConfig(config);
        return getOrCreate(name, ComponentKind.BULKHEAD, Bulkhead.class,
            () -> new PriorityBulkhead(name, config));
    }

    @Override
    public TimeoutPolicy getOrCreateTimeoutPolicy(DependencyName name, TimeoutConfig config) {
        requireConfig(config);
        return getOrCreate(name, ComponentKind.TIMEOUT_POLICY, TimeoutPolicy.class,
            () -> new AdaptiveTimeoutPolicy(name.getValue(), config));
    }

    @Override
    public RateLimiter getOrCreateRateLimiter(DependencyName name, RateLimiterConfig config) {
        requireConfig(config);
        return getOrCreate(name, ComponentKind.RATE_LIMITER, RateLimiter.class,
            () -> RateLimiterFactory.create(name.getValue(), config, clock));
    }

    @Override
    public IdempotencyStore getOrCreateIdempotencyStore(DependencyName name) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        return idempotencyStores.computeIfAbsent(name, key -> {
            IdempotencyStore store = idempotencyStoreFactory.get();
            if (store == null) {
                throw new IllegalStateException("idempotencyStoreFactory returned null for " + key);
            }
            return store;
        });
    }

    @Override
    public HealthChecker registerHealthChecker(HealthChecker checker) {
        if (checker == null) {
            throw new IllegalArgumentException("checker cannot be null");
        }
        HealthChecker existing = healthCheckers.putIfAbsent(checker.getName(), checker);
        if (existing != null) {
            return existing;
        }
        log.info("Health checker registered: name={}, type={}", checker.getName(), checker.getConfig().checkType());
        return checker;
    }

    @Override
    public Optional<CircuitBreaker> findCircuitBreaker(DependencyName name) {
        return find(name, ComponentKind.CIRCUIT_BREAKER, CircuitBreaker.class);
    }

    @Override
    public Optional<RetryManager> findRetryManager(DependencyName name) {
        return find(name, ComponentKind.RETRY_MANAGER, RetryManager.class);
    }

    @Override
    public Optional<Bulkhead> findBulkhead(DependencyName name) {
        return find(name, ComponentKind.BULKHEAD, Bulkhead.class);
    }

    @Override
    public ResilienceReport getComprehensiveStats() {
        Map<String, CircuitBreakerStats> circuitBreakers = new HashMap<>();
        Map<String, RetryStats> retryManagers = new HashMap<>();
        Map<String, BulkheadStats> bulkheads = new HashMap<>();
        Map<String, TimeoutStats> timeouts = new HashMap<>();
        Map<String, RateLimiterStats> rateLimiters = new HashMap<>();
        Map<String, HealthCheckResult> healthChecks = new HashMap<>();

        components.forEach((key, component) -> {
            String name = key.name().getValue();
            switch (key.kind()) {
                case CIRCUIT_BREAKER:
                    circuitBreakers.put(name, ((CircuitBreaker) component).getStats());
                    break;
                case RETRY_MANAGER:
                    retryManagers.put(name, ((RetryManager) component).getStats());
                    break;
                case BULKHEAD:
                    bulkheads.put(name, ((Bulkhead) component).getStats());
                    break;
                case TIMEOUT_POLICY:
                    timeouts.put(name, ((TimeoutPolicy) component).getStats());
                    break;
                case RATE_LIMITER:
                    rateLimiters.put(name, ((RateLimiter) component).getStats());
                    break;
                default:
                    break;
            }
        });
        healthCheckers.forEach((name, checker) ->
            checker.getLastResult().ifPresent(result -> healthChecks.put(name, result)));

        return new ResilienceReport(
            clock.instant(),
            circuitBreakers,
            retryManagers,
            bulkheads,
            timeouts,
            rateLimiters,
            healthChecks
        );
    }

    /**
     * 등록된 컴포넌트 수 (헬스 체커, 멱등성 저장소 제외).
     *
     * @return 컴포넌트 수
     */
    public int size() {
        return components.size();
    }

    private <C> C getOrCreate(DependencyName name, ComponentKind kind, Class<C> type, Supplier<C> factory) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        Object component = components.computeIfAbsent(new ComponentKey(name, kind), key -> {
            log.info("Resilience component created: dependency={}, kind={}", name, kind);
            return factory.get();
        });
        return type.cast(component);
    }

    private <C> Optional<C> find(DependencyName name, ComponentKind kind, Class<C> type) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        return Optional.ofNullable(components.get(new ComponentKey(name, kind))).map(type::cast);
    }

    private static void requireConfig(Object config) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
    }

    private record ComponentKey(DependencyName name, ComponentKind kind) {
    }
}
