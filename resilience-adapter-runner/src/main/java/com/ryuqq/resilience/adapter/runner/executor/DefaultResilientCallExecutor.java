package com.ryuqq.resilience.adapter.runner.executor;

import com.ryuqq.resilience.adapter.runner.retry.TimeLimitedInvoker;
import com.ryuqq.resilience.application.executor.CallOptions;
import com.ryuqq.resilience.application.executor.ResilientCallExecutor;
import com.ryuqq.resilience.application.registry.ResilienceRegistry;
import com.ryuqq.resilience.core.fallback.FallbackChain;
import com.ryuqq.resilience.core.fallback.FallbackResult;
import com.ryuqq.resilience.core.model.DependencyName;
import com.ryuqq.resilience.core.model.IdempotencyKey;
import com.ryuqq.resilience.core.protection.Bulkhead;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.RetryConfig;
import com.ryuqq.resilience.core.protection.RetryManager;
import com.ryuqq.resilience.core.protection.TimeoutPolicy;
import com.ryuqq.resilience.core.protection.noop.NoOpBulkhead;
import com.ryuqq.resilience.core.protection.noop.NoOpCircuitBreaker;
import com.ryuqq.resilience.core.spi.IdempotencyRecord;
import com.ryuqq.resilience.core.spi.IdempotencyStore;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;

/**
 * 레지스트리 컴포넌트를 조합하는 기본 실행기.
 *
 * <p><strong>조합 순서:</strong></p>
 * <pre>
 * Bulkhead.execute(priority)
 *   └─ CircuitBreaker.call
 *        └─ RetryManager.executeWithRetry(idempotencyKey)   (시도마다 TimeoutPolicy 마감)
 *             └─ work
 * </pre>
 *
 * <p>{@link CallOptions}의 설정이 null인 계층은 NoOp으로 대체합니다.
 * Retry 없이 Timeout만 지정하면 마감 시간이 있는 단일 시도로 실행합니다.</p>
 *
 * <p>멱등성 키는 Retry 계층 유무와 관계없이 적용됩니다. Retry 계층이 있으면 RetryManager가,
 * 없으면 실행기가 같은 의존성의 {@link IdempotencyStore}에서 직접 조회/저장합니다
 * (보관 시간 {@link RetryConfig#DEFAULT_IDEMPOTENCY_TTL_SECONDS}초).</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class DefaultResilientCallExecutor implements ResilientCallExecutor {

    private static final Duration IDEMPOTENCY_TTL = Duration.ofSeconds(RetryConfig.DEFAULT_IDEMPOTENCY_TTL_SECONDS);

    private final ResilienceRegistry registry;
    private final TimeLimitedInvoker invoker;

    public DefaultResilientCallExecutor(ResilienceRegistry registry) {
        this(registry, TimeLimitedInvoker.shared());
    }

    public DefaultResilientCallExecutor(ResilienceRegistry registry, TimeLimitedInvoker invoker) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (invoker == null) {
            throw new IllegalArgumentException("invoker cannot be null");
        }
        this.registry = registry;
        this.invoker = invoker;
    }

    @Override
    public <T> T execute(DependencyName name, Callable<T> work, CallOptions options) throws Exception {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        if (options == null) {
            throw new IllegalArgumentException("options cannot be null");
        }

        Bulkhead bulkhead = options.bulkhead() != null
            ? registry.getOrCreateBulkhead(name, options.bulkhead())
            : new NoOpBulkhead(name);
        CircuitBreaker circuitBreaker = options.circuitBreaker() != null
            ? registry.getOrCreateCircuitBreaker(name, options.circuitBreaker())
            : new NoOpCircuitBreaker(name);
        Callable<T> attempts = attempts(name, work, options);

        return bulkhead.execute(() -> circuitBreaker.call(attempts), options.priority());
    }

    @Override
    public <T> FallbackResult<T> executeWithFallback(
        DependencyName name,
        Callable<T> work,
        CallOptions options,
        FallbackChain<T> chain
    ) {
        if (chain == null) {
            throw new IllegalArgumentException("chain cannot be null");
        }
        return chain.withPrimary(() -> execute(name, work, options)).execute();
    }

    private <T> Callable<T> attempts(DependencyName name, Callable<T> work, CallOptions options) {
        if (options.retry() != null) {
            // TimeoutPolicy를 먼저 만들어야 RetryManager가 호출자의 Timeout 설정을 사용
            if (options.timeout() != null) {
                registry.getOrCreateTimeoutPolicy(name, options.timeout());
            }
            RetryManager retryManager = registry.getOrCreateRetryManager(name, options.retry());
            return () -> retryManager.executeWithRetry(work, options.idempotencyKey());
        }
        Callable<T> single = work;
        if (options.timeout() != null) {
            TimeoutPolicy timeoutPolicy = registry.getOrCreateTimeoutPolicy(name, options.timeout());
            single = () -> timed(work, timeoutPolicy);
        }
        if (options.idempotencyKey() != null) {
            IdempotencyStore store = registry.getOrCreateIdempotencyStore(name);
            Callable<T> attempt = single;
            return () -> idempotent(attempt, options.idempotencyKey(), store);
        }
        return single;
    }

    private static <T> T idempotent(Callable<T> work, IdempotencyKey key, IdempotencyStore store) throws Exception {
        Optional<IdempotencyRecord> cached = store.find(key);
        if (cached.isPresent()) {
            T value = cached.get().valueAs();
            return value;
        }
        T result = work.call();
        store.save(key, result, IDEMPOTENCY_TTL);
        return result;
    }

    private <T> T timed(Callable<T> work, TimeoutPolicy timeoutPolicy) throws Exception {
        long startNanos = System.nanoTime();
        try {
            T result = invoker.invoke(work, timeoutPolicy.getTimeoutMs());
            timeoutPolicy.recordLatency(elapsedMs(startNanos));
            return result;
        } catch (TimeoutException e) {
            timeoutPolicy.recordTimeout(elapsedMs(startNanos));
            throw e;
        } catch (Exception e) {
            timeoutPolicy.recordLatency(elapsedMs(startNanos));
            throw e;
        }
    }

    private static long elapsedMs(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }
}
