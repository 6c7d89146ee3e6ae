package com.ryuqq.resilience.adapter.runner.executor;

import com.ryuqq.resilience.adapter.inmemory.store.InMemoryIdempotencyStore;
import com.ryuqq.resilience.adapter.runner.fallback.OrderedFallbackChain;
import com.ryuqq.resilience.adapter.runner.registry.DefaultResilienceRegistry;
import com.ryuqq.resilience.adapter.runner.retry.TimeLimitedInvoker;
import com.ryuqq.resilience.application.executor.CallOptions;
import com.ryuqq.resilience.application.registry.ResilienceReport;
import com.ryuqq.resilience.application.registry.ResilienceReportJsonWriter;
import com.ryuqq.resilience.core.exception.BulkheadFullException;
import com.ryuqq.resilience.core.exception.CircuitOpenException;
import com.ryuqq.resilience.core.fallback.FallbackLevel;
import com.ryuqq.resilience.core.fallback.FallbackResult;
import com.ryuqq.resilience.core.model.DependencyName;
import com.ryuqq.resilience.core.model.IdempotencyKey;
import com.ryuqq.resilience.core.protection.BulkheadConfig;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.protection.RetryConfig;
import com.ryuqq.resilience.core.protection.TimeoutConfig;
import com.ryuqq.resilience.testkit.MutableClock;
import com.ryuqq.resilience.testkit.ScriptedCall;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * 레지스트리와 실행기를 실제 구현으로 조합한 시나리오 테스트.
 *
 * <p>시계는 {@link MutableClock}, 재시도 대기는 즉시 반환합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@DisplayName("보호 호출 시나리오 테스트")
class ResilienceScenarioTest {

    private static final DependencyName PAYMENT = DependencyName.of("payment-api");

    private MutableClock clock;
    private DefaultResilienceRegistry registry;
    private DefaultResilientCallExecutor executor;

    @BeforeEach
    void setUp() {
        clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
        registry = new DefaultResilienceRegistry(
            clock, () -> new InMemoryIdempotencyStore(clock), TimeLimitedInvoker.shared(), millis -> { }
        );
        executor = new DefaultResilientCallExecutor(registry);
    }

    @Test
    @DisplayName("실패 2회로 OPEN → 거부 → 타임아웃 후 HALF_OPEN → 성공 2회로 CLOSED")
    void circuitBreakerLifecycle() throws Exception {
        // given
        CallOptions options = CallOptions.none().withCircuitBreaker(new CircuitBreakerConfig(2, 2, 60));
        ScriptedCall<String> failing = ScriptedCall.alwaysFailing(() -> new IOException("refused"));

        // when: 실패 2회
        assertThatThrownBy(() -> executor.execute(PAYMENT, failing, options)).isInstanceOf(IOException.class);
        assertThatThrownBy(() -> executor.execute(PAYMENT, failing, options)).isInstanceOf(IOException.class);
        CircuitBreaker breaker = registry.findCircuitBreaker(PAYMENT).orElseThrow();

        // then: OPEN, 작업 미실행 거부
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        ScriptedCall<String> healthy = ScriptedCall.succeeding("paid");
        assertThatThrownBy(() -> executor.execute(PAYMENT, healthy, options))
            .isInstanceOf(CircuitOpenException.class)
            .satisfies(e -> assertThat(((CircuitOpenException) e).getRetryAfter())
                .isEqualTo(Instant.parse("2024-01-01T00:01:00Z")));
        assertThat(healthy.invocations()).isZero();

        // when: 타임아웃 경과
        clock.advanceSeconds(60);

        // then: HALF_OPEN → 성공 2회 → CLOSED
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
        assertThat(executor.execute(PAYMENT, healthy, options)).isEqualTo("paid");
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
        assertThat(executor.execute(PAYMENT, healthy, options)).isEqualTo("paid");
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.getStats().failureCount()).isZero();
    }

    @Test
    @DisplayName("기본 옵션: 일시 오류는 재시도로 흡수, 통계에 반영")
    void defaults_TransientFailureAbsorbed() throws Exception {
        // given: 정상 호출 9건으로 예산 윈도우 확보 (10건째의 재시도 1건 = 10%)
        for (int i = 0; i < 9; i++) {
            executor.execute(PAYMENT, ScriptedCall.succeeding("warm"), CallOptions.defaults());
        }
        ScriptedCall<String> flaky = ScriptedCall.failingTimes(1, () -> new IOException("reset"), "paid");

        // when
        String result = executor.execute(PAYMENT, flaky, CallOptions.defaults());

        // then
        assertThat(result).isEqualTo("paid");
        assertThat(flaky.invocations()).isEqualTo(2);
        ResilienceReport report = registry.getComprehensiveStats();
        assertThat(report.circuitBreakers().get("payment-api").state()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(report.circuitBreakers().get("payment-api").successfulCalls()).isEqualTo(10);
        assertThat(report.retryManagers().get("payment-api").budget().totalRetries()).isEqualTo(1);
        assertThat(report.retryManagers().get("payment-api").budget().retryRatePercent()).isLessThanOrEqualTo(10.0);
        assertThat(report.bulkheads().get("payment-api").successfulCalls()).isEqualTo(10);
        assertThat(report.timeouts().get("payment-api").sampleCount()).isEqualTo(11);
        assertThat(new ResilienceReportJsonWriter().write(report)).contains("\"payment-api\"");
    }

    @Test
    @DisplayName("멱등성 키가 같으면 보호 호출 전체에서 작업 1회")
    void idempotencyKey_ExactlyOnce() throws Exception {
        // given
        CallOptions options = CallOptions.defaults().withIdempotencyKey(IdempotencyKey.of("charge-1001"));
        ScriptedCall<String> charge = ScriptedCall.succeeding("receipt-1001");

        // when
        String first = executor.execute(PAYMENT, charge, options);
        String second = executor.execute(PAYMENT, charge, options);

        // then
        assertThat(first).isEqualTo(second).isEqualTo("receipt-1001");
        assertThat(charge.invocations()).isEqualTo(1);
        assertThat(registry.findRetryManager(PAYMENT).orElseThrow().getStats().idempotentHits()).isEqualTo(1);
    }

    @Test
    @DisplayName("Retry 계층이 없어도 멱등성 키가 같으면 작업 1회")
    void idempotencyKeyWithoutRetry_ExactlyOnce() throws Exception {
        // given
        CallOptions options = CallOptions.none().withIdempotencyKey(IdempotencyKey.of("refund-77"));
        ScriptedCall<String> refund = ScriptedCall.succeeding("refunded");

        // when
        String first = executor.execute(PAYMENT, refund, options);
        String second = executor.execute(PAYMENT, refund, options);

        // then
        assertThat(first).isEqualTo(second).isEqualTo("refunded");
        assertThat(refund.invocations()).isEqualTo(1);
        assertThat(registry.findRetryManager(PAYMENT)).isEmpty();
        assertThat(registry.getOrCreateIdempotencyStore(PAYMENT).size()).isEqualTo(1);
    }

    @Test
    @DisplayName("다른 의존성의 같은 멱등성 키는 결과를 공유하지 않음")
    void idempotencyKey_ScopedPerDependency() throws Exception {
        // given
        CallOptions options = CallOptions.defaults().withIdempotencyKey(IdempotencyKey.of("req-1"));
        ScriptedCall<String> charge = ScriptedCall.succeeding("payment-ok");
        ScriptedCall<Integer> reserve = ScriptedCall.succeeding(42);

        // when
        String payment = executor.execute(PAYMENT, charge, options);
        Integer inventory = executor.execute(DependencyName.of("inventory"), reserve, options);

        // then
        assertThat(payment).isEqualTo("payment-ok");
        assertThat(inventory).isEqualTo(42);
        assertThat(charge.invocations()).isEqualTo(1);
        assertThat(reserve.invocations()).isEqualTo(1);
    }

    @Test
    @DisplayName("Circuit OPEN이면 Fallback 체인이 하위 레벨로 응답")
    void openCircuit_FallbackServesDegraded() throws Exception {
        // given
        CallOptions options = CallOptions.none().withCircuitBreaker(new CircuitBreakerConfig(1, 1, 60));
        assertThatThrownBy(() -> executor.execute(
            PAYMENT, ScriptedCall.alwaysFailing(() -> new IOException("down")), options
        )).isInstanceOf(IOException.class);

        OrderedFallbackChain<String> chain = new OrderedFallbackChain<>("payment-status");
        chain.registerHandler(FallbackLevel.LOCAL_CACHE, ScriptedCall.succeeding("cached-status"))
            .registerHandler(FallbackLevel.DEFAULT, ScriptedCall.succeeding("unknown"));
        ScriptedCall<String> primary = ScriptedCall.succeeding("live-status");

        // when
        FallbackResult<String> result = executor.executeWithFallback(PAYMENT, primary, options, chain);

        // then
        assertThat(result.value()).isEqualTo("cached-status");
        assertThat(result.levelUsed()).isEqualTo(FallbackLevel.LOCAL_CACHE);
        assertThat(result.degraded()).isTrue();
        assertThat(primary.invocations()).isZero();
        assertThat(chain.getRegisteredLevels()).doesNotContain(FallbackLevel.PRIMARY);
    }

    @Test
    @DisplayName("Bulkhead 포화 시 작업 미실행 거부")
    void saturatedBulkhead_RejectsWithoutInvoking() throws Exception {
        // given
        CallOptions options = CallOptions.none().withBulkhead(new BulkheadConfig(2, 0, 100, false));
        CountDownLatch holding = new CountDownLatch(2);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(2);
        List<Future<String>> held = new ArrayList<>();
        for (int i = 0; i < 2; i++) {
            held.add(pool.submit(() -> executor.execute(PAYMENT, () -> {
                holding.countDown();
                release.await();
                return "done";
            }, options)));
        }
        assertThat(holding.await(2, TimeUnit.SECONDS)).isTrue();
        ScriptedCall<String> rejected = ScriptedCall.succeeding("never");

        // when & then
        assertThatThrownBy(() -> executor.execute(PAYMENT, rejected, options))
            .isInstanceOf(BulkheadFullException.class);
        assertThat(rejected.invocations()).isZero();

        release.countDown();
        for (Future<String> future : held) {
            assertThat(future.get(2, TimeUnit.SECONDS)).isEqualTo("done");
        }
        pool.shutdown();
        assertThat(registry.findBulkhead(PAYMENT).orElseThrow().getCurrentConcurrency()).isZero();
    }

    @Test
    @DisplayName("동시 호출 30건이 동시 실행 상한 3을 넘지 않음")
    void concurrentCalls_NeverExceedLimit() throws Exception {
        // given
        CallOptions options = CallOptions.none()
            .withBulkhead(new BulkheadConfig(3, 50, 5000, true))
            .withRetry(new RetryConfig().withMaxRetries(0))
            .withTimeout(TimeoutConfig.fixed(5000));
        AtomicInteger active = new AtomicInteger();
        AtomicInteger peak = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(30);
        List<Future<Integer>> futures = new ArrayList<>();

        // when
        for (int i = 0; i < 30; i++) {
            int index = i;
            futures.add(pool.submit(() -> executor.execute(PAYMENT, () -> {
                int now = active.incrementAndGet();
                peak.accumulateAndGet(now, Math::max);
                Thread.sleep(20);
                active.decrementAndGet();
                return index;
            }, options)));
        }

        // then
        for (Future<Integer> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        pool.shutdown();
        assertThat(peak.get()).isLessThanOrEqualTo(3);
        assertThat(registry.getComprehensiveStats().bulkheads().get("payment-api").successfulCalls())
            .isEqualTo(30);
    }
}
