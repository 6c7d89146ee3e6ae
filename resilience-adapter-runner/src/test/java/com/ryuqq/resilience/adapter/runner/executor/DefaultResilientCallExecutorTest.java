package com.ryuqq.resilience.adapter.runner.executor;

import com.ryuqq.resilience.adapter.inmemory.circuitbreaker.ConsecutiveFailureCircuitBreaker;
import com.ryuqq.resilience.application.executor.CallOptions;
import com.ryuqq.resilience.application.registry.ResilienceRegistry;
import com.ryuqq.resilience.core.model.DependencyName;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.RetryConfig;
import com.ryuqq.resilience.core.protection.RetryManager;
import com.ryuqq.resilience.core.protection.TimeoutConfig;
import com.ryuqq.resilience.core.protection.TimeoutPolicy;
import com.ryuqq.resilience.testkit.ScriptedCall;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

/**
 * DefaultResilientCallExecutor 테스트 (레지스트리 Mock).
 *
 * <p>CallOptions에 따라 어떤 계층을 레지스트리에서 가져오는지 검증합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
@DisplayName("DefaultResilientCallExecutor 테스트")
class DefaultResilientCallExecutorTest {

    private static final DependencyName NAME = DependencyName.of("inventory");

    @Mock
    private ResilienceRegistry registry;

    @Mock
    private RetryManager retryManager;

    @Mock
    private TimeoutPolicy timeoutPolicy;

    @Test
    @DisplayName("모든 계층이 없으면 레지스트리를 쓰지 않고 작업만 실행")
    void noLayers_RunsWorkDirectly() throws Exception {
        // given
        DefaultResilientCallExecutor executor = new DefaultResilientCallExecutor(registry);
        ScriptedCall<String> call = ScriptedCall.succeeding("stock");

        // when
        String result = executor.execute(NAME, call, CallOptions.none());

        // then
        assertThat(result).isEqualTo("stock");
        assertThat(call.invocations()).isEqualTo(1);
        verifyNoInteractions(registry);
    }

    @Test
    @DisplayName("Circuit Breaker만 지정하면 해당 계층만 조회")
    void circuitBreakerOnly() throws Exception {
        // given
        CircuitBreakerConfig config = new CircuitBreakerConfig(1, 1, 60);
        when(registry.getOrCreateCircuitBreaker(NAME, config))
            .thenReturn(new ConsecutiveFailureCircuitBreaker(NAME, config));
        DefaultResilientCallExecutor executor = new DefaultResilientCallExecutor(registry);

        // when
        executor.execute(NAME, ScriptedCall.succeeding(1), CallOptions.none().withCircuitBreaker(config));

        // then
        verify(registry).getOrCreateCircuitBreaker(NAME, config);
        verify(registry, never()).getOrCreateBulkhead(any(), any());
        verify(registry, never()).getOrCreateRetryManager(any(), any());
    }

    @Test
    @DisplayName("Retry와 Timeout을 함께 지정하면 TimeoutPolicy를 먼저 생성")
    void retryWithTimeout_TimeoutPolicyCreatedFirst() throws Exception {
        // given
        RetryConfig retry = new RetryConfig();
        TimeoutConfig timeout = TimeoutConfig.fixed(500);
        when(registry.getOrCreateRetryManager(NAME, retry)).thenReturn(retryManager);
        when(retryManager.executeWithRetry(any(), isNull())).thenReturn("ok");
        DefaultResilientCallExecutor executor = new DefaultResilientCallExecutor(registry);

        // when
        Object result = executor.execute(
            NAME, ScriptedCall.succeeding("ignored"), CallOptions.none().withRetry(retry).withTimeout(timeout)
        );

        // then
        assertThat(result).isEqualTo("ok");
        InOrder order = inOrder(registry);
        order.verify(registry).getOrCreateTimeoutPolicy(NAME, timeout);
        order.verify(registry).getOrCreateRetryManager(NAME, retry);
    }

    @Test
    @DisplayName("Timeout만 지정하면 마감 시간 단일 시도")
    void timeoutOnly_SingleTimedAttempt() {
        // given
        TimeoutConfig timeout = TimeoutConfig.fixed(50);
        when(registry.getOrCreateTimeoutPolicy(NAME, timeout)).thenReturn(timeoutPolicy);
        when(timeoutPolicy.getTimeoutMs()).thenReturn(50L);
        DefaultResilientCallExecutor executor = new DefaultResilientCallExecutor(registry);
        Callable<String> slow = () -> {
            Thread.sleep(5_000);
            return "late";
        };

        // when & then
        assertThatThrownBy(() -> executor.execute(NAME, slow, CallOptions.none().withTimeout(timeout)))
            .isInstanceOf(TimeoutException.class);
        verify(timeoutPolicy).recordTimeout(anyLong());
    }

    @Test
    @DisplayName("wrap은 호출 시점에 실행")
    void wrap_DefersExecution() throws Exception {
        // given
        DefaultResilientCallExecutor executor = new DefaultResilientCallExecutor(registry);
        ScriptedCall<String> call = ScriptedCall.succeeding("later");

        // when
        Callable<String> wrapped = executor.wrap(NAME, call, CallOptions.none());

        // then
        assertThat(call.invocations()).isZero();
        assertThat(wrapped.call()).isEqualTo("later");
        assertThat(call.invocations()).isEqualTo(1);
    }

    @Test
    @DisplayName("null 인자 거부")
    void nullArguments_ThrowException() {
        DefaultResilientCallExecutor executor = new DefaultResilientCallExecutor(registry);

        assertThatThrownBy(() -> executor.execute(null, () -> "x", CallOptions.none()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> executor.execute(NAME, null, CallOptions.none()))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> executor.execute(NAME, () -> "x", null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> executor.executeWithFallback(NAME, () -> "x", CallOptions.none(), null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DefaultResilientCallExecutor(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
