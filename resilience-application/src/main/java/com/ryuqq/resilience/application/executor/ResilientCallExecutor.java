package com.ryuqq.resilience.application.executor;

import com.ryuqq.resilience.core.fallback.FallbackChain;
import com.ryuqq.resilience.core.fallback.FallbackResult;
import com.ryuqq.resilience.core.model.DependencyName;

import java.util.concurrent.Callable;

/**
 * 보호 호출 실행기.
 *
 * <p>하나의 작업을 다음 순서로 감쌉니다:</p>
 * <ol>
 *   <li>Bulkhead 입장 (포화 시 {@code BulkheadFullException}/{@code BulkheadTimeoutException})</li>
 *   <li>Circuit Breaker 게이트 (OPEN이면 {@code CircuitOpenException}, 작업 미실행)</li>
 *   <li>Retry 루프 (시도마다 Adaptive Timeout, 재시도 예산, 멱등성 캐시)</li>
 * </ol>
 *
 * <p>작업 자체의 예외(checked 포함)는 변경 없이 전파됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * ResilientCallExecutor executor = new DefaultResilientCallExecutor(registry);
 * Order order = executor.execute(
 *     DependencyName.of("order-db"),
 *     () -&gt; orderClient.find(orderId),
 *     CallOptions.defaults().withPriority(PriorityLevel.HIGH)
 * );
 * </pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface ResilientCallExecutor {

    /**
     * 보호 호출 실행.
     *
     * @param name 의존성 이름
     * @param work 작업
     * @param options 호출 옵션
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws Exception 작업 예외 또는 보호 정책 예외
     */
    <T> T execute(DependencyName name, Callable<T> work, CallOptions options) throws Exception;

    /**
     * 보호 호출을 PRIMARY로 사용해 Fallback 체인 실행.
     *
     * <p>전달된 체인은 변경되지 않습니다.</p>
     *
     * @param name 의존성 이름
     * @param work PRIMARY 작업
     * @param options 호출 옵션
     * @param chain 하위 레벨 핸들러가 등록된 체인
     * @param <T> 결과 타입
     * @return 결과와 처리 레벨
     */
    <T> FallbackResult<T> executeWithFallback(
        DependencyName name,
        Callable<T> work,
        CallOptions options,
        FallbackChain<T> chain
    );

    /**
     * 인자를 묶은 보호 호출 {@link Callable}.
     *
     * @param name 의존성 이름
     * @param work 작업
     * @param options 호출 옵션
     * @param <T> 결과 타입
     * @return 호출 시 {@link #execute}를 수행하는 Callable
     */
    default <T> Callable<T> wrap(DependencyName name, Callable<T> work, CallOptions options) {
        return () -> execute(name, work, options);
    }
}
