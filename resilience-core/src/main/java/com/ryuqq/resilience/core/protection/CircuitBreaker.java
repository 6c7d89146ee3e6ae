package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.model.DependencyName;

import java.util.concurrent.Callable;

/**
 * Circuit Breaker SPI.
 *
 * <p>의존성 호출의 연속 실패를 추적하고, 임계값에 도달하면 빠르게 실패(Fail-Fast)하여
 * 장애가 전체 시스템으로 전파되는 것을 방지합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreaker cb = registry.getOrCreateCircuitBreaker(DependencyName.of("payment-api"), config);
 *
 * // 1. 위임 방식
 * Receipt receipt = cb.call(() -> paymentClient.charge(request));
 *
 * // 2. 수동 방식
 * if (!cb.tryAcquire()) {
 *     throw new CircuitOpenException(...);
 * }
 * try {
 *     Receipt result = paymentClient.charge(request);
 *     cb.recordSuccess();
 *     return result;
 * } catch (Exception e) {
 *     cb.recordFailure(e);
 *     throw e;
 * }
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * 보호 대상 의존성 이름.
     *
     * @return 의존성 이름
     */
    DependencyName getName();

    /**
     * Circuit Breaker를 거쳐 작업 실행.
     *
     * <p>OPEN 상태이고 대기 시간이 지나지 않았다면 작업을 호출하지 않고
     * {@link com.ryuqq.resilience.core.exception.CircuitOpenException}을 던집니다.
     * 작업이 던진 예외는 감싸지 않고 그대로 전파합니다.</p>
     *
     * @param work 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws com.ryuqq.resilience.core.exception.CircuitOpenException OPEN 상태인 경우
     * @throws Exception 작업이 던진 예외
     */
    <T> T call(Callable<T> work) throws Exception;

    /**
     * 통과 허용 여부 확인.
     *
     * <ul>
     *   <li>CLOSED: 항상 true</li>
     *   <li>OPEN: 대기 시간 경과 전 false, 경과 시 HALF_OPEN 전이 후 true</li>
     *   <li>HALF_OPEN: true (복구 테스트)</li>
     * </ul>
     *
     * @return true: 통과 허용, false: 차단
     */
    boolean tryAcquire();

    /**
     * 실행 성공 기록.
     */
    void recordSuccess();

    /**
     * 실행 실패 기록.
     *
     * <p>expectedExceptions에 해당하지 않는 예외는 무시됩니다.</p>
     *
     * @param throwable 발생한 예외
     */
    void recordFailure(Throwable throwable);

    /**
     * 현재 상태 조회 (OPEN 대기 시간 경과 시 HALF_OPEN 반영).
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * 통계 스냅샷 조회.
     *
     * @return 통계
     */
    CircuitBreakerStats getStats();

    /**
     * CLOSED 상태로 강제 리셋.
     *
     * <p>수동 복구 또는 테스트 목적으로 사용됩니다.</p>
     */
    void reset();
}
