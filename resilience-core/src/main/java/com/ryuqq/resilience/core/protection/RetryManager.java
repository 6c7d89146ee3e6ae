package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.model.DependencyName;
import com.ryuqq.resilience.core.model.IdempotencyKey;

import java.util.Set;
import java.util.concurrent.Callable;

/**
 * Retry Manager SPI.
 *
 * <p>지수 백오프 + Jitter, 재시도 예산, 멱등성 키, 조건부 재시도를 조합하여 작업을 실행합니다.</p>
 *
 * <p><strong>시도별 처리 흐름:</strong></p>
 * <pre>
 * 1. 멱등성 키의 유효한 결과가 있으면 작업 호출 없이 반환
 * 2. 재시도(attempt > 0)라면 예산 확인, 초과 시 RetryBudgetExceededException
 * 3. TimeoutPolicy의 현재 값으로 작업 실행
 * 4. 성공 시 멱등성 키가 있으면 결과 저장 후 반환
 * 5. 실패 시 재시도 가능 여부 판별, 불가하거나 횟수 소진 시 원래 예외 전파
 *    가능하면 지연 계산 → 대기 → 예산에 재시도 기록 → 반복
 * </pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface RetryManager {

    /**
     * 보호 대상 의존성 이름.
     *
     * @return 의존성 이름
     */
    DependencyName getName();

    /**
     * 재시도 정책으로 작업 실행.
     *
     * @param work 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws Exception 최종 시도의 예외 또는 정책 예외
     */
    <T> T executeWithRetry(Callable<T> work) throws Exception;

    /**
     * 멱등성 키와 함께 실행.
     *
     * @param work 작업
     * @param idempotencyKey 멱등성 키 (null이면 캐시 사용 안 함)
     * @param <T> 결과 타입
     * @return 작업 결과 또는 캐시된 결과
     * @throws Exception 최종 시도의 예외 또는 정책 예외
     */
    <T> T executeWithRetry(Callable<T> work, IdempotencyKey idempotencyKey) throws Exception;

    /**
     * 멱등성 키와 재시도 대상 상태 코드를 지정하여 실행.
     *
     * @param work 작업
     * @param idempotencyKey 멱등성 키 (null 허용)
     * @param retryOnStatus 재시도 대상 상태 코드 (null이면 설정값 사용)
     * @param <T> 결과 타입
     * @return 작업 결과 또는 캐시된 결과
     * @throws Exception 최종 시도의 예외 또는 정책 예외
     */
    <T> T executeWithRetry(Callable<T> work, IdempotencyKey idempotencyKey, Set<Integer> retryOnStatus) throws Exception;

    /**
     * 재시도 설정 조회.
     *
     * @return 설정
     */
    RetryConfig getConfig();

    /**
     * 통계 스냅샷 조회.
     *
     * @return 통계
     */
    RetryStats getStats();
}
