package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.model.DependencyName;
import com.ryuqq.resilience.core.model.PriorityLevel;

import java.util.concurrent.Callable;

/**
 * Bulkhead SPI.
 *
 * <p>의존성별 동시 실행 수와 대기열을 제한하여, 한 의존성의 포화가
 * 같은 프로세스의 다른 의존성 호출을 고갈시키지 못하도록 격리합니다.</p>
 *
 * <p><strong>진입 알고리즘:</strong></p>
 * <pre>
 * 1. 빈 슬롯이 있으면 즉시 실행
 * 2. 없으면 대기열에 등록 (우선순위 또는 FIFO), 대기열도 가득 차면 BulkheadFullException
 * 3. timeoutMs 안에 슬롯을 얻지 못하면 대기열에서 제거 후 BulkheadTimeoutException
 * 4. 실행 완료 시 (성공/실패 무관) 슬롯 반납
 * </pre>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * Bulkhead bulkhead = registry.getOrCreateBulkhead(DependencyName.of("llm"), new BulkheadConfig());
 * Answer answer = bulkhead.execute(() -> llmClient.complete(prompt), PriorityLevel.HIGH);
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface Bulkhead {

    /**
     * 보호 대상 의존성 이름.
     *
     * @return 의존성 이름
     */
    DependencyName getName();

    /**
     * Bulkhead 안에서 작업 실행.
     *
     * @param work 작업
     * @param priority 대기열 우선순위
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws com.ryuqq.resilience.core.exception.BulkheadFullException 슬롯과 대기열이 모두 찬 경우
     * @throws com.ryuqq.resilience.core.exception.BulkheadTimeoutException 대기 시간 초과
     * @throws InterruptedException 대기 중 인터럽트
     * @throws Exception 작업이 던진 예외
     */
    <T> T execute(Callable<T> work, PriorityLevel priority) throws Exception;

    /**
     * NORMAL 우선순위로 작업 실행.
     *
     * @param work 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws Exception {@link #execute(Callable, PriorityLevel)} 참고
     */
    default <T> T execute(Callable<T> work) throws Exception {
        return execute(work, PriorityLevel.NORMAL);
    }

    /**
     * 현재 동시 실행 수 조회.
     *
     * @return 실행 중인 작업 수
     */
    int getCurrentConcurrency();

    /**
     * 현재 대기열 길이 조회.
     *
     * @return 대기 중인 호출 수
     */
    int getQueuedCalls();

    /**
     * Bulkhead 설정 조회.
     *
     * @return 설정
     */
    BulkheadConfig getConfig();

    /**
     * 통계 스냅샷 조회.
     *
     * @return 통계
     */
    BulkheadStats getStats();
}
