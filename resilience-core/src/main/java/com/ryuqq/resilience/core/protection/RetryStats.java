package com.ryuqq.resilience.core.protection;

import java.util.List;

/**
 * RetryManager 통계 스냅샷.
 *
 * @param name 의존성 이름
 * @param totalExecutions executeWithRetry 호출 수
 * @param successfulExecutions 최종 성공 수
 * @param failedExecutions 최종 실패 수 (예산 초과 포함)
 * @param idempotentHits 캐시된 결과로 응답한 수
 * @param budgetRejections 예산 초과로 재시도를 포기한 수
 * @param budget 재시도 예산 스냅샷
 * @param recentAttempts 최근 시도 기록 (오래된 순)
 * @author Resilience Team
 * @since 1.0.0
 */
public record RetryStats(
    String name,
    long totalExecutions,
    long successfulExecutions,
    long failedExecutions,
    long idempotentHits,
    long budgetRejections,
    RetryBudgetStats budget,
    List<RetryAttempt> recentAttempts
) {

    public RetryStats {
        recentAttempts = recentAttempts == null ? List.of() : List.copyOf(recentAttempts);
    }
}
