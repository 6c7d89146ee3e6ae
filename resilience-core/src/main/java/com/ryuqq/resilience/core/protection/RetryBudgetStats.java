package com.ryuqq.resilience.core.protection;

/**
 * 재시도 예산 스냅샷.
 *
 * @param totalCalls 윈도우 내 전체 시도 수 (재시도 포함)
 * @param totalRetries 윈도우 내 재시도 수
 * @param retryRatePercent 재시도 비율 (%)
 * @param budgetPercent 상한 (%)
 * @param withinBudget 상한 이내 여부
 * @author Resilience Team
 * @since 1.0.0
 */
public record RetryBudgetStats(
    long totalCalls,
    long totalRetries,
    double retryRatePercent,
    double budgetPercent,
    boolean withinBudget
) {
}
