package com.ryuqq.resilience.core.exception;

/**
 * 재시도 예산(전체 호출 대비 재시도 비율 상한)을 넘어 재시도 없이 즉시 실패했음을 나타냅니다.
 *
 * <p>cause에는 재시도하려던 원래 실패가 담깁니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class RetryBudgetExceededException extends ResilienceException {

    public static final String ERROR_CODE = "RETRY-BUDGET";

    private final double retryRatePercent;
    private final double budgetPercent;

    public RetryBudgetExceededException(String dependency, double retryRatePercent, double budgetPercent, Throwable lastFailure) {
        super(ERROR_CODE, dependency,
            String.format("Retry budget exhausted for '%s' (retry rate %.2f%%, budget %.2f%%). Failing fast.",
                dependency, retryRatePercent, budgetPercent),
            lastFailure);
        this.retryRatePercent = retryRatePercent;
        this.budgetPercent = budgetPercent;
    }

    public double getRetryRatePercent() {
        return retryRatePercent;
    }

    public double getBudgetPercent() {
        return budgetPercent;
    }
}
