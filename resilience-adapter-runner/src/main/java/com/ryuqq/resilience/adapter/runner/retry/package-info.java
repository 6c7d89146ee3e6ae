/**
 * 재시도 실행 구성 요소.
 *
 * <p>백오프 계산, 재시도 예산, 오류 분류, 마감 시간 실행을 조합한
 * {@link com.ryuqq.resilience.adapter.runner.retry.BudgetedRetryManager}를 제공합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.runner.retry;
