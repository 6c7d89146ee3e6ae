/**
 * 보호 컴포넌트를 조합한 호출 경로 계약.
 *
 * <p>Bulkhead 입장 → Circuit Breaker 게이트 → Retry 루프(시도별 Adaptive Timeout) 순서입니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.application.executor;
