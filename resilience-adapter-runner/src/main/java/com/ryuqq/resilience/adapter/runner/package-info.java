/**
 * 런타임 어댑터.
 *
 * <p>인메모리 보호 컴포넌트 위에 재시도 실행, Fallback 체인, 헬스 체크,
 * 레지스트리와 조합 실행기를 제공합니다.</p>
 *
 * <ul>
 *   <li>{@code retry}: 백오프, 재시도 예산, 마감 시간 실행, RetryManager</li>
 *   <li>{@code fallback}: 다단계 Fallback 체인</li>
 *   <li>{@code health}: Grace period 헬스 체커와 주기 실행기</li>
 *   <li>{@code registry}: 기본 레지스트리</li>
 *   <li>{@code executor}: Bulkhead → Circuit Breaker → Retry 조합 실행기</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.runner;
