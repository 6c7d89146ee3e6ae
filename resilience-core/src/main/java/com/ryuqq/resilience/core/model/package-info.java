/**
 * 보호 컴포넌트 전반에서 사용하는 Value Object.
 *
 * <ul>
 *   <li>{@link com.ryuqq.resilience.core.model.DependencyName} - 의존성 이름 (Registry 키)</li>
 *   <li>{@link com.ryuqq.resilience.core.model.IdempotencyKey} - 호출자 제공 멱등성 키</li>
 *   <li>{@link com.ryuqq.resilience.core.model.PriorityLevel} - Bulkhead 우선순위</li>
 *   <li>{@link com.ryuqq.resilience.core.model.ComponentKind} - 컴포넌트 종류</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.model;
