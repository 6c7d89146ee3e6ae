/**
 * 우선순위 대기열 Bulkhead 구현 패키지.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.inmemory.bulkhead;
