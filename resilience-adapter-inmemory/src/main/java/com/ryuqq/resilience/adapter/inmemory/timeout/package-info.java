/**
 * P95 기반 적응형 타임아웃 구현 패키지.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.inmemory.timeout;
