/**
 * Fallback 체인 모델 패키지.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.fallback;
