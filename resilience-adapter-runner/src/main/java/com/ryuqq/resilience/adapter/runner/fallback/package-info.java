/**
 * 다단계 Fallback 체인 구현.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.runner.fallback;
