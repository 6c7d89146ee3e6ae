/**
 * 기본 레지스트리 구현.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.runner.registry;
