/**
 * 보호 호출 실행기 구현.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.runner.executor;
