/**
 * 헬스 체커 구현과 주기 실행기.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.adapter.runner.health;
