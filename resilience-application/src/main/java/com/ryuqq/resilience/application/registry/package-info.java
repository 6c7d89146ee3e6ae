/**
 * 보호 컴포넌트 레지스트리 계약과 통계 스냅샷.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.application.registry;
