/**
 * 헬스 체크 모델 패키지.
 *
 * <p>HEALTHY → UNHEALTHY 전환은 연속 실패가 유예 횟수에 도달해야 일어나고,
 * UNHEALTHY → HEALTHY 복구는 한 번의 성공으로 즉시 일어납니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.health;
