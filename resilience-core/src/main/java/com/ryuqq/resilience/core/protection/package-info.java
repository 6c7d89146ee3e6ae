/**
 * Protection SPI (Service Provider Interface) 패키지.
 *
 * <p>다운스트림 의존성 호출에서 발생하는 장애를 격리하기 위한 보호 컴포넌트의
 * 계약, 설정, 통계 타입을 정의합니다.</p>
 *
 * <h2>호출 경로 적용 순서</h2>
 * <pre>
 * 1. Bulkhead        → 동시 실행 슬롯 확보 (대기열, 우선순위)
 * 2. CircuitBreaker  → OPEN 상태 시 즉시 실패
 * 3. RetryManager    → 재시도 루프 (예산, 멱등성, 백오프)
 * 4. TimeoutPolicy   → 시도마다 새 데드라인
 * 5. 작업 실행
 * (실패 시 FallbackChain)
 * </pre>
 *
 * <p>RateLimiter는 호출 경로 바깥의 진입(ingress) 제어에 독립적으로 사용됩니다.</p>
 *
 * <h3>순서 선정 이유</h3>
 * <ul>
 *   <li><strong>Bulkhead First:</strong> 포화된 의존성이 프로세스 스레드를 점유하지 않도록 가장 먼저 격리</li>
 *   <li><strong>Circuit Breaker:</strong> 논리 호출 단위로 성공/실패 집계, 재시도 폭주 전에 차단</li>
 *   <li><strong>Retry:</strong> 개별 시도의 일시적 실패 흡수</li>
 *   <li><strong>Timeout:</strong> 시도별 상한 (전체 시간은 예산과 Breaker가 제한)</li>
 * </ul>
 *
 * <h2>NoOp 구현</h2>
 *
 * <p>모든 Protection SPI는 {@code noop} 하위 패키지에 기본 구현을 제공합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 * @see com.ryuqq.resilience.core.protection.CircuitBreaker
 * @see com.ryuqq.resilience.core.protection.RetryManager
 * @see com.ryuqq.resilience.core.protection.Bulkhead
 * @see com.ryuqq.resilience.core.protection.TimeoutPolicy
 * @see com.ryuqq.resilience.core.protection.RateLimiter
 */
package com.ryuqq.resilience.core.protection;
