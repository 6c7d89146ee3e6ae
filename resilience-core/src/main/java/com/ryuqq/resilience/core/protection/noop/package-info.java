/**
 * Protection SPI의 NoOp (No Operation) 구현.
 *
 * <p>호출 옵션에서 특정 보호 계층을 끄면 이 구현들이 사용됩니다.
 * 모든 요청을 허용하고 작업을 그대로 실행하며, 상태를 추적하지 않습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.protection.noop;
