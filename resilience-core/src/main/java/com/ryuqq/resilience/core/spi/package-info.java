/**
 * 저장소 SPI 패키지.
 *
 * <p>{@link com.ryuqq.resilience.core.spi.IdempotencyStore}는 RetryManager가 멱등성 결과를
 * 보관하는 저장소 확장점입니다. 기본 구현은 adapter-inmemory 모듈에 있습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
package com.ryuqq.resilience.core.spi;
