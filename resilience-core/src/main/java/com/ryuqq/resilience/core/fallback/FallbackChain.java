package com.ryuqq.resilience.core.fallback;

import java.util.concurrent.Callable;

/**
 * 다단계 Fallback 체인 SPI.
 *
 * <p>{@link FallbackLevel} 선언 순서대로 등록된 핸들러만 시도하고, 첫 성공 결과를 반환합니다.
 * 모든 핸들러가 실패하면(등록된 핸들러가 없는 경우 포함)
 * {@link com.ryuqq.resilience.core.exception.AllFallbacksExhaustedException}이 발생합니다.</p>
 *
 * @param <T> 결과 타입
 * @author Resilience Team
 * @since 1.0.0
 */
public interface FallbackChain<T> {

    /**
     * 레벨에 핸들러 등록 (같은 레벨 재등록 시 교체).
     *
     * @param level 레벨
     * @param handler 핸들러
     * @return this
     */
    FallbackChain<T> registerHandler(FallbackLevel level, Callable<T> handler);

    /**
     * PRIMARY 핸들러만 교체한 사본.
     *
     * <p>원본 체인은 변경되지 않습니다.</p>
     *
     * @param primary PRIMARY 핸들러
     * @return 새 체인
     */
    FallbackChain<T> withPrimary(Callable<T> primary);

    /**
     * 체인 실행.
     *
     * @return 결과와 처리 레벨
     * @throws com.ryuqq.resilience.core.exception.AllFallbacksExhaustedException 모든 핸들러 실패 시
     */
    FallbackResult<T> execute();
}
