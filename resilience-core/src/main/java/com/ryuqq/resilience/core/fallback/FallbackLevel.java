package com.ryuqq.resilience.core.fallback;

/**
 * Fallback 데이터 소스 레벨.
 *
 * <p>선언 순서가 시도 순서입니다. 아래로 갈수록 더 오래되었거나 저렴한 소스입니다.</p>
 *
 * <pre>
 * PRIMARY → REPLICA → DISTRIBUTED_CACHE → LOCAL_CACHE → DEFAULT
 * </pre>
 *
 * <p>DEFAULT 핸들러는 실패하지 않도록 작성하는 것을 강하게 권장합니다 (예: 고정 기본값 반환).
 * DEFAULT까지 실패하면 체인은 AllFallbacksExhaustedException으로 끝납니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public enum FallbackLevel {
    PRIMARY,
    REPLICA,
    DISTRIBUTED_CACHE,
    LOCAL_CACHE,
    DEFAULT;

    /**
     * 이 레벨의 응답이 저하(degraded) 응답인지 여부.
     *
     * @return PRIMARY가 아니면 true
     */
    public boolean isDegraded() {
        return this != PRIMARY;
    }
}
