package com.ryuqq.resilience.core.protection;

/**
 * 타임아웃 정책 통계 스냅샷.
 *
 * @param name 의존성 이름
 * @param adaptiveEnabled 적응형 사용 여부
 * @param currentTimeoutMs 현재 적용되는 타임아웃 (밀리초, 0은 타임아웃 없음)
 * @param sampleCount 윈도우 내 샘플 수
 * @param p50Ms P50 지연 (밀리초)
 * @param p95Ms P95 지연 (밀리초)
 * @param p99Ms P99 지연 (밀리초)
 * @param p999Ms P99.9 지연 (밀리초)
 * @param timeoutCount 기록된 타임아웃 발생 수
 * @author Resilience Team
 * @since 1.0.0
 */
public record TimeoutStats(
    String name,
    boolean adaptiveEnabled,
    long currentTimeoutMs,
    int sampleCount,
    long p50Ms,
    long p95Ms,
    long p99Ms,
    long p999Ms,
    long timeoutCount
) {
}
