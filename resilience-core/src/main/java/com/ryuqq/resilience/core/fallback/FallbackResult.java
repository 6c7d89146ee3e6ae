package com.ryuqq.resilience.core.fallback;

/**
 * Fallback 체인 실행 결과.
 *
 * <p>degraded가 true이면 응답 소비자가 결과를 오래된(stale) 데이터로 표시할 수 있습니다.</p>
 *
 * @param value 결과 값 (null 허용)
 * @param levelUsed 요청을 처리한 레벨
 * @param degraded PRIMARY 이외 레벨이 처리했는지 여부
 * @param <T> 결과 타입
 * @author Resilience Team
 * @since 1.0.0
 */
public record FallbackResult<T>(T value, FallbackLevel levelUsed, boolean degraded) {

    public FallbackResult {
        if (levelUsed == null) {
            throw new IllegalArgumentException("levelUsed cannot be null");
        }
    }

    /**
     * 레벨로부터 degraded 여부를 계산하여 생성.
     *
     * @param value 결과 값
     * @param levelUsed 처리 레벨
     * @param <T> 결과 타입
     * @return 결과
     */
    public static <T> FallbackResult<T> of(T value, FallbackLevel levelUsed) {
        return new FallbackResult<>(value, levelUsed, levelUsed != null && levelUsed.isDegraded());
    }
}
