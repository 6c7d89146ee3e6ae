package com.ryuqq.resilience.core.model;

/**
 * HTTP 스타일 상태 코드를 노출하는 결과 또는 예외.
 *
 * <p>RetryManager는 작업이 던진 예외나 반환한 결과가 이 인터페이스를 구현하면
 * 상태 코드로 재시도 여부를 판단합니다 (예: 429, 5xx는 재시도, 그 외 4xx는 즉시 실패).</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface StatusCodeProvider {

    /**
     * 상태 코드 조회.
     *
     * @return 상태 코드 (예: 503)
     */
    int statusCode();
}
