package com.ryuqq.resilience.core.protection;

import com.ryuqq.resilience.core.exception.RateLimitExceededException;

/**
 * Rate Limiter SPI.
 *
 * <p>요청 진입 속도를 제한하여 다운스트림 과부하와 내부 리소스 고갈을 방지합니다.
 * 세 알고리즘({@link RateLimiterAlgorithm})이 같은 형태로 교체 가능합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * RateLimiter limiter = registry.getOrCreateRateLimiter(
 *     DependencyName.of("ingress"), RateLimiterConfig.tokenBucket(100, 10));
 *
 * if (!limiter.allow()) {
 *     return tooManyRequests();
 * }
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface RateLimiter {

    /**
     * 리미터 이름.
     *
     * @return 이름
     */
    String getName();

    /**
     * 진입 허용 여부 확인 (비블로킹).
     *
     * <p>허용되면 용량을 소비합니다.</p>
     *
     * @return true: 허용, false: 제한 초과
     */
    boolean allow();

    /**
     * 진입 허용, 거부 시 예외.
     *
     * @throws RateLimitExceededException 제한 초과 시
     */
    default void acquire() {
        if (!allow()) {
            throw new RateLimitExceededException(getName());
        }
    }

    /**
     * 통계 스냅샷 조회.
     *
     * @return 통계
     */
    RateLimiterStats getStats();
}
