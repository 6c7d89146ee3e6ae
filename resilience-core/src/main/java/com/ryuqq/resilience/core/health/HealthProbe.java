package com.ryuqq.resilience.core.health;

import java.util.Map;

/**
 * 헬스 프로브.
 *
 * <p>정상이면 상세 정보를 반환하고, 비정상이면 예외를 던집니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface HealthProbe {

    /**
     * 프로브 실행.
     *
     * @return 상세 정보 (예: {"database": "connected"})
     * @throws Exception 비정상인 경우
     */
    Map<String, Object> probe() throws Exception;
}
