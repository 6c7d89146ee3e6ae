package com.ryuqq.resilience.core.health;

import java.util.Optional;

/**
 * 헬스 체커 SPI.
 *
 * <p>체크 종류 하나당 인스턴스 하나가 연속 실패 수와 보고 상태를 유지합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface HealthChecker {

    /**
     * 체커 이름 (보통 의존성 이름).
     *
     * @return 이름
     */
    String getName();

    /**
     * 설정 조회.
     *
     * @return 설정
     */
    HealthCheckConfig getConfig();

    /**
     * 프로브를 타임아웃 안에서 실행하고 결과를 반영.
     *
     * <p>프로브 실패는 예외로 전파되지 않고 결과의 error로 기록됩니다.</p>
     *
     * @param probe 헬스 프로브
     * @return 이번 검사 결과
     */
    HealthCheckResult check(HealthProbe probe);

    /**
     * 가장 최근 결과.
     *
     * @return 결과 (아직 검사 전이면 empty)
     */
    Optional<HealthCheckResult> getLastResult();
}
