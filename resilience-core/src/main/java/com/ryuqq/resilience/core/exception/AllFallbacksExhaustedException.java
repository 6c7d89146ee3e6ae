package com.ryuqq.resilience.core.exception;

import java.util.List;

/**
 * FallbackChain에 등록된 모든 핸들러(DEFAULT 포함)가 실패했음을 나타냅니다.
 *
 * <p>각 레벨의 실패는 {@link #getSuppressed()}로 확인할 수 있습니다.
 * 호출자가 하드 실패로 다뤄야 하는 유일한 Fallback 결과입니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class AllFallbacksExhaustedException extends ResilienceException {

    public static final String ERROR_CODE = "FALLBACK-EXHAUSTED";

    private final List<String> attemptedLevels;

    public AllFallbacksExhaustedException(List<String> attemptedLevels) {
        super(ERROR_CODE, null, "All fallbacks exhausted (attempted levels: " + attemptedLevels + ")");
        this.attemptedLevels = List.copyOf(attemptedLevels);
    }

    /**
     * 시도한 Fallback 레벨 목록 (시도 순서).
     *
     * @return 레벨 이름 목록
     */
    public List<String> getAttemptedLevels() {
        return attemptedLevels;
    }
}
