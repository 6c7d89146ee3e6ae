package com.ryuqq.resilience.core.protection;

import java.time.Instant;

/**
 * 단일 시도 기록 (영속화하지 않음).
 *
 * @param attemptNumber 시도 번호 (0 = 최초 시도)
 * @param timestamp 시도 완료 시각
 * @param delayMs 이 시도 이후 다음 재시도까지의 지연 (재시도하지 않으면 0)
 * @param withinBudget 재시도 예산 안에 있었는지 여부
 * @param success 성공 여부
 * @param error 실패 요약 (성공 시 null)
 * @author Resilience Team
 * @since 1.0.0
 */
public record RetryAttempt(
    int attemptNumber,
    Instant timestamp,
    long delayMs,
    boolean withinBudget,
    boolean success,
    String error
) {

    /**
     * 지연 시간을 채운 복사본 생성.
     */
    public RetryAttempt withDelay(long delayMs, boolean withinBudget) {
        return new RetryAttempt(attemptNumber, timestamp, delayMs, withinBudget, success, error);
    }
}
