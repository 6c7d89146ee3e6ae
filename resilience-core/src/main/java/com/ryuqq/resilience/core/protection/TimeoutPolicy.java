package com.ryuqq.resilience.core.protection;

/**
 * Timeout Policy SPI.
 *
 * <p>작업 시도마다 적용할 타임아웃을 결정하여 무한 대기를 방지합니다.
 * 모든 완료된 시도의 지연 시간을 기록하면 구현체가 관측값으로 타임아웃을 조정할 수 있습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * long timeout = policy.getTimeoutMs();
 * long start = System.nanoTime();
 * try {
 *     Result result = future.get(timeout, TimeUnit.MILLISECONDS);
 *     policy.recordLatency(elapsedMs(start));
 *     return result;
 * } catch (TimeoutException e) {
 *     future.cancel(true);
 *     policy.recordTimeout(elapsedMs(start));
 *     throw e;
 * }
 * }</pre>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface TimeoutPolicy {

    /**
     * 시도당(per-attempt) 타임아웃 조회.
     *
     * @return 타임아웃 (밀리초), 0은 타임아웃 없음을 의미
     */
    long getTimeoutMs();

    /**
     * 완료된 시도의 지연 시간 기록 (성공/실패 무관).
     *
     * @param latencyMs 지연 시간 (밀리초)
     */
    void recordLatency(long latencyMs);

    /**
     * 타임아웃 발생 기록.
     *
     * @param elapsedMs 실제 경과 시간 (밀리초)
     */
    void recordTimeout(long elapsedMs);

    /**
     * 통계 스냅샷 조회.
     *
     * @return 통계
     */
    TimeoutStats getStats();
}
