package com.ryuqq.resilience.core.protection;

/**
 * Bulkhead 통계 스냅샷.
 *
 * @param name 의존성 이름
 * @param maxConcurrentCalls 최대 동시 실행 수
 * @param maxQueueSize 최대 대기열 크기
 * @param activeCalls 현재 실행 중인 호출 수
 * @param queuedCalls 현재 대기 중인 호출 수
 * @param peakActiveCalls 관측된 최대 동시 실행 수
 * @param totalCalls 진입 시도 전체 수
 * @param successfulCalls 성공 호출 수
 * @param failedCalls 작업이 예외로 끝난 호출 수
 * @param rejectedCalls 가득 차서 거부된 호출 수
 * @param timedOutCalls 대기 시간 초과 호출 수
 * @param successRatePercent 성공률 (%)
 * @param rejectionRatePercent 거부율 (%, 시간 초과 포함)
 * @author Resilience Team
 * @since 1.0.0
 */
public record BulkheadStats(
    String name,
    int maxConcurrentCalls,
    int maxQueueSize,
    int activeCalls,
    int queuedCalls,
    int peakActiveCalls,
    long totalCalls,
    long successfulCalls,
    long failedCalls,
    long rejectedCalls,
    long timedOutCalls,
    double successRatePercent,
    double rejectionRatePercent
) {

    /**
     * 카운터로부터 비율을 계산하여 스냅샷 생성.
     */
    public static BulkheadStats of(
        String name,
        BulkheadConfig config,
        int activeCalls,
        int queuedCalls,
        int peakActiveCalls,
        long totalCalls,
        long successfulCalls,
        long failedCalls,
        long rejectedCalls,
        long timedOutCalls
    ) {
        double successRate = totalCalls > 0 ? successfulCalls * 100.0 / totalCalls : 0.0;
        double rejectionRate = totalCalls > 0 ? (rejectedCalls + timedOutCalls) * 100.0 / totalCalls : 0.0;
        return new BulkheadStats(
            name,
            config.maxConcurrentCalls(),
            config.maxQueueSize(),
            activeCalls,
            queuedCalls,
            peakActiveCalls,
            totalCalls,
            successfulCalls,
            failedCalls,
            rejectedCalls,
            timedOutCalls,
            successRate,
            rejectionRate
        );
    }
}
