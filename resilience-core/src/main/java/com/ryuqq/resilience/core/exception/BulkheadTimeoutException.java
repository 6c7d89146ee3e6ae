package com.ryuqq.resilience.core.exception;

/**
 * 대기열에 들어간 호출이 제한 시간 안에 실행 슬롯을 얻지 못했음을 나타냅니다.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class BulkheadTimeoutException extends ResilienceException {

    public static final String ERROR_CODE = "BULKHEAD-TIMEOUT";

    private final long waitedMs;

    public BulkheadTimeoutException(String dependency, long waitedMs) {
        super(ERROR_CODE, dependency,
            "Bulkhead '" + dependency + "' queue wait timed out after " + waitedMs + "ms");
        this.waitedMs = waitedMs;
    }

    public long getWaitedMs() {
        return waitedMs;
    }
}
