package com.ryuqq.resilience.core.exception;

/**
 * 보호 계층이 의도적으로 호출을 거부했음을 나타내는 예외의 공통 부모.
 *
 * <p>이 계열의 예외는 다운스트림 자체의 실패와 구분되어야 하므로 절대 삼키지 않고
 * 호출자에게 그대로 전달됩니다. 작업(unit of work)이 던진 예외는 이 타입으로 감싸지 않습니다.</p>
 *
 * <p><strong>에러 코드:</strong></p>
 * <ul>
 *   <li>CB-OPEN: {@link CircuitOpenException}</li>
 *   <li>RETRY-BUDGET: {@link RetryBudgetExceededException}</li>
 *   <li>BULKHEAD-FULL: {@link BulkheadFullException}</li>
 *   <li>BULKHEAD-TIMEOUT: {@link BulkheadTimeoutException}</li>
 *   <li>RATE-LIMIT: {@link RateLimitExceededException}</li>
 *   <li>FALLBACK-EXHAUSTED: {@link AllFallbacksExhaustedException}</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public abstract class ResilienceException extends RuntimeException {

    private final String errorCode;
    private final String dependency;

    protected ResilienceException(String errorCode, String dependency, String message) {
        this(errorCode, dependency, message, null);
    }

    protected ResilienceException(String errorCode, String dependency, String message, Throwable cause) {
        super(message, cause);
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        this.errorCode = errorCode;
        this.dependency = dependency;
    }

    /**
     * 에러 코드 조회.
     *
     * @return 에러 코드 (예: CB-OPEN)
     */
    public String getErrorCode() {
        return errorCode;
    }

    /**
     * 거부가 발생한 의존성 이름.
     *
     * @return 의존성 이름 (알 수 없으면 null)
     */
    public String getDependency() {
        return dependency;
    }
}
