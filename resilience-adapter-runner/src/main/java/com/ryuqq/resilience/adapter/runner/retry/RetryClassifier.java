package com.ryuqq.resilience.adapter.runner.retry;

import com.ryuqq.resilience.core.exception.ResilienceException;
import com.ryuqq.resilience.core.model.StatusCodeProvider;

import java.io.IOException;
import java.util.Set;
import java.util.concurrent.TimeoutException;

/**
 * 재시도 가능 여부 분류기.
 *
 * <ul>
 *   <li>정책 예외({@link ResilienceException}), 인터럽트: 재시도 안 함</li>
 *   <li>{@link TimeoutException}, {@link IOException}: 재시도</li>
 *   <li>상태 코드를 가진 오류: 재시도 대상 집합에 있을 때만 재시도</li>
 *   <li>그 외 예외: 재시도</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class RetryClassifier {

    private RetryClassifier() {
    }

    public static boolean isRetryable(Throwable error, Set<Integer> retryOnStatus) {
        if (error == null) {
            return false;
        }
        if (error instanceof ResilienceException || error instanceof InterruptedException) {
            return false;
        }
        if (error instanceof TimeoutException || error instanceof IOException) {
            return true;
        }
        if (error instanceof StatusCodeProvider) {
            return retryOnStatus.contains(((StatusCodeProvider) error).statusCode());
        }
        return error instanceof Exception;
    }

    /**
     * 정상 반환된 결과가 재시도 대상 상태 코드를 담고 있는지 여부.
     *
     * @param result 결과
     * @param retryOnStatus 재시도 대상 상태 코드
     * @return 재시도 대상이면 true
     */
    public static boolean isRetryableResult(Object result, Set<Integer> retryOnStatus) {
        return result instanceof StatusCodeProvider
            && retryOnStatus.contains(((StatusCodeProvider) result).statusCode());
    }
}
