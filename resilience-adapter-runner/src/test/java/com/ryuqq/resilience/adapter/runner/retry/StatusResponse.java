package com.ryuqq.resilience.adapter.runner.retry;

import com.ryuqq.resilience.core.model.StatusCodeProvider;

/**
 * 상태 코드를 가진 테스트용 응답.
 */
public record StatusResponse(int statusCode) implements StatusCodeProvider {
}
