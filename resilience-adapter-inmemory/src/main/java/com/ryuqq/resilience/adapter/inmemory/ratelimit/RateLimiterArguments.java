package com.ryuqq.resilience.adapter.inmemory.ratelimit;

import java.time.Clock;

/**
 * 레이트 리미터 공통 인자 검증.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
final class RateLimiterArguments {

    private RateLimiterArguments() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    static void validate(String name, int capacity, Clock clock) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive (current: " + capacity + ")");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
    }
}
