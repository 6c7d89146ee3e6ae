package com.ryuqq.resilience.adapter.inmemory.ratelimit;

import com.ryuqq.resilience.core.protection.RateLimiter;
import com.ryuqq.resilience.testkit.contract.AbstractRateLimiterContractTest;

import java.time.Clock;
import java.time.Duration;

/**
 * Contract Tests for {@link LeakyBucketRateLimiter}.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
class LeakyBucketRateLimiterContractTest extends AbstractRateLimiterContractTest {

    @Override
    protected RateLimiter createRateLimiter(String name, int capacity, Clock clock) {
        return new LeakyBucketRateLimiter(name, capacity, 4.0, clock);
    }

    @Override
    protected Duration recoveryTime() {
        return Duration.ofMillis(250);
    }
}
