package com.ryuqq.resilience.adapter.runner.retry;

/**
 * 재시도 대기.
 *
 * @author Resilience Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD_SLEEP = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
