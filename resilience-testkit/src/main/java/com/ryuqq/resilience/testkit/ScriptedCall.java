package com.ryuqq.resilience.testkit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Scripted unit of work for resilience tests.
 *
 * <p>Fails a fixed number of times with a supplied exception, then returns a value.
 * Every invocation is counted so tests can assert how often the protected work actually ran.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * ScriptedCall&lt;String&gt; call = ScriptedCall.failingTimes(2, () -&gt; new IOException("reset"), "ok");
 * String result = retryManager.executeWithRetry(call);
 * assertThat(call.invocations()).isEqualTo(3);
 * </pre>
 *
 * @param <T> result type
 * @author Resilience Team
 * @since 1.0.0
 */
public final class ScriptedCall<T> implements Callable<T> {

    private final int failuresBeforeSuccess;
    private final Supplier<? extends Exception> failure;
    private final T result;
    private final AtomicInteger invocations = new AtomicInteger();
    private final List<Long> invocationThreads = Collections.synchronizedList(new ArrayList<>());

    private ScriptedCall(int failuresBeforeSuccess, Supplier<? extends Exception> failure, T result) {
        if (failuresBeforeSuccess < 0) {
            throw new IllegalArgumentException(
                "failuresBeforeSuccess cannot be negative (current: " + failuresBeforeSuccess + ")"
            );
        }
        this.failuresBeforeSuccess = failuresBeforeSuccess;
        this.failure = failure;
        this.result = result;
    }

    /**
     * Always succeeds with the given value.
     *
     * @param result value to return
     * @param <T> result type
     * @return scripted call
     */
    public static <T> ScriptedCall<T> succeeding(T result) {
        return new ScriptedCall<>(0, null, result);
    }

    /**
     * Fails {@code times} times, then succeeds.
     *
     * @param times number of failures before success
     * @param failure exception factory (a fresh exception per failure)
     * @param result value returned afterwards
     * @param <T> result type
     * @return scripted call
     */
    public static <T> ScriptedCall<T> failingTimes(int times, Supplier<? extends Exception> failure, T result) {
        if (failure == null) {
            throw new IllegalArgumentException("failure cannot be null");
        }
        return new ScriptedCall<>(times, failure, result);
    }

    /**
     * Never succeeds.
     *
     * @param failure exception factory
     * @param <T> result type
     * @return scripted call
     */
    public static <T> ScriptedCall<T> alwaysFailing(Supplier<? extends Exception> failure) {
        return failingTimes(Integer.MAX_VALUE, failure, null);
    }

    @Override
    public T call() throws Exception {
        int attempt = invocations.incrementAndGet();
        invocationThreads.add(Thread.currentThread().getId());
        if (attempt <= failuresBeforeSuccess) {
            throw failure.get();
        }
        return result;
    }

    /**
     * Number of times the work has been invoked.
     *
     * @return invocation count
     */
    public int invocations() {
        return invocations.get();
    }

    /**
     * Thread ids of each invocation, in order.
     *
     * @return thread ids
     */
    public List<Long> invocationThreads() {
        synchronized (invocationThreads) {
            return List.copyOf(invocationThreads);
        }
    }
}
