package com.ryuqq.resilience.adapter.runner.retry;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 마감 시간이 있는 작업 실행기.
 *
 * <p>작업을 데몬 워커 스레드에서 실행하고 {@code timeoutMs} 동안만 결과를 기다립니다.
 * 마감 시 {@code Future.cancel(true)}로 워커를 인터럽트하고 {@link TimeoutException}을 던집니다.</p>
 *
 * <p>작업이 던진 예외는 {@link ExecutionException}에서 꺼내 그대로 전파합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class TimeLimitedInvoker {

    private static final TimeLimitedInvoker SHARED = new TimeLimitedInvoker(
        Executors.newCachedThreadPool(daemonThreadFactory("resilience-worker-"))
    );

    private final ExecutorService workers;

    public TimeLimitedInvoker(ExecutorService workers) {
        if (workers == null) {
            throw new IllegalArgumentException("workers cannot be null");
        }
        this.workers = workers;
    }

    /**
     * 프로세스 공용 인스턴스 (데몬 스레드 풀).
     *
     * @return 공용 실행기
     */
    public static TimeLimitedInvoker shared() {
        return SHARED;
    }

    /**
     * 마감 시간 안에서 작업 실행.
     *
     * @param work 작업
     * @param timeoutMs 마감 시간 (밀리초, 양수)
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws TimeoutException 마감 시간 초과 시 (작업은 취소됨)
     * @throws InterruptedException 대기 중 인터럽트 시 (작업은 취소되고 플래그 복원)
     * @throws Exception 작업 예외
     */
    public <T> T invoke(Callable<T> work, long timeoutMs) throws Exception {
        if (timeoutMs <= 0) {
            throw new IllegalArgumentException("timeoutMs must be positive (current: " + timeoutMs + ")");
        }
        Future<T> future = workers.submit(work);
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TimeoutException("Call timed out after " + timeoutMs + "ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Exception) {
                throw (Exception) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    static ThreadFactory daemonThreadFactory(String prefix) {
        AtomicInteger sequence = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + sequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
