package com.ryuqq.resilience.adapter.inmemory.circuitbreaker;

import com.ryuqq.resilience.core.exception.CircuitOpenException;
import com.ryuqq.resilience.core.model.DependencyName;
import com.ryuqq.resilience.core.protection.CircuitBreaker;
import com.ryuqq.resilience.core.protection.CircuitBreakerConfig;
import com.ryuqq.resilience.core.protection.CircuitBreakerState;
import com.ryuqq.resilience.core.protection.CircuitBreakerStats;
import com.ryuqq.resilience.core.protection.CircuitBreakerTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.Callable;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 연속 실패 기반 Circuit Breaker.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED ──(연속 실패 ≥ failureThreshold)──→ OPEN
 * OPEN ──(timeoutSeconds 경과, 다음 호출/조회 시 지연 평가)──→ HALF_OPEN
 * HALF_OPEN ──(연속 성공 ≥ successThreshold)──→ CLOSED
 * HALF_OPEN ──(실패 1회)──→ OPEN
 * </pre>
 *
 * <p><strong>동시성:</strong> 상태와 카운터는 하나의 {@link ReentrantLock}으로 보호됩니다.
 * 작업 실행 중에는 락을 잡지 않으므로 보호 대상 호출끼리는 직렬화되지 않습니다.
 * HALF_OPEN 상태에서 동시 프로브 수는 제한하지 않습니다.</p>
 *
 * <p>OPEN → HALF_OPEN 전환을 위한 타이머 스레드는 없습니다. 경과 시간은
 * {@link #tryAcquire()}와 {@link #getState()}에서 주입된 {@link Clock}으로 확인합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class ConsecutiveFailureCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(ConsecutiveFailureCircuitBreaker.class);

    private final DependencyName name;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    private CircuitBreakerState state = CircuitBreakerState.CLOSED;
    private int failureCount;
    private int successCount;
    private Instant lastFailureTime;
    private Instant openedAt;

    private long totalCalls;
    private long successfulCalls;
    private long failedCalls;
    private long rejectedCalls;

    /**
     * 시스템 UTC 시계로 생성.
     *
     * @param name 의존성 이름
     * @param config 설정
     */
    public ConsecutiveFailureCircuitBreaker(DependencyName name, CircuitBreakerConfig config) {
        this(name, config, Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param name 의존성 이름
     * @param config 설정
     * @param clock 시간 소스
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ConsecutiveFailureCircuitBreaker(DependencyName name, CircuitBreakerConfig config, Clock clock) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.name = name;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public DependencyName getName() {
        return name;
    }

    /**
     * {@inheritDoc}
     *
     * <p>expectedExceptions에 해당하지 않는 예외는 상태를 바꾸지 않고 그대로 전파됩니다.</p>
     */
    @Override
    public <T> T call(Callable<T> work) throws Exception {
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        if (!tryAcquire()) {
            throw new CircuitOpenException(name.getValue(), retryAfter());
        }
        T result;
        try {
            result = work.call();
        } catch (Exception e) {
            recordFailure(e);
            throw e;
        }
        recordSuccess();
        return result;
    }

    @Override
    public boolean tryAcquire() {
        lock.lock();
        try {
            totalCalls++;
            maybeHalfOpen();
            if (state == CircuitBreakerState.OPEN) {
                rejectedCalls++;
                log.debug("Circuit breaker '{}' rejected call (OPEN until {})", name, retryAfterLocked());
                return false;
            }
            return true;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordSuccess() {
        lock.lock();
        try {
            successfulCalls++;
            switch (state) {
                case CLOSED -> failureCount = 0;
                case HALF_OPEN -> {
                    successCount++;
                    if (successCount >= config.successThreshold()) {
                        moveTo(CircuitBreakerState.CLOSED);
                        log.info("Circuit breaker '{}' CLOSED after {} successful probes",
                            name, config.successThreshold());
                    }
                }
                case OPEN -> {
                    // 거부되기 전에 시작된 호출의 늦은 성공은 상태에 반영하지 않는다
                }
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void recordFailure(Throwable throwable) {
        if (throwable != null && !config.expectedExceptions().test(throwable)) {
            return;
        }
        lock.lock();
        try {
            failedCalls++;
            lastFailureTime = clock.instant();
            switch (state) {
                case CLOSED -> {
                    failureCount++;
                    if (failureCount >= config.failureThreshold()) {
                        moveTo(CircuitBreakerState.OPEN);
                        log.warn("Circuit breaker '{}' OPEN after {} consecutive failures (last: {})",
                            name, failureCount, describe(throwable));
                    }
                }
                case HALF_OPEN -> {
                    failureCount++;
                    moveTo(CircuitBreakerState.OPEN);
                    log.warn("Circuit breaker '{}' re-OPEN: probe failed ({})", name, describe(throwable));
                }
                case OPEN -> failureCount++;
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CircuitBreakerState getState() {
        lock.lock();
        try {
            maybeHalfOpen();
            return state;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public CircuitBreakerStats getStats() {
        lock.lock();
        try {
            maybeHalfOpen();
            return new CircuitBreakerStats(
                name.getValue(),
                state,
                failureCount,
                successCount,
                lastFailureTime,
                openedAt,
                totalCalls,
                successfulCalls,
                failedCalls,
                rejectedCalls
            );
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void reset() {
        lock.lock();
        try {
            CircuitBreakerState previous = state;
            state = CircuitBreakerState.CLOSED;
            failureCount = 0;
            successCount = 0;
            openedAt = null;
            log.info("Circuit breaker '{}' manually reset ({} → CLOSED)", name, previous);
        } finally {
            lock.unlock();
        }
    }

    private Instant retryAfter() {
        lock.lock();
        try {
            return retryAfterLocked();
        } finally {
            lock.unlock();
        }
    }

    private Instant retryAfterLocked() {
        return openedAt == null ? clock.instant() : openedAt.plusSeconds(config.timeoutSeconds());
    }

    /**
     * OPEN 상태에서 타임아웃이 지났으면 HALF_OPEN으로 전환 (락 보유 상태에서 호출).
     */
    private void maybeHalfOpen() {
        if (state != CircuitBreakerState.OPEN || openedAt == null) {
            return;
        }
        Duration elapsed = Duration.between(openedAt, clock.instant());
        if (elapsed.getSeconds() >= config.timeoutSeconds()) {
            moveTo(CircuitBreakerState.HALF_OPEN);
            log.info("Circuit breaker '{}' HALF_OPEN after {}s in OPEN", name, elapsed.getSeconds());
        }
    }

    /**
     * 전이 규칙 검증 후 상태 변경과 카운터 초기화 (락 보유 상태에서 호출).
     */
    private void moveTo(CircuitBreakerState next) {
        CircuitBreakerState previous = state;
        state = CircuitBreakerTransition.transition(previous, next);
        if (previous == CircuitBreakerState.HALF_OPEN) {
            successCount = 0;
        }
        switch (next) {
            case CLOSED -> {
                failureCount = 0;
                openedAt = null;
            }
            case OPEN -> openedAt = clock.instant();
            case HALF_OPEN -> successCount = 0;
        }
    }

    private static String describe(Throwable throwable) {
        return throwable == null ? "n/a" : throwable.getClass().getSimpleName() + ": " + throwable.getMessage();
    }
}
