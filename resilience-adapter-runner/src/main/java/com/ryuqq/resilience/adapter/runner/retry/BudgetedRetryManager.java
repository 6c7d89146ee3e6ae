package com.ryuqq.resilience.adapter.runner.retry;

import com.ryuqq.resilience.core.exception.RetryBudgetExceededException;
import com.ryuqq.resilience.core.model.DependencyName;
import com.ryuqq.resilience.core.model.IdempotencyKey;
import com.ryuqq.resilience.core.model.StatusCodeProvider;
import com.ryuqq.resilience.core.protection.RetryAttempt;
import com.ryuqq.resilience.core.protection.RetryBudgetStats;
import com.ryuqq.resilience.core.protection.RetryConfig;
import com.ryuqq.resilience.core.protection.RetryManager;
import com.ryuqq.resilience.core.protection.RetryStats;
import com.ryuqq.resilience.core.protection.TimeoutPolicy;
import com.ryuqq.resilience.core.spi.IdempotencyRecord;
import com.ryuqq.resilience.core.spi.IdempotencyStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 재시도 예산과 멱등성 캐시를 갖춘 RetryManager.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * executeWithRetry(work, key, retryOnStatus)
 *   ↓
 * 1. key가 있고 유효한 멱등성 레코드가 있으면 캐시 값 반환 (작업 미실행)
 *   ↓
 * 2. RetryBudget에 호출 1건 기록
 *   ↓
 * For attempt = 0..maxRetries:
 *   a. attempt &gt; 0이면 RetryBudget 확인 (초과 시 RetryBudgetExceededException)
 *      → backoff 계산 → sleep
 *   b. TimeoutPolicy 값으로 마감 시간을 두고 작업 실행 (시도마다 새 마감)
 *   c. 성공 → 멱등성 레코드 저장 → 반환
 *      결과가 재시도 대상 상태 코드이고 시도가 남았으면 재시도
 *   d. 실패 → 재시도 불가 오류이거나 마지막 시도면 원래 예외 전파
 * </pre>
 *
 * <p>모든 시도의 경과 시간은 TimeoutPolicy에 기록됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class BudgetedRetryManager implements RetryManager {

    private static final Logger log = LoggerFactory.getLogger(BudgetedRetryManager.class);

    static final int RECENT_ATTEMPTS_LIMIT = 20;

    private final DependencyName name;
    private final RetryConfig config;
    private final TimeoutPolicy timeoutPolicy;
    private final IdempotencyStore idempotencyStore;
    private final Clock clock;
    private final BackoffCalculator backoffCalculator;
    private final RetryBudget retryBudget;
    private final TimeLimitedInvoker invoker;
    private final Sleeper sleeper;

    private final AtomicLong totalExecutions = new AtomicLong();
    private final AtomicLong successfulExecutions = new AtomicLong();
    private final AtomicLong failedExecutions = new AtomicLong();
    private final AtomicLong idempotentHits = new AtomicLong();
    private final AtomicLong budgetRejections = new AtomicLong();

    private final ReentrantLock attemptsLock = new ReentrantLock();
    private final Deque<RetryAttempt> recentAttempts = new ArrayDeque<>();

    /**
     * 생성자 (시스템 시계, 공용 워커 풀, Thread.sleep 사용).
     *
     * @param name 의존성 이름
     * @param config 재시도 설정
     * @param timeoutPolicy 시도별 타임아웃 정책
     * @param idempotencyStore 멱등성 저장소
     */
    public BudgetedRetryManager(
        DependencyName name,
        RetryConfig config,
        TimeoutPolicy timeoutPolicy,
        IdempotencyStore idempotencyStore
    ) {
        this(name, config, timeoutPolicy, idempotencyStore, Clock.systemUTC(),
            new BackoffCalculator(config), TimeLimitedInvoker.shared(), Sleeper.THREAD_SLEEP);
    }

    /**
     * 생성자 (전체 주입).
     *
     * @param name 의존성 이름
     * @param config 재시도 설정
     * @param timeoutPolicy 시도별 타임아웃 정책
     * @param idempotencyStore 멱등성 저장소
     * @param clock 예산 윈도우와 시도 기록에 쓰는 시계
     * @param backoffCalculator 백오프 계산기
     * @param invoker 마감 시간 실행기
     * @param sleeper 재시도 대기
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public BudgetedRetryManager(
        DependencyName name,
        RetryConfig config,
        TimeoutPolicy timeoutPolicy,
        IdempotencyStore idempotencyStore,
        Clock clock,
        BackoffCalculator backoffCalculator,
        TimeLimitedInvoker invoker,
        Sleeper sleeper
    ) {
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (timeoutPolicy == null) {
            throw new IllegalArgumentException("timeoutPolicy cannot be null");
        }
        if (idempotencyStore == null) {
            throw new IllegalArgumentException("idempotencyStore cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        if (invoker == null) {
            throw new IllegalArgumentException("invoker cannot be null");
        }
        if (sleeper == null) {
            throw new IllegalArgumentException("sleeper cannot be null");
        }

        this.name = name;
        this.config = config;
        this.timeoutPolicy = timeoutPolicy;
        this.idempotencyStore = idempotencyStore;
        this.clock = clock;
        this.backoffCalculator = backoffCalculator;
        this.retryBudget = new RetryBudget(
            config.retryBudgetPercent(),
            config.budgetWindowSeconds(),
            config.minCallsBeforeEnforcement(),
            clock
        );
        this.invoker = invoker;
        this.sleeper = sleeper;
    }

    @Override
    public DependencyName getName() {
        return name;
    }

    @Override
    public <T> T executeWithRetry(Callable<T> work) throws Exception {
        return executeWithRetry(work, null, config.retryOnStatus());
    }

    @Override
    public <T> T executeWithRetry(Callable<T> work, IdempotencyKey idempotencyKey) throws Exception {
        return executeWithRetry(work, idempotencyKey, config.retryOnStatus());
    }

    @Override
    public <T> T executeWithRetry(
        Callable<T> work,
        IdempotencyKey idempotencyKey,
        Set<Integer> retryOnStatus
    ) throws Exception {
        if (work == null) {
            throw new IllegalArgumentException("work cannot be null");
        }
        Set<Integer> statuses = retryOnStatus != null ? retryOnStatus : config.retryOnStatus();
        totalExecutions.incrementAndGet();

        // 1. 멱등성 캐시 조회
        if (idempotencyKey != null) {
            Optional<IdempotencyRecord> cached = idempotencyStore.find(idempotencyKey);
            if (cached.isPresent()) {
                idempotentHits.incrementAndGet();
                successfulExecutions.incrementAndGet();
                log.debug("Idempotent hit: dependency={}, key={}", name, idempotencyKey.getValue());
                T value = cached.get().valueAs();
                return value;
            }
        }

        retryBudget.recordCall();

        Exception lastError = null;
        for (int attempt = 0; attempt <= config.maxRetries(); attempt++) {
            long delayMs = 0;
            if (attempt > 0) {
                // 2. 재시도 예산 확인
                if (!retryBudget.tryAcquireRetry()) {
                    budgetRejections.incrementAndGet();
                    failedExecutions.incrementAndGet();
                    RetryBudgetStats budget = retryBudget.snapshot();
                    log.warn("Retry budget exceeded: dependency={}, retryRate={}%, budget={}%",
                        name, budget.retryRatePercent(), budget.budgetPercent());
                    remember(new RetryAttempt(attempt, clock.instant(), 0, false, false, summarize(lastError)));
                    throw new RetryBudgetExceededException(
                        name.getValue(), budget.retryRatePercent(), budget.budgetPercent(), lastError
                    );
                }
                delayMs = backoffCalculator.calculate(attempt);
                log.debug("Retrying: dependency={}, attempt={}, delayMs={}", name, attempt, delayMs);
                sleeper.sleep(delayMs);
            }

            // 3. 시도별 마감 시간으로 실행
            long timeoutMs = timeoutPolicy.getTimeoutMs();
            long startNanos = System.nanoTime();
            try {
                T result = invoker.invoke(work, timeoutMs);
                timeoutPolicy.recordLatency(elapsedMs(startNanos));

                if (attempt < config.maxRetries() && RetryClassifier.isRetryableResult(result, statuses)) {
                    int status = ((StatusCodeProvider) result).statusCode();
                    remember(new RetryAttempt(attempt, clock.instant(), delayMs, true, false, "status " + status));
                    lastError = null;
                    continue;
                }

                // 4. 성공 → 멱등성 레코드 저장
                remember(new RetryAttempt(attempt, clock.instant(), delayMs, true, true, null));
                if (idempotencyKey != null) {
                    idempotencyStore.save(idempotencyKey, result, Duration.ofSeconds(config.idempotencyTtlSeconds()));
                }
                successfulExecutions.incrementAndGet();
                return result;

            } catch (TimeoutException e) {
                timeoutPolicy.recordTimeout(elapsedMs(startNanos));
                lastError = e;
            } catch (Exception e) {
                timeoutPolicy.recordLatency(elapsedMs(startNanos));
                lastError = e;
            }

            // 5. 실패 분류
            remember(new RetryAttempt(attempt, clock.instant(), delayMs, true, false, summarize(lastError)));
            if (!RetryClassifier.isRetryable(lastError, statuses) || attempt == config.maxRetries()) {
                failedExecutions.incrementAndGet();
                if (attempt > 0) {
                    log.warn("Retries exhausted: dependency={}, attempts={}, error={}",
                        name, attempt + 1, summarize(lastError));
                }
                throw lastError;
            }
        }

        // maxRetries >= 0 이므로 도달하지 않음
        throw new IllegalStateException("Retry loop ended without result: " + name);
    }

    @Override
    public RetryConfig getConfig() {
        return config;
    }

    @Override
    public RetryStats getStats() {
        return new RetryStats(
            name.getValue(),
            totalExecutions.get(),
            successfulExecutions.get(),
            failedExecutions.get(),
            idempotentHits.get(),
            budgetRejections.get(),
            retryBudget.snapshot(),
            recentAttempts()
        );
    }

    private void remember(RetryAttempt attempt) {
        attemptsLock.lock();
        try {
            if (recentAttempts.size() == RECENT_ATTEMPTS_LIMIT) {
                recentAttempts.pollFirst();
            }
            recentAttempts.addLast(attempt);
        } finally {
            attemptsLock.unlock();
        }
    }

    private List<RetryAttempt> recentAttempts() {
        attemptsLock.lock();
        try {
            return new ArrayList<>(recentAttempts);
        } finally {
            attemptsLock.unlock();
        }
    }

    private static long elapsedMs(long startNanos) {
        return Duration.ofNanos(System.nanoTime() - startNanos).toMillis();
    }

    private static String summarize(Throwable error) {
        if (error == null) {
            return null;
        }
        return error.getClass().getSimpleName() + ": " + error.getMessage();
    }
}
