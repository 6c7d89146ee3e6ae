package com.ryuqq.resilience.adapter.runner.fallback;

import com.ryuqq.resilience.core.exception.AllFallbacksExhaustedException;
import com.ryuqq.resilience.core.fallback.FallbackChain;
import com.ryuqq.resilience.core.fallback.FallbackLevel;
import com.ryuqq.resilience.core.fallback.FallbackResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * {@link FallbackLevel} 순서대로 핸들러를 시도하는 Fallback 체인.
 *
 * <p><strong>처리 흐름:</strong></p>
 * <pre>
 * PRIMARY → REPLICA → DISTRIBUTED_CACHE → LOCAL_CACHE → DEFAULT
 * (등록된 레벨만 실행, 첫 성공에서 중단)
 * </pre>
 *
 * <p>모든 핸들러가 실패하면 각 레벨의 예외를 suppressed로 담은
 * {@link AllFallbacksExhaustedException}을 던집니다. DEFAULT 핸들러가 실패한 경우도 같습니다.</p>
 *
 * <p>핸들러가 {@link InterruptedException}을 던지면 인터럽트 플래그를 복원하고 남은 레벨을 시도하지 않은 채
 * 같은 예외로 종료합니다.</p>
 *
 * <p>PRIMARY 이외 레벨의 결과는 degraded로 표시하고 WARN으로 기록합니다.</p>
 *
 * @param <T> 결과 타입
 * @author Resilience Team
 * @since 1.0.0
 */
public class OrderedFallbackChain<T> implements FallbackChain<T> {

    private static final Logger log = LoggerFactory.getLogger(OrderedFallbackChain.class);

    private final String name;
    private final Map<FallbackLevel, Callable<T>> handlers;

    public OrderedFallbackChain(String name) {
        this(name, new EnumMap<>(FallbackLevel.class));
    }

    private OrderedFallbackChain(String name, Map<FallbackLevel, Callable<T>> handlers) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        this.name = name;
        this.handlers = handlers;
    }

    @Override
    public synchronized FallbackChain<T> registerHandler(FallbackLevel level, Callable<T> handler) {
        if (level == null) {
            throw new IllegalArgumentException("level cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
        handlers.put(level, handler);
        return this;
    }

    @Override
    public synchronized FallbackChain<T> withPrimary(Callable<T> primary) {
        if (primary == null) {
            throw new IllegalArgumentException("primary cannot be null");
        }
        Map<FallbackLevel, Callable<T>> copy = new EnumMap<>(FallbackLevel.class);
        copy.putAll(handlers);
        copy.put(FallbackLevel.PRIMARY, primary);
        return new OrderedFallbackChain<>(name, copy);
    }

    @Override
    public FallbackResult<T> execute() {
        Map<FallbackLevel, Callable<T>> snapshot;
        synchronized (this) {
            snapshot = new EnumMap<>(FallbackLevel.class);
            snapshot.putAll(handlers);
        }

        List<String> attempted = new ArrayList<>();
        List<Exception> failures = new ArrayList<>();

        // EnumMap은 선언 순서로 순회
        for (Map.Entry<FallbackLevel, Callable<T>> entry : snapshot.entrySet()) {
            FallbackLevel level = entry.getKey();
            attempted.add(level.name());
            try {
                T value = entry.getValue().call();
                FallbackResult<T> result = FallbackResult.of(value, level);
                if (result.degraded()) {
                    log.warn("Degraded response: chain={}, level={}, failedLevels={}",
                        name, level, attempted.subList(0, attempted.size() - 1));
                }
                return result;
            } catch (InterruptedException e) {
                // 인터럽트는 다음 레벨로 넘기지 않고 체인 종료
                Thread.currentThread().interrupt();
                failures.add(e);
                log.warn("Fallback chain interrupted: chain={}, level={}", name, level);
                throw exhausted(attempted, failures);
            } catch (Exception e) {
                log.debug("Fallback level failed: chain={}, level={}, error={}", name, level, e.toString());
                failures.add(e);
            }
        }

        log.error("All fallbacks exhausted: chain={}, attemptedLevels={}", name, attempted);
        throw exhausted(attempted, failures);
    }

    private static AllFallbacksExhaustedException exhausted(List<String> attempted, List<Exception> failures) {
        AllFallbacksExhaustedException exhausted = new AllFallbacksExhaustedException(attempted);
        failures.forEach(exhausted::addSuppressed);
        return exhausted;
    }

    public String getName() {
        return name;
    }

    /**
     * 등록된 레벨 (선언 순서).
     *
     * @return 레벨 목록
     */
    public synchronized List<FallbackLevel> getRegisteredLevels() {
        return new ArrayList<>(handlers.keySet());
    }
}
