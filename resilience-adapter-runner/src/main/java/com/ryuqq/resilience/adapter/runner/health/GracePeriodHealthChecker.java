package com.ryuqq.resilience.adapter.runner.health;

import com.ryuqq.resilience.adapter.runner.retry.TimeLimitedInvoker;
import com.ryuqq.resilience.core.health.HealthCheckConfig;
import com.ryuqq.resilience.core.health.HealthCheckResult;
import com.ryuqq.resilience.core.health.HealthChecker;
import com.ryuqq.resilience.core.health.HealthProbe;
import com.ryuqq.resilience.core.health.HealthStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.ReentrantLock;

/**
 * 연속 실패 유예(grace period)를 적용하는 헬스 체커.
 *
 * <p><strong>상태 규칙:</strong></p>
 * <ul>
 *   <li>프로브 실패 → 연속 실패 수 +1, {@code gracePeriodFailures} 이상이면 UNHEALTHY</li>
 *   <li>유예 중인 실패는 이전 보고 상태를 유지 (첫 검사 전에는 HEALTHY로 간주)</li>
 *   <li>프로브 성공 1회 → 연속 실패 0, 즉시 HEALTHY</li>
 * </ul>
 *
 * <p>프로브는 {@code timeoutSeconds} 안에 끝나야 하며, 초과하면 실패로 처리합니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class GracePeriodHealthChecker implements HealthChecker {

    private static final Logger log = LoggerFactory.getLogger(GracePeriodHealthChecker.class);

    private final String name;
    private final HealthCheckConfig config;
    private final Clock clock;
    private final TimeLimitedInvoker invoker;
    private final ReentrantLock lock = new ReentrantLock();

    private HealthStatus status = HealthStatus.UNKNOWN;
    private int consecutiveFailures;
    private HealthCheckResult lastResult;

    public GracePeriodHealthChecker(String name, HealthCheckConfig config) {
        this(name, config, Clock.systemUTC(), TimeLimitedInvoker.shared());
    }

    public GracePeriodHealthChecker(String name, HealthCheckConfig config, Clock clock, TimeLimitedInvoker invoker) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (invoker == null) {
            throw new IllegalArgumentException("invoker cannot be null");
        }
        this.name = name;
        this.config = config;
        this.clock = clock;
        this.invoker = invoker;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public HealthCheckConfig getConfig() {
        return config;
    }

    @Override
    public HealthCheckResult check(HealthProbe probe) {
        if (probe == null) {
            throw new IllegalArgumentException("probe cannot be null");
        }

        long startNanos = System.nanoTime();
        Map<String, Object> details = null;
        String error = null;
        try {
            details = invoker.invoke(probe::probe, Duration.ofSeconds(config.timeoutSeconds()).toMillis());
        } catch (TimeoutException e) {
            error = "Health check timed out after " + config.timeoutSeconds() + "s";
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            error = "Health check interrupted";
        } catch (Exception e) {
            error = e.getClass().getSimpleName() + ": " + e.getMessage();
        }
        long latencyMs = Duration.ofNanos(System.nanoTime() - startNanos).toMillis();

        lock.lock();
        try {
            HealthStatus previous = status;
            if (error == null) {
                consecutiveFailures = 0;
                status = HealthStatus.HEALTHY;
            } else {
                consecutiveFailures++;
                if (consecutiveFailures >= config.gracePeriodFailures()) {
                    status = HealthStatus.UNHEALTHY;
                } else if (status == HealthStatus.UNKNOWN) {
                    status = HealthStatus.HEALTHY;
                }
                log.debug("Health probe failed: checker={}, type={}, consecutiveFailures={}, error={}",
                    name, config.checkType(), consecutiveFailures, error);
            }
            if (previous != status && previous != HealthStatus.UNKNOWN) {
                if (status == HealthStatus.UNHEALTHY) {
                    log.warn("Health status changed: checker={}, type={}, {} -> {}",
                        name, config.checkType(), previous, status);
                } else {
                    log.info("Health status changed: checker={}, type={}, {} -> {}",
                        name, config.checkType(), previous, status);
                }
            }
            lastResult = new HealthCheckResult(
                config.checkType(),
                status,
                latencyMs,
                consecutiveFailures,
                clock.instant(),
                details,
                error
            );
            return lastResult;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Optional<HealthCheckResult> getLastResult() {
        lock.lock();
        try {
            return Optional.ofNullable(lastResult);
        } finally {
            lock.unlock();
        }
    }

    /**
     * 현재 보고 상태.
     *
     * @return 상태 (검사 전이면 UNKNOWN)
     */
    public HealthStatus getStatus() {
        lock.lock();
        try {
            return status;
        } finally {
            lock.unlock();
        }
    }

    public boolean isHealthy() {
        return getStatus() == HealthStatus.HEALTHY;
    }
}
