package com.ryuqq.resilience.adapter.runner.health;

import com.ryuqq.resilience.core.health.HealthCheckResult;
import com.ryuqq.resilience.core.health.HealthChecker;
import com.ryuqq.resilience.core.health.HealthProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 헬스 체크 주기 실행기.
 *
 * <p>등록된 (체커, 프로브) 쌍을 체커 설정의 {@code intervalSeconds}마다 실행합니다.
 * 최근 결과는 체커가 보관하며 {@link #latestResult(String)}로 조회합니다.</p>
 *
 * <p>한 체커의 예외가 다른 체커의 주기 실행을 멈추지 않습니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class HealthCheckScheduler {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckScheduler.class);
    private static final AtomicInteger SEQUENCE = new AtomicInteger();

    private final ScheduledExecutorService scheduler;
    private final Map<String, Registration> registrations = new ConcurrentHashMap<>();

    public HealthCheckScheduler() {
        this(Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "resilience-health-" + SEQUENCE.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }));
    }

    public HealthCheckScheduler(ScheduledExecutorService scheduler) {
        if (scheduler == null) {
            throw new IllegalArgumentException("scheduler cannot be null");
        }
        this.scheduler = scheduler;
    }

    /**
     * 체커 주기 실행 등록. 같은 이름이 있으면 기존 등록을 취소하고 교체합니다.
     *
     * @param checker 헬스 체커
     * @param probe 프로브
     */
    public void schedule(HealthChecker checker, HealthProbe probe) {
        if (checker == null) {
            throw new IllegalArgumentException("checker cannot be null");
        }
        if (probe == null) {
            throw new IllegalArgumentException("probe cannot be null");
        }
        long interval = checker.getConfig().intervalSeconds();
        ScheduledFuture<?> future = scheduler.scheduleWithFixedDelay(
            () -> runCheck(checker, probe), 0, interval, TimeUnit.SECONDS
        );
        Registration previous = registrations.put(checker.getName(), new Registration(checker, future));
        if (previous != null) {
            previous.future.cancel(false);
        }
        log.info("Health check scheduled: checker={}, type={}, intervalSeconds={}",
            checker.getName(), checker.getConfig().checkType(), interval);
    }

    /**
     * 등록 해제.
     *
     * @param name 체커 이름
     * @return 등록되어 있었으면 true
     */
    public boolean cancel(String name) {
        Registration removed = registrations.remove(name);
        if (removed == null) {
            return false;
        }
        removed.future.cancel(false);
        return true;
    }

    public Optional<HealthCheckResult> latestResult(String name) {
        Registration registration = registrations.get(name);
        return registration == null ? Optional.empty() : registration.checker.getLastResult();
    }

    /**
     * 스케줄러 종료.
     *
     * @throws InterruptedException 종료 대기 중 인터럽트 발생 시
     */
    public void shutdown() throws InterruptedException {
        registrations.clear();
        scheduler.shutdown();
        if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
            scheduler.shutdownNow();
        }
    }

    private void runCheck(HealthChecker checker, HealthProbe probe) {
        try {
            checker.check(probe);
        } catch (RuntimeException e) {
            // 다음 주기는 계속 실행
            log.error("Health check run failed: checker={}", checker.getName(), e);
        }
    }

    private static final class Registration {

        private final HealthChecker checker;
        private final ScheduledFuture<?> future;

        private Registration(HealthChecker checker, ScheduledFuture<?> future) {
            this.checker = checker;
            this.future = future;
        }
    }
}
