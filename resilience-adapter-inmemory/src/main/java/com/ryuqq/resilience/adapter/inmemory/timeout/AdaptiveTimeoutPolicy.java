package com.ryuqq.resilience.adapter.inmemory.timeout;

import com.ryuqq.resilience.core.protection.TimeoutConfig;
import com.ryuqq.resilience.core.protection.TimeoutPolicy;
import com.ryuqq.resilience.core.protection.TimeoutStats;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 관측된 P95 지연 시간으로 호출 타임아웃을 산출하는 {@link TimeoutPolicy}.
 *
 * <pre>
 * samples &lt; minSamples 또는 adaptiveEnabled=false → defaultTimeoutMs
 * 그 외 → clamp(P95 × p95Multiplier, minTimeoutMs, maxTimeoutMs)
 * </pre>
 *
 * <p>성공/실패와 관계없이 모든 시도의 실제 소요 시간이 샘플로 들어옵니다. 타임아웃으로 끝난
 * 시도는 경과 시간이 샘플로 기록되므로 느려진 의존성에 맞춰 타임아웃이 늘어납니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class AdaptiveTimeoutPolicy implements TimeoutPolicy {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveTimeoutPolicy.class);

    private final String name;
    private final TimeoutConfig config;
    private final PercentileTracker tracker;
    private final AtomicLong timeoutCount = new AtomicLong();

    /**
     * 생성자.
     *
     * @param name 의존성 이름
     * @param config 설정
     */
    public AdaptiveTimeoutPolicy(String name, TimeoutConfig config) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        this.name = name;
        this.config = config;
        this.tracker = new PercentileTracker(config.windowSize());
    }

    @Override
    public long getTimeoutMs() {
        return computeTimeout(tracker.snapshot());
    }

    @Override
    public void recordLatency(long latencyMs) {
        tracker.record(latencyMs);
    }

    @Override
    public void recordTimeout(long elapsedMs) {
        long count = timeoutCount.incrementAndGet();
        tracker.record(elapsedMs);
        log.warn("Call to '{}' timed out after {}ms (timeouts so far: {})", name, elapsedMs, count);
    }

    @Override
    public TimeoutStats getStats() {
        PercentileTracker.Snapshot snapshot = tracker.snapshot();
        return new TimeoutStats(
            name,
            config.adaptiveEnabled(),
            computeTimeout(snapshot),
            snapshot.size(),
            snapshot.valueAt(50.0),
            snapshot.valueAt(95.0),
            snapshot.valueAt(99.0),
            snapshot.valueAt(99.9),
            timeoutCount.get()
        );
    }

    public TimeoutConfig getConfig() {
        return config;
    }

    private long computeTimeout(PercentileTracker.Snapshot snapshot) {
        if (!config.adaptiveEnabled() || snapshot.size() < config.minSamples()) {
            return config.defaultTimeoutMs();
        }
        long scaled = Math.round(snapshot.valueAt(95.0) * config.p95Multiplier());
        return Math.max(config.minTimeoutMs(), Math.min(config.maxTimeoutMs(), scaled));
    }
}
