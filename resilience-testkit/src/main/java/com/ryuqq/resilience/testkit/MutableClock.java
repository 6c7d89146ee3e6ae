package com.ryuqq.resilience.testkit;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Manually advanced {@link Clock} for time-dependent tests.
 *
 * <p>Components under test read time only through an injected {@link Clock}, so a test can move
 * time forward deterministically instead of sleeping.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * MutableClock clock = MutableClock.startingAt("2024-01-01T00:00:00Z");
 * CircuitBreaker cb = new ConsecutiveFailureCircuitBreaker(name, config, clock);
 * // ... trip the breaker ...
 * clock.advance(Duration.ofSeconds(60));
 * assertThat(cb.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
 * </pre>
 *
 * <p>Thread-safe: the current instant is held in an {@link AtomicReference}.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class MutableClock extends Clock {

    private final AtomicReference<Instant> now;
    private final ZoneId zone;

    /**
     * Creates a clock fixed at the given instant in UTC.
     *
     * @param start initial instant
     */
    public MutableClock(Instant start) {
        this(newReference(start), ZoneOffset.UTC);
    }

    private MutableClock(AtomicReference<Instant> now, ZoneId zone) {
        this.now = now;
        this.zone = zone;
    }

    private static AtomicReference<Instant> newReference(Instant start) {
        if (start == null) {
            throw new IllegalArgumentException("start cannot be null");
        }
        return new AtomicReference<>(start);
    }

    /**
     * Creates a clock starting at an ISO-8601 instant.
     *
     * @param isoInstant e.g. "2024-01-01T00:00:00Z"
     * @return new clock
     */
    public static MutableClock startingAt(String isoInstant) {
        return new MutableClock(Instant.parse(isoInstant));
    }

    /**
     * Creates a clock starting at the epoch.
     *
     * @return new clock
     */
    public static MutableClock atEpoch() {
        return new MutableClock(Instant.EPOCH);
    }

    /**
     * Moves the clock forward.
     *
     * @param duration amount to advance (must not be negative)
     */
    public void advance(Duration duration) {
        if (duration == null || duration.isNegative()) {
            throw new IllegalArgumentException("duration must not be null or negative");
        }
        now.updateAndGet(current -> current.plus(duration));
    }

    /**
     * Moves the clock forward by the given milliseconds.
     *
     * @param millis milliseconds to advance
     */
    public void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }

    /**
     * Moves the clock forward by the given seconds.
     *
     * @param seconds seconds to advance
     */
    public void advanceSeconds(long seconds) {
        advance(Duration.ofSeconds(seconds));
    }

    /**
     * Sets the clock to an absolute instant.
     *
     * @param instant new current instant
     */
    public void set(Instant instant) {
        if (instant == null) {
            throw new IllegalArgumentException("instant cannot be null");
        }
        now.set(instant);
    }

    @Override
    public ZoneId getZone() {
        return zone;
    }

    @Override
    public Clock withZone(ZoneId zone) {
        // shares the instant reference, so advance() is visible through both clocks
        return new MutableClock(now, zone);
    }

    @Override
    public Instant instant() {
        return now.get();
    }
}
