package com.ryuqq.resilience.adapter.inmemory.store;

import com.ryuqq.resilience.core.model.IdempotencyKey;
import com.ryuqq.resilience.core.spi.IdempotencyRecord;
import com.ryuqq.resilience.core.spi.IdempotencyStore;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of {@link IdempotencyStore}.
 *
 * <p>Results are kept in a {@link ConcurrentHashMap} keyed by {@link IdempotencyKey}.
 * Expired records are removed lazily when a lookup finds them, or in bulk by
 * {@link #evictExpired()}.</p>
 *
 * <p><strong>Thread Safety:</strong></p>
 * <ul>
 *   <li>Lazy removal uses {@link ConcurrentHashMap#remove(Object, Object)} so a record saved
 *       concurrently under the same key is never removed by mistake</li>
 *   <li>Concurrent first calls with the same key are not coalesced: both may run the work,
 *       and the later save wins</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public class InMemoryIdempotencyStore implements IdempotencyStore {

    private final ConcurrentHashMap<IdempotencyKey, IdempotencyRecord> records = new ConcurrentHashMap<>();
    private final Clock clock;

    /**
     * Creates a store backed by the system UTC clock.
     */
    public InMemoryIdempotencyStore() {
        this(Clock.systemUTC());
    }

    /**
     * Creates a store reading time from the given clock.
     *
     * @param clock time source
     */
    public InMemoryIdempotencyStore(Clock clock) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.clock = clock;
    }

    @Override
    public Optional<IdempotencyRecord> find(IdempotencyKey key) {
        if (key == null) {
            throw new IllegalArgumentException("IdempotencyKey cannot be null");
        }
        IdempotencyRecord record = records.get(key);
        if (record == null) {
            return Optional.empty();
        }
        if (record.isExpired(clock.instant())) {
            records.remove(key, record);
            return Optional.empty();
        }
        return Optional.of(record);
    }

    @Override
    public IdempotencyRecord save(IdempotencyKey key, Object value, Duration ttl) {
        if (key == null) {
            throw new IllegalArgumentException("IdempotencyKey cannot be null");
        }
        if (ttl == null || ttl.isZero() || ttl.isNegative()) {
            throw new IllegalArgumentException("ttl must be positive (current: " + ttl + ")");
        }
        Instant now = clock.instant();
        IdempotencyRecord record = new IdempotencyRecord(key, value, now, now.plus(ttl));
        records.put(key, record);
        return record;
    }

    @Override
    public int evictExpired() {
        Instant now = clock.instant();
        int evicted = 0;
        for (Map.Entry<IdempotencyKey, IdempotencyRecord> entry : records.entrySet()) {
            if (entry.getValue().isExpired(now) && records.remove(entry.getKey(), entry.getValue())) {
                evicted++;
            }
        }
        return evicted;
    }

    @Override
    public int size() {
        return records.size();
    }

    /**
     * Clears all stored records.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        records.clear();
    }
}
