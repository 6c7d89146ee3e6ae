package com.ryuqq.resilience.core.spi;

import com.ryuqq.resilience.core.model.IdempotencyKey;

import java.time.Instant;

/**
 * 멱등성 키로 저장된 결과.
 *
 * @param key 멱등성 키
 * @param value 저장된 결과 (null 허용)
 * @param createdAt 저장 시각
 * @param expiresAt 만료 시각
 * @author Resilience Team
 * @since 1.0.0
 */
public record IdempotencyRecord(
    IdempotencyKey key,
    Object value,
    Instant createdAt,
    Instant expiresAt
) {

    public IdempotencyRecord {
        if (key == null) {
            throw new IllegalArgumentException("key cannot be null");
        }
        if (createdAt == null || expiresAt == null) {
            throw new IllegalArgumentException("createdAt and expiresAt cannot be null");
        }
        if (expiresAt.isBefore(createdAt)) {
            throw new IllegalArgumentException("expiresAt cannot be before createdAt");
        }
    }

    /**
     * 주어진 시각 기준 만료 여부.
     *
     * @param now 기준 시각
     * @return 만료되었으면 true
     */
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /**
     * 저장된 결과를 호출자 타입으로 반환.
     *
     * <p>저장소는 의존성별로 분리되어 있어 한 키에는 같은 작업의 결과만 저장됩니다.</p>
     *
     * @param <V> 결과 타입
     * @return 저장된 결과 (null 가능)
     */
    public <V> V valueAs() {
        return (V) value;
    }
}
