package com.ryuqq.resilience.core.spi;

import com.ryuqq.resilience.core.model.IdempotencyKey;

import java.time.Duration;
import java.util.Optional;

/**
 * 멱등성 결과 저장소 SPI (Service Provider Interface).
 *
 * <p>같은 {@link IdempotencyKey}로 들어온 호출은 TTL 안에서 작업을 재실행하지 않고
 * 저장된 결과를 돌려받아야 합니다.</p>
 *
 * <p><strong>구현 책임:</strong></p>
 * <ul>
 *   <li>키 → 결과 매핑 저장소 관리</li>
 *   <li>만료된 레코드는 조회 시 지연 삭제 (lazy GC)</li>
 *   <li>동시 접근 안전성</li>
 * </ul>
 *
 * <p><strong>구현 예시:</strong></p>
 * <ul>
 *   <li>InMemory: ConcurrentHashMap (단일 프로세스)</li>
 *   <li>Redis: SET key value EX ttl (분산 환경)</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public interface IdempotencyStore {

    /**
     * 유효한(만료되지 않은) 레코드 조회.
     *
     * <p>만료된 레코드를 발견하면 삭제하고 빈 값을 반환합니다.</p>
     *
     * @param key 멱등성 키
     * @return 레코드 (없거나 만료된 경우 empty)
     * @throws IllegalArgumentException key가 null인 경우
     */
    Optional<IdempotencyRecord> find(IdempotencyKey key);

    /**
     * 결과 저장.
     *
     * @param key 멱등성 키
     * @param value 결과 (null 허용)
     * @param ttl 보관 기간
     * @return 저장된 레코드
     * @throws IllegalArgumentException key 또는 ttl이 유효하지 않은 경우
     */
    IdempotencyRecord save(IdempotencyKey key, Object value, Duration ttl);

    /**
     * 만료된 레코드 일괄 삭제.
     *
     * @return 삭제된 레코드 수
     */
    int evictExpired();

    /**
     * 저장된 레코드 수 (만료 미정리분 포함).
     *
     * @return 레코드 수
     */
    int size();
}
