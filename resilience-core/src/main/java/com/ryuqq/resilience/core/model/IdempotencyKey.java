package com.ryuqq.resilience.core.model;

/**
 * 멱등성 키 (Idempotency Key).
 *
 * <p>호출자가 제공하는 키로, 같은 키를 가진 호출이 TTL 안에 다시 들어오면
 * 작업을 재실행하지 않고 이전 결과를 돌려줍니다.</p>
 *
 * <p><strong>사용 시나리오:</strong></p>
 * <ul>
 *   <li>클라이언트가 요청별로 고유 키 생성 (UUID 권장)</li>
 *   <li>네트워크 타임아웃 후 재요청 시 동일 키 사용</li>
 *   <li>RetryManager는 키에 해당하는 유효한 결과가 있으면 즉시 반환</li>
 * </ul>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class IdempotencyKey {

    private final String value;

    private IdempotencyKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("IdempotencyKey cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("IdempotencyKey length cannot exceed 255 characters");
        }
        this.value = value;
    }

    /**
     * IdempotencyKey 생성.
     *
     * @param value 키 값
     * @return IdempotencyKey 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static IdempotencyKey of(String value) {
        return new IdempotencyKey(value);
    }

    /**
     * 키 값 조회.
     *
     * @return 키 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        IdempotencyKey that = (IdempotencyKey) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "IdempotencyKey{" + value + '}';
    }
}
