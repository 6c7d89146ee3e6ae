package com.ryuqq.resilience.core.model;

/**
 * 보호 대상 다운스트림 의존성의 논리 이름.
 *
 * <p>DependencyName은 Registry에서 CircuitBreaker, RetryManager, Bulkhead 등
 * 보호 컴포넌트를 찾는 키로 사용됩니다. 같은 이름은 항상 같은 컴포넌트 인스턴스로 연결됩니다.</p>
 *
 * <p><strong>예시:</strong> {@code "user-db"}, {@code "payment-api"}, {@code "llm.openai"}</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~128자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_), 점(.)만 허용</li>
 * </ul>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public final class DependencyName {

    private final String value;

    private DependencyName(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("DependencyName cannot be null or blank");
        }
        if (value.length() > 128) {
            throw new IllegalArgumentException("DependencyName length cannot exceed 128 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_.]+$")) {
            throw new IllegalArgumentException(
                "DependencyName contains invalid characters. Only alphanumeric, hyphen, underscore and dot are allowed"
            );
        }
        this.value = value;
    }

    /**
     * DependencyName 생성.
     *
     * @param value 의존성 이름
     * @return DependencyName 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static DependencyName of(String value) {
        return new DependencyName(value);
    }

    /**
     * 이름 값 조회.
     *
     * @return 의존성 이름
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DependencyName that = (DependencyName) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return value;
    }
}
