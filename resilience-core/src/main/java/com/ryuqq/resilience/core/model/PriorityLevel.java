package com.ryuqq.resilience.core.model;

/**
 * Bulkhead 대기열 우선순위.
 *
 * <p>priorityEnabled인 Bulkhead는 높은 우선순위 요청을 먼저 처리합니다.
 * 같은 우선순위 안에서는 FIFO 순서가 유지됩니다.</p>
 *
 * @author Resilience Team
 * @since 1.0.0
 */
public enum PriorityLevel {

    /** 장애 대응, 결제 확정 등 반드시 먼저 처리할 요청. */
    CRITICAL(3),

    HIGH(2),

    /** 기본값. */
    NORMAL(1),

    /** 배치, 프리페치 등 지연 허용 요청. */
    LOW(0);

    private final int weight;

    PriorityLevel(int weight) {
        this.weight = weight;
    }

    /**
     * 우선순위 가중치 (클수록 먼저 처리).
     *
     * @return 가중치
     */
    public int weight() {
        return weight;
    }
}
