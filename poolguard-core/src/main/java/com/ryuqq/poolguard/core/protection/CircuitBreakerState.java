package com.ryuqq.poolguard.core.protection;

/**
 * Circuit Breaker 상태.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED (정상)
 *   │
 *   ▼ (연속 실패 failureThreshold 도달)
 * OPEN (차단)
 *   │
 *   ▼ (마지막 실패 후 timeout 경과, 다음 호출 시)
 * HALF_OPEN (반개방)
 *   │
 *   ├─► 연속 성공 successThreshold 도달 → CLOSED
 *   └─► 실패 1회 → OPEN
 * </pre>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public enum CircuitBreakerState {

    /**
     * 정상 상태 (요청 통과).
     */
    CLOSED("closed"),

    /**
     * 차단 상태 (요청 즉시 거부).
     */
    OPEN("open"),

    /**
     * 반개방 상태 (제한된 수의 프로브만 통과).
     */
    HALF_OPEN("half-open");

    private final String value;

    CircuitBreakerState(String value) {
        this.value = value;
    }

    /**
     * 외부 노출용 상태 문자열.
     *
     * @return "closed", "open", "half-open"
     */
    public String value() {
        return value;
    }
}
