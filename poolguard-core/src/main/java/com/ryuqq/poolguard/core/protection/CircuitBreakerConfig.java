package com.ryuqq.poolguard.core.protection;

/**
 * Circuit Breaker 설정.
 *
 * <p>레지스트리는 이 설정을 템플릿으로 사용하여 작업 타입마다 이름만 바꾼
 * Circuit Breaker를 생성합니다.</p>
 *
 * @param name Circuit Breaker 이름 (보호 대상 키)
 * @param failureThreshold OPEN 전이까지의 연속 실패 수 (예: 5)
 * @param successThreshold CLOSED 복귀까지의 HALF_OPEN 연속 성공 수 (예: 2)
 * @param timeoutMs 마지막 실패 후 HALF_OPEN 전이까지 대기 시간 (밀리초)
 * @param halfOpenMaxCalls HALF_OPEN 상태 동시 프로브 한도
 * @author PoolGuard Team
 * @since 1.0.0
 */
public record CircuitBreakerConfig(
    String name,
    int failureThreshold,
    int successThreshold,
    long timeoutMs,
    int halfOpenMaxCalls
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: name="default", failureThreshold=5, successThreshold=2,
     * timeoutMs=30000, halfOpenMaxCalls=3</p>
     */
    public CircuitBreakerConfig() {
        this("default", 5, 2, 30_000, 3);
    }

    /**
     * Compact constructor with validation.
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public CircuitBreakerConfig {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name cannot be null or blank");
        }
        if (failureThreshold <= 0) {
            throw new IllegalArgumentException(
                "failureThreshold must be positive (current: " + failureThreshold + ")"
            );
        }
        if (successThreshold <= 0) {
            throw new IllegalArgumentException(
                "successThreshold must be positive (current: " + successThreshold + ")"
            );
        }
        if (timeoutMs < 0) {
            throw new IllegalArgumentException(
                "timeoutMs cannot be negative (current: " + timeoutMs + ")"
            );
        }
        if (halfOpenMaxCalls <= 0) {
            throw new IllegalArgumentException(
                "halfOpenMaxCalls must be positive (current: " + halfOpenMaxCalls + ")"
            );
        }
    }

    /**
     * name만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withName(String name) {
        return new CircuitBreakerConfig(name, failureThreshold, successThreshold, timeoutMs, halfOpenMaxCalls);
    }

    /**
     * failureThreshold만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withFailureThreshold(int failureThreshold) {
        return new CircuitBreakerConfig(name, failureThreshold, successThreshold, timeoutMs, halfOpenMaxCalls);
    }

    /**
     * successThreshold만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withSuccessThreshold(int successThreshold) {
        return new CircuitBreakerConfig(name, failureThreshold, successThreshold, timeoutMs, halfOpenMaxCalls);
    }

    /**
     * timeoutMs만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withTimeoutMs(long timeoutMs) {
        return new CircuitBreakerConfig(name, failureThreshold, successThreshold, timeoutMs, halfOpenMaxCalls);
    }

    /**
     * halfOpenMaxCalls만 변경한 새 인스턴스 생성.
     */
    public CircuitBreakerConfig withHalfOpenMaxCalls(int halfOpenMaxCalls) {
        return new CircuitBreakerConfig(name, failureThreshold, successThreshold, timeoutMs, halfOpenMaxCalls);
    }
}
