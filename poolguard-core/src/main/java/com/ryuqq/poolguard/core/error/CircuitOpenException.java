package com.ryuqq.poolguard.core.error;

/**
 * Circuit Breaker가 OPEN 상태여서 작업을 호출하지 않고 즉시 거부한 경우.
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public final class CircuitOpenException extends PoolGuardException {

    private final String breakerName;

    public CircuitOpenException(String breakerName, String message) {
        super(FailureKind.CIRCUIT_OPEN, message);
        this.breakerName = breakerName;
    }

    public String getBreakerName() {
        return breakerName;
    }
}
