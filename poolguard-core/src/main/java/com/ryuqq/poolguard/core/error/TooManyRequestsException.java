package com.ryuqq.poolguard.core.error;

/**
 * HALF_OPEN 상태에서 허용된 동시 프로브 수를 넘어 거부한 경우.
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public final class TooManyRequestsException extends PoolGuardException {

    private final String breakerName;

    public TooManyRequestsException(String breakerName, String message) {
        super(FailureKind.TOO_MANY_REQUESTS, message);
        this.breakerName = breakerName;
    }

    public String getBreakerName() {
        return breakerName;
    }
}
