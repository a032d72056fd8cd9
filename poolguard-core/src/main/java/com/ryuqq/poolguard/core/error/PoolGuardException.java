package com.ryuqq.poolguard.core.error;

/**
 * PoolGuard가 던지는 모든 분류 가능한 예외의 상위 타입.
 *
 * <p>문자열 비교 없이 {@link #getKind()}로 실패 종류를 판별할 수 있습니다.
 * 호출자가 감싼 작업에서 발생한 예외는 이 타입으로 감싸지 않고 그대로 전달됩니다.</p>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public abstract class PoolGuardException extends RuntimeException {

    private final FailureKind kind;

    protected PoolGuardException(FailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected PoolGuardException(FailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    /**
     * 실패 종류 조회.
     *
     * @return 실패 종류
     */
    public FailureKind getKind() {
        return kind;
    }
}
