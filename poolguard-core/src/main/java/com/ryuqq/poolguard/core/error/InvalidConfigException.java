package com.ryuqq.poolguard.core.error;

/**
 * 설정값이 유효하지 않아 등록을 거부한 경우.
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public final class InvalidConfigException extends PoolGuardException {

    private final String field;

    public InvalidConfigException(String field, String message) {
        super(FailureKind.INVALID_CONFIG, message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
