package com.ryuqq.poolguard.core.error;

/**
 * 등록되지 않았고 기본 설정으로 생성할 수도 없는 테넌트에 접근한 경우.
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public final class TenantNotFoundException extends PoolGuardException {

    private final String tenantId;

    public TenantNotFoundException(String tenantId, String message) {
        super(FailureKind.TENANT_NOT_FOUND, message);
        this.tenantId = tenantId;
    }

    public String getTenantId() {
        return tenantId;
    }
}
