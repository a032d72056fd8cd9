package com.ryuqq.poolguard.core.error;

/**
 * 테넌트 동시 작업 한도를 초과한 경우.
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public final class QuotaExceededException extends PoolGuardException {

    private final String tenantId;
    private final long limit;

    public QuotaExceededException(String tenantId, long limit) {
        super(FailureKind.QUOTA_EXCEEDED,
            "Quota exceeded for tenant " + tenantId + " (limit: " + limit + ")");
        this.tenantId = tenantId;
        this.limit = limit;
    }

    public String getTenantId() {
        return tenantId;
    }

    public long getLimit() {
        return limit;
    }
}
