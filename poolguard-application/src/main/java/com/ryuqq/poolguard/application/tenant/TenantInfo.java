package com.ryuqq.poolguard.application.tenant;

import com.ryuqq.poolguard.core.model.TenantConfig;
import com.ryuqq.poolguard.core.quota.ResourceQuota;

/**
 * 테넌트 하나의 설정, 자원 quota, 통계 묶음.
 *
 * <p>quota와 통계는 이 객체가 단독으로 소유합니다. 재등록하면 새 TenantInfo로 교체됩니다.</p>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public final class TenantInfo {

    private static final long BYTES_PER_MB = 1024L * 1024L;

    private final String tenantId;
    private final TenantConfig config;
    private final ResourceQuota quota;
    private final TenantStats stats;
    private final boolean implicit;

    private TenantInfo(String tenantId, TenantConfig config, boolean implicit) {
        this.tenantId = tenantId;
        this.config = config;
        this.quota = new ResourceQuota(
            (long) config.cpuQuota(),
            config.memoryQuotaMb() * BYTES_PER_MB,
            config.maxQueueSize()
        );
        this.stats = new TenantStats();
        this.implicit = implicit;
    }

    /**
     * 명시적으로 등록된 테넌트 생성.
     *
     * @param config 테넌트 설정
     * @return TenantInfo
     */
    static TenantInfo registered(TenantConfig config) {
        return new TenantInfo(config.tenantId(), config, false);
    }

    /**
     * 기본 설정으로 만든 암묵적 테넌트 생성.
     *
     * @param tenantId 테넌트 ID
     * @param defaultConfig 레지스트리 기본 설정
     * @return TenantInfo
     */
    static TenantInfo implicit(String tenantId, TenantConfig defaultConfig) {
        return new TenantInfo(tenantId, defaultConfig.withTenantId(tenantId), true);
    }

    public String getTenantId() {
        return tenantId;
    }

    public TenantConfig getConfig() {
        return config;
    }

    public ResourceQuota getQuota() {
        return quota;
    }

    public TenantStats getStats() {
        return stats;
    }

    public int getPriority() {
        return config.priority();
    }

    /**
     * 기본 설정에서 만들어졌는지 여부.
     *
     * @return 명시적 등록 없이 생성되었으면 true
     */
    public boolean isImplicit() {
        return implicit;
    }

    @Override
    public String toString() {
        return "TenantInfo{tenantId=" + tenantId + ", priority=" + config.priority() + ", implicit=" + implicit + '}';
    }
}
