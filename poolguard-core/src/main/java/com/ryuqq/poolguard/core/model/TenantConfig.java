package com.ryuqq.poolguard.core.model;

/**
 * 테넌트 설정 (불변 record).
 *
 * <p>워커 풀을 공유하는 하나의 테넌트가 사용할 수 있는 자원 한도와 스케줄링 우선순위를 담고 있습니다.
 * 등록 후에는 변경되지 않으며, 변경하려면 명시적으로 다시 등록해야 합니다.</p>
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxWorkers: 테넌트가 점유할 수 있는 최대 워커 수 (기본 10)</li>
 *   <li>maxQueueSize: 동시에 진행 중일 수 있는 작업 수 한도, 0이면 무제한 (기본 100)</li>
 *   <li>cpuQuota: CPU 사용량 한도 (밀리초, 기본 100)</li>
 *   <li>memoryQuotaMb: 메모리 한도 (MB, 기본 512)</li>
 *   <li>rateLimit: 초당 작업 수 (0이면 무제한, 기본 0)</li>
 *   <li>priority: 스케줄링 우선순위, 값이 클수록 먼저 선택됨 (기본 0)</li>
 * </ul>
 *
 * <p>tenantId는 이 record에서 검증하지 않습니다. 빈 tenantId는
 * 등록 시점에 {@code InvalidConfigException}으로 거부됩니다.</p>
 *
 * @param tenantId 테넌트 식별자
 * @param maxWorkers 최대 워커 수 (0 이상)
 * @param maxQueueSize 동시 진행 작업 한도 (0 이상, 0 = 무제한)
 * @param cpuQuota CPU 한도 (0 이상)
 * @param memoryQuotaMb 메모리 한도 (MB, 0 이상)
 * @param rateLimit 초당 작업 수 (0 이상)
 * @param priority 스케줄링 우선순위
 * @author PoolGuard Team
 * @since 1.0.0
 */
public record TenantConfig(
    String tenantId,
    int maxWorkers,
    int maxQueueSize,
    double cpuQuota,
    long memoryQuotaMb,
    double rateLimit,
    int priority
) {

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 수치 파라미터가 음수인 경우
     */
    public TenantConfig {
        if (maxWorkers < 0) {
            throw new IllegalArgumentException(
                "maxWorkers cannot be negative (current: " + maxWorkers + ")"
            );
        }
        if (maxQueueSize < 0) {
            throw new IllegalArgumentException(
                "maxQueueSize cannot be negative (current: " + maxQueueSize + ")"
            );
        }
        if (cpuQuota < 0) {
            throw new IllegalArgumentException(
                "cpuQuota cannot be negative (current: " + cpuQuota + ")"
            );
        }
        if (memoryQuotaMb < 0) {
            throw new IllegalArgumentException(
                "memoryQuotaMb cannot be negative (current: " + memoryQuotaMb + ")"
            );
        }
        if (rateLimit < 0) {
            throw new IllegalArgumentException(
                "rateLimit cannot be negative (current: " + rateLimit + ")"
            );
        }
    }

    /**
     * 기본 설정으로 생성.
     *
     * @param tenantId 테넌트 식별자
     * @return 기본값이 적용된 TenantConfig
     */
    public static TenantConfig defaults(String tenantId) {
        return new TenantConfig(tenantId, 10, 100, 100.0, 512, 0.0, 0);
    }

    /**
     * tenantId만 변경한 새 인스턴스 생성.
     */
    public TenantConfig withTenantId(String tenantId) {
        return new TenantConfig(tenantId, maxWorkers, maxQueueSize, cpuQuota, memoryQuotaMb, rateLimit, priority);
    }

    /**
     * maxWorkers만 변경한 새 인스턴스 생성.
     */
    public TenantConfig withMaxWorkers(int maxWorkers) {
        return new TenantConfig(tenantId, maxWorkers, maxQueueSize, cpuQuota, memoryQuotaMb, rateLimit, priority);
    }

    /**
     * maxQueueSize만 변경한 새 인스턴스 생성.
     */
    public TenantConfig withMaxQueueSize(int maxQueueSize) {
        return new TenantConfig(tenantId, maxWorkers, maxQueueSize, cpuQuota, memoryQuotaMb, rateLimit, priority);
    }

    /**
     * cpuQuota만 변경한 새 인스턴스 생성.
     */
    public TenantConfig withCpuQuota(double cpuQuota) {
        return new TenantConfig(tenantId, maxWorkers, maxQueueSize, cpuQuota, memoryQuotaMb, rateLimit, priority);
    }

    /**
     * memoryQuotaMb만 변경한 새 인스턴스 생성.
     */
    public TenantConfig withMemoryQuotaMb(long memoryQuotaMb) {
        return new TenantConfig(tenantId, maxWorkers, maxQueueSize, cpuQuota, memoryQuotaMb, rateLimit, priority);
    }

    /**
     * rateLimit만 변경한 새 인스턴스 생성.
     */
    public TenantConfig withRateLimit(double rateLimit) {
        return new TenantConfig(tenantId, maxWorkers, maxQueueSize, cpuQuota, memoryQuotaMb, rateLimit, priority);
    }

    /**
     * priority만 변경한 새 인스턴스 생성.
     */
    public TenantConfig withPriority(int priority) {
        return new TenantConfig(tenantId, maxWorkers, maxQueueSize, cpuQuota, memoryQuotaMb, rateLimit, priority);
    }
}
