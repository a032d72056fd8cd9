package com.ryuqq.poolguard.application.tenant;

import com.ryuqq.poolguard.core.error.InvalidConfigException;
import com.ryuqq.poolguard.core.error.QuotaExceededException;
import com.ryuqq.poolguard.core.error.TenantNotFoundException;
import com.ryuqq.poolguard.core.model.TenantConfig;
import com.ryuqq.poolguard.core.quota.ResourceQuota;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * 테넌트 레지스트리.
 *
 * <p>테넌트마다 하나의 {@link TenantInfo}(설정, ResourceQuota, TenantStats)를 소유합니다.
 * 숨은 싱글톤이 아니며, Admission Controller 인스턴스와 생명주기를 같이합니다.</p>
 *
 * <p><strong>미등록 테넌트 정책:</strong></p>
 * <ul>
 *   <li>조회({@link #getTenant(String)}): 기본 설정으로 만든 읽기 전용 뷰를 반환하며 저장하지 않음</li>
 *   <li>변경(checkQuota, recordTask*): adoption이 켜져 있으면 기본 설정으로 생성해 저장(putIfAbsent),
 *       꺼져 있으면 {@link TenantNotFoundException}</li>
 *   <li>{@link #releaseQuota(String)}: 등록/채택된 적 없는 테넌트는 예약이 있을 수 없으므로
 *       항상 {@link TenantNotFoundException}</li>
 * </ul>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>등록/채택은 ConcurrentHashMap 원자 연산으로 처리</li>
 *   <li>quota 예약과 통계 갱신은 lock 없이 원자 카운터로 처리</li>
 * </ul>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public final class TenantRegistry {

    private static final Logger log = LoggerFactory.getLogger(TenantRegistry.class);

    private final ConcurrentMap<String, TenantInfo> tenants = new ConcurrentHashMap<>();
    private final TenantConfig defaultConfig;
    private final boolean adoptUnknownTenants;

    /**
     * 생성자 (미등록 테넌트 자동 채택).
     *
     * @param defaultConfig 미등록 테넌트에 적용할 기본 설정
     * @throws IllegalArgumentException defaultConfig가 null인 경우
     */
    public TenantRegistry(TenantConfig defaultConfig) {
        this(defaultConfig, true);
    }

    /**
     * 생성자.
     *
     * @param defaultConfig 미등록 테넌트에 적용할 기본 설정
     * @param adoptUnknownTenants 변경 연산에서 미등록 테넌트를 기본 설정으로 채택할지 여부
     * @throws IllegalArgumentException defaultConfig가 null인 경우
     */
    public TenantRegistry(TenantConfig defaultConfig, boolean adoptUnknownTenants) {
        if (defaultConfig == null) {
            throw new IllegalArgumentException("defaultConfig cannot be null");
        }
        this.defaultConfig = defaultConfig;
        this.adoptUnknownTenants = adoptUnknownTenants;
    }

    /**
     * 테넌트 등록 (이미 있으면 교체).
     *
     * <p>교체 시 quota와 통계는 새로 시작합니다.</p>
     *
     * @param config 테넌트 설정
     * @return 등록된 TenantInfo
     * @throws InvalidConfigException config가 null이거나 tenantId가 비어 있는 경우
     */
    public TenantInfo registerTenant(TenantConfig config) {
        if (config == null) {
            throw new InvalidConfigException("config", "Tenant config cannot be null");
        }
        if (config.tenantId() == null || config.tenantId().isBlank()) {
            throw new InvalidConfigException("tenantId", "Tenant id cannot be empty");
        }

        TenantInfo info = TenantInfo.registered(config);
        TenantInfo previous = tenants.put(config.tenantId(), info);
        if (previous == null) {
            log.info("Tenant registered: {} (priority={}, maxQueueSize={})",
                config.tenantId(), config.priority(), config.maxQueueSize());
        } else {
            log.info("Tenant re-registered: {} (priority {} → {})",
                config.tenantId(), previous.getPriority(), config.priority());
        }
        return info;
    }

    /**
     * 테넌트 제거.
     *
     * @param tenantId 테넌트 ID
     * @return 제거된 TenantInfo (없었으면 empty)
     */
    public Optional<TenantInfo> removeTenant(String tenantId) {
        TenantInfo removed = tenantId == null ? null : tenants.remove(tenantId);
        if (removed != null) {
            log.info("Tenant removed: {}", tenantId);
        }
        return Optional.ofNullable(removed);
    }

    /**
     * 테넌트 조회.
     *
     * <p>미등록 테넌트는 기본 설정으로 만든 뷰를 반환하며, 레지스트리에 저장하지 않습니다.</p>
     *
     * @param tenantId 테넌트 ID
     * @return TenantInfo
     * @throws IllegalArgumentException tenantId가 null인 경우
     */
    public TenantInfo getTenant(String tenantId) {
        if (tenantId == null) {
            throw new IllegalArgumentException("tenantId cannot be null");
        }
        TenantInfo info = tenants.get(tenantId);
        if (info != null) {
            return info;
        }
        return TenantInfo.implicit(tenantId, defaultConfig);
    }

    /**
     * 등록(또는 채택)된 테넌트만 조회.
     *
     * @param tenantId 테넌트 ID
     * @return TenantInfo (없으면 empty)
     */
    public Optional<TenantInfo> findTenant(String tenantId) {
        return tenantId == null ? Optional.empty() : Optional.ofNullable(tenants.get(tenantId));
    }

    /**
     * quota 예약 시도.
     *
     * @param tenantId 테넌트 ID
     * @return 예약 성공 여부
     * @throws TenantNotFoundException adoption이 꺼져 있고 미등록 테넌트인 경우
     */
    public boolean checkQuota(String tenantId) {
        return resolveForUpdate(tenantId).getQuota().checkAndReserve();
    }

    /**
     * quota 예약 후 예약에 사용한 ResourceQuota 반환.
     *
     * <p>작업 도중 테넌트가 재등록되거나 제거되어도 같은 객체에 반환해야 하므로,
     * 실행기는 반환된 ResourceQuota의 {@link ResourceQuota#release()}를 직접 호출합니다.</p>
     *
     * @param tenantId 테넌트 ID
     * @return 슬롯을 예약한 ResourceQuota
     * @throws QuotaExceededException 동시 작업 한도에 도달한 경우
     * @throws TenantNotFoundException adoption이 꺼져 있고 미등록 테넌트인 경우
     */
    public ResourceQuota reserveQuota(String tenantId) {
        ResourceQuota quota = resolveForUpdate(tenantId).getQuota();
        if (!quota.checkAndReserve()) {
            throw new QuotaExceededException(tenantId, quota.getTasksLimit());
        }
        return quota;
    }

    /**
     * 예약한 quota 반환.
     *
     * @param tenantId 테넌트 ID
     * @throws TenantNotFoundException 등록 또는 채택된 적 없는 테넌트인 경우
     */
    public void releaseQuota(String tenantId) {
        TenantInfo info = findTenant(tenantId)
            .orElseThrow(() -> notFound(tenantId));
        if (!info.getQuota().release()) {
            log.warn("releaseQuota called without an outstanding reservation for tenant {}", tenantId);
        }
    }

    /**
     * 작업 제출 기록.
     *
     * @param tenantId 테넌트 ID
     */
    public void recordTaskSubmitted(String tenantId) {
        resolveForUpdate(tenantId).getStats().recordSubmitted();
    }

    /**
     * 작업 완료 기록.
     *
     * <p>통계와 함께 quota의 CPU 누적값, 메모리 스냅샷도 갱신합니다.</p>
     *
     * @param tenantId 테넌트 ID
     * @param cpuMillis 작업이 사용한 CPU 시간 (밀리초)
     * @param memoryBytes 작업 종료 시점 메모리 사용량 (바이트)
     */
    public void recordTaskCompleted(String tenantId, long cpuMillis, long memoryBytes) {
        TenantInfo info = resolveForUpdate(tenantId);
        info.getStats().recordCompleted(cpuMillis, memoryBytes);
        info.getQuota().recordCpu(cpuMillis);
        info.getQuota().recordMemory(memoryBytes);
    }

    /**
     * 작업 거부 기록.
     *
     * @param tenantId 테넌트 ID
     */
    public void recordTaskRejected(String tenantId) {
        resolveForUpdate(tenantId).getStats().recordRejected();
    }

    /**
     * 테넌트 통계 조회.
     *
     * @param tenantId 테넌트 ID
     * @return TenantStats
     * @throws TenantNotFoundException 등록 또는 채택된 적 없는 테넌트인 경우
     */
    public TenantStats tenantStats(String tenantId) {
        return findTenant(tenantId)
            .orElseThrow(() -> notFound(tenantId))
            .getStats();
    }

    /**
     * 등록된 모든 테넌트 조회 (관찰용 복사본, 순서 보장 없음).
     *
     * @return tenantId → TenantInfo
     */
    public Map<String, TenantInfo> allTenants() {
        return Collections.unmodifiableMap(new HashMap<>(tenants));
    }

    public TenantConfig getDefaultConfig() {
        return defaultConfig;
    }

    public boolean isAdoptUnknownTenants() {
        return adoptUnknownTenants;
    }

    /**
     * 변경 연산용 테넌트 조회 (필요 시 채택).
     */
    private TenantInfo resolveForUpdate(String tenantId) {
        if (tenantId == null || tenantId.isBlank()) {
            throw notFound(tenantId);
        }
        TenantInfo info = tenants.get(tenantId);
        if (info != null) {
            return info;
        }
        if (!adoptUnknownTenants) {
            throw notFound(tenantId);
        }
        TenantInfo adopted = TenantInfo.implicit(tenantId, defaultConfig);
        TenantInfo raced = tenants.putIfAbsent(tenantId, adopted);
        if (raced != null) {
            return raced;
        }
        log.info("Tenant {} adopted with default config", tenantId);
        return adopted;
    }

    private static TenantNotFoundException notFound(String tenantId) {
        return new TenantNotFoundException(tenantId, "Tenant not found: " + tenantId);
    }
}
