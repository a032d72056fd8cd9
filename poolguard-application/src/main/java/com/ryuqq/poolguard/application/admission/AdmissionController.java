package com.ryuqq.poolguard.application.admission;

import com.ryuqq.poolguard.application.stats.PoolStats;
import com.ryuqq.poolguard.application.tenant.TenantInfo;
import com.ryuqq.poolguard.core.model.TaskContext;
import com.ryuqq.poolguard.core.model.TenantConfig;
import com.ryuqq.poolguard.core.outcome.TaskOutcome;

import java.util.Optional;
import java.util.concurrent.Callable;

/**
 * 멀티 테넌트 작업 수락 API.
 *
 * <p>워커 풀은 작업마다 이 인터페이스를 통해 수락 여부를 결정하고,
 * 여유 용량이 생기면 다음에 처리할 테넌트를 선택합니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * controller.registerTenant(TenantConfig.defaults("tenant-a").withPriority(10));
 *
 * TaskOutcome<String> outcome = controller.submit(
 *     TaskContext.of("tenant-a"), "payment", () -> gateway.charge(order));
 *
 * if (outcome instanceof Rejected<String> rejected
 *         && rejected.kind().isAdmissionRejection()) {
 *     // 나중에 다시 제출
 * }
 * }</pre>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public interface AdmissionController {

    /**
     * 테넌트 등록 (이미 있으면 교체).
     *
     * @param config 테넌트 설정
     * @return 등록된 TenantInfo
     * @throws com.ryuqq.poolguard.core.error.InvalidConfigException tenantId가 비어 있는 경우
     */
    TenantInfo registerTenant(TenantConfig config);

    /**
     * 테넌트 제거.
     *
     * @param tenantId 테넌트 ID
     * @return 제거되었으면 true
     */
    boolean removeTenant(String tenantId);

    /**
     * quota 예약 시도.
     *
     * @param tenantId 테넌트 ID
     * @return 예약 성공 여부
     * @throws com.ryuqq.poolguard.core.error.TenantNotFoundException 테넌트를 만들 수 없는 경우
     */
    boolean checkQuota(String tenantId);

    /**
     * 예약한 quota 반환.
     *
     * @param tenantId 테넌트 ID
     * @throws com.ryuqq.poolguard.core.error.TenantNotFoundException 등록된 적 없는 테넌트인 경우
     */
    void releaseQuota(String tenantId);

    /**
     * 다음에 작업을 꺼낼 테넌트 선택.
     *
     * @return 선택된 테넌트 (없으면 empty)
     */
    Optional<TenantInfo> schedule();

    /**
     * 작업 제출 및 보호된 실행.
     *
     * <p>수락 거부, 보호 거부, 실행 실패, 취소는 예외가 아닌 {@link TaskOutcome}으로 반환됩니다.</p>
     *
     * @param ctx 작업 컨텍스트
     * @param taskType Circuit Breaker 키가 되는 작업 유형
     * @param task 실행할 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     */
    <T> TaskOutcome<T> submit(TaskContext ctx, String taskType, Callable<T> task);

    /**
     * 작업 제출 (실패 시 Dead Letter Queue에 남길 payload 포함).
     *
     * @param ctx 작업 컨텍스트
     * @param taskType Circuit Breaker 키가 되는 작업 유형
     * @param task 실행할 작업
     * @param payload 작업 원본 데이터
     * @param <T> 결과 타입
     * @return 작업 결과
     */
    <T> TaskOutcome<T> submit(TaskContext ctx, String taskType, Callable<T> task, byte[] payload);

    /**
     * 풀 통계 스냅샷.
     *
     * @param queueLen 외부 큐의 현재 대기 작업 수
     * @return PoolStats
     */
    PoolStats stats(int queueLen);
}
