/**
 * 테넌트 레지스트리와 스케줄러.
 *
 * <p><strong>주요 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.poolguard.application.tenant.TenantRegistry}: 테넌트별 quota와 통계 소유</li>
 *   <li>{@link com.ryuqq.poolguard.application.tenant.TenantScheduler}: 우선순위 + round-robin 선택</li>
 * </ul>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
package com.ryuqq.poolguard.application.tenant;
