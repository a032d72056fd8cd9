/**
 * 테넌트별 자원 한도.
 *
 * <p>{@link com.ryuqq.poolguard.core.quota.ResourceQuota}는 동시 작업 슬롯을 lock-free로 예약하고
 * CPU 누적 시간과 메모리 스냅샷을 기록합니다. 한도 0은 무제한을 뜻합니다.</p>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
package com.ryuqq.poolguard.core.quota;
