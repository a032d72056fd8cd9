/**
 * 멀티 테넌트 작업 실행기와 알림 디스패처.
 *
 * <p><strong>주요 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.poolguard.adapter.runner.TenantAwareTaskRunner}: 수락, 보호, 재시도, DLQ를 묶는 구성 루트</li>
 *   <li>{@link com.ryuqq.poolguard.adapter.runner.NotificationDispatcher}: 콜백 비동기 실행</li>
 *   <li>{@link com.ryuqq.poolguard.adapter.runner.TaskResourceMeter}: 작업 단위 CPU/할당 측정</li>
 * </ul>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
package com.ryuqq.poolguard.adapter.runner;
