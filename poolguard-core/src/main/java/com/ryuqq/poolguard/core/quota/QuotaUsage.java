package com.ryuqq.poolguard.core.quota;

/**
 * 테넌트 자원 사용량 조회 결과.
 *
 * @param cpuUsed 누적 CPU 사용량 (밀리초)
 * @param memoryUsed 마지막으로 보고된 메모리 사용량 (바이트)
 * @param tasksUsed 진행 중인 작업 수
 * @param cpuLimit CPU 한도 (밀리초)
 * @param memoryLimit 메모리 한도 (바이트)
 * @param tasksLimit 동시 작업 한도 (0 = 무제한)
 * @author PoolGuard Team
 * @since 1.0.0
 */
public record QuotaUsage(
    long cpuUsed,
    long memoryUsed,
    long tasksUsed,
    long cpuLimit,
    long memoryLimit,
    long tasksLimit
) {

    /**
     * 남은 작업 슬롯 수.
     *
     * @return 남은 슬롯 수, 무제한이면 {@link Long#MAX_VALUE}
     */
    public long remainingTasks() {
        if (tasksLimit == 0) {
            return Long.MAX_VALUE;
        }
        return Math.max(0, tasksLimit - tasksUsed);
    }
}
