package com.ryuqq.poolguard.adapter.runner.monitor;

/**
 * 자원 사용량 스냅샷.
 *
 * @param cpuPercent 마지막 샘플의 CPU 사용률
 * @param memoryMb 마지막 샘플의 메모리 사용량 (MB)
 * @param throttled throttle 여부
 * @param maxCpuPercent 현재 CPU 임계값
 * @param maxMemoryMb 현재 메모리 임계값 (MB)
 * @author PoolGuard Team
 * @since 1.0.0
 */
public record ResourceMetrics(
    double cpuPercent,
    long memoryMb,
    boolean throttled,
    double maxCpuPercent,
    long maxMemoryMb
) {
}
