package com.ryuqq.poolguard.adapter.runner.monitor;

/**
 * ResourceMonitor 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxCpuPercent: CPU 사용률 임계값 (기본 80.0, 한 코어 기준 백분율)</li>
 *   <li>maxMemoryMb: 메모리 사용량 임계값 (기본 1024MB)</li>
 *   <li>cpuThrottle: CPU 기준 throttle 활성화 (기본 true)</li>
 *   <li>memoryThrottle: 메모리 기준 throttle 활성화 (기본 true)</li>
 *   <li>sampleIntervalMs: 샘플링 간격 (기본 1000ms)</li>
 * </ul>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 * @param maxCpuPercent CPU 사용률 임계값 (NaN 불가)
 * @param maxMemoryMb 메모리 임계값 (MB, 0 이상)
 * @param cpuThrottle CPU throttle 활성화 여부
 * @param memoryThrottle 메모리 throttle 활성화 여부
 * @param sampleIntervalMs 샘플링 간격 (밀리초, 양수여야 함)
 */
public record ResourceMonitorConfig(
    double maxCpuPercent,
    long maxMemoryMb,
    boolean cpuThrottle,
    boolean memoryThrottle,
    long sampleIntervalMs
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxCpuPercent=80.0, maxMemoryMb=1024, cpuThrottle=true,
     * memoryThrottle=true, sampleIntervalMs=1000</p>
     */
    public ResourceMonitorConfig() {
        this(80.0, 1024, true, true, 1000);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public ResourceMonitorConfig {
        if (Double.isNaN(maxCpuPercent)) {
            throw new IllegalArgumentException("maxCpuPercent cannot be NaN");
        }
        if (maxMemoryMb < 0) {
            throw new IllegalArgumentException(
                "maxMemoryMb must not be negative (current: " + maxMemoryMb + ")"
            );
        }
        if (sampleIntervalMs <= 0) {
            throw new IllegalArgumentException(
                "sampleIntervalMs must be positive (current: " + sampleIntervalMs + ")"
            );
        }
    }

    public ResourceMonitorConfig withMaxCpuPercent(double maxCpuPercent) {
        return new ResourceMonitorConfig(maxCpuPercent, maxMemoryMb, cpuThrottle, memoryThrottle, sampleIntervalMs);
    }

    public ResourceMonitorConfig withMaxMemoryMb(long maxMemoryMb) {
        return new ResourceMonitorConfig(maxCpuPercent, maxMemoryMb, cpuThrottle, memoryThrottle, sampleIntervalMs);
    }

    public ResourceMonitorConfig withCpuThrottle(boolean cpuThrottle) {
        return new ResourceMonitorConfig(maxCpuPercent, maxMemoryMb, cpuThrottle, memoryThrottle, sampleIntervalMs);
    }

    public ResourceMonitorConfig withMemoryThrottle(boolean memoryThrottle) {
        return new ResourceMonitorConfig(maxCpuPercent, maxMemoryMb, cpuThrottle, memoryThrottle, sampleIntervalMs);
    }

    public ResourceMonitorConfig withSampleIntervalMs(long sampleIntervalMs) {
        return new ResourceMonitorConfig(maxCpuPercent, maxMemoryMb, cpuThrottle, memoryThrottle, sampleIntervalMs);
    }
}
