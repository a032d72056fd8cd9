package com.ryuqq.poolguard.adapter.runner.monitor;

import com.ryuqq.poolguard.core.spi.ResourceProbe;

import java.lang.management.ManagementFactory;
import java.lang.management.OperatingSystemMXBean;

/**
 * JVM MXBean 기반 자원 측정.
 *
 * <p>CPU 시간은 {@code com.sun.management.OperatingSystemMXBean}이 있을 때만 측정하며,
 * 없으면 -1을 반환합니다. 메모리는 힙 사용량(total - free)입니다.</p>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public final class JvmResourceProbe implements ResourceProbe {

    private final OperatingSystemMXBean osBean = ManagementFactory.getOperatingSystemMXBean();

    @Override
    public long processCpuTimeNanos() {
        if (osBean instanceof com.sun.management.OperatingSystemMXBean sunBean) {
            return sunBean.getProcessCpuTime();
        }
        return -1;
    }

    @Override
    public long usedMemoryBytes() {
        Runtime runtime = Runtime.getRuntime();
        return runtime.totalMemory() - runtime.freeMemory();
    }
}
