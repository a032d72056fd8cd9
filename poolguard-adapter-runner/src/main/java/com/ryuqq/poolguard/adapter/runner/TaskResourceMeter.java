package com.ryuqq.poolguard.adapter.runner;

import java.lang.management.ManagementFactory;
import java.lang.management.ThreadMXBean;

/**
 * 작업 단위 자원 측정기.
 *
 * <p>작업을 실행하는 현재 스레드의 CPU 시간과 할당 바이트를 측정합니다.
 * JVM이 지원하지 않는 항목은 0으로 보고됩니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * TaskResourceMeter.Sample start = meter.begin();
 * task.call();
 * TaskResourceMeter.Usage usage = meter.since(start);
 * registry.recordTaskCompleted(tenantId, usage.cpuMillis(), usage.allocatedBytes());
 * }</pre>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public final class TaskResourceMeter {

    private final ThreadMXBean threadBean = ManagementFactory.getThreadMXBean();
    private final boolean cpuSupported;
    private final boolean allocationSupported;

    public TaskResourceMeter() {
        this.cpuSupported = threadBean.isCurrentThreadCpuTimeSupported() && threadBean.isThreadCpuTimeEnabled();
        this.allocationSupported = threadBean instanceof com.sun.management.ThreadMXBean sunBean
            && sunBean.isThreadAllocatedMemorySupported()
            && sunBean.isThreadAllocatedMemoryEnabled();
    }

    /**
     * 현재 스레드의 측정 시작점.
     *
     * @return 시작 샘플
     */
    public Sample begin() {
        return new Sample(currentCpuNanos(), currentAllocatedBytes());
    }

    /**
     * 시작점 이후 현재 스레드가 사용한 자원.
     *
     * <p>begin()을 호출한 스레드에서 호출해야 의미 있는 값이 나옵니다.</p>
     *
     * @param start 시작 샘플
     * @return 사용량
     */
    public Usage since(Sample start) {
        long cpuNanos = Math.max(0, currentCpuNanos() - start.cpuNanos());
        long allocated = Math.max(0, currentAllocatedBytes() - start.allocatedBytes());
        return new Usage(cpuNanos / 1_000_000L, allocated);
    }

    public boolean isCpuSupported() {
        return cpuSupported;
    }

    public boolean isAllocationSupported() {
        return allocationSupported;
    }

    private long currentCpuNanos() {
        return cpuSupported ? threadBean.getCurrentThreadCpuTime() : 0L;
    }

    private long currentAllocatedBytes() {
        if (!allocationSupported) {
            return 0L;
        }
        return ((com.sun.management.ThreadMXBean) threadBean).getThreadAllocatedBytes(Thread.currentThread().getId());
    }

    /**
     * 측정 시작 샘플.
     *
     * @param cpuNanos 스레드 CPU 시간 (나노초)
     * @param allocatedBytes 스레드 누적 할당 바이트
     */
    public record Sample(long cpuNanos, long allocatedBytes) {
    }

    /**
     * 작업 자원 사용량.
     *
     * @param cpuMillis CPU 시간 (밀리초)
     * @param allocatedBytes 할당 바이트
     */
    public record Usage(long cpuMillis, long allocatedBytes) {
    }
}
