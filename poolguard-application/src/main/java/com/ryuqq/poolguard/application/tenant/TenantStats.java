package com.ryuqq.poolguard.application.tenant;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 테넌트별 작업 통계.
 *
 * <p>제출/완료/거부 수와 누적 CPU 시간, 마지막 메모리 샘플을 원자적으로 갱신합니다.</p>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public final class TenantStats {

    private final AtomicLong tasksSubmitted = new AtomicLong();
    private final AtomicLong tasksCompleted = new AtomicLong();
    private final AtomicLong tasksRejected = new AtomicLong();
    private final AtomicLong totalCpuTimeMillis = new AtomicLong();
    private final AtomicLong lastMemoryBytes = new AtomicLong();

    void recordSubmitted() {
        tasksSubmitted.incrementAndGet();
    }

    void recordCompleted(long cpuMillis, long memoryBytes) {
        tasksCompleted.incrementAndGet();
        totalCpuTimeMillis.addAndGet(cpuMillis);
        lastMemoryBytes.set(memoryBytes);
    }

    void recordRejected() {
        tasksRejected.incrementAndGet();
    }

    public long getTasksSubmitted() {
        return tasksSubmitted.get();
    }

    public long getTasksCompleted() {
        return tasksCompleted.get();
    }

    public long getTasksRejected() {
        return tasksRejected.get();
    }

    public long getTotalCpuTimeMillis() {
        return totalCpuTimeMillis.get();
    }

    public long getLastMemoryBytes() {
        return lastMemoryBytes.get();
    }

    @Override
    public String toString() {
        return "TenantStats{submitted=" + getTasksSubmitted()
            + ", completed=" + getTasksCompleted()
            + ", rejected=" + getTasksRejected()
            + ", cpuMillis=" + getTotalCpuTimeMillis()
            + ", lastMemoryBytes=" + getLastMemoryBytes() + '}';
    }
}
