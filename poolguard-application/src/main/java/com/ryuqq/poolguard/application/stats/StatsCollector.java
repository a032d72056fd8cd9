package com.ryuqq.poolguard.application.stats;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 풀 전체 통계 수집기.
 *
 * <p>모든 카운터는 원자 연산으로 갱신되며 lock을 사용하지 않습니다.
 * 대기 작업 수는 큐가 외부에 있으므로 {@link #snapshot(int)} 호출 시 전달받습니다.</p>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public final class StatsCollector {

    private final AtomicInteger activeWorkers = new AtomicInteger();
    private final AtomicLong completedTasks = new AtomicLong();
    private final AtomicLong rejectedTasks = new AtomicLong();
    private final AtomicLong totalLatencyNanos = new AtomicLong();
    private final AtomicReference<String> lastError = new AtomicReference<>();
    private final long startNanos = System.nanoTime();

    public void workerStarted() {
        activeWorkers.incrementAndGet();
    }

    public void workerFinished() {
        activeWorkers.updateAndGet(n -> Math.max(0, n - 1));
    }

    /**
     * 작업 완료 기록.
     *
     * @param latency 작업 처리 시간
     * @throws IllegalArgumentException latency가 null이거나 음수인 경우
     */
    public void recordTaskCompletion(Duration latency) {
        if (latency == null || latency.isNegative()) {
            throw new IllegalArgumentException("latency cannot be null or negative");
        }
        completedTasks.incrementAndGet();
        totalLatencyNanos.addAndGet(latency.toNanos());
    }

    public void recordTaskRejection() {
        rejectedTasks.incrementAndGet();
    }

    /**
     * 마지막 오류 기록.
     *
     * @param error 오류 (null이면 무시)
     */
    public void recordError(Throwable error) {
        if (error == null) {
            return;
        }
        String message = error.getMessage();
        lastError.set(message != null ? message : error.getClass().getSimpleName());
    }

    /**
     * 통계 스냅샷.
     *
     * <p>평균 처리 시간은 totalLatency / completed이며, 완료 작업이 없으면 0입니다.
     * 필드 간 원자적 일관성은 보장하지 않습니다.</p>
     *
     * @param queueLen 외부 큐의 현재 대기 작업 수
     * @return PoolStats
     */
    public PoolStats snapshot(int queueLen) {
        long completed = completedTasks.get();
        long totalNanos = totalLatencyNanos.get();
        Duration average = completed == 0 ? Duration.ZERO : Duration.ofNanos(totalNanos / completed);
        return new PoolStats(
            activeWorkers.get(),
            queueLen,
            completed,
            rejectedTasks.get(),
            average,
            Duration.ofNanos(System.nanoTime() - startNanos),
            lastError.get()
        );
    }
}
