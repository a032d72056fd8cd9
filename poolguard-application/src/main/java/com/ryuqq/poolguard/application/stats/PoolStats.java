package com.ryuqq.poolguard.application.stats;

import java.time.Duration;

/**
 * 풀 전체 통계 스냅샷.
 *
 * @param activeWorkers 실행 중인 작업 수
 * @param queuedTasks 대기 중인 작업 수 (외부 큐에서 전달된 값)
 * @param completedTasks 누적 완료 작업 수
 * @param rejectedTasks 누적 거부 작업 수
 * @param averageLatency 평균 처리 시간 (완료 작업이 없으면 0)
 * @param uptime 수집기 생성 이후 경과 시간
 * @param lastError 마지막으로 기록된 오류 메시지 (없으면 null)
 * @author PoolGuard Team
 * @since 1.0.0
 */
public record PoolStats(
    int activeWorkers,
    int queuedTasks,
    long completedTasks,
    long rejectedTasks,
    Duration averageLatency,
    Duration uptime,
    String lastError
) {
}
