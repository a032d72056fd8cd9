package com.ryuqq.poolguard.core.outcome;

/**
 * 취소 신호로 중단됨.
 *
 * @param taskId 작업 ID
 * @param attempts 취소 전까지 수행된 시도 횟수
 * @param <T> 작업 결과 타입
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public record Cancelled<T>(String taskId, int attempts) implements TaskOutcome<T> {

    public Cancelled {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
    }
}
