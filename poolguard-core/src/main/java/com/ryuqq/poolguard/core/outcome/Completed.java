package com.ryuqq.poolguard.core.outcome;

/**
 * 성공 완료.
 *
 * @param taskId 작업 ID
 * @param value 작업 결과 (null 가능)
 * @param attempts 성공까지 걸린 시도 횟수 (1 이상)
 * @param latencyNanos 실행 소요 시간 (나노초)
 * @param <T> 작업 결과 타입
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public record Completed<T>(
    String taskId,
    T value,
    int attempts,
    long latencyNanos
) implements TaskOutcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException taskId가 null이거나 attempts가 양수가 아닌 경우
     */
    public Completed {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (attempts <= 0) {
            throw new IllegalArgumentException("attempts must be positive (current: " + attempts + ")");
        }
    }
}
