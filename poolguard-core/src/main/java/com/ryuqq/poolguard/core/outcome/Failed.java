package com.ryuqq.poolguard.core.outcome;

/**
 * 재시도를 모두 소진한 실행 실패.
 *
 * <p>error는 감싼 작업이 마지막으로 던진 예외이며, 변형 없이 그대로 전달됩니다.</p>
 *
 * @param taskId 작업 ID
 * @param error 마지막 실행 오류
 * @param attempts 수행된 시도 횟수
 * @param deadLettered DLQ로 전송되었는지 여부
 * @param <T> 작업 결과 타입
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public record Failed<T>(
    String taskId,
    Exception error,
    int attempts,
    boolean deadLettered
) implements TaskOutcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException taskId 또는 error가 null인 경우
     */
    public Failed {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
    }
}
