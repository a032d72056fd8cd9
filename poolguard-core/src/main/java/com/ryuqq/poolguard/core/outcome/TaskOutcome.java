package com.ryuqq.poolguard.core.outcome;

/**
 * 제출된 작업 하나의 최종 결과.
 *
 * <p>TaskOutcome은 네 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Completed}: 성공적으로 완료됨</li>
 *   <li>{@link Rejected}: 입장 또는 보호 단계에서 거부됨 (작업 미실행 또는 차단)</li>
 *   <li>{@link Failed}: 재시도를 모두 소진한 실행 실패</li>
 *   <li>{@link Cancelled}: 취소 신호로 중단됨</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스가 컴파일 타임에 고정됩니다.
 * 호출자는 결과 종류에 따라 백오프, DLQ 전송, 사용자 노출 등을 결정합니다.</p>
 *
 * <p><strong>분기 예시:</strong></p>
 * <pre>{@code
 * TaskOutcome<String> outcome = runner.submit(ctx, "payment", task);
 * if (outcome instanceof Rejected<String> rejected && rejected.kind().isAdmissionRejection()) {
 *     // 나중에 다시 제출
 * } else if (outcome instanceof Failed<String> failed) {
 *     log.error("task failed", failed.error());
 * }
 * }</pre>
 *
 * @param <T> 작업 결과 타입
 * @author PoolGuard Team
 * @since 1.0.0
 */
public sealed interface TaskOutcome<T> permits Completed, Rejected, Failed, Cancelled {

    /**
     * 작업 식별자.
     *
     * @return 작업 ID
     */
    String taskId();

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isCompleted() {
        return this instanceof Completed;
    }

    /**
     * 결과가 거부인지 확인.
     *
     * @return 거부 여부
     */
    default boolean isRejected() {
        return this instanceof Rejected;
    }

    /**
     * 결과가 실행 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFailed() {
        return this instanceof Failed;
    }

    /**
     * 결과가 취소인지 확인.
     *
     * @return 취소 여부
     */
    default boolean isCancelled() {
        return this instanceof Cancelled;
    }
}
