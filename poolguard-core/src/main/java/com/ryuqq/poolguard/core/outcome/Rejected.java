package com.ryuqq.poolguard.core.outcome;

import com.ryuqq.poolguard.core.error.FailureKind;

/**
 * 입장 또는 보호 단계에서의 거부.
 *
 * <p>예외적 상황이 아닌, 자주 발생하는 정상 결과입니다.
 * {@link FailureKind#isAdmissionRejection()}, {@link FailureKind#isProtectionRejection()}로
 * 거부 단계를 구분합니다.</p>
 *
 * @param taskId 작업 ID
 * @param kind 거부 사유
 * @param message 사람이 읽을 수 있는 설명
 * @param <T> 작업 결과 타입
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public record Rejected<T>(
    String taskId,
    FailureKind kind,
    String message
) implements TaskOutcome<T> {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException taskId 또는 kind가 null인 경우
     */
    public Rejected {
        if (taskId == null) {
            throw new IllegalArgumentException("taskId cannot be null");
        }
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
    }
}
