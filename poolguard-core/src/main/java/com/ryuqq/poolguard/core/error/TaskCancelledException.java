package com.ryuqq.poolguard.core.error;

/**
 * 취소 신호로 작업이 중단된 경우.
 *
 * <p>재시도 소진과 구분하기 위해 별도 타입으로 보고합니다.
 * 취소 직전에 관찰된 실행 오류가 있으면 suppressed 예외로 첨부됩니다.</p>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public final class TaskCancelledException extends PoolGuardException {

    private final int attempts;

    public TaskCancelledException(int attempts) {
        super(FailureKind.CANCELLED, "Task cancelled after " + attempts + " attempt(s)");
        this.attempts = attempts;
    }

    /**
     * 취소 전까지 수행된 시도 횟수.
     *
     * @return 시도 횟수
     */
    public int getAttempts() {
        return attempts;
    }
}
