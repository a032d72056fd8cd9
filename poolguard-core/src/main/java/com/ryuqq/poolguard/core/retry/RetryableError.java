package com.ryuqq.poolguard.core.retry;

/**
 * 재시도해도 되는 오류임을 표시하는 래퍼.
 *
 * <p>조건부 재시도에서 "표시된 오류만 재시도" 정책을 쓸 때 사용합니다.
 * 원인 체인 어디에 있어도 재시도 대상으로 인식됩니다.</p>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public class RetryableError extends RuntimeException {

    public RetryableError(Throwable cause) {
        super(cause == null ? null : cause.getMessage(), cause);
    }

    public RetryableError(String message) {
        super(message);
    }

    /**
     * 원인 체인에 RetryableError가 있는지 확인.
     *
     * @param error 검사할 오류
     * @return 재시도 대상이면 true
     */
    public static boolean isRetryable(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof RetryableError) {
                return true;
            }
            if (current.getCause() == current) {
                return false;
            }
            current = current.getCause();
        }
        return false;
    }
}
