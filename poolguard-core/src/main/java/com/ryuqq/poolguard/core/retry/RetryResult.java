package com.ryuqq.poolguard.core.retry;

/**
 * 값과 오류를 함께 전달하는 시도 결과.
 *
 * <p>작업 함수가 실패하면서도 부분 결과를 만들어낼 수 있는 경우에 사용합니다.
 * 재시도를 모두 소진해도 마지막으로 만들어진 값은 보존됩니다.</p>
 *
 * @param value 결과 값 (null 가능)
 * @param error 오류 (성공이면 null)
 * @param attempts 수행된 시도 횟수 (작업 함수가 반환할 때는 0)
 * @param <T> 결과 타입
 * @author PoolGuard Team
 * @since 1.0.0
 */
public record RetryResult<T>(T value, Exception error, int attempts) {

    public RetryResult {
        if (attempts < 0) {
            throw new IllegalArgumentException("attempts cannot be negative (current: " + attempts + ")");
        }
    }

    /**
     * 성공 결과 생성.
     */
    public static <T> RetryResult<T> success(T value) {
        return new RetryResult<>(value, null, 0);
    }

    /**
     * 실패 결과 생성 (부분 값 포함 가능).
     */
    public static <T> RetryResult<T> failure(T value, Exception error) {
        if (error == null) {
            throw new IllegalArgumentException("error cannot be null");
        }
        return new RetryResult<>(value, error, 0);
    }

    /**
     * 성공 여부.
     *
     * @return error가 null이면 true
     */
    public boolean isSuccess() {
        return error == null;
    }

    /**
     * attempts만 변경한 새 인스턴스 생성.
     */
    public RetryResult<T> withAttempts(int attempts) {
        return new RetryResult<>(value, error, attempts);
    }
}
