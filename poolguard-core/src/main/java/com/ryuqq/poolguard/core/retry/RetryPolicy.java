package com.ryuqq.poolguard.core.retry;

/**
 * 재시도 정책 (불변 record).
 *
 * <p>가변 상태가 없는 순수 설정입니다. 작업 하나는 최대 {@code maxRetries + 1}번 시도됩니다.</p>
 *
 * <p><strong>지연 계산:</strong></p>
 * <pre>
 * delay = min(initialDelayMs * multiplier^attemptIndex, maxDelayMs)
 * jitter 사용 시: delay += delay * 0.25 * U(-1, 1)
 * </pre>
 *
 * @param maxRetries 최초 시도 이후 재시도 횟수 (0 이상)
 * @param initialDelayMs 첫 재시도 전 대기 시간 (밀리초, 0 이상)
 * @param maxDelayMs 최대 대기 시간 (밀리초, initialDelayMs 이상)
 * @param multiplier 지수 배수 (1.0 이상)
 * @param jitter ±25% 무작위 jitter 적용 여부
 * @author PoolGuard Team
 * @since 1.0.0
 */
public record RetryPolicy(
    int maxRetries,
    long initialDelayMs,
    long maxDelayMs,
    double multiplier,
    boolean jitter
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxRetries=3, initialDelayMs=100, maxDelayMs=30000, multiplier=2.0, jitter=true</p>
     */
    public RetryPolicy() {
        this(3, 100, 30_000, 2.0, true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RetryPolicy {
        if (maxRetries < 0) {
            throw new IllegalArgumentException(
                "maxRetries cannot be negative (current: " + maxRetries + ")"
            );
        }
        if (initialDelayMs < 0) {
            throw new IllegalArgumentException(
                "initialDelayMs cannot be negative (current: " + initialDelayMs + ")"
            );
        }
        if (maxDelayMs < initialDelayMs) {
            throw new IllegalArgumentException(
                "maxDelayMs must be >= initialDelayMs (initial: " + initialDelayMs + ", max: " + maxDelayMs + ")"
            );
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException(
                "multiplier must be >= 1.0 (current: " + multiplier + ")"
            );
        }
    }

    /**
     * 재시도하지 않는 정책 (1회 시도).
     *
     * @return maxRetries=0인 정책
     */
    public static RetryPolicy noRetry() {
        return new RetryPolicy(0, 0, 0, 1.0, false);
    }

    /**
     * 최대 시도 횟수.
     *
     * @return maxRetries + 1
     */
    public int maxAttempts() {
        return maxRetries + 1;
    }

    /**
     * maxRetries만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withMaxRetries(int maxRetries) {
        return new RetryPolicy(maxRetries, initialDelayMs, maxDelayMs, multiplier, jitter);
    }

    /**
     * initialDelayMs만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withInitialDelayMs(long initialDelayMs) {
        return new RetryPolicy(maxRetries, initialDelayMs, maxDelayMs, multiplier, jitter);
    }

    /**
     * maxDelayMs만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withMaxDelayMs(long maxDelayMs) {
        return new RetryPolicy(maxRetries, initialDelayMs, maxDelayMs, multiplier, jitter);
    }

    /**
     * multiplier만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withMultiplier(double multiplier) {
        return new RetryPolicy(maxRetries, initialDelayMs, maxDelayMs, multiplier, jitter);
    }

    /**
     * jitter만 변경한 새 인스턴스 생성.
     */
    public RetryPolicy withJitter(boolean jitter) {
        return new RetryPolicy(maxRetries, initialDelayMs, maxDelayMs, multiplier, jitter);
    }
}
