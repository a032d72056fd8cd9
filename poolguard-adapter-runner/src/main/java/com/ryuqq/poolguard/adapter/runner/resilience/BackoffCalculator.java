package com.ryuqq.poolguard.adapter.runner.resilience;

import com.ryuqq.poolguard.core.retry.RetryPolicy;

import java.util.function.DoubleSupplier;

/**
 * Exponential Backoff with Jitter 계산기.
 *
 * <p>재시도 간격을 지수적으로 증가시키되, jitter로 ±25% 범위의 무작위성을 더해
 * 동시에 실패한 호출자들이 같은 시각에 몰리지 않도록 합니다.</p>
 *
 * <p><strong>알고리즘:</strong></p>
 * <pre>
 * delay = min(initialDelay * multiplier^attemptIndex, maxDelay)
 * jitter 사용 시: delay += delay * 0.25 * U(-1, 1)
 * </pre>
 *
 * <p><strong>예시 (initialDelay=100ms, multiplier=2.0, maxDelay=30000ms):</strong></p>
 * <ul>
 *   <li>attemptIndex=0: 100ms (jitter 시 75-125ms)</li>
 *   <li>attemptIndex=1: 200ms (jitter 시 150-250ms)</li>
 *   <li>attemptIndex=2: 400ms (jitter 시 300-500ms)</li>
 *   <li>attemptIndex=15: 3276800ms → 30000ms로 제한 (jitter 시 22500-37500ms)</li>
 * </ul>
 *
 * <p>jitter는 상한 제한 뒤에 적용되므로 maxDelay를 최대 25%까지 넘을 수 있습니다.</p>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public class BackoffCalculator {

    static final double JITTER_RATIO = 0.25;

    private final DoubleSupplier uniform;

    /**
     * 기본 난수 생성기로 생성.
     */
    public BackoffCalculator() {
        this(Math::random);
    }

    /**
     * 난수 공급자 주입.
     *
     * @param uniform [0.0, 1.0) 범위의 난수 공급자
     */
    BackoffCalculator(DoubleSupplier uniform) {
        this.uniform = uniform;
    }

    /**
     * 재시도 지연 시간 계산.
     *
     * @param policy 재시도 정책
     * @param attemptIndex 방금 실패한 시도의 인덱스 (0부터 시작)
     * @return 다음 시도 전 대기 시간 (밀리초, 0 이상)
     * @throws IllegalArgumentException policy가 null이거나 attemptIndex가 음수인 경우
     */
    public long calculate(RetryPolicy policy, int attemptIndex) {
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (attemptIndex < 0) {
            throw new IllegalArgumentException(
                "attemptIndex must not be negative (current: " + attemptIndex + ")"
            );
        }

        // 1. 지수적 백오프 (double로 계산 후 상한 적용해 overflow 방지)
        double exponential = policy.initialDelayMs() * Math.pow(policy.multiplier(), attemptIndex);
        double delay = Math.min(exponential, (double) policy.maxDelayMs());

        // 2. ±25% jitter
        if (policy.jitter()) {
            double factor = uniform.getAsDouble() * 2.0 - 1.0;
            delay += delay * JITTER_RATIO * factor;
        }

        return Math.max(0L, Math.round(delay));
    }
}
