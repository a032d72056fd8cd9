package com.ryuqq.poolguard.adapter.runner;

import com.ryuqq.poolguard.core.retry.RetryPolicy;

/**
 * TenantAwareTaskRunner 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>retryPolicy: 작업 재시도 정책 (기본 {@code new RetryPolicy()})</li>
 *   <li>throttleWaitMs: throttle 중 제출된 작업의 대기 시간 (기본 100ms)</li>
 *   <li>rejectWhenThrottled: 대기 후에도 throttle이면 거부할지 여부 (기본 false, 대기 후 진행)</li>
 *   <li>dlqEnabled: 최종 실패 작업의 DLQ 전송 활성화 여부 (기본 true)</li>
 * </ul>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 * @param retryPolicy 재시도 정책 (null 불가)
 * @param throttleWaitMs throttle 대기 시간 (밀리초, 0 이상)
 * @param rejectWhenThrottled throttle 지속 시 거부 여부
 * @param dlqEnabled DLQ 전송 활성화 여부
 */
public record TaskRunnerConfig(
    RetryPolicy retryPolicy,
    long throttleWaitMs,
    boolean rejectWhenThrottled,
    boolean dlqEnabled
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: retryPolicy=기본 RetryPolicy, throttleWaitMs=100ms,
     * rejectWhenThrottled=false, dlqEnabled=true</p>
     */
    public TaskRunnerConfig() {
        this(new RetryPolicy(), 100, false, true);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public TaskRunnerConfig {
        if (retryPolicy == null) {
            throw new IllegalArgumentException("retryPolicy cannot be null");
        }
        if (throttleWaitMs < 0) {
            throw new IllegalArgumentException(
                "throttleWaitMs must not be negative (current: " + throttleWaitMs + ")"
            );
        }
    }

    /**
     * retryPolicy만 변경한 새 인스턴스 생성.
     */
    public TaskRunnerConfig withRetryPolicy(RetryPolicy retryPolicy) {
        return new TaskRunnerConfig(retryPolicy, throttleWaitMs, rejectWhenThrottled, dlqEnabled);
    }

    /**
     * throttleWaitMs만 변경한 새 인스턴스 생성.
     */
    public TaskRunnerConfig withThrottleWaitMs(long throttleWaitMs) {
        return new TaskRunnerConfig(retryPolicy, throttleWaitMs, rejectWhenThrottled, dlqEnabled);
    }

    /**
     * rejectWhenThrottled만 변경한 새 인스턴스 생성.
     */
    public TaskRunnerConfig withRejectWhenThrottled(boolean rejectWhenThrottled) {
        return new TaskRunnerConfig(retryPolicy, throttleWaitMs, rejectWhenThrottled, dlqEnabled);
    }

    /**
     * dlqEnabled만 변경한 새 인스턴스 생성.
     */
    public TaskRunnerConfig withDlqEnabled(boolean dlqEnabled) {
        return new TaskRunnerConfig(retryPolicy, throttleWaitMs, rejectWhenThrottled, dlqEnabled);
    }
}
