package com.ryuqq.poolguard.core.protection;

/**
 * Circuit Breaker 카운터 스냅샷.
 *
 * @param name Circuit Breaker 이름
 * @param state 현재 상태
 * @param totalFailures 누적 실패 수
 * @param totalSuccesses 누적 성공 수
 * @param consecutiveFailures 연속 실패 수
 * @param consecutiveSuccesses 연속 성공 수
 * @param halfOpenCalls 진행 중인 HALF_OPEN 프로브 수
 * @author PoolGuard Team
 * @since 1.0.0
 */
public record CircuitBreakerMetrics(
    String name,
    CircuitBreakerState state,
    long totalFailures,
    long totalSuccesses,
    int consecutiveFailures,
    int consecutiveSuccesses,
    int halfOpenCalls
) {
}
