/**
 * Circuit Breaker, 백오프, 재시도 실행기.
 *
 * <p><strong>주요 컴포넌트:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.poolguard.adapter.runner.resilience.StateMachineCircuitBreaker}: closed/open/half-open 상태 머신</li>
 *   <li>{@link com.ryuqq.poolguard.adapter.runner.resilience.CircuitBreakerRegistry}: 작업 유형별 lazy 생성</li>
 *   <li>{@link com.ryuqq.poolguard.adapter.runner.resilience.BackoffCalculator}: 지수 백오프 + ±25% jitter</li>
 *   <li>{@link com.ryuqq.poolguard.adapter.runner.resilience.RetryExecutor}: 취소 가능한 재시도 실행</li>
 * </ul>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
package com.ryuqq.poolguard.adapter.runner.resilience;
