/**
 * Protection SPI (Service Provider Interface) 패키지.
 *
 * <p>하위 의존성이 연속으로 실패할 때 워커 풀 전체로 장애가 번지는 것을 막기 위한
 * Circuit Breaker 확장점을 정의합니다. 상태 머신 구현은 {@code poolguard-adapter-runner}
 * 모듈의 {@code StateMachineCircuitBreaker}가 제공합니다.</p>
 *
 * <h2>보호 체인 순서</h2>
 *
 * <pre>
 * 1. TenantRegistry  → 테넌트 quota 예약 (입장 거부)
 * 2. ResourceMonitor → 프로세스 자원 throttle 확인
 * 3. RetryExecutor   → 시도 횟수와 백오프 관리
 * 4. CircuitBreaker  → 시도마다 OPEN/HALF_OPEN 차단 (보호 거부)
 * 5. Task            → 실제 작업 실행
 * </pre>
 *
 * <h2>NoOp 구현</h2>
 *
 * <p>{@code noop} 하위 패키지의 {@link com.ryuqq.poolguard.core.protection.noop.NoOpCircuitBreaker}는
 * 모든 요청을 통과시키고 상태를 추적하지 않습니다.</p>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 * @see com.ryuqq.poolguard.core.protection.CircuitBreaker
 * @see com.ryuqq.poolguard.core.protection.noop
 */
package com.ryuqq.poolguard.core.protection;
