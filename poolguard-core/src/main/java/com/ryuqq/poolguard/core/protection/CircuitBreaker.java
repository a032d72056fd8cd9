package com.ryuqq.poolguard.core.protection;

import java.util.concurrent.Callable;

/**
 * Circuit Breaker SPI.
 *
 * <p>하나의 하위 작업(작업 타입 단위)의 연속 실패를 추적하고, 임계값 도달 시 빠르게 실패(Fail-Fast)하여
 * 장애가 전체 워커 풀로 전파되는 것을 방지합니다.</p>
 *
 * <p><strong>Circuit Breaker 패턴:</strong></p>
 * <ul>
 *   <li>CLOSED: 정상 동작, 연속 실패 추적</li>
 *   <li>OPEN: 요청 차단, 빠른 실패</li>
 *   <li>HALF_OPEN: 제한된 동시 프로브로 복구 테스트</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * CircuitBreaker cb = registry.get("payment");
 *
 * try {
 *     Receipt receipt = cb.call(() -> paymentApi.charge(order));
 * } catch (CircuitOpenException | TooManyRequestsException e) {
 *     // 보호 거부: 나중에 다시 시도
 * } catch (Exception e) {
 *     // 실제 실행 실패 (변형 없이 전달됨)
 * }
 * }</pre>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public interface CircuitBreaker {

    /**
     * Circuit Breaker 보호 하에 작업 실행.
     *
     * <ul>
     *   <li>CLOSED: 작업을 바로 실행하고 결과에 따라 카운터 갱신</li>
     *   <li>OPEN: timeout 전이면 작업 호출 없이 {@code CircuitOpenException},
     *       timeout이 지났으면 HALF_OPEN으로 전이 후 재평가</li>
     *   <li>HALF_OPEN: 진행 중인 프로브가 halfOpenMaxCalls 이상이면 {@code TooManyRequestsException}</li>
     * </ul>
     *
     * @param task 보호할 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws com.ryuqq.poolguard.core.error.CircuitOpenException OPEN 상태로 차단된 경우
     * @throws com.ryuqq.poolguard.core.error.TooManyRequestsException HALF_OPEN 프로브 한도 초과
     * @throws Exception 작업이 던진 예외 (그대로 전달)
     */
    <T> T call(Callable<T> task) throws Exception;

    /**
     * Circuit Breaker 이름 (보호 대상 키).
     *
     * @return 이름
     */
    String getName();

    /**
     * 현재 Circuit Breaker 상태 조회.
     *
     * @return CLOSED, OPEN, HALF_OPEN 중 하나
     */
    CircuitBreakerState getState();

    /**
     * 통계 조회.
     *
     * @return 현재 카운터 스냅샷
     */
    CircuitBreakerMetrics getMetrics();

    /**
     * Circuit Breaker를 CLOSED 상태로 강제 리셋.
     *
     * <p>수동 복구 또는 테스트 목적으로 사용됩니다.</p>
     */
    void reset();
}
