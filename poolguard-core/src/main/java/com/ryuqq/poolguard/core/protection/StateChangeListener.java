package com.ryuqq.poolguard.core.protection;

/**
 * Circuit Breaker 상태 전이 알림.
 *
 * <p>알림은 상태 전이를 일으킨 스레드가 아닌 별도 실행기에서 비동기로 전달되며,
 * 리스너가 느리거나 예외를 던져도 상태 전이에 영향을 주지 않습니다.</p>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface StateChangeListener {

    /**
     * 상태가 바뀐 뒤 호출됩니다.
     *
     * @param name Circuit Breaker 이름
     * @param from 이전 상태
     * @param to 새 상태
     */
    void onStateChange(String name, CircuitBreakerState from, CircuitBreakerState to);
}
