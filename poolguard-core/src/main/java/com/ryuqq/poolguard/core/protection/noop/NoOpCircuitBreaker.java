package com.ryuqq.poolguard.core.protection.noop;

import com.ryuqq.poolguard.core.protection.CircuitBreaker;
import com.ryuqq.poolguard.core.protection.CircuitBreakerMetrics;
import com.ryuqq.poolguard.core.protection.CircuitBreakerState;

import java.util.concurrent.Callable;

/**
 * Circuit Breaker NoOp 구현.
 *
 * <p>모든 요청을 항상 통과시키며, 상태 추적을 하지 않습니다.
 * 작업 타입별 보호가 필요 없는 환경이나 테스트에서 사용합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>call(): 작업을 그대로 실행</li>
 *   <li>getState(): 항상 CLOSED 반환</li>
 *   <li>getMetrics(): 항상 0인 카운터 반환</li>
 *   <li>reset(): 아무 동작 안 함</li>
 * </ul>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public final class NoOpCircuitBreaker implements CircuitBreaker {

    private final String name;

    public NoOpCircuitBreaker() {
        this("noop");
    }

    public NoOpCircuitBreaker(String name) {
        this.name = name;
    }

    @Override
    public <T> T call(Callable<T> task) throws Exception {
        return task.call();
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public CircuitBreakerState getState() {
        return CircuitBreakerState.CLOSED;
    }

    @Override
    public CircuitBreakerMetrics getMetrics() {
        return new CircuitBreakerMetrics(name, CircuitBreakerState.CLOSED, 0, 0, 0, 0, 0);
    }

    @Override
    public void reset() {
        // NoOp
    }
}
