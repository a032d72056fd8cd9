package com.ryuqq.poolguard.adapter.runner.resilience;

import com.ryuqq.poolguard.core.error.CircuitOpenException;
import com.ryuqq.poolguard.core.error.TooManyRequestsException;
import com.ryuqq.poolguard.core.protection.CircuitBreaker;
import com.ryuqq.poolguard.core.protection.CircuitBreakerConfig;
import com.ryuqq.poolguard.core.protection.CircuitBreakerMetrics;
import com.ryuqq.poolguard.core.protection.CircuitBreakerState;
import com.ryuqq.poolguard.core.protection.StateChangeListener;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;

/**
 * 상태 머신 기반 Circuit Breaker 구현체.
 *
 * <p><strong>상태 전이:</strong></p>
 * <pre>
 * CLOSED ──(연속 실패 ≥ failureThreshold)──→ OPEN
 * OPEN ──(timeout 경과 후 첫 호출)──→ HALF_OPEN
 * HALF_OPEN ──(연속 성공 ≥ successThreshold)──→ CLOSED
 * HALF_OPEN ──(실패 1회)──→ OPEN
 * </pre>
 *
 * <p><strong>전이 시 카운터 초기화:</strong></p>
 * <ul>
 *   <li>CLOSED 진입: 연속 실패, 연속 성공, 프로브 수 0</li>
 *   <li>OPEN 진입: 연속 성공 0, 마지막 실패 시각 기록</li>
 *   <li>HALF_OPEN 진입: 연속 실패, 연속 성공, 프로브 수 0</li>
 * </ul>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>카운터 갱신은 원자 연산으로 처리 (hot path에서 lock 없음)</li>
 *   <li>상태 전이와 HALF_OPEN 슬롯 점유/반환만 짧은 monitor 구간에서 수행하며, 작업 실행 중에는 lock을 잡지 않음</li>
 *   <li>모든 전이는 구간 번호를 올림. 이전 구간에서 시작한 HALF_OPEN 호출은 종료 시 새 구간의 슬롯을 반환하지 않음</li>
 *   <li>상태 변경 리스너는 {@link Executor}로 비동기 호출되어 전이를 막지 않음</li>
 * </ul>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public final class StateMachineCircuitBreaker implements CircuitBreaker {

    private static final Logger log = LoggerFactory.getLogger(StateMachineCircuitBreaker.class);

    private static final long NOT_HALF_OPEN = -1L;

    private final CircuitBreakerConfig config;
    private final StateChangeListener listener;
    private final Executor notifier;
    private final LongSupplier nanoClock;
    private final long timeoutNanos;

    private final Object transitionLock = new Object();
    private final AtomicReference<CircuitBreakerState> state = new AtomicReference<>(CircuitBreakerState.CLOSED);
    private final AtomicInteger consecutiveFailures = new AtomicInteger();
    private final AtomicInteger consecutiveSuccesses = new AtomicInteger();
    private final AtomicInteger halfOpenCalls = new AtomicInteger();
    private final AtomicLong halfOpenEpoch = new AtomicLong();
    private final AtomicLong totalFailures = new AtomicLong();
    private final AtomicLong totalSuccesses = new AtomicLong();
    private volatile long lastFailureNanos;

    /**
     * 리스너 없이 생성.
     *
     * @param config 설정
     */
    public StateMachineCircuitBreaker(CircuitBreakerConfig config) {
        this(config, null, null);
    }

    /**
     * 생성자.
     *
     * @param config 설정
     * @param listener 상태 변경 리스너 (null이면 알림 없음)
     * @param notifier 리스너를 실행할 Executor (listener가 있으면 필수)
     * @throws IllegalArgumentException config가 null이거나, listener는 있는데 notifier가 null인 경우
     */
    public StateMachineCircuitBreaker(CircuitBreakerConfig config, StateChangeListener listener, Executor notifier) {
        this(config, listener, notifier, System::nanoTime);
    }

    StateMachineCircuitBreaker(CircuitBreakerConfig config, StateChangeListener listener,
                               Executor notifier, LongSupplier nanoClock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (listener != null && notifier == null) {
            throw new IllegalArgumentException("notifier cannot be null when listener is set");
        }
        this.config = config;
        this.listener = listener;
        this.notifier = notifier;
        this.nanoClock = nanoClock;
        this.timeoutNanos = TimeUnit.MILLISECONDS.toNanos(config.timeoutMs());
    }

    @Override
    public <T> T call(Callable<T> task) throws Exception {
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }

        CircuitBreakerState current = state.get();
        if (current == CircuitBreakerState.OPEN) {
            if (nanoClock.getAsLong() - lastFailureNanos < timeoutNanos) {
                throw new CircuitOpenException(config.name(),
                    "Circuit breaker '" + config.name() + "' is open");
            }
            transitionFrom(CircuitBreakerState.OPEN, CircuitBreakerState.HALF_OPEN);
            // 다른 호출이 먼저 전이했을 수 있으므로 현재 상태로 다시 판단
            return call(task);
        }

        if (current == CircuitBreakerState.HALF_OPEN) {
            long epoch = acquireHalfOpenSlot();
            if (epoch == NOT_HALF_OPEN) {
                return call(task);
            }
            try {
                return invoke(task);
            } finally {
                releaseHalfOpenSlot(epoch);
            }
        }

        return invoke(task);
    }

    private <T> T invoke(Callable<T> task) throws Exception {
        T result;
        try {
            result = task.call();
        } catch (Exception e) {
            onFailure();
            throw e;
        }
        onSuccess();
        return result;
    }

    /**
     * HALF_OPEN 슬롯을 하나 점유하고 점유 시점의 구간 번호를 반환.
     *
     * @return 구간 번호, 이미 HALF_OPEN이 아니면 {@link #NOT_HALF_OPEN}
     * @throws TooManyRequestsException 동시 호출 한도에 도달한 경우
     */
    private long acquireHalfOpenSlot() {
        synchronized (transitionLock) {
            if (state.get() != CircuitBreakerState.HALF_OPEN) {
                return NOT_HALF_OPEN;
            }
            if (halfOpenCalls.get() >= config.halfOpenMaxCalls()) {
                throw new TooManyRequestsException(config.name(),
                    "Circuit breaker '" + config.name() + "' reached half-open call limit ("
                        + config.halfOpenMaxCalls() + ")");
            }
            halfOpenCalls.incrementAndGet();
            return halfOpenEpoch.get();
        }
    }

    /**
     * 점유한 구간이 아직 현재 HALF_OPEN 구간일 때만 슬롯 반환.
     * 이전 구간에서 시작한 호출은 새 구간의 카운터를 건드리지 않음.
     */
    private void releaseHalfOpenSlot(long epoch) {
        synchronized (transitionLock) {
            if (halfOpenEpoch.get() == epoch) {
                halfOpenCalls.updateAndGet(n -> Math.max(0, n - 1));
            }
        }
    }

    private void onSuccess() {
        totalSuccesses.incrementAndGet();
        CircuitBreakerState current = state.get();
        if (current == CircuitBreakerState.HALF_OPEN) {
            if (consecutiveSuccesses.incrementAndGet() >= config.successThreshold()) {
                transitionFrom(CircuitBreakerState.HALF_OPEN, CircuitBreakerState.CLOSED);
            }
        } else if (current == CircuitBreakerState.CLOSED) {
            consecutiveFailures.set(0);
        }
    }

    private void onFailure() {
        totalFailures.incrementAndGet();
        lastFailureNanos = nanoClock.getAsLong();
        CircuitBreakerState current = state.get();
        if (current == CircuitBreakerState.HALF_OPEN) {
            transitionFrom(CircuitBreakerState.HALF_OPEN, CircuitBreakerState.OPEN);
        } else if (current == CircuitBreakerState.CLOSED) {
            if (consecutiveFailures.incrementAndGet() >= config.failureThreshold()) {
                transitionFrom(CircuitBreakerState.CLOSED, CircuitBreakerState.OPEN);
            }
        }
    }

    /**
     * 현재 상태가 expected일 때만 target으로 전이.
     *
     * @return 전이했으면 true
     */
    private boolean transitionFrom(CircuitBreakerState expected, CircuitBreakerState target) {
        synchronized (transitionLock) {
            if (state.get() != expected) {
                return false;
            }
            enter(target);
        }
        log.info("Circuit breaker '{}' state changed: {} → {}", config.name(), expected.value(), target.value());
        notifyStateChange(expected, target);
        return true;
    }

    private void enter(CircuitBreakerState target) {
        halfOpenEpoch.incrementAndGet();
        switch (target) {
            case CLOSED:
                consecutiveFailures.set(0);
                consecutiveSuccesses.set(0);
                halfOpenCalls.set(0);
                break;
            case OPEN:
                consecutiveSuccesses.set(0);
                lastFailureNanos = nanoClock.getAsLong();
                break;
            case HALF_OPEN:
                consecutiveFailures.set(0);
                consecutiveSuccesses.set(0);
                halfOpenCalls.set(0);
                break;
            default:
                throw new IllegalStateException("Unknown state: " + target);
        }
        state.set(target);
    }

    private void notifyStateChange(CircuitBreakerState from, CircuitBreakerState to) {
        if (listener != null) {
            notifier.execute(() -> listener.onStateChange(config.name(), from, to));
        }
    }

    @Override
    public String getName() {
        return config.name();
    }

    @Override
    public CircuitBreakerState getState() {
        return state.get();
    }

    @Override
    public CircuitBreakerMetrics getMetrics() {
        return new CircuitBreakerMetrics(
            config.name(),
            state.get(),
            totalFailures.get(),
            totalSuccesses.get(),
            consecutiveFailures.get(),
            consecutiveSuccesses.get(),
            halfOpenCalls.get()
        );
    }

    @Override
    public void reset() {
        CircuitBreakerState previous;
        synchronized (transitionLock) {
            previous = state.get();
            enter(CircuitBreakerState.CLOSED);
        }
        if (previous != CircuitBreakerState.CLOSED) {
            log.info("Circuit breaker '{}' reset: {} → {}", config.name(), previous.value(),
                CircuitBreakerState.CLOSED.value());
            notifyStateChange(previous, CircuitBreakerState.CLOSED);
        }
    }

    public CircuitBreakerConfig getConfig() {
        return config;
    }
}
