package com.ryuqq.poolguard.adapter.runner.resilience;

import com.ryuqq.poolguard.core.error.CircuitOpenException;
import com.ryuqq.poolguard.core.error.TooManyRequestsException;
import com.ryuqq.poolguard.core.protection.CircuitBreakerConfig;
import com.ryuqq.poolguard.core.protection.CircuitBreakerMetrics;
import com.ryuqq.poolguard.core.protection.CircuitBreakerState;
import com.ryuqq.poolguard.core.protection.StateChangeListener;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * StateMachineCircuitBreaker 유닛 테스트.
 *
 * <p>가짜 시계로 timeout 경과를 제어하고, 리스너는 호출 스레드에서 바로 실행합니다.</p>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class StateMachineCircuitBreakerTest {

    private static final long TIMEOUT_MS = 1_000;

    @Mock
    private StateChangeListener listener;

    private final AtomicLong clock = new AtomicLong(1_000_000L);
    private StateMachineCircuitBreaker breaker;

    @BeforeEach
    void setUp() {
        CircuitBreakerConfig config = new CircuitBreakerConfig("payments", 3, 2, TIMEOUT_MS, 1);
        breaker = new StateMachineCircuitBreaker(config, listener, Runnable::run, clock::get);
    }

    private void fail() {
        assertThatThrownBy(() -> breaker.call(() -> {
            throw new IOException("downstream error");
        })).isInstanceOf(IOException.class);
    }

    private void succeed() throws Exception {
        assertThat(breaker.call(() -> "ok")).isEqualTo("ok");
    }

    private void elapse(long millis) {
        clock.addAndGet(TimeUnit.MILLISECONDS.toNanos(millis));
    }

    // ============================================================
    // 1. CLOSED
    // ============================================================

    @Test
    void 연속_실패가_임계치에_도달하면_OPEN() {
        // when
        fail();
        fail();
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        fail();

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThat(breaker.getMetrics().totalFailures()).isEqualTo(3);
    }

    @Test
    void 성공하면_연속_실패_카운트가_초기화됨() throws Exception {
        // when
        fail();
        fail();
        succeed();
        fail();
        fail();

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(breaker.getMetrics().consecutiveFailures()).isEqualTo(2);
    }

    // ============================================================
    // 2. OPEN
    // ============================================================

    @Test
    void OPEN_상태에서는_작업을_실행하지_않고_거부() {
        // given
        fail();
        fail();
        fail();
        int[] invoked = {0};

        // when & then
        assertThatThrownBy(() -> breaker.call(() -> ++invoked[0]))
            .isInstanceOf(CircuitOpenException.class)
            .hasMessageContaining("payments");
        assertThat(invoked[0]).isZero();
    }

    @Test
    void timeout_경과후_첫_호출은_HALF_OPEN_프로브로_실행됨() throws Exception {
        // given
        fail();
        fail();
        fail();
        elapse(TIMEOUT_MS);

        // when
        succeed();

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.HALF_OPEN);
        assertThat(breaker.getMetrics().consecutiveSuccesses()).isEqualTo(1);
    }

    // ============================================================
    // 3. HALF_OPEN
    // ============================================================

    @Test
    void HALF_OPEN_연속_성공이_임계치에_도달하면_CLOSED() throws Exception {
        // given
        fail();
        fail();
        fail();
        elapse(TIMEOUT_MS + 1);

        // when
        succeed();
        succeed();

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.CLOSED);
        InOrder order = inOrder(listener);
        order.verify(listener).onStateChange("payments", CircuitBreakerState.CLOSED, CircuitBreakerState.OPEN);
        order.verify(listener).onStateChange("payments", CircuitBreakerState.OPEN, CircuitBreakerState.HALF_OPEN);
        order.verify(listener).onStateChange("payments", CircuitBreakerState.HALF_OPEN, CircuitBreakerState.CLOSED);
    }

    @Test
    void HALF_OPEN_실패하면_다시_OPEN() {
        // given
        fail();
        fail();
        fail();
        elapse(TIMEOUT_MS);

        // when
        fail();

        // then
        assertThat(breaker.getState()).isEqualTo(CircuitBreakerState.OPEN);
        assertThatThrownBy(() -> breaker.call(() -> "blocked"))
            .isInstanceOf(CircuitOpenException.class);
    }

    @Test
    void HALF_OPEN_동시_프로브_한도_초과는_TooManyRequests() throws Exception {
        // given
        fail();
        fail();
        fail();
        elapse(TIMEOUT_MS);

        CountDownLatch probeRunning = new CountDownLatch(1);
        CountDownLatch releaseProbe = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<String> probe = pool.submit(() -> breaker.call(() -> {
                probeRunning.countDown();
                releaseProbe.await(5, TimeUnit.SECONDS);
                return "probe";
            }));
            assertThat(probeRunning.await(5, TimeUnit.SECONDS)).isTrue();

            // when & then
            assertThatThrownBy(() -> breaker.call(() -> "second"))
                .isInstanceOf(TooManyRequestsException.class);

            releaseProbe.countDown();
            assertThat(probe.get(5, TimeUnit.SECONDS)).isEqualTo("probe");
            assertThat(breaker.getMetrics().halfOpenCalls()).isZero();
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void 이전_HALF_OPEN_구간의_호출이_끝나도_새_구간의_동시_호출_한도는_유지됨() throws Exception {
        // given
        StateMachineCircuitBreaker wide = new StateMachineCircuitBreaker(
            new CircuitBreakerConfig("payments", 1, 5, TIMEOUT_MS, 2), listener, Runnable::run, clock::get);
        assertThatThrownBy(() -> wide.call(() -> {
            throw new IOException("downstream error");
        })).isInstanceOf(IOException.class);
        elapse(TIMEOUT_MS);

        CountDownLatch staleRunning = new CountDownLatch(1);
        CountDownLatch releaseStale = new CountDownLatch(1);
        CountDownLatch freshRunning = new CountDownLatch(2);
        CountDownLatch releaseFresh = new CountDownLatch(1);
        ExecutorService pool = Executors.newFixedThreadPool(3);
        try {
            Future<String> stale = pool.submit(() -> wide.call(() -> {
                staleRunning.countDown();
                releaseStale.await(5, TimeUnit.SECONDS);
                return "stale";
            }));
            assertThat(staleRunning.await(5, TimeUnit.SECONDS)).isTrue();

            // 같은 구간의 다른 호출이 실패하여 OPEN, timeout 후 새 HALF_OPEN 구간
            assertThatThrownBy(() -> wide.call(() -> {
                throw new IOException("downstream error");
            })).isInstanceOf(IOException.class);
            assertThat(wide.getState()).isEqualTo(CircuitBreakerState.OPEN);
            elapse(TIMEOUT_MS);

            Future<String> first = pool.submit(() -> wide.call(() -> {
                freshRunning.countDown();
                releaseFresh.await(5, TimeUnit.SECONDS);
                return "first";
            }));
            Future<String> second = pool.submit(() -> wide.call(() -> {
                freshRunning.countDown();
                releaseFresh.await(5, TimeUnit.SECONDS);
                return "second";
            }));
            assertThat(freshRunning.await(5, TimeUnit.SECONDS)).isTrue();

            // when
            releaseStale.countDown();
            assertThat(stale.get(5, TimeUnit.SECONDS)).isEqualTo("stale");

            // then
            assertThat(wide.getMetrics().halfOpenCalls()).isEqualTo(2);
            assertThatThrownBy(() -> wide.call(() -> "third"))
                .isInstanceOf(TooManyRequestsException.class);

            releaseFresh.countDown();
            assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo("first");
            assertThat(second.get(5, TimeUnit.SECONDS)).isEqualTo("second");
            assertThat(wide.getMetrics().halfOpenCalls()).isZero();
        } finally {
            pool.shutdownNow();
        }
    }

    // ============================================================
    // 4. reset / 기타
    // ============================================================

    @Test
    void reset_하면_CLOSED로_돌아가고_카운터_초기화() {
        // given
        fail();
        fail();
        fail();

        // when
        breaker.reset();

        // then
        CircuitBreakerMetrics metrics = breaker.getMetrics();
        assertThat(metrics.state()).isEqualTo(CircuitBreakerState.CLOSED);
        assertThat(metrics.consecutiveFailures()).isZero();
        assertThat(metrics.totalFailures()).isEqualTo(3);
    }

    @Test
    void 리스너가_없으면_notifier도_필요없음() {
        // given
        StateMachineCircuitBreaker plain = new StateMachineCircuitBreaker(new CircuitBreakerConfig());

        // when & then
        assertThat(plain.getName()).isEqualTo("default");
        assertThatThrownBy(() -> new StateMachineCircuitBreaker(new CircuitBreakerConfig(), listener, null))
            .isInstanceOf(IllegalArgumentException.class);
        verifyNoInteractions(listener);
    }
}
