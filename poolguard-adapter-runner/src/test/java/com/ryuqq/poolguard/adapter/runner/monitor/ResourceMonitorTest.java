package com.ryuqq.poolguard.adapter.runner.monitor;

import com.ryuqq.poolguard.core.spi.ResourceProbe;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

/**
 * ResourceMonitor 유닛 테스트.
 *
 * <p>가짜 probe와 시계로 샘플 값을 제어하고 {@code sampleOnce()}를 직접 호출합니다.</p>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class ResourceMonitorTest {

    private static final long MB = 1024L * 1024L;

    @Mock
    private ThrottleListener listener;

    private final AtomicLong clock = new AtomicLong(0);
    private final FakeProbe probe = new FakeProbe();
    private ResourceMonitor monitor;

    @BeforeEach
    void setUp() {
        monitor = new ResourceMonitor(new ResourceMonitorConfig(), listener, Runnable::run, probe, clock::get);
    }

    @AfterEach
    void tearDown() {
        monitor.close();
    }

    /**
     * 1초 동안 지정한 CPU 시간을 사용한 것으로 진행.
     */
    private void advance(long cpuMillis) {
        clock.addAndGet(TimeUnit.SECONDS.toNanos(1));
        probe.cpuNanos.addAndGet(TimeUnit.MILLISECONDS.toNanos(cpuMillis));
    }

    // ============================================================
    // 1. 측정
    // ============================================================

    @Test
    void CPU_사용률은_경과시간_대비_CPU시간() {
        // given
        probe.memoryBytes.set(200 * MB);
        advance(250);

        // when
        monitor.sampleOnce();

        // then
        assertThat(monitor.getCurrentCpuPercent()).isEqualTo(25.0);
        assertThat(monitor.getCurrentMemoryMb()).isEqualTo(200);
        assertThat(monitor.isThrottled()).isFalse();
        verifyNoInteractions(listener);
    }

    @Test
    void CPU시간_측정불가면_0으로_처리() {
        // given
        probe.cpuNanos.set(-1);
        advance(0);

        // when
        monitor.sampleOnce();

        // then
        assertThat(monitor.getCurrentCpuPercent()).isZero();
    }

    // ============================================================
    // 2. throttling
    // ============================================================

    @Test
    void CPU_한도_초과시_throttle_진입_알림은_한번만() {
        // given
        advance(900);
        monitor.sampleOnce();

        // when
        advance(950);
        monitor.sampleOnce();

        // then
        assertThat(monitor.isThrottled()).isTrue();
        verify(listener, times(1)).onThrottle(ThrottleListener.RESOURCE_CPU);
        verify(listener, never()).onThrottle(ThrottleListener.RESOURCE_MEMORY);
    }

    @Test
    void 메모리_한도_0이면_즉시_throttle() {
        // given
        monitor.setLimits(80.0, 0);
        probe.memoryBytes.set(5 * MB);
        advance(10);

        // when
        monitor.sampleOnce();

        // then
        assertThat(monitor.isThrottled()).isTrue();
        verify(listener).onThrottle(ThrottleListener.RESOURCE_MEMORY);
    }

    @Test
    void 음수_CPU_한도면_항상_throttle() {
        // given
        monitor.setLimits(-1.0, 1024);
        advance(0);

        // when
        monitor.sampleOnce();

        // then
        assertThat(monitor.isThrottled()).isTrue();
        assertThat(monitor.metrics().maxCpuPercent()).isEqualTo(-1.0);
    }

    @Test
    void 한도_완화후_다음_샘플에서_throttle_해제() {
        // given
        monitor.setLimits(-1.0, 1024);
        advance(0);
        monitor.sampleOnce();

        // when
        monitor.setLimits(80.0, 1024);
        advance(100);
        monitor.sampleOnce();

        // then
        assertThat(monitor.isThrottled()).isFalse();
        verify(listener).onThrottle(ThrottleListener.RESOURCE_CPU);
        verify(listener, times(1)).onUnthrottle(ThrottleListener.RESOURCE_ALL);
    }

    @Test
    void throttle_비활성화_설정이면_한도를_넘어도_무시() {
        // given
        ResourceMonitor relaxed = new ResourceMonitor(
            new ResourceMonitorConfig().withCpuThrottle(false).withMemoryThrottle(false),
            listener, Runnable::run, probe, clock::get);
        relaxed.setLimits(-1.0, 0);
        probe.memoryBytes.set(100 * MB);
        advance(990);

        // when
        relaxed.sampleOnce();

        // then
        assertThat(relaxed.isThrottled()).isFalse();
        verifyNoInteractions(listener);
    }

    @Test
    void setLimits_잘못된_값_거부() {
        assertThatThrownBy(() -> monitor.setLimits(Double.NaN, 10))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> monitor.setLimits(50.0, -1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    // ============================================================
    // 3. 생명주기
    // ============================================================

    @Test
    void start_stop은_멱등() {
        // given
        ResourceMonitor live = new ResourceMonitor(
            new ResourceMonitorConfig().withSampleIntervalMs(10), listener, Runnable::run, probe);

        // when
        live.start();
        live.start();
        boolean runningAfterStart = live.isRunning();
        live.stop();
        live.stop();

        // then
        assertThat(runningAfterStart).isTrue();
        assertThat(live.isRunning()).isFalse();
    }

    @Test
    void 시작하면_주기적으로_샘플링() throws Exception {
        // given
        probe.memoryBytes.set(64 * MB);
        ResourceMonitor live = new ResourceMonitor(
            new ResourceMonitorConfig().withSampleIntervalMs(5), listener, Runnable::run, probe);

        // when
        live.start();
        try {
            long deadline = System.currentTimeMillis() + 2_000;
            while (live.getCurrentMemoryMb() == 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(5);
            }
        } finally {
            live.stop();
        }

        // then
        assertThat(live.getCurrentMemoryMb()).isEqualTo(64);
    }

    @Test
    void 실제_JVM_측정으로도_낮은_한도면_throttle되고_한도를_올리면_해제() throws Exception {
        // given
        ResourceMonitor live = new ResourceMonitor(
            new ResourceMonitorConfig().withSampleIntervalMs(10).withMaxCpuPercent(-1.0).withMemoryThrottle(false),
            listener, Runnable::run);

        // when
        live.start();
        try {
            boolean throttled = awaitState(live, true);
            live.setLimits(Double.MAX_VALUE, 1024);
            boolean released = awaitState(live, false);

            // then
            assertThat(throttled).isTrue();
            assertThat(released).isTrue();
        } finally {
            live.stop();
        }
        verify(listener).onThrottle(ThrottleListener.RESOURCE_CPU);
        verify(listener).onUnthrottle(ThrottleListener.RESOURCE_ALL);
    }

    private static boolean awaitState(ResourceMonitor target, boolean expected) throws InterruptedException {
        long deadline = System.currentTimeMillis() + 2_000;
        while (target.isThrottled() != expected && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        return target.isThrottled() == expected;
    }

    private static final class FakeProbe implements ResourceProbe {

        private final AtomicLong cpuNanos = new AtomicLong();
        private final AtomicLong memoryBytes = new AtomicLong();

        @Override
        public long processCpuTimeNanos() {
            return cpuNanos.get();
        }

        @Override
        public long usedMemoryBytes() {
            return memoryBytes.get();
        }
    }
}
