package com.ryuqq.poolguard.adapter.runner.monitor;

import com.ryuqq.poolguard.core.spi.ResourceProbe;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.LongSupplier;

/**
 * 프로세스 자원 모니터.
 *
 * <p>시작된 동안 일정 간격으로 CPU와 메모리 사용량을 샘플링하고,
 * 임계값을 넘으면 throttle 플래그를 세웁니다.</p>
 *
 * <p><strong>샘플링 주기:</strong></p>
 * <ol>
 *   <li>CPU: 직전 샘플 이후 CPU 시간 증가분 / 경과 시간 * 100 (한 코어 기준, 멀티코어에서는 100 초과 가능)</li>
 *   <li>메모리: 현재 사용량을 MB로 저장</li>
 *   <li>활성화된 자원 중 하나라도 임계값 초과 시 throttle
 *       (해제 → throttle 전이 시에만 초과한 자원마다 onThrottle)</li>
 *   <li>모든 자원이 임계값 이하이면 해제 (throttle → 해제 전이 시에만 onUnthrottle("all"))</li>
 * </ol>
 *
 * <p><strong>생명주기:</strong> {@link #start()}/{@link #stop()}은 여러 번 호출해도 안전합니다.
 * stop은 샘플링 스레드를 즉시 깨워 종료를 기다립니다.</p>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public final class ResourceMonitor implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ResourceMonitor.class);

    private static final long BYTES_PER_MB = 1024L * 1024L;
    private static final long STOP_TIMEOUT_MS = 5000;

    private final ResourceMonitorConfig config;
    private final ThrottleListener listener;
    private final Executor notifier;
    private final ResourceProbe probe;
    private final LongSupplier nanoClock;

    private final AtomicReference<Limits> limits;
    private final AtomicLong currentCpuBits = new AtomicLong(Double.doubleToLongBits(0.0));
    private final AtomicLong currentMemoryBytes = new AtomicLong();
    private final AtomicBoolean throttled = new AtomicBoolean(false);

    private final Object sampleLock = new Object();
    private long lastCpuNanos = -1;
    private long lastSampleNanos;

    private ScheduledExecutorService scheduler;

    /**
     * JVM 측정기로 생성.
     *
     * @param config 설정
     * @param listener throttle 리스너
     * @param notifier 리스너 실행용 Executor
     */
    public ResourceMonitor(ResourceMonitorConfig config, ThrottleListener listener, Executor notifier) {
        this(config, listener, notifier, new JvmResourceProbe());
    }

    /**
     * 생성자.
     *
     * @param config 설정
     * @param listener throttle 리스너
     * @param notifier 리스너 실행용 Executor
     * @param probe 자원 측정기
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public ResourceMonitor(ResourceMonitorConfig config, ThrottleListener listener,
                           Executor notifier, ResourceProbe probe) {
        this(config, listener, notifier, probe, System::nanoTime);
    }

    ResourceMonitor(ResourceMonitorConfig config, ThrottleListener listener,
                    Executor notifier, ResourceProbe probe, LongSupplier nanoClock) {
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (listener == null) {
            throw new IllegalArgumentException("listener cannot be null");
        }
        if (notifier == null) {
            throw new IllegalArgumentException("notifier cannot be null");
        }
        if (probe == null) {
            throw new IllegalArgumentException("probe cannot be null");
        }
        this.config = config;
        this.listener = listener;
        this.notifier = notifier;
        this.probe = probe;
        this.nanoClock = nanoClock;
        this.limits = new AtomicReference<>(new Limits(config.maxCpuPercent(), config.maxMemoryMb()));
        resetBaseline();
    }

    /**
     * 샘플링 시작 (이미 실행 중이면 무시).
     */
    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        resetBaseline();
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "poolguard-resource-monitor");
            thread.setDaemon(true);
            return thread;
        });
        long interval = config.sampleIntervalMs();
        scheduler.scheduleAtFixedRate(this::sampleSafely, interval, interval, TimeUnit.MILLISECONDS);
        log.info("Resource monitor started (interval={}ms, maxCpu={}%, maxMemory={}MB)",
            interval, limits.get().maxCpuPercent(), limits.get().maxMemoryMb());
    }

    /**
     * 샘플링 중지 (실행 중이 아니면 무시).
     */
    public synchronized void stop() {
        if (scheduler == null) {
            return;
        }
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(STOP_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                log.warn("Resource monitor thread did not terminate within {}ms", STOP_TIMEOUT_MS);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        scheduler = null;
        log.info("Resource monitor stopped");
    }

    public synchronized boolean isRunning() {
        return scheduler != null;
    }

    @Override
    public void close() {
        stop();
    }

    /**
     * 샘플링 1회 수행.
     *
     * <p>주기 실행과 같은 로직이며, 스케줄러 없이 직접 구동할 때 사용합니다.</p>
     */
    public void sampleOnce() {
        synchronized (sampleLock) {
            long now = nanoClock.getAsLong();
            long cpuNanos = probe.processCpuTimeNanos();
            long elapsed = now - lastSampleNanos;

            double cpuPercent = 0.0;
            if (cpuNanos >= 0 && lastCpuNanos >= 0 && elapsed > 0) {
                cpuPercent = (double) (cpuNanos - lastCpuNanos) / elapsed * 100.0;
            }
            lastCpuNanos = cpuNanos;
            lastSampleNanos = now;

            currentCpuBits.set(Double.doubleToLongBits(cpuPercent));
            currentMemoryBytes.set(probe.usedMemoryBytes());
            evaluate(cpuPercent, getCurrentMemoryMb());
        }
    }

    private void sampleSafely() {
        try {
            sampleOnce();
        } catch (RuntimeException e) {
            // 예외가 나가면 scheduleAtFixedRate가 이후 실행을 멈춤
            log.warn("Resource sampling failed", e);
        }
    }

    private void evaluate(double cpuPercent, long memoryMb) {
        Limits current = limits.get();
        boolean cpuOver = config.cpuThrottle() && cpuPercent > current.maxCpuPercent();
        boolean memoryOver = config.memoryThrottle() && memoryMb > current.maxMemoryMb();

        if (cpuOver || memoryOver) {
            if (throttled.compareAndSet(false, true)) {
                log.info("Throttling enabled (cpu={}%, memory={}MB, maxCpu={}%, maxMemory={}MB)",
                    String.format("%.1f", cpuPercent), memoryMb, current.maxCpuPercent(), current.maxMemoryMb());
                if (cpuOver) {
                    notifier.execute(() -> listener.onThrottle(ThrottleListener.RESOURCE_CPU));
                }
                if (memoryOver) {
                    notifier.execute(() -> listener.onThrottle(ThrottleListener.RESOURCE_MEMORY));
                }
            }
        } else if (throttled.compareAndSet(true, false)) {
            log.info("Throttling disabled (cpu={}%, memory={}MB)", String.format("%.1f", cpuPercent), memoryMb);
            notifier.execute(() -> listener.onUnthrottle(ThrottleListener.RESOURCE_ALL));
        }
    }

    private void resetBaseline() {
        synchronized (sampleLock) {
            lastCpuNanos = probe.processCpuTimeNanos();
            lastSampleNanos = nanoClock.getAsLong();
        }
    }

    /**
     * 임계값 변경 (샘플링 루프 재시작 없이 다음 샘플부터 적용).
     *
     * @param maxCpuPercent CPU 임계값
     * @param maxMemoryMb 메모리 임계값 (MB, 0 이상)
     * @throws IllegalArgumentException maxCpuPercent가 NaN이거나 maxMemoryMb가 음수인 경우
     */
    public void setLimits(double maxCpuPercent, long maxMemoryMb) {
        if (Double.isNaN(maxCpuPercent)) {
            throw new IllegalArgumentException("maxCpuPercent cannot be NaN");
        }
        if (maxMemoryMb < 0) {
            throw new IllegalArgumentException(
                "maxMemoryMb must not be negative (current: " + maxMemoryMb + ")"
            );
        }
        limits.set(new Limits(maxCpuPercent, maxMemoryMb));
    }

    public double getCurrentCpuPercent() {
        return Double.longBitsToDouble(currentCpuBits.get());
    }

    public long getCurrentMemoryMb() {
        return currentMemoryBytes.get() / BYTES_PER_MB;
    }

    public boolean isThrottled() {
        return throttled.get();
    }

    /**
     * 자원 사용량 스냅샷.
     *
     * @return ResourceMetrics
     */
    public ResourceMetrics metrics() {
        Limits current = limits.get();
        return new ResourceMetrics(
            getCurrentCpuPercent(),
            getCurrentMemoryMb(),
            isThrottled(),
            current.maxCpuPercent(),
            current.maxMemoryMb()
        );
    }

    private record Limits(double maxCpuPercent, long maxMemoryMb) {
    }
}
