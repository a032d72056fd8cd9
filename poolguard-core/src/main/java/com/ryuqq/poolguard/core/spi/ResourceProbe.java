package com.ryuqq.poolguard.core.spi;

/**
 * 프로세스 자원 측정 SPI.
 *
 * <p>ResourceMonitor가 샘플링 주기마다 호출합니다. JVM 구현은
 * {@code poolguard-adapter-runner}의 {@code JvmResourceProbe}가 제공합니다.</p>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public interface ResourceProbe {

    /**
     * 프로세스가 지금까지 사용한 CPU 시간.
     *
     * @return 누적 CPU 시간 (나노초), 측정 불가 시 -1
     */
    long processCpuTimeNanos();

    /**
     * 현재 사용 중인 메모리.
     *
     * @return 사용 중인 메모리 (바이트)
     */
    long usedMemoryBytes();
}
