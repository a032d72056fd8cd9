package com.ryuqq.poolguard.core.quota;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 테넌트 하나의 자원 사용량 카운터.
 *
 * <p>CPU 누적 사용량, 최근 메모리 사용량, 진행 중인 작업 수를 설정된 한도와 함께 추적합니다.
 * 모든 카운터는 lock 없이 원자적 연산으로 갱신됩니다.</p>
 *
 * <p><strong>불변 조건:</strong></p>
 * <ul>
 *   <li>tasksLimit &gt; 0이면 tasksUsed는 tasksLimit을 넘지 않음</li>
 *   <li>tasksUsed는 0 미만으로 내려가지 않음</li>
 *   <li>memoryUsed는 누적값이 아닌 마지막 스냅샷 값</li>
 * </ul>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public final class ResourceQuota {

    private final long cpuLimit;
    private final long memoryLimit;
    private final long tasksLimit;

    private final AtomicLong cpuUsed = new AtomicLong();
    private final AtomicLong memoryUsed = new AtomicLong();
    private final AtomicLong tasksUsed = new AtomicLong();

    /**
     * 생성자.
     *
     * @param cpuLimit CPU 한도 (밀리초, 0 = 무제한)
     * @param memoryLimit 메모리 한도 (바이트, 0 = 무제한)
     * @param tasksLimit 동시 작업 한도 (0 = 무제한)
     * @throws IllegalArgumentException 한도가 음수인 경우
     */
    public ResourceQuota(long cpuLimit, long memoryLimit, long tasksLimit) {
        if (cpuLimit < 0) {
            throw new IllegalArgumentException("cpuLimit cannot be negative (current: " + cpuLimit + ")");
        }
        if (memoryLimit < 0) {
            throw new IllegalArgumentException("memoryLimit cannot be negative (current: " + memoryLimit + ")");
        }
        if (tasksLimit < 0) {
            throw new IllegalArgumentException("tasksLimit cannot be negative (current: " + tasksLimit + ")");
        }
        this.cpuLimit = cpuLimit;
        this.memoryLimit = memoryLimit;
        this.tasksLimit = tasksLimit;
    }

    /**
     * 작업 슬롯 예약 시도.
     *
     * <p>증가 후 값이 tasksLimit을 넘지 않을 때만 CAS로 증가시킵니다.
     * tasksLimit이 0이면 한도 검사 없이 항상 예약합니다.</p>
     *
     * @return 예약 성공 여부
     */
    public boolean checkAndReserve() {
        if (tasksLimit == 0) {
            tasksUsed.incrementAndGet();
            return true;
        }
        while (true) {
            long current = tasksUsed.get();
            if (current >= tasksLimit) {
                return false;
            }
            if (tasksUsed.compareAndSet(current, current + 1)) {
                return true;
            }
        }
    }

    /**
     * 예약한 작업 슬롯 반환 (0 미만으로 내려가지 않음).
     *
     * @return 실제로 감소했으면 true, 이미 0이었으면 false
     */
    public boolean release() {
        while (true) {
            long current = tasksUsed.get();
            if (current <= 0) {
                return false;
            }
            if (tasksUsed.compareAndSet(current, current - 1)) {
                return true;
            }
        }
    }

    /**
     * CPU 사용량 누적.
     *
     * @param cpuMillis 추가할 CPU 시간 (밀리초)
     */
    public void recordCpu(long cpuMillis) {
        cpuUsed.addAndGet(cpuMillis);
    }

    /**
     * 메모리 사용량 기록 (덮어쓰기).
     *
     * @param bytes 현재 메모리 사용량 (바이트)
     */
    public void recordMemory(long bytes) {
        memoryUsed.set(bytes);
    }

    /**
     * 현재 사용량 조회.
     *
     * <p>필드별로는 원자적으로 읽지만 전체가 하나의 스냅샷은 아닙니다.</p>
     *
     * @return 사용량과 한도
     */
    public QuotaUsage usage() {
        return new QuotaUsage(
            cpuUsed.get(),
            memoryUsed.get(),
            tasksUsed.get(),
            cpuLimit,
            memoryLimit,
            tasksLimit
        );
    }

    public long getTasksLimit() {
        return tasksLimit;
    }
}
