package com.ryuqq.poolguard.adapter.runner.monitor;

/**
 * Throttle 상태 변화 리스너.
 *
 * <p>상태가 바뀌는 순간에만 호출됩니다. 호출은 알림 스레드에서 비동기로 이루어집니다.</p>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public interface ThrottleListener {

    String RESOURCE_CPU = "cpu";
    String RESOURCE_MEMORY = "memory";
    String RESOURCE_ALL = "all";

    /**
     * throttle 시작 시 임계값을 넘은 자원마다 호출.
     *
     * @param resource {@value #RESOURCE_CPU} 또는 {@value #RESOURCE_MEMORY}
     */
    default void onThrottle(String resource) {
    }

    /**
     * 모든 자원이 임계값 아래로 내려와 throttle이 해제될 때 호출.
     *
     * @param resource 항상 {@value #RESOURCE_ALL}
     */
    default void onUnthrottle(String resource) {
    }
}
