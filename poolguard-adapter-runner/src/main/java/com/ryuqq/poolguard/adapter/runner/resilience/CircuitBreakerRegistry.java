package com.ryuqq.poolguard.adapter.runner.resilience;

import com.ryuqq.poolguard.core.protection.CircuitBreaker;
import com.ryuqq.poolguard.core.protection.CircuitBreakerConfig;
import com.ryuqq.poolguard.core.protection.StateChangeListener;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;

/**
 * 작업 유형별 Circuit Breaker 레지스트리.
 *
 * <p>처음 요청된 키에 대해 설정 템플릿(이름만 키로 교체)으로 Circuit Breaker를 만들고,
 * 이후에는 같은 인스턴스를 반환합니다. 키마다 상태는 완전히 독립적입니다.</p>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public final class CircuitBreakerRegistry {

    private final ConcurrentMap<String, CircuitBreaker> breakers = new ConcurrentHashMap<>();
    private final CircuitBreakerConfig template;
    private final StateChangeListener listener;
    private final Executor notifier;

    public CircuitBreakerRegistry(CircuitBreakerConfig template) {
        this(template, null, null);
    }

    /**
     * 생성자.
     *
     * @param template Circuit Breaker 설정 템플릿
     * @param listener 모든 Circuit Breaker에 공유되는 상태 변경 리스너 (nullable)
     * @param notifier 리스너 실행용 Executor (listener가 있으면 필수)
     * @throws IllegalArgumentException template이 null인 경우
     */
    public CircuitBreakerRegistry(CircuitBreakerConfig template, StateChangeListener listener, Executor notifier) {
        if (template == null) {
            throw new IllegalArgumentException("template cannot be null");
        }
        if (listener != null && notifier == null) {
            throw new IllegalArgumentException("notifier cannot be null when listener is set");
        }
        this.template = template;
        this.listener = listener;
        this.notifier = notifier;
    }

    /**
     * 키에 해당하는 Circuit Breaker 조회 (없으면 생성).
     *
     * @param taskType 작업 유형
     * @return Circuit Breaker
     * @throws IllegalArgumentException taskType이 null이거나 비어 있는 경우
     */
    public CircuitBreaker get(String taskType) {
        if (taskType == null || taskType.isBlank()) {
            throw new IllegalArgumentException("taskType cannot be null or blank");
        }
        return breakers.computeIfAbsent(taskType,
            key -> new StateMachineCircuitBreaker(template.withName(key), listener, notifier));
    }

    /**
     * 생성된 모든 Circuit Breaker 조회 (복사본).
     *
     * @return 키 → Circuit Breaker
     */
    public Map<String, CircuitBreaker> getAll() {
        return Collections.unmodifiableMap(new HashMap<>(breakers));
    }

    public CircuitBreakerConfig getTemplate() {
        return template;
    }
}
