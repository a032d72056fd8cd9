package com.ryuqq.poolguard.adapter.runner;

import com.ryuqq.poolguard.adapter.runner.dlq.DeadLetterQueue;
import com.ryuqq.poolguard.adapter.runner.monitor.ResourceMetrics;
import com.ryuqq.poolguard.adapter.runner.monitor.ResourceMonitor;
import com.ryuqq.poolguard.adapter.runner.monitor.ResourceMonitorConfig;
import com.ryuqq.poolguard.adapter.runner.monitor.ThrottleListener;
import com.ryuqq.poolguard.adapter.runner.resilience.CircuitBreakerRegistry;
import com.ryuqq.poolguard.adapter.runner.resilience.RetryExecutor;
import com.ryuqq.poolguard.application.admission.AdmissionController;
import com.ryuqq.poolguard.application.stats.PoolStats;
import com.ryuqq.poolguard.application.stats.StatsCollector;
import com.ryuqq.poolguard.application.tenant.TenantInfo;
import com.ryuqq.poolguard.application.tenant.TenantRegistry;
import com.ryuqq.poolguard.application.tenant.TenantScheduler;
import com.ryuqq.poolguard.core.error.CircuitOpenException;
import com.ryuqq.poolguard.core.error.FailureKind;
import com.ryuqq.poolguard.core.error.QuotaExceededException;
import com.ryuqq.poolguard.core.error.TaskCancelledException;
import com.ryuqq.poolguard.core.error.TenantNotFoundException;
import com.ryuqq.poolguard.core.error.TooManyRequestsException;
import com.ryuqq.poolguard.core.model.TaskContext;
import com.ryuqq.poolguard.core.model.TenantConfig;
import com.ryuqq.poolguard.core.outcome.Cancelled;
import com.ryuqq.poolguard.core.outcome.Completed;
import com.ryuqq.poolguard.core.outcome.Failed;
import com.ryuqq.poolguard.core.outcome.Rejected;
import com.ryuqq.poolguard.core.outcome.TaskOutcome;
import com.ryuqq.poolguard.core.protection.CircuitBreaker;
import com.ryuqq.poolguard.core.protection.CircuitBreakerConfig;
import com.ryuqq.poolguard.core.protection.StateChangeListener;
import com.ryuqq.poolguard.core.quota.ResourceQuota;
import com.ryuqq.poolguard.core.retry.RetryableTask;
import com.ryuqq.poolguard.core.spi.DeadLetterEntry;
import com.ryuqq.poolguard.core.spi.ResourceProbe;
import com.ryuqq.poolguard.core.spi.Span;
import com.ryuqq.poolguard.core.spi.Tracer;
import com.ryuqq.poolguard.core.spi.noop.NoOpTracer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.function.Predicate;

/**
 * 멀티 테넌트 작업 실행기 (Admission Controller 구현체).
 *
 * <p>테넌트 quota, 자원 throttle, 작업 유형별 Circuit Breaker, 재시도,
 * Dead Letter Queue를 하나의 제출 흐름으로 묶습니다. 모든 구성 요소는
 * 이 인스턴스가 소유하며 전역 상태는 없습니다.</p>
 *
 * <p><strong>제출 흐름:</strong></p>
 * <pre>
 * submit(ctx, taskType, task)
 *   1. recordTaskSubmitted(tenant)
 *   2. throttle 중이면 throttleWaitMs 대기 (취소 가능)
 *      여전히 throttle이고 rejectWhenThrottled → Rejected(THROTTLED)
 *   3. quota 예약 실패 → Rejected(QUOTA_EXCEEDED | TENANT_NOT_FOUND)
 *   4. 스케줄러 등록 확인, activeWorkers 증가, span 시작
 *   5. retry(조건: CircuitOpen 제외) { breakers.get(taskType).call(task) }
 *   6. 결과 매핑:
 *      - 성공 → Completed (recordTaskCompleted, latency 기록)
 *      - CircuitOpen / TooManyRequests → Rejected
 *      - TaskCancelled → Cancelled
 *      - 그 외 → Failed (+ DLQ)
 *   7. 항상: 예약한 quota 반환, activeWorkers 감소, span 종료
 * </pre>
 *
 * <p>예상 가능한 결과(거부, 실패, 취소)는 예외가 아닌 {@link TaskOutcome}으로 반환합니다.</p>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public final class TenantAwareTaskRunner implements AdmissionController, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TenantAwareTaskRunner.class);

    static final String SPAN_NAME = "poolguard.task";

    private final TenantRegistry registry;
    private final TenantScheduler scheduler;
    private final CircuitBreakerRegistry breakers;
    private final RetryExecutor retryExecutor;
    private final ResourceMonitor monitor;
    private final StatsCollector stats;
    private final DeadLetterQueue deadLetterQueue;
    private final Tracer tracer;
    private final TaskResourceMeter meter;
    private final TaskRunnerConfig config;
    private final NotificationDispatcher ownedDispatcher;

    /**
     * 생성자 (모든 구성 요소 주입).
     *
     * @param registry 테넌트 레지스트리
     * @param scheduler 테넌트 스케줄러
     * @param breakers Circuit Breaker 레지스트리
     * @param retryExecutor 재시도 실행기
     * @param monitor 자원 모니터
     * @param stats 통계 수집기
     * @param deadLetterQueue DLQ (nullable, 없으면 DLQ 전송 안 함)
     * @param tracer Tracer
     * @param meter 작업 자원 측정기
     * @param config 설정
     * @throws IllegalArgumentException deadLetterQueue 외의 의존성이 null인 경우
     */
    public TenantAwareTaskRunner(TenantRegistry registry, TenantScheduler scheduler,
                                 CircuitBreakerRegistry breakers, RetryExecutor retryExecutor,
                                 ResourceMonitor monitor, StatsCollector stats,
                                 DeadLetterQueue deadLetterQueue, Tracer tracer,
                                 TaskResourceMeter meter, TaskRunnerConfig config) {
        this(registry, scheduler, breakers, retryExecutor, monitor, stats,
            deadLetterQueue, tracer, meter, config, null);
    }

    private TenantAwareTaskRunner(TenantRegistry registry, TenantScheduler scheduler,
                                  CircuitBreakerRegistry breakers, RetryExecutor retryExecutor,
                                  ResourceMonitor monitor, StatsCollector stats,
                                  DeadLetterQueue deadLetterQueue, Tracer tracer,
                                  TaskResourceMeter meter, TaskRunnerConfig config,
                                  NotificationDispatcher ownedDispatcher) {
        requireNonNull(registry, "registry");
        requireNonNull(scheduler, "scheduler");
        requireNonNull(breakers, "breakers");
        requireNonNull(retryExecutor, "retryExecutor");
        requireNonNull(monitor, "monitor");
        requireNonNull(stats, "stats");
        requireNonNull(tracer, "tracer");
        requireNonNull(meter, "meter");
        requireNonNull(config, "config");

        this.registry = registry;
        this.scheduler = scheduler;
        this.breakers = breakers;
        this.retryExecutor = retryExecutor;
        this.monitor = monitor;
        this.stats = stats;
        this.deadLetterQueue = deadLetterQueue;
        this.tracer = tracer;
        this.meter = meter;
        this.config = config;
        this.ownedDispatcher = ownedDispatcher;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ========================================
    // 생명주기
    // ========================================

    /**
     * 자원 모니터 샘플링 시작.
     */
    public void start() {
        monitor.start();
    }

    /**
     * 자원 모니터 중지 및 builder가 만든 알림 디스패처 종료.
     */
    @Override
    public void close() {
        monitor.stop();
        if (ownedDispatcher != null) {
            ownedDispatcher.close();
        }
    }

    // ========================================
    // 테넌트 / 수락 API
    // ========================================

    @Override
    public TenantInfo registerTenant(TenantConfig config) {
        TenantInfo info = registry.registerTenant(config);
        scheduler.addTenant(info);
        return info;
    }

    @Override
    public boolean removeTenant(String tenantId) {
        scheduler.removeTenant(tenantId);
        return registry.removeTenant(tenantId).isPresent();
    }

    @Override
    public boolean checkQuota(String tenantId) {
        return registry.checkQuota(tenantId);
    }

    @Override
    public void releaseQuota(String tenantId) {
        registry.releaseQuota(tenantId);
    }

    @Override
    public Optional<TenantInfo> schedule() {
        return scheduler.schedule();
    }

    /**
     * 실행할 작업이 있는 테넌트 중 다음 테넌트 선택.
     *
     * @param eligible 실행 가능 여부 조건
     * @return 선택된 테넌트 (없으면 empty)
     */
    public Optional<TenantInfo> schedule(Predicate<TenantInfo> eligible) {
        return scheduler.schedule(eligible);
    }

    @Override
    public PoolStats stats(int queueLen) {
        return stats.snapshot(queueLen);
    }

    public ResourceMetrics resourceMetrics() {
        return monitor.metrics();
    }

    // ========================================
    // 작업 제출
    // ========================================

    @Override
    public <T> TaskOutcome<T> submit(TaskContext ctx, String taskType, Callable<T> task) {
        return submit(ctx, taskType, task, null);
    }

    @Override
    public <T> TaskOutcome<T> submit(TaskContext ctx, String taskType, Callable<T> task, byte[] payload) {
        requireNonNull(ctx, "ctx");
        requireNonNull(task, "task");
        if (taskType == null || taskType.isBlank()) {
            throw new IllegalArgumentException("taskType cannot be null or blank");
        }

        String tenantId = ctx.getTenantId();
        String taskId = ctx.getRequestId() != null ? ctx.getRequestId() : UUID.randomUUID().toString();

        // 1. 제출 기록 (미등록 테넌트는 정책에 따라 채택 또는 거부)
        try {
            registry.recordTaskSubmitted(tenantId);
        } catch (TenantNotFoundException e) {
            return reject(taskId, tenantId, FailureKind.TENANT_NOT_FOUND, e.getMessage());
        }

        // 2. 자원 throttle
        if (monitor.isThrottled()) {
            if (ctx.awaitCancellation(config.throttleWaitMs())) {
                return new Cancelled<>(taskId, 0);
            }
            if (monitor.isThrottled() && config.rejectWhenThrottled()) {
                return reject(taskId, tenantId, FailureKind.THROTTLED,
                    "Resource usage above limits: " + monitor.metrics());
            }
        }

        // 3. quota 예약 (반환은 예약한 ResourceQuota에 직접)
        ResourceQuota reserved;
        try {
            reserved = registry.reserveQuota(tenantId);
        } catch (TenantNotFoundException e) {
            return reject(taskId, tenantId, FailureKind.TENANT_NOT_FOUND, e.getMessage());
        } catch (QuotaExceededException e) {
            return reject(taskId, tenantId, FailureKind.QUOTA_EXCEEDED, e.getMessage());
        }

        // 4. 실행 준비
        if (!scheduler.contains(tenantId)) {
            scheduler.addTenant(registry.getTenant(tenantId));
        }
        stats.workerStarted();
        Span span = tracer.startSpan(SPAN_NAME,
            Map.of("tenant.id", tenantId, "task.type", taskType, "task.id", taskId),
            ctx.getSpan().orElse(null));
        TaskContext taskCtx = ctx.withSpan(span);

        try {
            return execute(taskCtx, taskId, taskType, task, payload, span);
        } finally {
            // 7. 정리
            reserved.release();
            stats.workerFinished();
            span.end();
        }
    }

    private <T> TaskOutcome<T> execute(TaskContext ctx, String taskId, String taskType,
                                       Callable<T> task, byte[] payload, Span span) {
        String tenantId = ctx.getTenantId();
        RetryableTask attempts = new RetryableTask(taskId);
        CircuitBreaker breaker = breakers.get(taskType);
        long startNanos = System.nanoTime();
        TaskResourceMeter.Sample sample = meter.begin();

        try {
            // 5. 재시도 + Circuit Breaker
            T value = retryExecutor.executeWithCondition(ctx, config.retryPolicy(), attempts,
                error -> !(error instanceof CircuitOpenException),
                () -> breaker.call(task));

            // 6. 성공
            TaskResourceMeter.Usage usage = meter.since(sample);
            Duration latency = Duration.ofNanos(System.nanoTime() - startNanos);
            recordCompletedQuietly(tenantId, usage);
            stats.recordTaskCompletion(latency);
            span.setAttribute("task.attempts", attempts.getAttempts());
            span.setStatus(Span.Status.OK, null);
            return new Completed<>(taskId, value, attempts.getAttempts(), latency.toNanos());

        } catch (CircuitOpenException | TooManyRequestsException e) {
            span.setStatus(Span.Status.ERROR, e.getMessage());
            return reject(taskId, tenantId, e.getKind(), e.getMessage());

        } catch (TaskCancelledException e) {
            span.addEvent("cancelled", Map.of("task.attempts", e.getAttempts()));
            span.setStatus(Span.Status.ERROR, e.getMessage());
            return new Cancelled<>(taskId, e.getAttempts());

        } catch (Exception e) {
            stats.recordError(e);
            span.setAttribute("task.attempts", attempts.getAttempts());
            span.setStatus(Span.Status.ERROR, e.getMessage());
            boolean deadLettered = deadLetter(taskId, tenantId, payload, attempts, e);
            return new Failed<>(taskId, e, attempts.getAttempts(), deadLettered);
        }
    }

    private <T> TaskOutcome<T> reject(String taskId, String tenantId, FailureKind kind, String message) {
        stats.recordTaskRejection();
        if (registry.findTenant(tenantId).isPresent()) {
            registry.recordTaskRejected(tenantId);
        }
        return new Rejected<>(taskId, kind, message);
    }

    private boolean deadLetter(String taskId, String tenantId, byte[] payload, RetryableTask attempts, Exception error) {
        if (!config.dlqEnabled() || deadLetterQueue == null) {
            log.warn("Task {} for tenant {} failed after {} attempt(s): {}",
                taskId, tenantId, attempts.getAttempts(), error.toString());
            return false;
        }
        DeadLetterEntry entry = new DeadLetterEntry(
            taskId, payload, System.currentTimeMillis(), attempts.getAttempts(), attempts.getErrorMessages());
        try {
            deadLetterQueue.push(entry);
        } catch (RuntimeException pushError) {
            log.error("Failed to push task {} to dead letter queue", taskId, pushError);
            return false;
        }
        log.error("Task {} for tenant {} failed after {} attempt(s), routed to dead letter queue",
            taskId, tenantId, attempts.getAttempts(), error);
        return true;
    }

    private void recordCompletedQuietly(String tenantId, TaskResourceMeter.Usage usage) {
        try {
            registry.recordTaskCompleted(tenantId, usage.cpuMillis(), usage.allocatedBytes());
        } catch (TenantNotFoundException e) {
            log.debug("Tenant {} removed before completion was recorded", tenantId);
        }
    }

    private static void requireNonNull(Object value, String name) {
        if (value == null) {
            throw new IllegalArgumentException(name + " cannot be null");
        }
    }

    // ========================================
    // 접근자
    // ========================================

    public TenantRegistry getTenantRegistry() {
        return registry;
    }

    public TenantScheduler getScheduler() {
        return scheduler;
    }

    public CircuitBreakerRegistry getCircuitBreakers() {
        return breakers;
    }

    public ResourceMonitor getResourceMonitor() {
        return monitor;
    }

    public Optional<DeadLetterQueue> getDeadLetterQueue() {
        return Optional.ofNullable(deadLetterQueue);
    }

    public TaskRunnerConfig getConfig() {
        return config;
    }

    /**
     * TenantAwareTaskRunner 조립기.
     *
     * <p>지정하지 않은 구성 요소는 기본 설정으로 생성됩니다. 알림 디스패처를 지정하지 않으면
     * runner가 하나를 만들어 소유하고 {@link TenantAwareTaskRunner#close()}에서 종료합니다.</p>
     */
    public static final class Builder {

        private TenantConfig defaultTenantConfig = TenantConfig.defaults("default");
        private boolean adoptUnknownTenants = true;
        private CircuitBreakerConfig circuitBreakerConfig = new CircuitBreakerConfig();
        private StateChangeListener stateChangeListener;
        private ResourceMonitorConfig resourceMonitorConfig = new ResourceMonitorConfig();
        private ThrottleListener throttleListener = new ThrottleListener() { };
        private ResourceProbe resourceProbe;
        private DeadLetterQueue deadLetterQueue;
        private Tracer tracer = new NoOpTracer();
        private TaskRunnerConfig config = new TaskRunnerConfig();
        private RetryExecutor retryExecutor = new RetryExecutor();
        private NotificationDispatcher dispatcher;

        private Builder() {
        }

        public Builder defaultTenantConfig(TenantConfig defaultTenantConfig) {
            this.defaultTenantConfig = defaultTenantConfig;
            return this;
        }

        public Builder adoptUnknownTenants(boolean adoptUnknownTenants) {
            this.adoptUnknownTenants = adoptUnknownTenants;
            return this;
        }

        public Builder circuitBreakerConfig(CircuitBreakerConfig circuitBreakerConfig) {
            this.circuitBreakerConfig = circuitBreakerConfig;
            return this;
        }

        public Builder stateChangeListener(StateChangeListener stateChangeListener) {
            this.stateChangeListener = stateChangeListener;
            return this;
        }

        public Builder resourceMonitorConfig(ResourceMonitorConfig resourceMonitorConfig) {
            this.resourceMonitorConfig = resourceMonitorConfig;
            return this;
        }

        public Builder throttleListener(ThrottleListener throttleListener) {
            this.throttleListener = throttleListener;
            return this;
        }

        public Builder resourceProbe(ResourceProbe resourceProbe) {
            this.resourceProbe = resourceProbe;
            return this;
        }

        public Builder deadLetterQueue(DeadLetterQueue deadLetterQueue) {
            this.deadLetterQueue = deadLetterQueue;
            return this;
        }

        public Builder tracer(Tracer tracer) {
            this.tracer = tracer;
            return this;
        }

        public Builder config(TaskRunnerConfig config) {
            this.config = config;
            return this;
        }

        public Builder retryExecutor(RetryExecutor retryExecutor) {
            this.retryExecutor = retryExecutor;
            return this;
        }

        public Builder dispatcher(NotificationDispatcher dispatcher) {
            this.dispatcher = dispatcher;
            return this;
        }

        /**
         * runner 생성.
         *
         * @return TenantAwareTaskRunner (모니터는 시작되지 않은 상태)
         */
        public TenantAwareTaskRunner build() {
            NotificationDispatcher owned = dispatcher == null ? new NotificationDispatcher() : null;
            NotificationDispatcher notifier = dispatcher != null ? dispatcher : owned;

            ResourceMonitor monitor = resourceProbe == null
                ? new ResourceMonitor(resourceMonitorConfig, throttleListener, notifier)
                : new ResourceMonitor(resourceMonitorConfig, throttleListener, notifier, resourceProbe);

            return new TenantAwareTaskRunner(
                new TenantRegistry(defaultTenantConfig, adoptUnknownTenants),
                new TenantScheduler(),
                new CircuitBreakerRegistry(circuitBreakerConfig, stateChangeListener, notifier),
                retryExecutor,
                monitor,
                new StatsCollector(),
                deadLetterQueue,
                tracer,
                new TaskResourceMeter(),
                config,
                owned
            );
        }
    }
}
