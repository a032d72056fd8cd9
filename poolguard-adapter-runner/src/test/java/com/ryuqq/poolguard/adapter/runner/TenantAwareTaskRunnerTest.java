package com.ryuqq.poolguard.adapter.runner;

import com.ryuqq.poolguard.adapter.inmemory.dlq.InMemoryDeadLetterStore;
import com.ryuqq.poolguard.adapter.runner.dlq.DeadLetterQueue;
import com.ryuqq.poolguard.adapter.runner.monitor.ResourceMonitorConfig;
import com.ryuqq.poolguard.application.stats.PoolStats;
import com.ryuqq.poolguard.application.tenant.TenantInfo;
import com.ryuqq.poolguard.core.error.FailureKind;
import com.ryuqq.poolguard.core.model.TaskContext;
import com.ryuqq.poolguard.core.model.TenantConfig;
import com.ryuqq.poolguard.core.outcome.Cancelled;
import com.ryuqq.poolguard.core.outcome.Completed;
import com.ryuqq.poolguard.core.outcome.Failed;
import com.ryuqq.poolguard.core.outcome.Rejected;
import com.ryuqq.poolguard.core.outcome.TaskOutcome;
import com.ryuqq.poolguard.core.protection.CircuitBreakerConfig;
import com.ryuqq.poolguard.core.protection.CircuitBreakerState;
import com.ryuqq.poolguard.core.protection.StateChangeListener;
import com.ryuqq.poolguard.core.retry.RetryPolicy;
import com.ryuqq.poolguard.core.spi.DeadLetterEntry;
import com.ryuqq.poolguard.core.spi.ResourceProbe;
import com.ryuqq.poolguard.core.spi.Span;
import com.ryuqq.poolguard.testkit.tracing.RecordingTracer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;

/**
 * TenantAwareTaskRunner 유닛 테스트.
 *
 * <p>입장 제어부터 실행, 재시도, Circuit Breaker, DLQ, 추적까지 전체 흐름을 검증합니다:</p>
 * <ul>
 *   <li>정상 실행 → Completed, quota 반환</li>
 *   <li>quota 소진 → Rejected(QUOTA_EXCEEDED)</li>
 *   <li>Circuit Breaker OPEN → Rejected(CIRCUIT_OPEN)</li>
 *   <li>재시도 소진 → Failed + DLQ 적재</li>
 *   <li>취소 → Cancelled</li>
 *   <li>자원 한도 초과 → Rejected(THROTTLED)</li>
 * </ul>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class TenantAwareTaskRunnerTest {

    private static final RetryPolicy FAST_RETRY = new RetryPolicy(2, 1, 5, 2.0, false);

    @Mock
    private StateChangeListener stateChangeListener;

    private InMemoryDeadLetterStore store;
    private RecordingTracer tracer;
    private TenantAwareTaskRunner runner;

    @BeforeEach
    void setUp() {
        store = new InMemoryDeadLetterStore();
        tracer = new RecordingTracer();
        runner = TenantAwareTaskRunner.builder()
            .deadLetterQueue(new DeadLetterQueue(store))
            .tracer(tracer)
            .config(new TaskRunnerConfig().withRetryPolicy(FAST_RETRY))
            .build();
        runner.registerTenant(TenantConfig.defaults("t1").withMaxQueueSize(1).withPriority(5));
    }

    @AfterEach
    void tearDown() {
        runner.close();
    }

    // ============================================================
    // 1. 정상 실행
    // ============================================================

    @Test
    void submit_성공하면_Completed_반환하고_quota_반환() {
        // given
        TaskContext ctx = TaskContext.builder("t1").requestId("req-1").build();

        // when
        TaskOutcome<String> outcome = runner.submit(ctx, "email", () -> "sent");

        // then
        assertThat(outcome).isInstanceOf(Completed.class);
        Completed<String> completed = (Completed<String>) outcome;
        assertThat(completed.taskId()).isEqualTo("req-1");
        assertThat(completed.value()).isEqualTo("sent");
        assertThat(completed.attempts()).isEqualTo(1);

        assertThat(runner.getTenantRegistry().getTenant("t1").getQuota().usage().tasksUsed()).isZero();
        assertThat(runner.getTenantRegistry().tenantStats("t1").getTasksCompleted()).isEqualTo(1);
        PoolStats stats = runner.stats(0);
        assertThat(stats.completedTasks()).isEqualTo(1);
        assertThat(stats.activeWorkers()).isZero();
    }

    @Test
    void submit_성공시_span_기록() {
        // when
        runner.submit(TaskContext.builder("t1").requestId("req-span").build(), "email", () -> "sent");

        // then
        assertThat(tracer.spans()).hasSize(1);
        RecordingTracer.RecordedSpan span = tracer.spans().get(0);
        assertThat(span.getName()).isEqualTo(TenantAwareTaskRunner.SPAN_NAME);
        assertThat(span.getAttributes())
            .containsEntry("tenant.id", "t1")
            .containsEntry("task.type", "email")
            .containsEntry("task.id", "req-span");
        assertThat(span.getStatus()).isEqualTo(Span.Status.OK);
        assertThat(span.isEnded()).isTrue();
    }

    @Test
    void 일시적_실패후_재시도로_성공() {
        // given
        AtomicInteger calls = new AtomicInteger();

        // when
        TaskOutcome<Integer> outcome = runner.submit(TaskContext.of("t1"), "sync", () -> {
            if (calls.incrementAndGet() < 2) {
                throw new IOException("temporary");
            }
            return 42;
        });

        // then
        assertThat(outcome).isInstanceOf(Completed.class);
        assertThat(((Completed<Integer>) outcome).attempts()).isEqualTo(2);
        assertThat(store.size()).isZero();
    }

    // ============================================================
    // 2. 입장 거부
    // ============================================================

    @Test
    void quota_소진시_QUOTA_EXCEEDED로_거부() {
        // given
        runner.checkQuota("t1");
        AtomicInteger calls = new AtomicInteger();

        // when
        TaskOutcome<Integer> outcome = runner.submit(TaskContext.of("t1"), "email", calls::incrementAndGet);

        // then
        assertThat(outcome).isInstanceOf(Rejected.class);
        Rejected<Integer> rejected = (Rejected<Integer>) outcome;
        assertThat(rejected.kind()).isEqualTo(FailureKind.QUOTA_EXCEEDED);
        assertThat(rejected.message()).contains("t1").contains("limit: 1");
        assertThat(calls.get()).isZero();
        assertThat(runner.stats(0).rejectedTasks()).isEqualTo(1);
        assertThat(runner.getTenantRegistry().tenantStats("t1").getTasksRejected()).isEqualTo(1);
    }

    @Test
    void 실행중_재등록되면_이전_작업은_이전_quota에만_반환() throws Exception {
        // given
        CountDownLatch running = new CountDownLatch(1);
        CountDownLatch finish = new CountDownLatch(1);
        ExecutorService pool = Executors.newSingleThreadExecutor();
        try {
            Future<TaskOutcome<String>> inFlight = pool.submit(() -> runner.submit(TaskContext.of("t1"), "email", () -> {
                running.countDown();
                finish.await(5, TimeUnit.SECONDS);
                return "done";
            }));
            assertThat(running.await(5, TimeUnit.SECONDS)).isTrue();

            // when
            runner.registerTenant(TenantConfig.defaults("t1").withMaxQueueSize(1).withPriority(5));
            boolean newSlot = runner.checkQuota("t1");
            finish.countDown();
            assertThat(inFlight.get(5, TimeUnit.SECONDS).isCompleted()).isTrue();

            // then
            assertThat(newSlot).isTrue();
            assertThat(runner.checkQuota("t1")).isFalse();
            assertThat(runner.getTenantRegistry().getTenant("t1").getQuota().usage().tasksUsed()).isEqualTo(1);
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void 채택_비활성화시_미등록_테넌트는_TENANT_NOT_FOUND() {
        // given
        try (TenantAwareTaskRunner strict = TenantAwareTaskRunner.builder().adoptUnknownTenants(false).build()) {

            // when
            TaskOutcome<String> outcome = strict.submit(TaskContext.of("stranger"), "email", () -> "never");

            // then
            assertThat(outcome).isInstanceOf(Rejected.class);
            assertThat(((Rejected<String>) outcome).kind()).isEqualTo(FailureKind.TENANT_NOT_FOUND);
        }
    }

    @Test
    void 미등록_테넌트는_채택되어_스케줄러에도_추가됨() {
        // when
        TaskOutcome<String> outcome = runner.submit(TaskContext.of("newcomer"), "email", () -> "ok");

        // then
        assertThat(outcome.isCompleted()).isTrue();
        assertThat(runner.getScheduler().contains("newcomer")).isTrue();
        assertThat(runner.getTenantRegistry().findTenant("newcomer")).map(TenantInfo::isImplicit).contains(true);
    }

    @Test
    void 자원_한도_초과시_THROTTLED로_거부() {
        // given
        ResourceProbe heavy = new ResourceProbe() {
            @Override
            public long processCpuTimeNanos() {
                return -1;
            }

            @Override
            public long usedMemoryBytes() {
                return 64L * 1024 * 1024;
            }
        };
        try (TenantAwareTaskRunner throttled = TenantAwareTaskRunner.builder()
            .resourceProbe(heavy)
            .resourceMonitorConfig(new ResourceMonitorConfig().withMaxMemoryMb(16))
            .config(new TaskRunnerConfig().withThrottleWaitMs(1).withRejectWhenThrottled(true))
            .build()) {
            throttled.getResourceMonitor().sampleOnce();

            // when
            TaskOutcome<String> outcome = throttled.submit(TaskContext.of("t1"), "report", () -> "never");

            // then
            assertThat(throttled.resourceMetrics().throttled()).isTrue();
            assertThat(outcome).isInstanceOf(Rejected.class);
            assertThat(((Rejected<String>) outcome).kind()).isEqualTo(FailureKind.THROTTLED);
        }
    }

    // ============================================================
    // 3. Circuit Breaker
    // ============================================================

    @Test
    void circuit_OPEN이면_작업을_실행하지_않고_거부() {
        // given
        try (TenantAwareTaskRunner guarded = TenantAwareTaskRunner.builder()
            .circuitBreakerConfig(new CircuitBreakerConfig().withFailureThreshold(1))
            .stateChangeListener(stateChangeListener)
            .config(new TaskRunnerConfig().withRetryPolicy(RetryPolicy.noRetry()).withDlqEnabled(false))
            .build()) {
            guarded.submit(TaskContext.of("t1"), "payment", () -> {
                throw new IllegalStateException("gateway down");
            });
            AtomicInteger calls = new AtomicInteger();

            // when
            TaskOutcome<Integer> outcome = guarded.submit(TaskContext.of("t1"), "payment", calls::incrementAndGet);

            // then
            assertThat(outcome).isInstanceOf(Rejected.class);
            assertThat(((Rejected<Integer>) outcome).kind()).isEqualTo(FailureKind.CIRCUIT_OPEN);
            assertThat(calls.get()).isZero();
            assertThat(guarded.getCircuitBreakers().get("payment").getState()).isEqualTo(CircuitBreakerState.OPEN);
            verify(stateChangeListener, timeout(1_000))
                .onStateChange("payment", CircuitBreakerState.CLOSED, CircuitBreakerState.OPEN);

            // 다른 작업 유형은 영향 없음
            assertThat(guarded.submit(TaskContext.of("t1"), "email", () -> "ok").isCompleted()).isTrue();
        }
    }

    // ============================================================
    // 4. 실패와 DLQ
    // ============================================================

    @Test
    void 재시도_소진시_Failed_반환하고_DLQ에_적재() {
        // given
        byte[] payload = "{\"orderId\":7}".getBytes(StandardCharsets.UTF_8);
        TaskContext ctx = TaskContext.builder("t1").requestId("req-fail").build();

        // when
        TaskOutcome<String> outcome = runner.submit(ctx, "sync", () -> {
            throw new IOException("remote unavailable");
        }, payload);

        // then
        assertThat(outcome).isInstanceOf(Failed.class);
        Failed<String> failed = (Failed<String>) outcome;
        assertThat(failed.attempts()).isEqualTo(FAST_RETRY.maxAttempts());
        assertThat(failed.deadLettered()).isTrue();
        assertThat(failed.error()).hasMessage("remote unavailable");

        DeadLetterEntry entry = runner.getDeadLetterQueue().orElseThrow().pop().orElseThrow();
        assertThat(entry.taskId()).isEqualTo("req-fail");
        assertThat(entry.payload()).containsExactly(payload);
        assertThat(entry.failureCount()).isEqualTo(3);
        assertThat(entry.errors()).hasSize(3).allMatch(message -> message.contains("remote unavailable"));

        assertThat(runner.stats(0).lastError()).isEqualTo("remote unavailable");
        assertThat(runner.getTenantRegistry().getTenant("t1").getQuota().usage().tasksUsed()).isZero();
        assertThat(tracer.spans().get(0).getStatus()).isEqualTo(Span.Status.ERROR);
    }

    @Test
    void DLQ_비활성화면_적재하지_않음() {
        // given
        try (TenantAwareTaskRunner noDlq = TenantAwareTaskRunner.builder()
            .deadLetterQueue(new DeadLetterQueue(store))
            .config(new TaskRunnerConfig().withRetryPolicy(RetryPolicy.noRetry()).withDlqEnabled(false))
            .build()) {

            // when
            TaskOutcome<String> outcome = noDlq.submit(TaskContext.of("t1"), "sync", () -> {
                throw new IOException("boom");
            });

            // then
            assertThat(((Failed<String>) outcome).deadLettered()).isFalse();
            assertThat(store.size()).isZero();
        }
    }

    // ============================================================
    // 5. 취소
    // ============================================================

    @Test
    void 취소된_컨텍스트는_Cancelled_반환() {
        // given
        TaskContext ctx = TaskContext.builder("t1").requestId("req-cancel").build();
        ctx.cancel();
        AtomicInteger calls = new AtomicInteger();

        // when
        TaskOutcome<Integer> outcome = runner.submit(ctx, "email", calls::incrementAndGet);

        // then
        assertThat(outcome).isInstanceOf(Cancelled.class);
        assertThat(outcome.taskId()).isEqualTo("req-cancel");
        assertThat(calls.get()).isZero();
        assertThat(runner.getTenantRegistry().getTenant("t1").getQuota().usage().tasksUsed()).isZero();
        assertThat(tracer.spans().get(0).getEvents()).extracting(RecordingTracer.Event::name).contains("cancelled");
    }

    @Test
    void 재시도_대기중_취소되면_Cancelled() {
        // given
        TaskContext ctx = TaskContext.of("t1");
        try (TenantAwareTaskRunner slow = TenantAwareTaskRunner.builder()
            .config(new TaskRunnerConfig().withRetryPolicy(new RetryPolicy(3, 10_000, 10_000, 1.0, false)))
            .build()) {

            // when
            TaskOutcome<String> outcome = slow.submit(ctx, "sync", () -> {
                ctx.cancel();
                throw new IOException("first");
            });

            // then
            assertThat(outcome).isInstanceOf(Cancelled.class);
            assertThat(((Cancelled<String>) outcome).attempts()).isEqualTo(1);
        }
    }

    // ============================================================
    // 6. 스케줄링
    // ============================================================

    @Test
    void 등록된_테넌트는_우선순위대로_스케줄됨() {
        // given
        runner.registerTenant(TenantConfig.defaults("t0").withPriority(1));

        // when & then
        assertThat(runner.schedule()).map(TenantInfo::getTenantId).contains("t1");
        assertThat(runner.schedule(info -> info.getPriority() < 5)).map(TenantInfo::getTenantId).contains("t0");

        assertThat(runner.removeTenant("t1")).isTrue();
        assertThat(runner.schedule()).map(TenantInfo::getTenantId).contains("t0");
    }
}
