package com.ryuqq.poolguard.adapter.runner.resilience;

import com.ryuqq.poolguard.core.error.TaskCancelledException;
import com.ryuqq.poolguard.core.model.TaskContext;
import com.ryuqq.poolguard.core.retry.RetryPolicy;
import com.ryuqq.poolguard.core.retry.RetryResult;
import com.ryuqq.poolguard.core.retry.RetryableError;
import com.ryuqq.poolguard.core.retry.RetryableTask;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * 취소 가능한 재시도 실행기.
 *
 * <p>작업을 최대 {@code maxRetries + 1}번 시도하며, 첫 성공에서 바로 반환합니다.
 * 실패한 시도 사이에는 {@link BackoffCalculator}가 계산한 시간만큼 대기합니다.</p>
 *
 * <p><strong>취소:</strong></p>
 * <ul>
 *   <li>매 시도 직전과 대기 중에 {@link TaskContext}의 취소 신호를 확인</li>
 *   <li>취소되면 남은 재시도와 무관하게 {@link TaskCancelledException}으로 즉시 중단</li>
 *   <li>직전 실행 오류는 suppressed 예외로 첨부</li>
 * </ul>
 *
 * <p><strong>실패 전달:</strong> 재시도를 모두 소진하거나 조건이 재시도를 거부하면
 * 마지막 예외를 감싸지 않고 그대로 던집니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * RetryExecutor retry = new RetryExecutor();
 * String body = retry.executeWithCondition(ctx, new RetryPolicy(),
 *     RetryExecutor::isRetryable,
 *     () -> client.fetch(url));
 * }</pre>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public final class RetryExecutor {

    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final BackoffCalculator backoffCalculator;

    public RetryExecutor() {
        this(new BackoffCalculator());
    }

    /**
     * 생성자 (커스텀 BackoffCalculator 주입).
     *
     * @param backoffCalculator 백오프 계산기
     * @throws IllegalArgumentException backoffCalculator가 null인 경우
     */
    public RetryExecutor(BackoffCalculator backoffCalculator) {
        if (backoffCalculator == null) {
            throw new IllegalArgumentException("backoffCalculator cannot be null");
        }
        this.backoffCalculator = backoffCalculator;
    }

    /**
     * 모든 예외를 재시도하며 실행.
     *
     * @param ctx 취소 신호를 가진 컨텍스트
     * @param policy 재시도 정책
     * @param task 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws TaskCancelledException 취소된 경우
     * @throws Exception 재시도 소진 시 마지막 예외
     */
    public <T> T execute(TaskContext ctx, RetryPolicy policy, Callable<T> task) throws Exception {
        return run(ctx, policy, error -> true, task, null);
    }

    /**
     * 시도 이력을 RetryableTask에 기록하며 실행.
     *
     * @param ctx 취소 신호를 가진 컨텍스트
     * @param policy 재시도 정책
     * @param record 시도 횟수, 시각, 오류를 기록할 대상 (호출자 소유)
     * @param task 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws TaskCancelledException 취소된 경우
     * @throws Exception 재시도 소진 시 마지막 예외
     */
    public <T> T execute(TaskContext ctx, RetryPolicy policy, RetryableTask record, Callable<T> task)
            throws Exception {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        return run(ctx, policy, error -> true, task, record);
    }

    /**
     * 조건부 재시도 실행.
     *
     * <p>조건이 false를 반환한 예외는 남은 재시도와 관계없이 즉시 던집니다.</p>
     *
     * @param ctx 취소 신호를 가진 컨텍스트
     * @param policy 재시도 정책
     * @param shouldRetry 재시도 여부 판단 조건
     * @param task 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws TaskCancelledException 취소된 경우
     * @throws Exception 재시도 거부 또는 소진 시 마지막 예외
     */
    public <T> T executeWithCondition(TaskContext ctx, RetryPolicy policy,
                                      Predicate<Exception> shouldRetry, Callable<T> task) throws Exception {
        if (shouldRetry == null) {
            throw new IllegalArgumentException("shouldRetry cannot be null");
        }
        return run(ctx, policy, shouldRetry, task, null);
    }

    /**
     * 조건부 재시도 실행 (시도 이력 기록 포함).
     *
     * @param ctx 취소 신호를 가진 컨텍스트
     * @param policy 재시도 정책
     * @param record 시도 횟수, 시각, 오류를 기록할 대상 (호출자 소유)
     * @param shouldRetry 재시도 여부 판단 조건
     * @param task 작업
     * @param <T> 결과 타입
     * @return 작업 결과
     * @throws TaskCancelledException 취소된 경우
     * @throws Exception 재시도 거부 또는 소진 시 마지막 예외
     */
    public <T> T executeWithCondition(TaskContext ctx, RetryPolicy policy, RetryableTask record,
                                      Predicate<Exception> shouldRetry, Callable<T> task) throws Exception {
        if (record == null) {
            throw new IllegalArgumentException("record cannot be null");
        }
        if (shouldRetry == null) {
            throw new IllegalArgumentException("shouldRetry cannot be null");
        }
        return run(ctx, policy, shouldRetry, task, record);
    }

    /**
     * 값과 오류를 함께 다루는 재시도 실행.
     *
     * <p>예외를 던지지 않고 결과로 반환합니다. 최종 실패여도 마지막으로 만들어진 값이 보존되며,
     * 취소되면 error에 {@link TaskCancelledException}이 담깁니다.</p>
     *
     * @param ctx 취소 신호를 가진 컨텍스트
     * @param policy 재시도 정책
     * @param task 값과 오류를 반환하는 작업
     * @param <T> 결과 타입
     * @return 마지막 시도 결과 (attempts에 실제 시도 횟수)
     */
    public <T> RetryResult<T> executeWithResult(TaskContext ctx, RetryPolicy policy, Supplier<RetryResult<T>> task) {
        validate(ctx, policy, task);

        T lastValue = null;
        Exception lastError = null;
        int attempts = 0;

        for (int attempt = 0; attempt <= policy.maxRetries(); attempt++) {
            if (ctx.isCancelled()) {
                return new RetryResult<>(lastValue, cancelled(attempts, lastError), attempts);
            }
            attempts++;

            RetryResult<T> result;
            try {
                result = task.get();
            } catch (RuntimeException e) {
                result = RetryResult.failure(lastValue, e);
            }
            if (result == null) {
                result = RetryResult.failure(lastValue, new IllegalStateException("task returned null result"));
            }
            lastValue = result.value();
            if (result.isSuccess()) {
                return result.withAttempts(attempts);
            }
            lastError = result.error();

            if (attempt < policy.maxRetries() && waitBeforeRetry(ctx, policy, attempt, lastError, null)) {
                return new RetryResult<>(lastValue, cancelled(attempts, lastError), attempts);
            }
        }
        return new RetryResult<>(lastValue, lastError, attempts);
    }

    /**
     * 원인 체인에 {@link RetryableError}가 있는지 확인.
     *
     * @param error 검사할 예외
     * @return 재시도 대상이면 true
     */
    public static boolean isRetryable(Throwable error) {
        return RetryableError.isRetryable(error);
    }

    private <T> T run(TaskContext ctx, RetryPolicy policy, Predicate<Exception> shouldRetry,
                      Callable<T> task, RetryableTask record) throws Exception {
        validate(ctx, policy, task);

        Exception lastError = null;
        int attempts = 0;

        for (int attempt = 0; attempt <= policy.maxRetries(); attempt++) {
            if (ctx.isCancelled()) {
                throw cancelled(attempts, lastError);
            }
            attempts++;
            if (record != null) {
                record.recordAttempt(System.currentTimeMillis());
            }

            try {
                return task.call();
            } catch (Exception e) {
                lastError = e;
                if (record != null) {
                    record.recordError(e);
                }
                if (!shouldRetry.test(e)) {
                    throw e;
                }
            }

            if (attempt < policy.maxRetries() && waitBeforeRetry(ctx, policy, attempt, lastError, record)) {
                throw cancelled(attempts, lastError);
            }
        }
        throw lastError;
    }

    /**
     * 다음 시도 전 대기.
     *
     * @return 대기 중 취소되었으면 true
     */
    private boolean waitBeforeRetry(TaskContext ctx, RetryPolicy policy, int attempt,
                                    Exception lastError, RetryableTask record) {
        long delayMs = backoffCalculator.calculate(policy, attempt);
        if (record != null) {
            record.scheduleNextRetry(System.currentTimeMillis() + delayMs);
        }
        log.debug("Attempt {}/{} failed ({}), retrying in {}ms",
            attempt + 1, policy.maxAttempts(), lastError.toString(), delayMs);
        return ctx.awaitCancellation(delayMs);
    }

    private static TaskCancelledException cancelled(int attempts, Exception lastError) {
        TaskCancelledException cancelled = new TaskCancelledException(attempts);
        if (lastError != null) {
            cancelled.addSuppressed(lastError);
        }
        return cancelled;
    }

    private static void validate(TaskContext ctx, RetryPolicy policy, Object task) {
        if (ctx == null) {
            throw new IllegalArgumentException("ctx cannot be null");
        }
        if (policy == null) {
            throw new IllegalArgumentException("policy cannot be null");
        }
        if (task == null) {
            throw new IllegalArgumentException("task cannot be null");
        }
    }
}
