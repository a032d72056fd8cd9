/**
 * Retry configuration and per-sequence bookkeeping.
 *
 * <p>{@link com.ryuqq.poolguard.core.retry.RetryPolicy} is pure configuration.
 * {@link com.ryuqq.poolguard.core.retry.RetryableTask} belongs to the caller of the retry executor
 * and records attempts and errors for one retry sequence.</p>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
package com.ryuqq.poolguard.core.retry;
