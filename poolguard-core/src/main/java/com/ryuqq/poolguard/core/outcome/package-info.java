/**
 * Task outcome types returned by the admission control plane.
 *
 * <p>{@link com.ryuqq.poolguard.core.outcome.TaskOutcome} is a sealed hierarchy so the
 * worker-pool glue can tell admission/protection rejections, terminal execution failures
 * and cancellations apart without inspecting message strings.</p>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
package com.ryuqq.poolguard.core.outcome;
