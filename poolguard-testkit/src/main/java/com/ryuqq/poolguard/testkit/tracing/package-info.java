/**
 * In-memory tracer for asserting on emitted spans.
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
package com.ryuqq.poolguard.testkit.tracing;
