/**
 * In-memory {@link com.ryuqq.poolguard.core.spi.DeadLetterStore} implementation.
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
package com.ryuqq.poolguard.adapter.inmemory.dlq;
