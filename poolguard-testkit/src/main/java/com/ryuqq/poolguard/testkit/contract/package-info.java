/**
 * Contract tests shared by every {@link com.ryuqq.poolguard.core.spi.DeadLetterStore} backend.
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
package com.ryuqq.poolguard.testkit.contract;
