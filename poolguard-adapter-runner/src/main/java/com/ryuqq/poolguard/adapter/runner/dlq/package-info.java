/**
 * Dead Letter Queue (JSON 인코딩 + DeadLetterStore SPI).
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
package com.ryuqq.poolguard.adapter.runner.dlq;
