/**
 * 풀 전체 통계.
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
package com.ryuqq.poolguard.application.stats;
