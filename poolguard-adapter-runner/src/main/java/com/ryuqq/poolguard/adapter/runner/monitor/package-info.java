/**
 * 프로세스 자원 모니터링과 throttle 신호.
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
package com.ryuqq.poolguard.adapter.runner.monitor;
