/**
 * 작업 수락 API.
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
package com.ryuqq.poolguard.application.admission;
