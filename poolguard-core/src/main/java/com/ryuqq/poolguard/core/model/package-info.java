/**
 * Core value types shared by every PoolGuard module.
 *
 * <ul>
 *   <li>{@link com.ryuqq.poolguard.core.model.TenantConfig} - per-tenant limits and scheduling priority</li>
 *   <li>{@link com.ryuqq.poolguard.core.model.TaskContext} - cancellable per-task handle carrying caller identity</li>
 * </ul>
 *
 * @since 1.0.0
 * @author PoolGuard Team
 */
package com.ryuqq.poolguard.core.model;
