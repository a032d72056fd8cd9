/**
 * Collaborator SPIs consumed by the control plane.
 *
 * <ul>
 *   <li>{@link com.ryuqq.poolguard.core.spi.DeadLetterStore} - persistent storage behind the dead-letter queue</li>
 *   <li>{@link com.ryuqq.poolguard.core.spi.Tracer} / {@link com.ryuqq.poolguard.core.spi.Span} - span emission, export excluded</li>
 *   <li>{@link com.ryuqq.poolguard.core.spi.ResourceProbe} - process CPU and memory sampling source</li>
 * </ul>
 *
 * <p>The control plane depends only on these contracts, never on a concrete backend.</p>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
package com.ryuqq.poolguard.core.spi;
