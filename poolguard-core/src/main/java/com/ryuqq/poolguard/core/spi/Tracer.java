package com.ryuqq.poolguard.core.spi;

import java.util.Map;

/**
 * Tracing collaborator SPI.
 *
 * <p>PoolGuard emits spans and attributes through this interface but never exports them.
 * Export, sampling and propagation belong to the implementation.</p>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public interface Tracer {

    /**
     * Starts a span.
     *
     * @param name span name
     * @param attributes initial attributes (may be empty, never null)
     * @param parent parent span, or null for a root span
     * @return the started span
     */
    Span startSpan(String name, Map<String, Object> attributes, Span parent);
}
