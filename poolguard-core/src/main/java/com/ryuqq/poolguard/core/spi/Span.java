package com.ryuqq.poolguard.core.spi;

import java.util.Map;

/**
 * A started trace span.
 *
 * <p>Implementations must tolerate calls after {@link #end()} by ignoring them.</p>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public interface Span {

    /**
     * Span status.
     */
    enum Status {
        UNSET,
        OK,
        ERROR
    }

    String getName();

    void setAttribute(String key, Object value);

    void addEvent(String name, Map<String, Object> attributes);

    void setStatus(Status status, String message);

    void end();
}
