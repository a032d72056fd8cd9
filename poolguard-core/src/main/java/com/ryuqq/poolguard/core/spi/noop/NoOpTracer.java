package com.ryuqq.poolguard.core.spi.noop;

import com.ryuqq.poolguard.core.spi.Span;
import com.ryuqq.poolguard.core.spi.Tracer;

import java.util.Map;

/**
 * Tracer NoOp 구현.
 *
 * <p>Span을 기록하지 않으며, 모든 호출이 같은 NoOp Span을 반환합니다.</p>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public final class NoOpTracer implements Tracer {

    private static final Span NOOP_SPAN = new Span() {
        @Override
        public String getName() {
            return "noop";
        }

        @Override
        public void setAttribute(String key, Object value) {
            // NoOp
        }

        @Override
        public void addEvent(String name, Map<String, Object> attributes) {
            // NoOp
        }

        @Override
        public void setStatus(Status status, String message) {
            // NoOp
        }

        @Override
        public void end() {
            // NoOp
        }
    };

    @Override
    public Span startSpan(String name, Map<String, Object> attributes, Span parent) {
        return NOOP_SPAN;
    }
}
