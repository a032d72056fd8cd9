package com.ryuqq.poolguard.testkit.tracing;

import com.ryuqq.poolguard.core.spi.Span;
import com.ryuqq.poolguard.core.spi.Tracer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Tracer that keeps every started span in memory so tests can assert on them.
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * RecordingTracer tracer = new RecordingTracer();
 * runner = TenantAwareTaskRunner.builder().tracer(tracer).build();
 *
 * runner.submit(ctx, "payment", task);
 *
 * RecordingTracer.RecordedSpan span = tracer.spans().get(0);
 * assertTrue(span.isEnded());
 * </pre>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public final class RecordingTracer implements Tracer {

    private final List<RecordedSpan> spans = new CopyOnWriteArrayList<>();

    @Override
    public Span startSpan(String name, Map<String, Object> attributes, Span parent) {
        RecordedSpan span = new RecordedSpan(name, attributes, parent);
        spans.add(span);
        return span;
    }

    /**
     * Spans in start order.
     *
     * @return snapshot of started spans
     */
    public List<RecordedSpan> spans() {
        return List.copyOf(spans);
    }

    public void clear() {
        spans.clear();
    }

    /**
     * Recorded event on a span.
     *
     * @param name event name
     * @param attributes event attributes
     */
    public record Event(String name, Map<String, Object> attributes) {
    }

    /**
     * Span that records every call.
     */
    public static final class RecordedSpan implements Span {

        private final String name;
        private final Span parent;
        private final Map<String, Object> attributes = new LinkedHashMap<>();
        private final List<Event> events = new ArrayList<>();
        private Status status = Status.UNSET;
        private String statusMessage;
        private boolean ended;

        RecordedSpan(String name, Map<String, Object> attributes, Span parent) {
            this.name = name;
            this.parent = parent;
            if (attributes != null) {
                this.attributes.putAll(attributes);
            }
        }

        @Override
        public String getName() {
            return name;
        }

        @Override
        public synchronized void setAttribute(String key, Object value) {
            attributes.put(key, value);
        }

        @Override
        public synchronized void addEvent(String name, Map<String, Object> attributes) {
            events.add(new Event(name, attributes == null ? Map.of() : Map.copyOf(attributes)));
        }

        @Override
        public synchronized void setStatus(Status status, String message) {
            this.status = status;
            this.statusMessage = message;
        }

        @Override
        public synchronized void end() {
            ended = true;
        }

        public Span getParent() {
            return parent;
        }

        public synchronized Map<String, Object> getAttributes() {
            return Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        }

        public synchronized List<Event> getEvents() {
            return List.copyOf(events);
        }

        public synchronized Status getStatus() {
            return status;
        }

        public synchronized String getStatusMessage() {
            return statusMessage;
        }

        public synchronized boolean isEnded() {
            return ended;
        }
    }
}
