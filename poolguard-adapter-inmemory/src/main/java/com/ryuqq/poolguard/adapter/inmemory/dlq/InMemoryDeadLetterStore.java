package com.ryuqq.poolguard.adapter.inmemory.dlq;

import com.ryuqq.poolguard.core.spi.DeadLetterStore;
import com.ryuqq.poolguard.core.spi.StoredItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

/**
 * In-memory implementation of {@link DeadLetterStore} SPI for testing and reference purposes.
 *
 * <p><strong>Architecture:</strong></p>
 * <ul>
 *   <li><strong>Main Queue:</strong> ArrayDeque&lt;StoredItem&gt; - FIFO order of pushed entries</li>
 *   <li><strong>In-Flight Tracking:</strong> HashMap&lt;String, StoredItem&gt; - popped but not yet acknowledged</li>
 * </ul>
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>Optional capacity limit (push fails with {@link IllegalStateException} when full)</li>
 *   <li>nack returns an in-flight entry to the tail of the queue</li>
 *   <li>All operations are guarded by the instance monitor</li>
 * </ul>
 *
 * <p>In-flight entries are keyed by task id. Popping two entries with the same id before
 * acknowledging the first keeps only the latest one in flight.</p>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * DeadLetterStore store = new InMemoryDeadLetterStore(10_000);
 * DeadLetterQueue dlq = new DeadLetterQueue(store);
 * </pre>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public class InMemoryDeadLetterStore implements DeadLetterStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryDeadLetterStore.class);

    private final Deque<StoredItem> queue = new ArrayDeque<>();
    private final Map<String, StoredItem> inFlight = new HashMap<>();
    private final int capacity;
    private boolean closed;

    /**
     * Creates an unbounded store.
     */
    public InMemoryDeadLetterStore() {
        this(0);
    }

    /**
     * Creates a store with a capacity limit.
     *
     * @param capacity maximum queued entries, 0 for unbounded
     * @throws IllegalArgumentException if capacity is negative
     */
    public InMemoryDeadLetterStore(int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity cannot be negative, but was: " + capacity);
        }
        this.capacity = capacity;
    }

    @Override
    public synchronized void push(StoredItem item) {
        if (item == null) {
            throw new IllegalArgumentException("item cannot be null");
        }
        if (closed) {
            throw new IllegalStateException("Dead letter store is closed");
        }
        if (capacity > 0 && queue.size() >= capacity) {
            throw new IllegalStateException("Dead letter store is full (capacity: " + capacity + ")");
        }
        queue.addLast(item);
    }

    @Override
    public synchronized Optional<StoredItem> pop() {
        StoredItem item = queue.pollFirst();
        if (item == null) {
            return Optional.empty();
        }
        inFlight.put(item.id(), item);
        return Optional.of(item);
    }

    @Override
    public synchronized Optional<StoredItem> popIf(Predicate<StoredItem> condition) {
        if (condition == null) {
            throw new IllegalArgumentException("condition cannot be null");
        }
        StoredItem head = queue.peekFirst();
        if (head == null || !condition.test(head)) {
            return Optional.empty();
        }
        return pop();
    }

    @Override
    public synchronized Optional<StoredItem> peek() {
        return Optional.ofNullable(queue.peekFirst());
    }

    @Override
    public synchronized boolean acknowledge(String id) {
        return id != null && inFlight.remove(id) != null;
    }

    @Override
    public synchronized boolean nack(String id) {
        StoredItem item = id == null ? null : inFlight.remove(id);
        if (item == null) {
            return false;
        }
        queue.addLast(item);
        return true;
    }

    @Override
    public synchronized int size() {
        return queue.size();
    }

    /**
     * Number of popped entries awaiting acknowledgement.
     *
     * @return in-flight entry count
     */
    public synchronized int inFlightCount() {
        return inFlight.size();
    }

    /**
     * Drops every queued and in-flight entry. Useful between tests.
     */
    public synchronized void clear() {
        queue.clear();
        inFlight.clear();
    }

    @Override
    public synchronized void close() {
        if (!closed) {
            closed = true;
            log.info("In-memory dead letter store closed ({} queued, {} in flight)", queue.size(), inFlight.size());
        }
    }
}
