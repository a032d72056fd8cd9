package com.ryuqq.poolguard.core.spi;

import java.util.Optional;
import java.util.function.Predicate;

/**
 * Dead-letter storage SPI.
 *
 * <p>This interface abstracts the persistent store that keeps tasks which exhausted
 * their retries. Entries are opaque byte arrays keyed by task id; encoding is the
 * caller's concern.</p>
 *
 * <p><strong>Responsibilities:</strong></p>
 * <ul>
 *   <li>Appending encoded entries in arrival order</li>
 *   <li>Popping the oldest entry into an in-flight set until acknowledged</li>
 *   <li>Conditionally popping the oldest entry when it matches a predicate</li>
 *   <li>Peeking the oldest entry without removing it</li>
 *   <li>Acknowledging (dropping) or negative acknowledging (requeueing) in-flight entries</li>
 * </ul>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: All methods must be safely callable from multiple threads</li>
 *   <li>FIFO: pop and peek observe entries in push order</li>
 *   <li>Idempotent: acknowledging an unknown id is a no-op that returns false</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * store.push(new StoredItem("task-1", bytes, System.currentTimeMillis()));
 *
 * store.pop().ifPresent(item -&gt; {
 *     try {
 *         replay(item);
 *         store.acknowledge(item.id());
 *     } catch (Exception e) {
 *         store.nack(item.id());
 *     }
 * });
 * </pre>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public interface DeadLetterStore extends AutoCloseable {

    /**
     * Appends an encoded entry.
     *
     * @param item the entry to store
     * @throws IllegalArgumentException if item is null
     * @throws IllegalStateException if the store is full or closed
     */
    void push(StoredItem item);

    /**
     * Removes the oldest entry and tracks it as in-flight until acknowledged.
     *
     * @return the oldest entry, or empty if the store holds none
     */
    Optional<StoredItem> pop();

    /**
     * Removes the oldest entry only if it matches the condition, tracking it as in-flight.
     *
     * <p>The check and the removal happen as one atomic step: a concurrent pop can never
     * cause a different entry than the one tested to be removed.</p>
     *
     * @param condition tested against the current oldest entry
     * @return the removed entry, or empty if the store is empty or the oldest entry did not match
     * @throws IllegalArgumentException if condition is null
     */
    Optional<StoredItem> popIf(Predicate<StoredItem> condition);

    /**
     * Returns the oldest entry without removing it.
     *
     * @return the oldest entry, or empty if the store holds none
     */
    Optional<StoredItem> peek();

    /**
     * Permanently drops an in-flight entry.
     *
     * @param id the task id of a popped entry
     * @return true if an in-flight entry was dropped
     */
    boolean acknowledge(String id);

    /**
     * Returns an in-flight entry to the tail of the store.
     *
     * @param id the task id of a popped entry
     * @return true if the entry was requeued, false if no in-flight entry had that id
     */
    boolean nack(String id);

    /**
     * Number of entries waiting to be popped (in-flight entries excluded).
     *
     * @return queued entry count
     */
    int size();

    /**
     * Releases resources held by the store. Further pushes fail.
     */
    @Override
    void close();
}
