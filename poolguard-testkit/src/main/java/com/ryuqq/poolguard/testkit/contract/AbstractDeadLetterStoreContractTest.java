package com.ryuqq.poolguard.testkit.contract;

import com.ryuqq.poolguard.core.spi.DeadLetterStore;
import com.ryuqq.poolguard.core.spi.StoredItem;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test for {@link DeadLetterStore} implementations.
 *
 * <p>Every store backend extends this class and supplies a fresh instance through
 * {@link #createStore()}. The same scenarios then run against each backend.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>FIFO ordering for pop and peek</li>
 *   <li>pop → acknowledge drops the entry, pop → nack requeues it at the tail</li>
 *   <li>popIf removes the head only when it matches, and never a later entry</li>
 *   <li>acknowledge/nack of unknown ids are no-ops</li>
 *   <li>push after close fails</li>
 *   <li>concurrent pushes lose nothing</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyStoreContractTest extends AbstractDeadLetterStoreContractTest {
 *     {@literal @}Override
 *     protected DeadLetterStore createStore() {
 *         return new MyStore();
 *     }
 * }
 * </pre>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public abstract class AbstractDeadLetterStoreContractTest {

    protected DeadLetterStore store;

    /**
     * Creates the store under test. Called before each test.
     *
     * @return an empty, open store
     */
    protected abstract DeadLetterStore createStore();

    @BeforeEach
    void setUpStore() {
        store = createStore();
    }

    @AfterEach
    void tearDownStore() {
        if (store != null) {
            store.close();
        }
    }

    /**
     * Creates a stored item with a UTF-8 body.
     *
     * @param id task id
     * @param body entry body
     * @return stored item
     */
    protected StoredItem item(String id, String body) {
        return new StoredItem(id, body.getBytes(StandardCharsets.UTF_8), System.currentTimeMillis());
    }

    @Test
    void testEmptyStore_PopAndPeekReturnEmpty() {
        assertEquals(0, store.size());
        assertTrue(store.pop().isEmpty(), "pop on empty store should return empty");
        assertTrue(store.peek().isEmpty(), "peek on empty store should return empty");
    }

    @Test
    void testPushPop_PreservesFifoOrder() {
        // Given
        store.push(item("task-1", "a"));
        store.push(item("task-2", "b"));
        store.push(item("task-3", "c"));

        // When
        List<String> popped = new ArrayList<>();
        Optional<StoredItem> next;
        while ((next = store.pop()).isPresent()) {
            popped.add(next.get().id());
        }

        // Then
        assertEquals(List.of("task-1", "task-2", "task-3"), popped);
        assertEquals(0, store.size());
    }

    @Test
    void testPeek_DoesNotRemoveEntry() {
        // Given
        store.push(item("task-1", "payload"));

        // When
        Optional<StoredItem> first = store.peek();
        Optional<StoredItem> second = store.peek();

        // Then
        assertTrue(first.isPresent());
        assertEquals(first, second, "peek should be repeatable");
        assertArrayEquals("payload".getBytes(StandardCharsets.UTF_8), first.get().data());
        assertEquals(1, store.size());
    }

    @Test
    void testPopThenAcknowledge_EntryIsGone() {
        // Given
        store.push(item("task-1", "a"));

        // When
        StoredItem popped = store.pop().orElseThrow();
        boolean acknowledged = store.acknowledge(popped.id());

        // Then
        assertTrue(acknowledged);
        assertFalse(store.acknowledge(popped.id()), "second acknowledge should be a no-op");
        assertFalse(store.nack(popped.id()), "acknowledged entry cannot be requeued");
        assertEquals(0, store.size());
    }

    @Test
    void testPopThenNack_EntryRequeuedAtTail() {
        // Given
        store.push(item("task-1", "a"));
        store.push(item("task-2", "b"));

        // When
        StoredItem popped = store.pop().orElseThrow();
        boolean requeued = store.nack(popped.id());

        // Then
        assertTrue(requeued);
        assertEquals(2, store.size());
        assertEquals("task-2", store.pop().orElseThrow().id());
        assertEquals("task-1", store.pop().orElseThrow().id());
    }

    @Test
    void testPopIf_HeadMatching_MovesToInFlight() {
        // Given
        store.push(new StoredItem("task-1", "a".getBytes(StandardCharsets.UTF_8), 1_000L));
        store.push(new StoredItem("task-2", "b".getBytes(StandardCharsets.UTF_8), 5_000L));

        // When
        Optional<StoredItem> popped = store.popIf(item -> item.createdAtMillis() <= 2_000L);

        // Then
        assertTrue(popped.isPresent());
        assertEquals("task-1", popped.get().id());
        assertEquals(1, store.size());
        assertTrue(store.acknowledge("task-1"), "conditionally popped entry should be in flight");
    }

    @Test
    void testPopIf_HeadNotMatching_LeavesQueueUntouched() {
        // Given
        store.push(new StoredItem("task-1", "a".getBytes(StandardCharsets.UTF_8), 5_000L));
        store.push(new StoredItem("task-2", "b".getBytes(StandardCharsets.UTF_8), 1_000L));

        // When
        Optional<StoredItem> popped = store.popIf(item -> item.createdAtMillis() <= 2_000L);

        // Then
        assertTrue(popped.isEmpty(), "only the head is tested, later matching entries stay");
        assertEquals(2, store.size());
        assertEquals("task-1", store.peek().orElseThrow().id());
        assertFalse(store.acknowledge("task-2"));
    }

    @Test
    void testPopIf_EmptyStoreOrNullCondition() {
        assertTrue(store.popIf(item -> true).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> store.popIf(null));
    }

    @Test
    void testAcknowledgeUnknownId_ReturnsFalse() {
        assertFalse(store.acknowledge("missing"));
        assertFalse(store.nack("missing"));
    }

    @Test
    void testPushAfterClose_Fails() {
        // Given
        store.close();

        // When & Then
        assertThrows(IllegalStateException.class, () -> store.push(item("task-1", "a")));
    }

    @Test
    void testPushNull_Fails() {
        assertThrows(IllegalArgumentException.class, () -> store.push(null));
    }

    @Test
    void testConcurrentPush_NoEntryLost() throws InterruptedException {
        // Given
        int threads = 8;
        int perThread = 50;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch done = new CountDownLatch(threads);

        // When
        for (int t = 0; t < threads; t++) {
            int threadIndex = t;
            executor.submit(() -> {
                try {
                    for (int i = 0; i < perThread; i++) {
                        store.push(item("task-" + threadIndex + "-" + i, "x"));
                    }
                } finally {
                    done.countDown();
                }
            });
        }

        // Then
        assertTrue(done.await(10, TimeUnit.SECONDS));
        executor.shutdown();
        assertEquals(threads * perThread, store.size());
    }
}
