package com.ryuqq.poolguard.adapter.runner.dlq;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ryuqq.poolguard.core.spi.DeadLetterEntry;
import com.ryuqq.poolguard.core.spi.DeadLetterStore;
import com.ryuqq.poolguard.core.spi.StoredItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Dead Letter Queue.
 *
 * <p>재시도를 모두 소진한 작업을 JSON으로 인코딩해 {@link DeadLetterStore}에 보관합니다.
 * 저장소 구현(in-memory, 파일, 외부 저장소)과는 SPI로만 연결됩니다.</p>
 *
 * <p><strong>동작:</strong></p>
 * <ul>
 *   <li>push: 인코딩 → (maxSize 도달 시 가장 오래된 항목 제거) → 저장 → onMessage 비동기 호출</li>
 *   <li>pop: 가장 오래된 항목을 꺼내 디코딩 (처리 후 {@link #acknowledge(String)} 필요)</li>
 *   <li>cleanup: retention보다 오래된 항목을 앞에서부터 제거</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * DeadLetterQueue dlq = new DeadLetterQueue(store, 10_000, Duration.ofDays(7), entry ->
 *     alerts.send(entry.taskId()), dispatcher);
 *
 * dlq.pop().ifPresent(entry -> {
 *     replay(entry);
 *     dlq.acknowledge(entry.taskId());
 * });
 * }</pre>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public final class DeadLetterQueue implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DeadLetterQueue.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private final DeadLetterStore store;
    private final int maxSize;
    private final Duration retention;
    private final Consumer<DeadLetterEntry> onMessage;
    private final Executor notifier;

    /**
     * 크기 제한, retention, 리스너 없이 생성.
     *
     * @param store 저장소
     */
    public DeadLetterQueue(DeadLetterStore store) {
        this(store, 0, Duration.ZERO, null, null);
    }

    /**
     * 생성자.
     *
     * @param store 저장소
     * @param maxSize 최대 보관 수 (0이면 무제한)
     * @param retention 보관 기간 (0이면 cleanup 시 제거하지 않음)
     * @param onMessage push 성공 시 호출되는 리스너 (nullable)
     * @param notifier 리스너 실행용 Executor (onMessage가 있으면 필수)
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public DeadLetterQueue(DeadLetterStore store, int maxSize, Duration retention,
                           Consumer<DeadLetterEntry> onMessage, Executor notifier) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (maxSize < 0) {
            throw new IllegalArgumentException(
                "maxSize must not be negative (current: " + maxSize + ")"
            );
        }
        if (retention == null || retention.isNegative()) {
            throw new IllegalArgumentException("retention cannot be null or negative");
        }
        if (onMessage != null && notifier == null) {
            throw new IllegalArgumentException("notifier cannot be null when onMessage is set");
        }
        this.store = store;
        this.maxSize = maxSize;
        this.retention = retention;
        this.onMessage = onMessage;
        this.notifier = notifier;
    }

    /**
     * 실패 작업 추가.
     *
     * @param entry DLQ 기록
     * @throws IllegalArgumentException entry가 null인 경우
     * @throws IllegalStateException 인코딩 실패 또는 저장소가 닫혔거나 가득 찬 경우
     */
    public synchronized void push(DeadLetterEntry entry) {
        if (entry == null) {
            throw new IllegalArgumentException("entry cannot be null");
        }
        byte[] data = encode(entry);

        while (maxSize > 0 && store.size() >= maxSize) {
            if (!evictOldest()) {
                break;
            }
        }

        store.push(new StoredItem(entry.taskId(), data, entry.failedAtMillis()));

        if (onMessage != null) {
            notifier.execute(() -> onMessage.accept(entry));
        }
    }

    /**
     * 가장 오래된 항목 꺼내기.
     *
     * <p>꺼낸 항목은 {@link #acknowledge(String)} 전까지 in-flight로 남습니다.</p>
     *
     * @return DLQ 기록 (비어 있으면 empty)
     * @throws IllegalStateException 디코딩 실패 시
     */
    public Optional<DeadLetterEntry> pop() {
        return store.pop().map(DeadLetterQueue::decode);
    }

    /**
     * 가장 오래된 항목 조회 (제거하지 않음).
     *
     * @return DLQ 기록 (비어 있으면 empty)
     * @throws IllegalStateException 디코딩 실패 시
     */
    public Optional<DeadLetterEntry> peek() {
        return store.peek().map(DeadLetterQueue::decode);
    }

    /**
     * 꺼낸 항목 처리 완료.
     *
     * @param taskId 작업 ID
     * @return in-flight 항목이 제거되었으면 true
     */
    public boolean acknowledge(String taskId) {
        return store.acknowledge(taskId);
    }

    /**
     * 꺼낸 항목을 다시 큐 끝으로 반환.
     *
     * @param taskId 작업 ID
     * @return 반환되었으면 true
     */
    public boolean nack(String taskId) {
        return store.nack(taskId);
    }

    /**
     * retention보다 오래된 항목 제거.
     *
     * @return 제거된 항목 수
     */
    public synchronized int cleanup() {
        if (retention.isZero()) {
            return 0;
        }
        long cutoff = System.currentTimeMillis() - retention.toMillis();
        int removed = 0;
        // 확인과 제거를 한 번에: 동시 pop이 끼어들어도 cutoff 이후 항목은 제거되지 않음
        Optional<StoredItem> expired = store.popIf(item -> item.createdAtMillis() <= cutoff);
        while (expired.isPresent()) {
            store.acknowledge(expired.get().id());
            removed++;
            expired = store.popIf(item -> item.createdAtMillis() <= cutoff);
        }
        if (removed > 0) {
            log.info("Dead letter cleanup removed {} entries older than {}", removed, retention);
        }
        return removed;
    }

    public int size() {
        return store.size();
    }

    public int getMaxSize() {
        return maxSize;
    }

    public Duration getRetention() {
        return retention;
    }

    @Override
    public void close() {
        store.close();
    }

    private boolean evictOldest() {
        Optional<StoredItem> oldest = store.pop();
        if (oldest.isEmpty()) {
            return false;
        }
        store.acknowledge(oldest.get().id());
        log.warn("Dead letter queue full (maxSize={}), evicted oldest entry {}", maxSize, oldest.get().id());
        return true;
    }

    private static byte[] encode(DeadLetterEntry entry) {
        try {
            return MAPPER.writeValueAsBytes(entry);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode dead letter entry " + entry.taskId(), e);
        }
    }

    private static DeadLetterEntry decode(StoredItem item) {
        try {
            return MAPPER.readValue(item.data(), DeadLetterEntry.class);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to decode dead letter entry " + item.id(), e);
        }
    }
}
