package com.ryuqq.poolguard.adapter.runner;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 비동기 알림 디스패처.
 *
 * <p>상태 전이, throttle/unthrottle, DLQ 메시지 콜백을 호출한 쪽과 분리된
 * 전용 데몬 스레드에서 실행합니다. 호출자는 콜백 완료를 기다리지 않습니다.</p>
 *
 * <p><strong>보장:</strong></p>
 * <ul>
 *   <li>큐가 가득 차면 알림을 버리고 WARN 로그를 남김 (호출자는 blocking 되지 않음)</li>
 *   <li>콜백 예외는 WARN 로그로 남기고 전파하지 않음</li>
 *   <li>단일 스레드이므로 같은 디스패처로 보낸 알림은 제출 순서대로 실행됨</li>
 * </ul>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public final class NotificationDispatcher implements Executor, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(NotificationDispatcher.class);

    private static final int DEFAULT_CAPACITY = 1024;
    private static final long CLOSE_TIMEOUT_MS = 1000;

    private final ThreadPoolExecutor executor;
    private final AtomicLong dropped = new AtomicLong();

    /**
     * 기본 큐 용량(1024)으로 생성.
     */
    public NotificationDispatcher() {
        this(DEFAULT_CAPACITY);
    }

    /**
     * 생성자.
     *
     * @param capacity 대기 가능한 알림 수 (양수여야 함)
     * @throws IllegalArgumentException capacity가 양수가 아닌 경우
     */
    public NotificationDispatcher(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException(
                "capacity must be positive (current: " + capacity + ")"
            );
        }
        this.executor = new ThreadPoolExecutor(
            1, 1, 0L, TimeUnit.MILLISECONDS,
            new LinkedBlockingQueue<>(capacity),
            runnable -> {
                Thread thread = new Thread(runnable, "poolguard-notifier");
                thread.setDaemon(true);
                return thread;
            },
            (rejected, pool) -> {
                dropped.incrementAndGet();
                log.warn("Notification dropped (queue full or dispatcher closed), total dropped: {}", dropped.get());
            }
        );
    }

    /**
     * 알림 제출 (non-blocking).
     *
     * @param notification 실행할 콜백
     */
    @Override
    public void execute(Runnable notification) {
        if (notification == null) {
            return;
        }
        executor.execute(() -> {
            try {
                notification.run();
            } catch (RuntimeException e) {
                log.warn("Notification listener threw an exception", e);
            }
        });
    }

    /**
     * 버려진 알림 수.
     *
     * @return 큐 초과 또는 종료 후 제출로 버려진 알림 수
     */
    public long getDroppedCount() {
        return dropped.get();
    }

    /**
     * 디스패처 종료.
     *
     * <p>이미 큐에 있는 알림은 최대 1초 동안 처리한 뒤 나머지는 버립니다.</p>
     */
    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(CLOSE_TIMEOUT_MS, TimeUnit.MILLISECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
    }
}
