package com.ryuqq.poolguard.adapter.runner;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * NotificationDispatcher 유닛 테스트.
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
class NotificationDispatcherTest {

    @Test
    void 알림은_전용_스레드에서_실행됨() throws Exception {
        // given
        AtomicReference<String> threadName = new AtomicReference<>();
        CountDownLatch done = new CountDownLatch(1);

        // when
        try (NotificationDispatcher dispatcher = new NotificationDispatcher()) {
            dispatcher.execute(() -> {
                threadName.set(Thread.currentThread().getName());
                done.countDown();
            });

            // then
            assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
            assertThat(threadName.get()).isEqualTo("poolguard-notifier");
        }
    }

    @Test
    void 리스너_예외가_이후_알림을_막지_않음() throws Exception {
        // given
        CountDownLatch delivered = new CountDownLatch(1);

        // when
        try (NotificationDispatcher dispatcher = new NotificationDispatcher()) {
            dispatcher.execute(() -> {
                throw new IllegalStateException("listener bug");
            });
            dispatcher.execute(delivered::countDown);

            // then
            assertThat(delivered.await(5, TimeUnit.SECONDS)).isTrue();
        }
    }

    @Test
    void 큐가_가득_차면_알림을_버리고_호출자는_막히지_않음() throws Exception {
        // given
        CountDownLatch blocker = new CountDownLatch(1);
        CountDownLatch running = new CountDownLatch(1);

        try (NotificationDispatcher dispatcher = new NotificationDispatcher(1)) {
            dispatcher.execute(() -> {
                running.countDown();
                try {
                    blocker.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            assertThat(running.await(5, TimeUnit.SECONDS)).isTrue();

            // when
            dispatcher.execute(() -> { });
            dispatcher.execute(() -> { });
            dispatcher.execute(() -> { });

            // then
            assertThat(dispatcher.getDroppedCount()).isEqualTo(2);
            blocker.countDown();
        }
    }

    @Test
    void 닫힌_후_알림은_버려짐() {
        // given
        NotificationDispatcher dispatcher = new NotificationDispatcher();
        dispatcher.close();

        // when
        dispatcher.execute(() -> { });

        // then
        assertThat(dispatcher.getDroppedCount()).isEqualTo(1);
    }

    @Test
    void 용량은_양수여야_함() {
        assertThatThrownBy(() -> new NotificationDispatcher(0))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
