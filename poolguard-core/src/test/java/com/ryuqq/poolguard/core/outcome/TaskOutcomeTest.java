package com.ryuqq.poolguard.core.outcome;

import com.ryuqq.poolguard.core.error.FailureKind;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

/**
 * TaskOutcome 변형별 테스트.
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
class TaskOutcomeTest {

    @Test
    void completed_상태_판별() {
        // given
        TaskOutcome<String> outcome = new Completed<>("task-1", "ok", 1, 1_000);

        // then
        assertTrue(outcome.isCompleted());
        assertFalse(outcome.isRejected());
        assertFalse(outcome.isFailed());
        assertFalse(outcome.isCancelled());
        assertEquals("task-1", outcome.taskId());
    }

    @Test
    void rejected_종류_보존() {
        // given
        TaskOutcome<String> outcome = new Rejected<>("task-2", FailureKind.QUOTA_EXCEEDED, "quota exceeded");

        // then
        assertTrue(outcome.isRejected());
        Rejected<String> rejected = (Rejected<String>) outcome;
        assertEquals(FailureKind.QUOTA_EXCEEDED, rejected.kind());
        assertEquals("quota exceeded", rejected.message());
    }

    @Test
    void failed_오류와_DLQ_여부_보존() {
        // given
        IOException error = new IOException("disk full");
        TaskOutcome<String> outcome = new Failed<>("task-3", error, 4, true);

        // then
        assertTrue(outcome.isFailed());
        Failed<String> failed = (Failed<String>) outcome;
        assertSame(error, failed.error());
        assertEquals(4, failed.attempts());
        assertTrue(failed.deadLettered());
    }

    @Test
    void cancelled_상태_판별() {
        TaskOutcome<Void> outcome = new Cancelled<>("task-4", 2);

        assertTrue(outcome.isCancelled());
        assertEquals(2, ((Cancelled<Void>) outcome).attempts());
    }

    @Test
    void 필수값_누락_거부() {
        assertThrows(IllegalArgumentException.class, () -> new Completed<>(null, "v", 1, 0));
        assertThrows(IllegalArgumentException.class, () -> new Completed<>("t", "v", 0, 0));
        assertThrows(IllegalArgumentException.class, () -> new Rejected<>("t", null, "m"));
        assertThrows(IllegalArgumentException.class, () -> new Failed<>("t", null, 1, false));
        assertThrows(IllegalArgumentException.class, () -> new Cancelled<>(null, 0));
    }
}
