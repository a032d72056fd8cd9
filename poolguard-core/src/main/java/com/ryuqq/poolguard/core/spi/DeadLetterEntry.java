package com.ryuqq.poolguard.core.spi;

import java.util.List;

/**
 * 재시도를 모두 소진한 작업의 DLQ 기록.
 *
 * @param taskId 작업 ID
 * @param payload 원본 작업 데이터 (빈 배열 가능)
 * @param failedAtMillis 최종 실패 시각 (epoch 밀리초)
 * @param failureCount 실패한 시도 횟수
 * @param errors 시도별 오류 메시지
 * @author PoolGuard Team
 * @since 1.0.0
 */
public record DeadLetterEntry(
    String taskId,
    byte[] payload,
    long failedAtMillis,
    int failureCount,
    List<String> errors
) {

    public DeadLetterEntry {
        if (taskId == null || taskId.isBlank()) {
            throw new IllegalArgumentException("taskId cannot be null or blank");
        }
        payload = payload == null ? new byte[0] : payload.clone();
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }
}
