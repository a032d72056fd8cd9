package com.ryuqq.poolguard.core.retry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 진행 중인 재시도 시퀀스 하나의 기록.
 *
 * <p>재시도 실행기를 호출한 쪽이 소유하며, 시도 횟수와 시각, 누적된 오류를 담습니다.
 * 실패 작업을 DLQ로 보낼 때 failureCount와 errors의 출처가 됩니다.</p>
 *
 * <p>한 시점에 하나의 스레드가 갱신한다고 가정하지만, 다른 스레드에서 읽을 수 있도록
 * 메서드는 동기화되어 있습니다.</p>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public final class RetryableTask {

    private final String id;
    private int attempts;
    private long lastAttemptAtMillis;
    private long nextRetryAtMillis;
    private final List<Exception> errors = new ArrayList<>();

    /**
     * 생성자.
     *
     * @param id 작업 ID
     * @throws IllegalArgumentException id가 null이거나 빈 문자열인 경우
     */
    public RetryableTask(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
        this.id = id;
    }

    /**
     * 시도 시작 기록.
     *
     * @param nowMillis 현재 시각 (epoch 밀리초)
     */
    public synchronized void recordAttempt(long nowMillis) {
        attempts++;
        lastAttemptAtMillis = nowMillis;
    }

    /**
     * 시도 실패 기록.
     *
     * @param error 실패 원인
     */
    public synchronized void recordError(Exception error) {
        errors.add(error);
    }

    /**
     * 다음 재시도 예정 시각 기록.
     *
     * @param atMillis 예정 시각 (epoch 밀리초)
     */
    public synchronized void scheduleNextRetry(long atMillis) {
        nextRetryAtMillis = atMillis;
    }

    public String getId() {
        return id;
    }

    public synchronized int getAttempts() {
        return attempts;
    }

    public synchronized long getLastAttemptAtMillis() {
        return lastAttemptAtMillis;
    }

    public synchronized long getNextRetryAtMillis() {
        return nextRetryAtMillis;
    }

    /**
     * 누적 오류 조회.
     *
     * @return 시도 순서대로 정렬된 오류 목록 (복사본)
     */
    public synchronized List<Exception> getErrors() {
        return Collections.unmodifiableList(new ArrayList<>(errors));
    }

    /**
     * 누적 오류 메시지 조회.
     *
     * @return "클래스명: 메시지" 형식 목록
     */
    public synchronized List<String> getErrorMessages() {
        List<String> messages = new ArrayList<>(errors.size());
        for (Exception error : errors) {
            messages.add(error.getClass().getSimpleName() + ": " + error.getMessage());
        }
        return messages;
    }
}
