package com.ryuqq.poolguard.core.model;

import com.ryuqq.poolguard.core.spi.Span;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * 작업 실행 컨텍스트.
 *
 * <p>제출된 작업 하나마다 생성되며, 테넌트/사용자/요청 식별 정보와 인증 정보,
 * 그리고 취소 신호를 함께 전달합니다. 하위 컴포넌트는 읽기만 하며,
 * 작업이 끝나면 버려집니다.</p>
 *
 * <p><strong>취소:</strong></p>
 * <ul>
 *   <li>{@link #cancel()} 호출 시 취소 신호가 발생하며 되돌릴 수 없습니다.</li>
 *   <li>{@link #withSpan(Span)}로 만든 파생 컨텍스트는 같은 취소 신호를 공유합니다.</li>
 *   <li>{@link #awaitCancellation(long)}은 대기 중 취소되면 즉시 깨어납니다.</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * TaskContext ctx = TaskContext.builder("tenant-a")
 *     .requestId("req-1")
 *     .userId("user-7")
 *     .claim("role", "admin")
 *     .build();
 *
 * // 다른 스레드에서
 * ctx.cancel();
 * }</pre>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public final class TaskContext {

    private final String tenantId;
    private final String userId;
    private final String requestId;
    private final String sourceIp;
    private final String userAgent;
    private final String token;
    private final Map<String, Object> claims;
    private final Span span;
    private final CountDownLatch cancelled;

    private TaskContext(Builder builder, Span span, CountDownLatch cancelled) {
        this.tenantId = builder.tenantId;
        this.userId = builder.userId;
        this.requestId = builder.requestId;
        this.sourceIp = builder.sourceIp;
        this.userAgent = builder.userAgent;
        this.token = builder.token;
        this.claims = Collections.unmodifiableMap(new HashMap<>(builder.claims));
        this.span = span;
        this.cancelled = cancelled;
    }

    private TaskContext(TaskContext parent, Span span) {
        this.tenantId = parent.tenantId;
        this.userId = parent.userId;
        this.requestId = parent.requestId;
        this.sourceIp = parent.sourceIp;
        this.userAgent = parent.userAgent;
        this.token = parent.token;
        this.claims = parent.claims;
        this.span = span;
        this.cancelled = parent.cancelled;
    }

    /**
     * 테넌트 ID만 가진 컨텍스트 생성.
     *
     * @param tenantId 테넌트 ID
     * @return TaskContext
     * @throws IllegalArgumentException tenantId가 null이거나 빈 문자열인 경우
     */
    public static TaskContext of(String tenantId) {
        return builder(tenantId).build();
    }

    /**
     * Builder 생성.
     *
     * @param tenantId 테넌트 ID
     * @return Builder
     */
    public static Builder builder(String tenantId) {
        return new Builder(tenantId);
    }

    /**
     * 현재 Span을 부모로 연결한 파생 컨텍스트 생성.
     *
     * <p>식별 정보와 취소 신호는 원본과 공유합니다.</p>
     *
     * @param span 부모로 사용할 Span
     * @return 파생 컨텍스트
     */
    public TaskContext withSpan(Span span) {
        if (span == null) {
            throw new IllegalArgumentException("span cannot be null");
        }
        return new TaskContext(this, span);
    }

    /**
     * 취소 신호 발생 (멱등).
     */
    public void cancel() {
        cancelled.countDown();
    }

    /**
     * 취소 여부 확인.
     *
     * @return 취소되었으면 true
     */
    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * 지정 시간 동안 대기하되, 취소되면 즉시 반환.
     *
     * <p>현재 스레드가 인터럽트되면 인터럽트 플래그를 복원하고 취소로 간주합니다.</p>
     *
     * @param millis 최대 대기 시간 (밀리초)
     * @return 대기 중(또는 대기 전) 취소되었으면 true, 시간이 다 지났으면 false
     */
    public boolean awaitCancellation(long millis) {
        if (millis <= 0) {
            return isCancelled();
        }
        try {
            return cancelled.await(millis, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getUserId() {
        return userId;
    }

    public String getRequestId() {
        return requestId;
    }

    public String getSourceIp() {
        return sourceIp;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public String getToken() {
        return token;
    }

    public Map<String, Object> getClaims() {
        return claims;
    }

    /**
     * 부모 Span 조회.
     *
     * @return 연결된 Span (없으면 empty)
     */
    public Optional<Span> getSpan() {
        return Optional.ofNullable(span);
    }

    @Override
    public String toString() {
        return "TaskContext{tenantId=" + tenantId + ", requestId=" + requestId + ", userId=" + userId + '}';
    }

    /**
     * TaskContext Builder.
     */
    public static final class Builder {

        private final String tenantId;
        private String userId;
        private String requestId;
        private String sourceIp;
        private String userAgent;
        private String token;
        private final Map<String, Object> claims = new HashMap<>();

        private Builder(String tenantId) {
            if (tenantId == null || tenantId.isBlank()) {
                throw new IllegalArgumentException("tenantId cannot be null or blank");
            }
            this.tenantId = tenantId;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder sourceIp(String sourceIp) {
            this.sourceIp = sourceIp;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder token(String token) {
            this.token = token;
            return this;
        }

        public Builder claim(String key, Object value) {
            if (key == null) {
                throw new IllegalArgumentException("claim key cannot be null");
            }
            this.claims.put(key, value);
            return this;
        }

        public TaskContext build() {
            return new TaskContext(this, null, new CountDownLatch(1));
        }
    }
}
