package com.ryuqq.poolguard.core.error;

/**
 * 호출자에게 노출되는 실패 종류.
 *
 * <p>입장 거부(admission-rejection)와 보호 거부(protection-rejection)는 자주 발생하는
 * 정상적인 결과이며, 실제 실행 오류와 구분되어야 호출자가 백오프 또는 사용자 노출 등
 * 다른 처리를 적용할 수 있습니다.</p>
 *
 * @author PoolGuard Team
 * @since 1.0.0
 */
public enum FailureKind {

    /** 등록되지 않았고 암묵적으로 생성할 수도 없는 테넌트. */
    TENANT_NOT_FOUND,

    /** 테넌트 동시 작업 한도 초과. */
    QUOTA_EXCEEDED,

    /** Circuit Breaker OPEN 상태로 호출 차단. */
    CIRCUIT_OPEN,

    /** HALF_OPEN 상태의 동시 프로브 수 초과. */
    TOO_MANY_REQUESTS,

    /** 프로세스 자원 한도 초과로 입장 보류. */
    THROTTLED,

    /** 잘못된 설정. */
    INVALID_CONFIG,

    /** 취소 신호 발생. */
    CANCELLED;

    /**
     * 입장 단계에서 거부된 실패인지 확인.
     *
     * @return TENANT_NOT_FOUND, QUOTA_EXCEEDED, THROTTLED이면 true
     */
    public boolean isAdmissionRejection() {
        return this == TENANT_NOT_FOUND || this == QUOTA_EXCEEDED || this == THROTTLED;
    }

    /**
     * 보호 메커니즘에 의해 거부된 실패인지 확인.
     *
     * @return CIRCUIT_OPEN, TOO_MANY_REQUESTS이면 true
     */
    public boolean isProtectionRejection() {
        return this == CIRCUIT_OPEN || this == TOO_MANY_REQUESTS;
    }
}
