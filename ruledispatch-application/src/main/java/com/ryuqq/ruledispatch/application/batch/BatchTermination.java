package com.ryuqq.ruledispatch.application.batch;

/**
 * 배치 실행 종료 사유.
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public enum BatchTermination {

    /**
     * 모든 파라미터를 평가함.
     */
    COMPLETED,

    /**
     * 비즈니스 룰 거부로 조기 종료 (사용자 조치 대상).
     */
    BUSINESS_RULE_REJECTION,

    /**
     * 디스패치 실패로 조기 종료 (운영자 조치 대상).
     */
    DISPATCH_FAILURE;

    /**
     * 조기 종료 여부.
     *
     * @return COMPLETED가 아니면 true
     */
    public boolean isEarlyExit() {
        return this != COMPLETED;
    }
}
