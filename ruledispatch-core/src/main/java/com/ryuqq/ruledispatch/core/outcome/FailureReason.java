package com.ryuqq.ruledispatch.core.outcome;

/**
 * 룰 실패 사유 분류.
 *
 * <p>실패한 {@link RuleResult}가 의도된 비즈니스 거부인지, 다른 종류의 오류인지를 구분합니다.
 * Batch Executor는 {@link #BUSINESS_RULE}인 경우에만 즉시 중단합니다.</p>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public enum FailureReason {

    /**
     * 의도된 비즈니스 룰 거부 (예: 주간 최대 근무 시간 초과).
     */
    BUSINESS_RULE,

    /**
     * 룰 입력값 검증 실패.
     */
    VALIDATION,

    /**
     * 분류되지 않은 룰 수준 실패.
     */
    UNSPECIFIED
}
