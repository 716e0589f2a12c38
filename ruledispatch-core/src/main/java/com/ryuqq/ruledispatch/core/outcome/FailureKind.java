package com.ryuqq.ruledispatch.core.outcome;

/**
 * 인프라/레지스트리 실패 종류.
 *
 * <p>{@link Failed} Outcome의 원인을 구분합니다. 모두 운영자가 조치해야 하는 실패이며,
 * 사용자가 요청을 고쳐서 해결하는 비즈니스 거부와는 다릅니다.</p>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public enum FailureKind {

    /**
     * 태그에 등록된 핸들러 없음 (배포 구성 결함).
     */
    HANDLER_NOT_FOUND,

    /**
     * 파라미터의 실제 타입이 태그에 등록된 타입과 다름.
     */
    PARAMETER_TYPE_MISMATCH,

    /**
     * 핸들러가 예외를 던졌거나 null Outcome을 반환함.
     */
    HANDLER_ERROR,

    /**
     * 핸들러가 허용 시간 내에 완료되지 않음.
     */
    HANDLER_TIMEOUT
}
