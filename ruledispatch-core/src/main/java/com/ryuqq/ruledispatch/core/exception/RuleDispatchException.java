package com.ryuqq.ruledispatch.core.exception;

import com.ryuqq.ruledispatch.core.model.ParameterTypeTag;

/**
 * 룰 디스패치 예외의 최상위 타입.
 *
 * <p>레지스트리 구성 오류와 디스패치 시점 구성 결함을 나타냅니다.
 * 비즈니스 룰 거부는 예외가 아니라 값(Produced Outcome)으로 전달됩니다.</p>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public class RuleDispatchException extends RuntimeException {

    private final ParameterTypeTag tag;

    /**
     * 생성자.
     *
     * @param message 오류 메시지
     * @param tag 관련 태그 (null 가능)
     */
    public RuleDispatchException(String message, ParameterTypeTag tag) {
        super(message);
        this.tag = tag;
    }

    /**
     * 생성자 (원인 포함).
     *
     * @param message 오류 메시지
     * @param tag 관련 태그 (null 가능)
     * @param cause 원인
     */
    public RuleDispatchException(String message, ParameterTypeTag tag, Throwable cause) {
        super(message, cause);
        this.tag = tag;
    }

    /**
     * 관련 태그 조회.
     *
     * @return 태그 (없으면 null)
     */
    public ParameterTypeTag getTag() {
        return tag;
    }
}
