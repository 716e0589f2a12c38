package com.ryuqq.ruledispatch.core.exception;

import com.ryuqq.ruledispatch.core.model.ParameterTypeTag;

/**
 * 파라미터의 실제 타입이 태그에 등록된 타입과 다를 때 발생.
 *
 * <p>두 파라미터 타입이 같은 태그를 반환하는 구성 결함입니다.
 * Dispatcher는 이 예외를 {@code Failed(PARAMETER_TYPE_MISMATCH)}로 변환합니다.</p>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public class ParameterTypeMismatchException extends RuleDispatchException {

    /**
     * 생성자.
     *
     * @param tag 파라미터 태그
     * @param expected 등록된 파라미터 타입
     * @param actual 실제 파라미터 타입
     */
    public ParameterTypeMismatchException(ParameterTypeTag tag, Class<?> expected, Class<?> actual) {
        super(String.format("Parameter type mismatch for %s: expected %s but was %s",
            tag.getValue(), expected.getName(), actual.getName()), tag);
    }
}
