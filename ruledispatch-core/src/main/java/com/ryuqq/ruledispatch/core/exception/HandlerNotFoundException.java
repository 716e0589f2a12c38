package com.ryuqq.ruledispatch.core.exception;

import com.ryuqq.ruledispatch.core.model.ParameterTypeTag;

/**
 * 태그에 등록된 핸들러가 없을 때 발생.
 *
 * <p>항상 배포 구성 결함입니다(파라미터 타입은 있으나 대응하는 핸들러가 없음).
 * Dispatcher는 이 예외를 {@code Failed(HANDLER_NOT_FOUND)}로 변환합니다.</p>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public class HandlerNotFoundException extends RuleDispatchException {

    /**
     * 생성자.
     *
     * @param tag 핸들러가 없는 태그
     */
    public HandlerNotFoundException(ParameterTypeTag tag) {
        super("No handler registered for " + tag.getValue(), tag);
    }
}
