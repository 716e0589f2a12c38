package com.ryuqq.ruledispatch.core.exception;

import com.ryuqq.ruledispatch.core.model.ParameterTypeTag;

/**
 * 같은 태그에 두 번째 핸들러를 등록하려 할 때 발생.
 *
 * <p>설정 시점 전용 오류이며, 애플리케이션 초기화를 중단해야 합니다.</p>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public class DuplicateRegistrationException extends RuleDispatchException {

    /**
     * 생성자.
     *
     * @param tag 이미 핸들러가 등록된 태그
     * @param existingType 기존 등록의 파라미터 타입
     */
    public DuplicateRegistrationException(ParameterTypeTag tag, Class<?> existingType) {
        super(String.format("Handler already registered for %s (existing parameter type: %s)",
            tag.getValue(), existingType.getName()), tag);
    }
}
