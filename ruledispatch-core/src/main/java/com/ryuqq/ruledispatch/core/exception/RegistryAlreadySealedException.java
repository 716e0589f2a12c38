package com.ryuqq.ruledispatch.core.exception;

import com.ryuqq.ruledispatch.core.model.ParameterTypeTag;

/**
 * 봉인(sealed)된 레지스트리에 쓰기를 시도할 때 발생.
 *
 * <p>등록 순서가 잘못된 프로그래밍 오류를 나타냅니다.</p>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public class RegistryAlreadySealedException extends RuleDispatchException {

    /**
     * 등록 시도 중 발생한 경우의 생성자.
     *
     * @param tag 등록하려던 태그
     */
    public RegistryAlreadySealedException(ParameterTypeTag tag) {
        super("Registry is sealed, cannot register handler for " + tag.getValue(), tag);
    }

    /**
     * 중복 봉인 시도 시의 생성자.
     */
    public RegistryAlreadySealedException() {
        super("Registry is already sealed", null);
    }
}
