package com.ryuqq.ruledispatch.core.exception;

import com.ryuqq.ruledispatch.core.model.ParameterTypeTag;

/**
 * 봉인 전 레지스트리에서 조회를 시도할 때 발생.
 *
 * <p>설정 단계가 끝나기 전에 디스패치 경로가 열린 프로그래밍 오류입니다.
 * Dispatcher는 이 예외를 변환하지 않고 호출자에게 전파합니다.</p>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public class RegistryNotSealedException extends RuleDispatchException {

    /**
     * 생성자.
     *
     * @param tag 조회하려던 태그
     */
    public RegistryNotSealedException(ParameterTypeTag tag) {
        super("Registry must be sealed before resolving " + tag.getValue(), tag);
    }
}
