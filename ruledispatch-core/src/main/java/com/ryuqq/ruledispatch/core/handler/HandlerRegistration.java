package com.ryuqq.ruledispatch.core.handler;

import com.ryuqq.ruledispatch.core.exception.ParameterTypeMismatchException;
import com.ryuqq.ruledispatch.core.model.ParameterTypeTag;
import com.ryuqq.ruledispatch.core.model.RuleParameters;
import com.ryuqq.ruledispatch.core.outcome.Outcome;

/**
 * 태그와 핸들러의 불변 쌍.
 *
 * <p>설정 단계에서 한 번 만들어지고 이후 변경되지 않습니다. 파라미터 타입 토큰을 함께 보관하여
 * 디스패치 시 안전하게 {@code P}로 좁힐 수 있게 합니다.</p>
 *
 * @param tag 파라미터 태그
 * @param parameterType 핸들러가 받는 파라미터 타입
 * @param handler 핸들러
 * @param <P> 파라미터 타입
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public record HandlerRegistration<P extends RuleParameters>(
    ParameterTypeTag tag,
    Class<P> parameterType,
    RuleHandler<P> handler
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드가 null인 경우
     */
    public HandlerRegistration {
        if (tag == null) {
            throw new IllegalArgumentException("tag cannot be null");
        }
        if (parameterType == null) {
            throw new IllegalArgumentException("parameterType cannot be null");
        }
        if (handler == null) {
            throw new IllegalArgumentException("handler cannot be null");
        }
    }

    /**
     * HandlerRegistration 생성.
     *
     * @param tag 파라미터 태그
     * @param parameterType 파라미터 타입
     * @param handler 핸들러
     * @param <P> 파라미터 타입
     * @return HandlerRegistration 인스턴스
     */
    public static <P extends RuleParameters> HandlerRegistration<P> of(
            ParameterTypeTag tag, Class<P> parameterType, RuleHandler<P> handler) {
        return new HandlerRegistration<>(tag, parameterType, handler);
    }

    /**
     * 파라미터를 등록된 타입으로 좁혀 핸들러 호출.
     *
     * @param params 룰 파라미터
     * @return 핸들러가 반환한 Outcome (그대로)
     * @throws ParameterTypeMismatchException params가 등록된 타입이 아닌 경우
     */
    public Outcome invoke(RuleParameters params) {
        if (!parameterType.isInstance(params)) {
            throw new ParameterTypeMismatchException(tag, parameterType, params.getClass());
        }
        return handler.handle(parameterType.cast(params));
    }
}
