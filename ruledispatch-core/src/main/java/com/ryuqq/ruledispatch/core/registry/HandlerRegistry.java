package com.ryuqq.ruledispatch.core.registry;

import com.ryuqq.ruledispatch.core.exception.HandlerNotFoundException;
import com.ryuqq.ruledispatch.core.exception.RegistryNotSealedException;
import com.ryuqq.ruledispatch.core.handler.HandlerRegistration;
import com.ryuqq.ruledispatch.core.model.ParameterTypeTag;

import java.util.Set;

/**
 * 태그 → 핸들러 매핑 조회 인터페이스.
 *
 * <p>태그 하나에는 정확히 하나의 핸들러가 등록되며, 조회는 상수 시간에 수행됩니다.
 * 봉인 이후에는 읽기 전용이므로 여러 스레드에서 동시에 조회해도 안전합니다.</p>
 *
 * <p>등록 방식(명시적 테이블, 빌더 등)과 무관하게 Dispatcher는 이 계약만 의존합니다.
 * 런타임 타입 스캐닝은 사용하지 않습니다.</p>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 * @see DefaultHandlerRegistry
 */
public interface HandlerRegistry {

    /**
     * 태그에 등록된 핸들러 조회.
     *
     * <p>부수효과 없는 순수 조회이며, 같은 태그에 대해 항상 같은 등록을 반환합니다.</p>
     *
     * @param tag 파라미터 태그
     * @return 등록 정보
     * @throws IllegalArgumentException tag가 null인 경우
     * @throws HandlerNotFoundException 등록된 핸들러가 없는 경우
     * @throws RegistryNotSealedException 아직 봉인되지 않은 경우
     */
    HandlerRegistration<?> resolve(ParameterTypeTag tag);

    /**
     * 태그에 핸들러가 등록되어 있는지 확인.
     *
     * @param tag 파라미터 태그
     * @return 등록되어 있으면 true
     */
    boolean contains(ParameterTypeTag tag);

    /**
     * 등록된 태그 목록 조회.
     *
     * @return 불변 태그 집합
     */
    Set<ParameterTypeTag> registeredTags();

    /**
     * 등록된 핸들러 수.
     *
     * @return 등록 수
     */
    int size();

    /**
     * 현재 생명주기 상태.
     *
     * @return BUILDING 또는 SEALED
     */
    RegistryState state();

    /**
     * 봉인 여부 확인.
     *
     * @return SEALED인 경우 true
     */
    default boolean isSealed() {
        return state() == RegistryState.SEALED;
    }
}
