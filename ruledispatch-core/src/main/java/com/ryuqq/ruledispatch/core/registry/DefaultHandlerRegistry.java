package com.ryuqq.ruledispatch.core.registry;

import com.ryuqq.ruledispatch.core.exception.DuplicateRegistrationException;
import com.ryuqq.ruledispatch.core.exception.HandlerNotFoundException;
import com.ryuqq.ruledispatch.core.exception.MissingRegistrationException;
import com.ryuqq.ruledispatch.core.exception.RegistryAlreadySealedException;
import com.ryuqq.ruledispatch.core.exception.RegistryNotSealedException;
import com.ryuqq.ruledispatch.core.handler.HandlerRegistration;
import com.ryuqq.ruledispatch.core.handler.RuleHandler;
import com.ryuqq.ruledispatch.core.model.ParameterTypeTag;
import com.ryuqq.ruledispatch.core.model.RuleParameters;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * 2단계 생명주기를 가진 Handler Registry 기본 구현.
 *
 * <p><strong>생명주기:</strong></p>
 * <ol>
 *   <li>BUILDING: {@link #register}로 태그별 핸들러를 명시적으로 등록</li>
 *   <li>{@link #seal()} 또는 {@link #seal(Collection)}: 불변 맵으로 복사 후 SEALED 전이</li>
 *   <li>SEALED: {@link #resolve}만 허용 (O(1), lock-free)</li>
 * </ol>
 *
 * <p><strong>동시성:</strong></p>
 * <ul>
 *   <li>register()/seal()은 설정 단계에서 호출되며 동기화되어 있음</li>
 *   <li>resolve()는 봉인 시 게시된 불변 맵만 읽으므로 동시 호출에 안전</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * HandlerRegistry registry = DefaultHandlerRegistry.builder()
 *     .register(ShiftOverlapParameters.TAG, ShiftOverlapParameters.class, new ShiftOverlapHandler())
 *     .register(EligibilityParameters.TAG, EligibilityParameters.class, new EligibilityHandler())
 *     .build(List.of(ShiftOverlapParameters.TAG, EligibilityParameters.TAG));
 * </pre>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public final class DefaultHandlerRegistry implements HandlerRegistry {

    private final Map<ParameterTypeTag, HandlerRegistration<?>> pending = new LinkedHashMap<>();

    private volatile Map<ParameterTypeTag, HandlerRegistration<?>> sealed;
    private volatile RegistryState state = RegistryState.BUILDING;

    /**
     * 빈 레지스트리 생성 (BUILDING 상태).
     */
    public DefaultHandlerRegistry() {
    }

    /**
     * 빌더 생성.
     *
     * @return 새 Builder
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * 핸들러 등록.
     *
     * @param tag 파라미터 태그
     * @param parameterType 파라미터 타입
     * @param handler 핸들러
     * @param <P> 파라미터 타입
     * @return this (체이닝용)
     * @throws IllegalArgumentException 인자가 null인 경우
     * @throws DuplicateRegistrationException 태그에 이미 핸들러가 있는 경우
     * @throws RegistryAlreadySealedException 이미 봉인된 경우
     */
    public <P extends RuleParameters> DefaultHandlerRegistry register(
            ParameterTypeTag tag, Class<P> parameterType, RuleHandler<P> handler) {
        return register(HandlerRegistration.of(tag, parameterType, handler));
    }

    /**
     * 등록 정보로 핸들러 등록.
     *
     * @param registration 등록 정보
     * @return this (체이닝용)
     * @throws IllegalArgumentException registration이 null인 경우
     * @throws DuplicateRegistrationException 태그에 이미 핸들러가 있는 경우
     * @throws RegistryAlreadySealedException 이미 봉인된 경우
     */
    public synchronized DefaultHandlerRegistry register(HandlerRegistration<?> registration) {
        if (registration == null) {
            throw new IllegalArgumentException("registration cannot be null");
        }
        ParameterTypeTag tag = registration.tag();
        if (!state.acceptsRegistration()) {
            throw new RegistryAlreadySealedException(tag);
        }
        HandlerRegistration<?> existing = pending.get(tag);
        if (existing != null) {
            throw new DuplicateRegistrationException(tag, existing.parameterType());
        }
        pending.put(tag, registration);
        return this;
    }

    /**
     * 레지스트리 봉인.
     *
     * @throws RegistryAlreadySealedException 이미 봉인된 경우
     */
    public synchronized void seal() {
        RegistryState next = RegistryLifecycle.transition(state, RegistryState.SEALED);
        sealed = Map.copyOf(pending);
        pending.clear();
        state = next;
    }

    /**
     * 필수 태그 커버리지를 검증한 뒤 봉인.
     *
     * <p>누락된 태그가 하나라도 있으면 봉인하지 않고 BUILDING 상태를 유지합니다.</p>
     *
     * @param requiredTags 반드시 핸들러가 있어야 하는 태그
     * @throws IllegalArgumentException requiredTags가 null인 경우
     * @throws MissingRegistrationException 필수 태그의 핸들러가 없는 경우
     * @throws RegistryAlreadySealedException 이미 봉인된 경우
     */
    public synchronized void seal(Collection<ParameterTypeTag> requiredTags) {
        if (requiredTags == null) {
            throw new IllegalArgumentException("requiredTags cannot be null");
        }
        if (!state.acceptsRegistration()) {
            throw new RegistryAlreadySealedException();
        }
        List<ParameterTypeTag> missing = new ArrayList<>();
        for (ParameterTypeTag tag : requiredTags) {
            if (!pending.containsKey(tag) && !missing.contains(tag)) {
                missing.add(tag);
            }
        }
        if (!missing.isEmpty()) {
            throw new MissingRegistrationException(missing);
        }
        seal();
    }

    @Override
    public HandlerRegistration<?> resolve(ParameterTypeTag tag) {
        if (tag == null) {
            throw new IllegalArgumentException("tag cannot be null");
        }
        Map<ParameterTypeTag, HandlerRegistration<?>> table = sealed;
        if (table == null) {
            throw new RegistryNotSealedException(tag);
        }
        HandlerRegistration<?> registration = table.get(tag);
        if (registration == null) {
            throw new HandlerNotFoundException(tag);
        }
        return registration;
    }

    @Override
    public boolean contains(ParameterTypeTag tag) {
        if (tag == null) {
            return false;
        }
        Map<ParameterTypeTag, HandlerRegistration<?>> table = sealed;
        if (table != null) {
            return table.containsKey(tag);
        }
        synchronized (this) {
            return pending.containsKey(tag);
        }
    }

    @Override
    public Set<ParameterTypeTag> registeredTags() {
        Map<ParameterTypeTag, HandlerRegistration<?>> table = sealed;
        if (table != null) {
            return table.keySet();
        }
        synchronized (this) {
            return Set.copyOf(pending.keySet());
        }
    }

    @Override
    public int size() {
        Map<ParameterTypeTag, HandlerRegistration<?>> table = sealed;
        if (table != null) {
            return table.size();
        }
        synchronized (this) {
            return pending.size();
        }
    }

    @Override
    public RegistryState state() {
        return state;
    }

    /**
     * DefaultHandlerRegistry 빌더.
     *
     * <p>{@link #build()}는 항상 봉인된 레지스트리를 반환합니다.</p>
     */
    public static final class Builder {

        private final DefaultHandlerRegistry registry = new DefaultHandlerRegistry();

        private Builder() {
        }

        /**
         * 핸들러 등록.
         *
         * @param tag 파라미터 태그
         * @param parameterType 파라미터 타입
         * @param handler 핸들러
         * @param <P> 파라미터 타입
         * @return this
         * @throws DuplicateRegistrationException 태그에 이미 핸들러가 있는 경우
         */
        public <P extends RuleParameters> Builder register(
                ParameterTypeTag tag, Class<P> parameterType, RuleHandler<P> handler) {
            registry.register(tag, parameterType, handler);
            return this;
        }

        /**
         * 등록 정보로 핸들러 등록.
         *
         * @param registration 등록 정보
         * @return this
         * @throws DuplicateRegistrationException 태그에 이미 핸들러가 있는 경우
         */
        public Builder register(HandlerRegistration<?> registration) {
            registry.register(registration);
            return this;
        }

        /**
         * 봉인된 레지스트리 생성.
         *
         * @return SEALED 상태의 레지스트리
         * @throws RegistryAlreadySealedException build()를 두 번 호출한 경우
         */
        public DefaultHandlerRegistry build() {
            registry.seal();
            return registry;
        }

        /**
         * 필수 태그 커버리지를 검증하고 봉인된 레지스트리 생성.
         *
         * @param requiredTags 반드시 핸들러가 있어야 하는 태그
         * @return SEALED 상태의 레지스트리
         * @throws MissingRegistrationException 필수 태그의 핸들러가 없는 경우
         */
        public DefaultHandlerRegistry build(Collection<ParameterTypeTag> requiredTags) {
            registry.seal(requiredTags);
            return registry;
        }
    }
}
