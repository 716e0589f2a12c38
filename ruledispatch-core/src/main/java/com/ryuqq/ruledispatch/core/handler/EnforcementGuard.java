package com.ryuqq.ruledispatch.core.handler;

import com.ryuqq.ruledispatch.core.model.RuleParameters;
import com.ryuqq.ruledispatch.core.outcome.Outcome;
import com.ryuqq.ruledispatch.core.spi.RuleConfigurationSource;

import java.util.function.Function;

/**
 * 룰 적용 여부를 확인한 뒤 위임하는 핸들러 데코레이터.
 *
 * <p>{@link RuleConfigurationSource}가 해당 스코프에서 룰을 적용하지 않는다고 답하면
 * 위임 핸들러를 호출하지 않고 {@link Outcome#empty()}를 반환합니다.</p>
 *
 * <p>룰 태그는 디스패치된 파라미터의 {@code params.tag()}를 사용하므로,
 * 설정 조회 대상은 항상 핸들러가 등록된 태그와 같습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * RuleHandler&lt;ShiftOverlapParameters&gt; guarded = new EnforcementGuard&lt;&gt;(
 *     configurationSource,
 *     ShiftOverlapParameters::locationId,
 *     new ShiftOverlapHandler()
 * );
 * </pre>
 *
 * @param <P> 파라미터 타입
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public final class EnforcementGuard<P extends RuleParameters> implements RuleHandler<P> {

    private final RuleConfigurationSource configurationSource;
    private final Function<? super P, String> scopeExtractor;
    private final RuleHandler<P> delegate;

    /**
     * 생성자.
     *
     * @param configurationSource 룰 설정 소스
     * @param scopeExtractor 파라미터에서 스코프(예: 지점 ID)를 꺼내는 함수, 결과는 null 가능
     * @param delegate 실제 룰 핸들러
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public EnforcementGuard(
            RuleConfigurationSource configurationSource,
            Function<? super P, String> scopeExtractor,
            RuleHandler<P> delegate) {
        if (configurationSource == null) {
            throw new IllegalArgumentException("configurationSource cannot be null");
        }
        if (scopeExtractor == null) {
            throw new IllegalArgumentException("scopeExtractor cannot be null");
        }
        if (delegate == null) {
            throw new IllegalArgumentException("delegate cannot be null");
        }
        this.configurationSource = configurationSource;
        this.scopeExtractor = scopeExtractor;
        this.delegate = delegate;
    }

    /**
     * 스코프 없이(전역 설정만) 적용 여부를 확인하는 가드 생성.
     *
     * @param configurationSource 룰 설정 소스
     * @param delegate 실제 룰 핸들러
     * @param <P> 파라미터 타입
     * @return EnforcementGuard 인스턴스
     */
    public static <P extends RuleParameters> EnforcementGuard<P> global(
            RuleConfigurationSource configurationSource, RuleHandler<P> delegate) {
        return new EnforcementGuard<>(configurationSource, params -> null, delegate);
    }

    @Override
    public Outcome handle(P params) {
        String scope = scopeExtractor.apply(params);
        if (!configurationSource.isEnforced(params.tag(), scope)) {
            return Outcome.empty();
        }
        return delegate.handle(params);
    }
}
