package com.ryuqq.ruledispatch.core.handler;

import com.ryuqq.ruledispatch.core.model.RuleParameters;
import com.ryuqq.ruledispatch.core.outcome.Outcome;

/**
 * 특정 파라미터 타입 하나를 처리하는 룰 핸들러.
 *
 * <p>핸들러는 {@code P -> Outcome} 함수로 취급됩니다. 비즈니스 거부는 예외가 아니라
 * {@code Outcome.produced(RuleResult.rejected(...))}로 반환해야 합니다.</p>
 *
 * <p><strong>구현 가이드:</strong></p>
 * <ul>
 *   <li>null을 반환하지 않음 (보고할 내용이 없으면 {@link Outcome#empty()})</li>
 *   <li>부수효과가 없거나 멱등하게 구현 (Dispatcher는 재시도하지 않음)</li>
 *   <li>재시도가 필요하면 핸들러 내부에서 처리</li>
 * </ul>
 *
 * @param <P> 처리할 파라미터 타입
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface RuleHandler<P extends RuleParameters> {

    /**
     * 룰 실행.
     *
     * @param params 룰 파라미터 (null 아님)
     * @return 실행 결과 (Produced, Empty, Failed)
     */
    Outcome handle(P params);
}
