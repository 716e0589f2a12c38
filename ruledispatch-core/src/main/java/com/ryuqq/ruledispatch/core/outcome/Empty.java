package com.ryuqq.ruledispatch.core.outcome;

/**
 * 룰이 실행되었으나 보고할 결과가 없음.
 *
 * <p>룰이 현재 컨텍스트에 적용되지 않는 경우(예: 비활성화된 룰) 반환되며, 통과로 간주됩니다.
 * Batch Executor는 결과 목록에 추가하지 않고 다음 룰로 진행합니다.</p>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public record Empty() implements Outcome {

    /**
     * 공유 인스턴스.
     */
    public static final Empty INSTANCE = new Empty();
}
