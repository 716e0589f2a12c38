package com.ryuqq.ruledispatch.core.outcome;

/**
 * 룰이 결과를 생성함.
 *
 * <p>result는 성공일 수도, 비즈니스 거부일 수도 있습니다.
 * 거부 여부는 {@link RuleResult#isBusinessRuleRejection()}으로 확인합니다.</p>
 *
 * @param result 룰 결과
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public record Produced(RuleResult result) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException result가 null인 경우
     */
    public Produced {
        if (result == null) {
            throw new IllegalArgumentException("result cannot be null");
        }
    }
}
