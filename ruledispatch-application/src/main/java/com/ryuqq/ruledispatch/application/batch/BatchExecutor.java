package com.ryuqq.ruledispatch.application.batch;

import com.ryuqq.ruledispatch.core.model.RuleParameters;

import java.util.List;

/**
 * 여러 룰 파라미터를 순서대로 디스패치하고 조기 종료 규칙을 적용하는 실행기.
 *
 * <p><strong>알고리즘 (입력 순서대로 fold):</strong></p>
 * <ol>
 *   <li>Failed → 즉시 중단, 지금까지의 결과 + 실패 반환 (DISPATCH_FAILURE)</li>
 *   <li>Produced(비즈니스 거부) → 결과 추가 후 즉시 중단 (BUSINESS_RULE_REJECTION)</li>
 *   <li>Produced(그 외) → 결과 추가 후 계속</li>
 *   <li>Empty → 건너뛰고 계속</li>
 * </ol>
 *
 * <p>조기 종료 이후의 파라미터는 디스패치되지 않습니다. 따라서 병렬 실행하지 않습니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * BatchResult result = batchExecutor.runAll(List.of(overlap, eligibility, weeklyHours));
 * switch (result.termination()) {
 *     case COMPLETED -&gt; accept();
 *     case BUSINESS_RULE_REJECTION -&gt; rejectWith(result.rejection().orElseThrow());
 *     case DISPATCH_FAILURE -&gt; alertOperator(result.failureOrEmpty().orElseThrow());
 * }
 * </pre>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public interface BatchExecutor {

    /**
     * 파라미터 목록 실행.
     *
     * @param params 룰 파라미터 (입력 순서 유지)
     * @return 배치 결과
     * @throws IllegalArgumentException params가 null이거나, 도달한 원소가 null인 경우
     */
    BatchResult runAll(List<? extends RuleParameters> params);
}
