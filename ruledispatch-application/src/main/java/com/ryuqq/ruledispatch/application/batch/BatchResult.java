package com.ryuqq.ruledispatch.application.batch;

import com.ryuqq.ruledispatch.core.outcome.Failed;
import com.ryuqq.ruledispatch.core.outcome.RuleResult;

import java.util.List;
import java.util.Optional;

/**
 * 배치 실행 결과.
 *
 * <p>Produced 결과를 입력 순서대로 담고, 조기 종료된 경우 그 사유를 함께 담습니다.
 * Empty Outcome은 결과 목록에 포함되지 않습니다.</p>
 *
 * <p><strong>종료 사유별 상태:</strong></p>
 * <ul>
 *   <li>COMPLETED: failure 없음</li>
 *   <li>BUSINESS_RULE_REJECTION: failure 없음, 마지막 결과가 거부 결과</li>
 *   <li>DISPATCH_FAILURE: failure 있음 (실패한 파라미터의 결과는 목록에 없음)</li>
 * </ul>
 *
 * @param results Produced 결과 (입력 순서, 불변)
 * @param failure 디스패치 실패 (DISPATCH_FAILURE일 때만, 그 외 null)
 * @param termination 종료 사유
 * @param evaluatedCount 디스패치된 파라미터 수 (조기 종료 지점 포함)
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public record BatchResult(
    List<RuleResult> results,
    Failed failure,
    BatchTermination termination,
    int evaluatedCount
) {

    private static final BatchResult EMPTY = new BatchResult(List.of(), null, BatchTermination.COMPLETED, 0);

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필드 조합이 종료 사유와 맞지 않는 경우
     */
    public BatchResult {
        if (results == null) {
            throw new IllegalArgumentException("results cannot be null");
        }
        if (termination == null) {
            throw new IllegalArgumentException("termination cannot be null");
        }
        if (evaluatedCount < results.size()) {
            throw new IllegalArgumentException(
                "evaluatedCount cannot be less than results size (evaluatedCount: " + evaluatedCount + ", results: " + results.size() + ")"
            );
        }
        if ((termination == BatchTermination.DISPATCH_FAILURE) != (failure != null)) {
            throw new IllegalArgumentException("failure must be present if and only if termination is DISPATCH_FAILURE");
        }
        if (termination == BatchTermination.BUSINESS_RULE_REJECTION
                && (results.isEmpty() || !results.get(results.size() - 1).isBusinessRuleRejection())) {
            throw new IllegalArgumentException("BUSINESS_RULE_REJECTION requires a rejection as the last result");
        }
        results = List.copyOf(results);
    }

    /**
     * 빈 입력에 대한 결과.
     *
     * @return 결과 없음, 실패 없음, COMPLETED
     */
    public static BatchResult empty() {
        return EMPTY;
    }

    /**
     * 모든 파라미터를 평가한 결과 생성.
     *
     * @param results Produced 결과
     * @param evaluatedCount 평가한 파라미터 수
     * @return COMPLETED BatchResult
     */
    public static BatchResult completed(List<RuleResult> results, int evaluatedCount) {
        return new BatchResult(results, null, BatchTermination.COMPLETED, evaluatedCount);
    }

    /**
     * 비즈니스 거부로 조기 종료한 결과 생성.
     *
     * @param results Produced 결과 (마지막이 거부 결과)
     * @param evaluatedCount 평가한 파라미터 수
     * @return BUSINESS_RULE_REJECTION BatchResult
     */
    public static BatchResult rejected(List<RuleResult> results, int evaluatedCount) {
        return new BatchResult(results, null, BatchTermination.BUSINESS_RULE_REJECTION, evaluatedCount);
    }

    /**
     * 디스패치 실패로 조기 종료한 결과 생성.
     *
     * @param results 실패 이전까지의 Produced 결과
     * @param failure 디스패치 실패
     * @param evaluatedCount 평가한 파라미터 수 (실패한 파라미터 포함)
     * @return DISPATCH_FAILURE BatchResult
     */
    public static BatchResult failed(List<RuleResult> results, Failed failure, int evaluatedCount) {
        return new BatchResult(results, failure, BatchTermination.DISPATCH_FAILURE, evaluatedCount);
    }

    /**
     * 디스패치 실패 조회.
     *
     * @return 실패 (없으면 Optional.empty())
     */
    public Optional<Failed> failureOrEmpty() {
        return Optional.ofNullable(failure);
    }

    /**
     * 비즈니스 거부 결과 조회.
     *
     * @return 거부 결과 (BUSINESS_RULE_REJECTION이 아니면 Optional.empty())
     */
    public Optional<RuleResult> rejection() {
        if (termination != BatchTermination.BUSINESS_RULE_REJECTION) {
            return Optional.empty();
        }
        return Optional.of(results.get(results.size() - 1));
    }

    /**
     * 조기 종료 없이 모두 평가했는지 확인.
     *
     * @return COMPLETED인 경우 true
     */
    public boolean isSuccessful() {
        return termination == BatchTermination.COMPLETED;
    }
}
