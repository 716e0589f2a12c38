package com.ryuqq.ruledispatch.adapter.runner;

import com.ryuqq.ruledispatch.application.batch.BatchExecutor;
import com.ryuqq.ruledispatch.application.batch.BatchResult;
import com.ryuqq.ruledispatch.application.dispatcher.Dispatcher;
import com.ryuqq.ruledispatch.core.model.RuleParameters;
import com.ryuqq.ruledispatch.core.outcome.Failed;
import com.ryuqq.ruledispatch.core.outcome.Outcome;
import com.ryuqq.ruledispatch.core.outcome.Produced;
import com.ryuqq.ruledispatch.core.outcome.RuleResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * 순차 Batch Executor 구현체.
 *
 * <p>입력 순서대로 호출 스레드에서 하나씩 디스패치하며, 두 가지 조건에서 즉시 중단합니다:</p>
 * <ul>
 *   <li>Failed: 인프라 실패 → DISPATCH_FAILURE (실패 건은 결과 목록에 없음)</li>
 *   <li>비즈니스 거부: → BUSINESS_RULE_REJECTION (거부 결과까지 목록에 포함)</li>
 * </ul>
 *
 * <p>비즈니스 룰 이외 사유의 실패 결과(VALIDATION, UNSPECIFIED)는 목록에 추가하고 계속 진행합니다.
 * Empty는 목록에 추가하지 않습니다.</p>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public final class SequentialBatchExecutor implements BatchExecutor {

    private static final Logger log = LoggerFactory.getLogger(SequentialBatchExecutor.class);

    private final Dispatcher dispatcher;

    /**
     * 생성자.
     *
     * @param dispatcher 디스패처
     * @throws IllegalArgumentException dispatcher가 null인 경우
     */
    public SequentialBatchExecutor(Dispatcher dispatcher) {
        if (dispatcher == null) {
            throw new IllegalArgumentException("dispatcher cannot be null");
        }
        this.dispatcher = dispatcher;
    }

    @Override
    public BatchResult runAll(List<? extends RuleParameters> params) {
        if (params == null) {
            throw new IllegalArgumentException("params cannot be null");
        }
        if (params.isEmpty()) {
            return BatchResult.empty();
        }

        log.debug("Batch started: {} parameters", params.size());
        List<RuleResult> results = new ArrayList<>();
        int evaluated = 0;

        for (RuleParameters current : params) {
            if (current == null) {
                throw new IllegalArgumentException("params[" + evaluated + "] cannot be null");
            }

            Outcome outcome = dispatcher.dispatch(current);
            evaluated++;
            if (outcome == null) {
                throw new IllegalStateException("Dispatcher returned null outcome for " + current.tag());
            }

            if (outcome instanceof Failed failed) {
                log.warn("Batch halted at {}/{}: {} for {}",
                    evaluated, params.size(), failed.kind(), failed.tag().getValue());
                return BatchResult.failed(results, failed, evaluated);
            }

            if (outcome instanceof Produced produced) {
                RuleResult result = produced.result();
                results.add(result);
                if (result.isBusinessRuleRejection()) {
                    log.info("Batch stopped at {}/{} by business rule rejection from {} (code: {})",
                        evaluated, params.size(), current.tag().getValue(), result.errorCode());
                    return BatchResult.rejected(results, evaluated);
                }
            }
            // Empty: 통과
        }

        log.debug("Batch completed: {} evaluated, {} results", evaluated, results.size());
        return BatchResult.completed(results, evaluated);
    }
}
