package com.ryuqq.ruledispatch.core.spi.noop;

import com.ryuqq.ruledispatch.core.exception.RuleDispatchException;
import com.ryuqq.ruledispatch.core.model.ParameterTypeTag;
import com.ryuqq.ruledispatch.core.outcome.Failed;
import com.ryuqq.ruledispatch.core.outcome.Outcome;
import com.ryuqq.ruledispatch.core.spi.DispatchTelemetry;

/**
 * Dispatch Telemetry NoOp 구현.
 *
 * <p>아무것도 기록하지 않습니다. 테스트 환경이나 별도 Sink가 필요 없을 때 사용합니다.</p>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public final class NoOpDispatchTelemetry implements DispatchTelemetry {

    @Override
    public void onHandlerNotFound(ParameterTypeTag tag) {
        // NoOp
    }

    @Override
    public void onRegistryError(RuleDispatchException error) {
        // NoOp
    }

    @Override
    public void onHandlerFailure(Failed failure) {
        // NoOp
    }

    @Override
    public void onDispatched(ParameterTypeTag tag, Outcome outcome, long elapsedNanos) {
        // NoOp
    }
}
