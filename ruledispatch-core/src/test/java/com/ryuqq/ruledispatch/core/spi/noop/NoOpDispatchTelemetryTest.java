package com.ryuqq.ruledispatch.core.spi.noop;

import com.ryuqq.ruledispatch.core.exception.RegistryNotSealedException;
import com.ryuqq.ruledispatch.core.model.ParameterTypeTag;
import com.ryuqq.ruledispatch.core.outcome.Failed;
import com.ryuqq.ruledispatch.core.outcome.Outcome;
import com.ryuqq.ruledispatch.core.spi.DispatchTelemetry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NoOpDispatchTelemetry 유닛 테스트.
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
@DisplayName("NoOpDispatchTelemetry 테스트")
class NoOpDispatchTelemetryTest {

    @Test
    @DisplayName("모든 보고 메서드는 예외 없이 실행된다")
    void 모든_보고_예외_없이_실행() {
        // given
        DispatchTelemetry telemetry = new NoOpDispatchTelemetry();
        ParameterTypeTag tag = ParameterTypeTag.of("SHIFT_OVERLAP");

        // when & then
        assertDoesNotThrow(() -> {
            telemetry.onHandlerNotFound(tag);
            telemetry.onRegistryError(new RegistryNotSealedException(tag));
            telemetry.onHandlerFailure(Failed.handlerNotFound(tag));
            telemetry.onDispatched(tag, Outcome.empty(), 1_000);
        });
    }
}
