package com.ryuqq.ruledispatch.adapter.runner;

import com.ryuqq.ruledispatch.core.exception.RegistryNotSealedException;
import com.ryuqq.ruledispatch.core.model.ParameterTypeTag;
import com.ryuqq.ruledispatch.core.outcome.Failed;
import com.ryuqq.ruledispatch.core.outcome.FailureKind;
import com.ryuqq.ruledispatch.core.outcome.Outcome;
import com.ryuqq.ruledispatch.core.outcome.RuleResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.slf4j.Logger;

import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.startsWith;
import static org.mockito.Mockito.*;

/**
 * Slf4jDispatchTelemetry 유닛 테스트.
 *
 * <p>보고 종류별 로그 레벨과 인자를 검증합니다.</p>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class Slf4jDispatchTelemetryTest {

    private static final ParameterTypeTag TAG = ParameterTypeTag.of("SHIFT_OVERLAP");

    @Mock
    private Logger logger;

    private Slf4jDispatchTelemetry telemetry;

    @BeforeEach
    void setUp() {
        telemetry = new Slf4jDispatchTelemetry(logger);
    }

    @Test
    void onHandlerNotFound_WARN으로_태그_기록() {
        // when
        telemetry.onHandlerNotFound(TAG);

        // then
        verify(logger).warn(startsWith("No handler registered for {}"), eq("SHIFT_OVERLAP"));
        verifyNoMoreInteractions(logger);
    }

    @Test
    void onHandlerFailure_WARN으로_종류와_원인_기록() {
        // when
        telemetry.onHandlerFailure(Failed.of(FailureKind.HANDLER_ERROR, TAG, "Handler threw NullPointerException", "boom"));

        // then
        verify(logger).warn(startsWith("Rule dispatch failed"), eq("SHIFT_OVERLAP"), eq(FailureKind.HANDLER_ERROR),
            eq("Handler threw NullPointerException"), eq("boom"));
    }

    @Test
    void onRegistryError_ERROR로_태그와_메시지_기록() {
        // given
        RegistryNotSealedException error = new RegistryNotSealedException(TAG);

        // when
        telemetry.onRegistryError(error);

        // then
        verify(logger).error(startsWith("Registry error"), eq("SHIFT_OVERLAP"), eq(error.getMessage()));
    }

    @Test
    void onDispatched_DEBUG_비활성시_기록하지_않음() {
        // given
        when(logger.isDebugEnabled()).thenReturn(false);

        // when
        telemetry.onDispatched(TAG, Outcome.produced(RuleResult.passed()), 12_345);

        // then
        verify(logger).isDebugEnabled();
        verifyNoMoreInteractions(logger);
    }

    @Test
    void onDispatched_DEBUG_활성시_결과_타입과_소요시간_기록() {
        // given
        when(logger.isDebugEnabled()).thenReturn(true);

        // when
        telemetry.onDispatched(TAG, Outcome.empty(), 12_345);

        // then
        verify(logger).debug(anyString(), eq("SHIFT_OVERLAP"), eq("Empty"), eq(12L));
    }

    @Test
    void constructor_null_Logger_예외() {
        assertThatThrownBy(() -> new Slf4jDispatchTelemetry(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
