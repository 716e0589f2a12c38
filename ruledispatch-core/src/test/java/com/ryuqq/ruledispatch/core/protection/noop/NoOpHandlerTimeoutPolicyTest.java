package com.ryuqq.ruledispatch.core.protection.noop;

import com.ryuqq.ruledispatch.core.model.ParameterTypeTag;
import com.ryuqq.ruledispatch.core.protection.HandlerTimeoutPolicy;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * NoOpHandlerTimeoutPolicy 유닛 테스트.
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
@DisplayName("NoOpHandlerTimeoutPolicy 테스트")
class NoOpHandlerTimeoutPolicyTest {

    @Test
    @DisplayName("getTimeoutMs() 는 항상 0을 반환한다")
    void getTimeoutMs_항상_0_반환() {
        // given
        HandlerTimeoutPolicy policy = new NoOpHandlerTimeoutPolicy();

        // when
        long timeout = policy.getTimeoutMs(ParameterTypeTag.of("SHIFT_OVERLAP"));

        // then
        assertEquals(0, timeout);
    }

    @Test
    @DisplayName("recordTimeout() 은 예외 없이 실행된다")
    void recordTimeout_예외_없이_실행() {
        // given
        HandlerTimeoutPolicy policy = new NoOpHandlerTimeoutPolicy();

        // when & then
        assertDoesNotThrow(() -> policy.recordTimeout(ParameterTypeTag.of("SHIFT_OVERLAP"), 1000));
    }
}
