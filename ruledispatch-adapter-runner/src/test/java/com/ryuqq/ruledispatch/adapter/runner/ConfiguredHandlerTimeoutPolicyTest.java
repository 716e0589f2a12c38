package com.ryuqq.ruledispatch.adapter.runner;

import com.ryuqq.ruledispatch.core.model.ParameterTypeTag;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ConfiguredHandlerTimeoutPolicy 유닛 테스트.
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
@DisplayName("ConfiguredHandlerTimeoutPolicy 테스트")
class ConfiguredHandlerTimeoutPolicyTest {

    private static final ParameterTypeTag OVERLAP = ParameterTypeTag.of("SHIFT_OVERLAP");
    private static final ParameterTypeTag HOURS = ParameterTypeTag.of("WEEKLY_HOURS");

    @Test
    @DisplayName("getTimeoutMs() 는 설정의 태그별 값을 반환한다")
    void getTimeoutMs_설정값_반환() {
        // given
        ConfiguredHandlerTimeoutPolicy policy = new ConfiguredHandlerTimeoutPolicy(
            new TimeoutConfig().withDefaultTimeoutMs(300).withOverride(OVERLAP, 30));

        // then
        assertThat(policy.getTimeoutMs(OVERLAP)).isEqualTo(30);
        assertThat(policy.getTimeoutMs(HOURS)).isEqualTo(300);
    }

    @Test
    @DisplayName("recordTimeout() 은 태그별로 횟수를 누적한다")
    void recordTimeout_태그별_횟수_누적() {
        // given
        ConfiguredHandlerTimeoutPolicy policy = new ConfiguredHandlerTimeoutPolicy(new TimeoutConfig());

        // when
        policy.recordTimeout(OVERLAP, 51);
        policy.recordTimeout(OVERLAP, 60);

        // then
        assertThat(policy.timeoutCount(OVERLAP)).isEqualTo(2);
        assertThat(policy.timeoutCount(HOURS)).isZero();
    }

    @Test
    @DisplayName("null 설정은 거부한다")
    void constructor_null_설정_예외() {
        assertThatThrownBy(() -> new ConfiguredHandlerTimeoutPolicy(null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
