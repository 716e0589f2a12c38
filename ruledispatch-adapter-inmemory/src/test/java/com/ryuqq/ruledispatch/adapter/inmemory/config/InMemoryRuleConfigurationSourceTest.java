package com.ryuqq.ruledispatch.adapter.inmemory.config;

import com.ryuqq.ruledispatch.core.model.ParameterTypeTag;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link InMemoryRuleConfigurationSource}.
 *
 * <p><strong>Test Coverage:</strong></p>
 * <ul>
 *   <li>Default flag when nothing is configured</li>
 *   <li>Lookup order: scoped flag, then global flag, then default</li>
 *   <li>Input validation</li>
 * </ul>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
class InMemoryRuleConfigurationSourceTest {

    private static final ParameterTypeTag WEEKLY_HOURS = ParameterTypeTag.of("WEEKLY_HOURS");
    private static final ParameterTypeTag SHIFT_OVERLAP = ParameterTypeTag.of("SHIFT_OVERLAP");

    private InMemoryRuleConfigurationSource source;

    @BeforeEach
    void setUp() {
        source = new InMemoryRuleConfigurationSource();
    }

    @Test
    void isEnforced_NothingConfigured_ReturnsDefault() {
        assertThat(source.isEnforced(WEEKLY_HOURS, null)).isTrue();
        assertThat(source.isEnforced(WEEKLY_HOURS, "LOCATION-1")).isTrue();
        assertThat(new InMemoryRuleConfigurationSource(false).isEnforced(WEEKLY_HOURS, "LOCATION-1")).isFalse();
    }

    @Test
    void isEnforced_GlobalFlag_AppliesToEveryScope() {
        // Given
        source.disable(WEEKLY_HOURS);

        // Then
        assertThat(source.isEnforced(WEEKLY_HOURS, null)).isFalse();
        assertThat(source.isEnforced(WEEKLY_HOURS, "LOCATION-1")).isFalse();
        assertThat(source.isEnforced(SHIFT_OVERLAP, "LOCATION-1")).isTrue();
    }

    @Test
    void isEnforced_ScopedFlag_OverridesGlobalFlag() {
        // Given
        source.disable(WEEKLY_HOURS);
        source.enable(WEEKLY_HOURS, "LOCATION-7");

        // Then
        assertThat(source.isEnforced(WEEKLY_HOURS, "LOCATION-7")).isTrue();
        assertThat(source.isEnforced(WEEKLY_HOURS, "LOCATION-1")).isFalse();
        assertThat(source.isEnforced(WEEKLY_HOURS, null)).isFalse();
    }

    @Test
    void isEnforced_ScopedDisable_OverridesDefault() {
        // Given
        source.disable(SHIFT_OVERLAP, "LOCATION-3");

        // Then
        assertThat(source.isEnforced(SHIFT_OVERLAP, "LOCATION-3")).isFalse();
        assertThat(source.isEnforced(SHIFT_OVERLAP, "LOCATION-4")).isTrue();
    }

    @Test
    void enable_AfterDisable_ReplacesFlag() {
        // Given
        source.disable(WEEKLY_HOURS);

        // When
        source.enable(WEEKLY_HOURS);

        // Then
        assertThat(source.isEnforced(WEEKLY_HOURS, null)).isTrue();
    }

    @Test
    void clear_RemovesAllFlags() {
        // Given
        source.disable(WEEKLY_HOURS);
        source.disable(SHIFT_OVERLAP, "LOCATION-3");

        // When
        source.clear();

        // Then
        assertThat(source.isEnforced(WEEKLY_HOURS, null)).isTrue();
        assertThat(source.isEnforced(SHIFT_OVERLAP, "LOCATION-3")).isTrue();
    }

    @Test
    void invalidArguments_ThrowException() {
        assertThatThrownBy(() -> source.isEnforced(null, "LOCATION-1"))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> source.disable(null))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> source.enable(WEEKLY_HOURS, " "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("scope");
    }
}
