package com.ryuqq.ruledispatch.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * ParameterTypeTag Value Object 테스트.
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
class ParameterTypeTagTest {

    @Test
    void of_ValidUppercaseValue_CreatesTag() {
        // Given
        String value = "ELIGIBILITY";

        // When
        ParameterTypeTag tag = ParameterTypeTag.of(value);

        // Then
        assertNotNull(tag);
        assertEquals(value, tag.getValue());
    }

    @Test
    void of_ValueWithUnderscoreAndDigits_CreatesTag() {
        // When
        ParameterTypeTag tag = ParameterTypeTag.of("MAX_WEEKLY_HOURS_40");

        // Then
        assertEquals("MAX_WEEKLY_HOURS_40", tag.getValue());
    }

    @Test
    void of_NullValue_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> ParameterTypeTag.of(null)
        );
        assertTrue(exception.getMessage().contains("cannot be null"));
    }

    @Test
    void of_BlankValue_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> ParameterTypeTag.of("   "));
    }

    @Test
    void of_ValueExceeds64Characters_ThrowsException() {
        // Given
        String value = "A".repeat(65);

        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> ParameterTypeTag.of(value)
        );
        assertTrue(exception.getMessage().contains("cannot exceed 64"));
    }

    @Test
    void of_ValueWith64Characters_CreatesTag() {
        // When & Then
        assertDoesNotThrow(() -> ParameterTypeTag.of("A".repeat(64)));
    }

    @Test
    void of_LowercaseValue_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> ParameterTypeTag.of("shift_overlap"));
    }

    @Test
    void of_LeadingDigit_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> ParameterTypeTag.of("1_RULE"));
    }

    @Test
    void of_ValueWithHyphen_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> ParameterTypeTag.of("SHIFT-OVERLAP"));
    }

    @Test
    void equals_SameValue_ReturnsTrue() {
        // Given
        ParameterTypeTag tag1 = ParameterTypeTag.of("SHIFT_OVERLAP");
        ParameterTypeTag tag2 = ParameterTypeTag.of("SHIFT_OVERLAP");

        // When & Then
        assertEquals(tag1, tag2);
        assertEquals(tag1.hashCode(), tag2.hashCode());
    }

    @Test
    void equals_DifferentValue_ReturnsFalse() {
        // When & Then
        assertNotEquals(ParameterTypeTag.of("SHIFT_OVERLAP"), ParameterTypeTag.of("ELIGIBILITY"));
    }

    @Test
    void toString_ContainsValue() {
        // When & Then
        assertEquals("ParameterTypeTag{SHIFT_OVERLAP}", ParameterTypeTag.of("SHIFT_OVERLAP").toString());
    }
}
