package com.ryuqq.ruledispatch.core.outcome;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * RuleResult Record 테스트.
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
class RuleResultTest {

    @Test
    void passed_NoMessage_CreatesSuccess() {
        // When
        RuleResult result = RuleResult.passed();

        // Then
        assertTrue(result.success());
        assertNull(result.message());
        assertEquals(0, result.errorCode());
        assertNull(result.failureReason());
        assertFalse(result.isBusinessRuleRejection());
    }

    @Test
    void rejected_CreatesBusinessRuleRejection() {
        // When
        RuleResult result = RuleResult.rejected(4001, "Candidate exceeds weekly hour limit");

        // Then
        assertFalse(result.success());
        assertEquals(4001, result.errorCode());
        assertEquals(FailureReason.BUSINESS_RULE, result.failureReason());
        assertTrue(result.isBusinessRuleRejection());
    }

    @Test
    void failed_ValidationReason_IsNotBusinessRuleRejection() {
        // When
        RuleResult result = RuleResult.failed(4220, "Shift end precedes start", FailureReason.VALIDATION);

        // Then
        assertFalse(result.success());
        assertFalse(result.isBusinessRuleRejection());
    }

    @Test
    void constructor_SuccessWithErrorCode_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new RuleResult(true, "ok", 12, null)
        );
        assertTrue(exception.getMessage().contains("errorCode must be 0"));
    }

    @Test
    void constructor_SuccessWithFailureReason_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> new RuleResult(true, "ok", 0, FailureReason.BUSINESS_RULE));
    }

    @Test
    void constructor_FailureWithoutReason_ThrowsException() {
        // When & Then
        IllegalArgumentException exception = assertThrows(
            IllegalArgumentException.class,
            () -> new RuleResult(false, "denied", 1, null)
        );
        assertTrue(exception.getMessage().contains("failureReason cannot be null"));
    }

    @Test
    void rejected_BlankMessage_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> RuleResult.rejected(1, "  "));
    }

    @Test
    void equals_SameValues_ReturnsTrue() {
        // When & Then
        assertEquals(RuleResult.rejected(1, "denied"), RuleResult.rejected(1, "denied"));
        assertNotEquals(RuleResult.rejected(1, "denied"), RuleResult.rejected(2, "denied"));
    }
}
