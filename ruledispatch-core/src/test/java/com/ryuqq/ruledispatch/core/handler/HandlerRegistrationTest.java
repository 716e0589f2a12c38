package com.ryuqq.ruledispatch.core.handler;

import com.ryuqq.ruledispatch.core.exception.ParameterTypeMismatchException;
import com.ryuqq.ruledispatch.core.model.ParameterTypeTag;
import com.ryuqq.ruledispatch.core.model.RuleParameters;
import com.ryuqq.ruledispatch.core.outcome.Outcome;
import com.ryuqq.ruledispatch.core.outcome.Produced;
import com.ryuqq.ruledispatch.core.outcome.RuleResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * HandlerRegistration Record 테스트.
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
class HandlerRegistrationTest {

    private static final ParameterTypeTag TAG = ParameterTypeTag.of("CANDIDATE_ELIGIBILITY");

    private record EligibilityParameters(String candidateId) implements RuleParameters {
        @Override
        public ParameterTypeTag tag() {
            return TAG;
        }
    }

    private record ImpostorParameters(String candidateId) implements RuleParameters {
        @Override
        public ParameterTypeTag tag() {
            return TAG;
        }
    }

    @Test
    void invoke_MatchingType_PassesNarrowedParameters() {
        // Given
        HandlerRegistration<EligibilityParameters> registration = HandlerRegistration.of(
            TAG, EligibilityParameters.class,
            params -> Outcome.produced(RuleResult.passed(params.candidateId()))
        );

        // When
        Outcome outcome = registration.invoke(new EligibilityParameters("C-42"));

        // Then
        assertTrue(outcome instanceof Produced);
        assertEquals("C-42", ((Produced) outcome).result().message());
    }

    @Test
    void invoke_DifferentTypeWithSameTag_ThrowsMismatch() {
        // Given
        HandlerRegistration<EligibilityParameters> registration =
            HandlerRegistration.of(TAG, EligibilityParameters.class, params -> Outcome.empty());

        // When & Then
        ParameterTypeMismatchException exception = assertThrows(
            ParameterTypeMismatchException.class,
            () -> registration.invoke(new ImpostorParameters("C-42"))
        );
        assertEquals(TAG, exception.getTag());
        assertTrue(exception.getMessage().contains(ImpostorParameters.class.getName()));
    }

    @Test
    void constructor_NullFields_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class,
            () -> HandlerRegistration.of(null, EligibilityParameters.class, params -> Outcome.empty()));
        assertThrows(IllegalArgumentException.class,
            () -> HandlerRegistration.<EligibilityParameters>of(TAG, null, params -> Outcome.empty()));
        assertThrows(IllegalArgumentException.class,
            () -> HandlerRegistration.of(TAG, EligibilityParameters.class, null));
    }
}
