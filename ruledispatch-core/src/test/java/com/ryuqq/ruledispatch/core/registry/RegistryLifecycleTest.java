package com.ryuqq.ruledispatch.core.registry;

import com.ryuqq.ruledispatch.core.exception.RegistryAlreadySealedException;
import org.junit.jupiter.api.Test;

import static com.ryuqq.ruledispatch.core.registry.RegistryState.*;
import static org.junit.jupiter.api.Assertions.*;

/**
 * RegistryLifecycle 테스트.
 *
 * <ul>
 *   <li>BUILDING → SEALED 성공</li>
 *   <li>SEALED → 어떤 상태든 RegistryAlreadySealedException</li>
 *   <li>BUILDING → BUILDING 시도 시 IllegalStateException</li>
 * </ul>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
class RegistryLifecycleTest {

    @Test
    void validate_BuildingToSealed_Succeeds() {
        // When & Then
        assertDoesNotThrow(() -> RegistryLifecycle.validate(BUILDING, SEALED));
    }

    @Test
    void transition_BuildingToSealed_ReturnsSealed() {
        // When
        RegistryState state = RegistryLifecycle.transition(BUILDING, SEALED);

        // Then
        assertEquals(SEALED, state);
        assertFalse(state.acceptsRegistration());
    }

    @Test
    void validate_SealedToSealed_ThrowsAlreadySealed() {
        // When & Then
        assertThrows(RegistryAlreadySealedException.class, () -> RegistryLifecycle.validate(SEALED, SEALED));
    }

    @Test
    void validate_SealedToBuilding_ThrowsAlreadySealed() {
        // When & Then
        assertThrows(RegistryAlreadySealedException.class, () -> RegistryLifecycle.validate(SEALED, BUILDING));
    }

    @Test
    void validate_BuildingToBuilding_ThrowsException() {
        // When & Then
        IllegalStateException exception = assertThrows(
            IllegalStateException.class,
            () -> RegistryLifecycle.validate(BUILDING, BUILDING)
        );
        assertTrue(exception.getMessage().contains("Invalid registry state transition"));
    }

    @Test
    void validate_NullState_ThrowsException() {
        // When & Then
        assertThrows(IllegalArgumentException.class, () -> RegistryLifecycle.validate(null, SEALED));
        assertThrows(IllegalArgumentException.class, () -> RegistryLifecycle.validate(BUILDING, null));
    }
}
