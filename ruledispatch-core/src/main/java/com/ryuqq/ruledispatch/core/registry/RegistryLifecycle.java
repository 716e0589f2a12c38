package com.ryuqq.ruledispatch.core.registry;

import com.ryuqq.ruledispatch.core.exception.RegistryAlreadySealedException;

/**
 * 레지스트리 상태 전이 검증 및 실행.
 *
 * <p><strong>허용되는 전이:</strong> BUILDING → SEALED</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>SEALED에서는 어떤 상태로도 전이 불가</li>
 *   <li>같은 상태로의 전이 불가</li>
 * </ul>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public final class RegistryLifecycle {

    // Utility class - prevent instantiation
    private RegistryLifecycle() {
        throw new UnsupportedOperationException("Utility class cannot be instantiated");
    }

    /**
     * 상태 전이가 유효한지 검증.
     *
     * @param from 현재 상태
     * @param to 전이할 상태
     * @throws IllegalArgumentException from 또는 to가 null인 경우
     * @throws RegistryAlreadySealedException from이 SEALED인 경우
     * @throws IllegalStateException 그 밖의 유효하지 않은 전이인 경우
     */
    public static void validate(RegistryState from, RegistryState to) {
        if (from == null || to == null) {
            throw new IllegalArgumentException("States cannot be null (from: " + from + ", to: " + to + ")");
        }

        // 봉인 후에는 어디로도 전이 불가
        if (from == RegistryState.SEALED) {
            throw new RegistryAlreadySealedException();
        }

        if (to != RegistryState.SEALED) {
            throw new IllegalStateException(
                String.format("Invalid registry state transition: %s → %s", from, to)
            );
        }
    }

    /**
     * 상태 전이 실행 (검증 후).
     *
     * @param current 현재 상태
     * @param next 다음 상태
     * @return 전이된 상태 (next)
     * @throws IllegalArgumentException current 또는 next가 null인 경우
     * @throws RegistryAlreadySealedException current가 SEALED인 경우
     * @throws IllegalStateException 유효하지 않은 전이인 경우
     */
    public static RegistryState transition(RegistryState current, RegistryState next) {
        validate(current, next);
        return next;
    }
}
