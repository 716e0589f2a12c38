package com.ryuqq.ruledispatch.testkit.contract;

import com.ryuqq.ruledispatch.core.model.ParameterTypeTag;
import com.ryuqq.ruledispatch.core.model.RuleParameters;

/**
 * General-purpose rule parameters for contract tests.
 *
 * <p>The tag is a constructor argument so a single record can stand in for any number of
 * parameter variants. {@code id} distinguishes instances in recorded invocations.</p>
 *
 * @param tag parameter type tag
 * @param id instance identifier (e.g., "p1")
 * @param scope optional scope used by enforcement tests (may be null)
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public record TestParameters(ParameterTypeTag tag, String id, String scope) implements RuleParameters {

    /**
     * Compact constructor.
     *
     * @throws IllegalArgumentException if tag or id is null
     */
    public TestParameters {
        if (tag == null) {
            throw new IllegalArgumentException("tag cannot be null");
        }
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id cannot be null or blank");
        }
    }

    /**
     * Creates parameters without a scope.
     *
     * @param tag tag value (e.g., "SHIFT_OVERLAP")
     * @param id instance identifier
     * @return parameters instance
     */
    public static TestParameters of(String tag, String id) {
        return new TestParameters(ParameterTypeTag.of(tag), id, null);
    }

    /**
     * Creates parameters with a scope.
     *
     * @param tag tag value
     * @param id instance identifier
     * @param scope scope identifier
     * @return parameters instance
     */
    public static TestParameters scoped(String tag, String id, String scope) {
        return new TestParameters(ParameterTypeTag.of(tag), id, scope);
    }
}
