package com.ryuqq.ruledispatch.testkit.contract;

import com.ryuqq.ruledispatch.core.model.ParameterTypeTag;
import com.ryuqq.ruledispatch.core.model.RuleParameters;

/**
 * A second parameter type that can claim any tag.
 *
 * <p>Used to reproduce two parameter types sharing a tag, which the dispatcher must report as
 * a type mismatch instead of handing the wrong object to a handler.</p>
 *
 * @param tag parameter type tag
 * @param id instance identifier
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public record ForeignTestParameters(ParameterTypeTag tag, String id) implements RuleParameters {

    /**
     * Creates foreign parameters.
     *
     * @param tag tag value
     * @param id instance identifier
     * @return parameters instance
     */
    public static ForeignTestParameters of(String tag, String id) {
        return new ForeignTestParameters(ParameterTypeTag.of(tag), id);
    }
}
