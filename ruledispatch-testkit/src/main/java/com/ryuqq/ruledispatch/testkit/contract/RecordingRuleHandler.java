package com.ryuqq.ruledispatch.testkit.contract;

import com.ryuqq.ruledispatch.core.handler.RuleHandler;
import com.ryuqq.ruledispatch.core.model.RuleParameters;
import com.ryuqq.ruledispatch.core.outcome.Outcome;
import com.ryuqq.ruledispatch.core.outcome.RuleResult;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

/**
 * Call-counting stub handler.
 *
 * <p>Records every invocation and answers with a scripted {@link Outcome}. Thread-safe, so it
 * can be used from timed (executor-backed) dispatch as well.</p>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * RecordingRuleHandler&lt;TestParameters&gt; third = RecordingRuleHandler.passing();
 * registry.register(tag("THIRD"), TestParameters.class, third);
 * // ... run batch ...
 * assertEquals(0, third.callCount(), "third rule must not run after a rejection");
 * </pre>
 *
 * @param <P> parameter type
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public final class RecordingRuleHandler<P extends RuleParameters> implements RuleHandler<P> {

    private final Function<P, Outcome> answer;
    private final List<P> invocations = new CopyOnWriteArrayList<>();

    /**
     * Creates a handler with a custom answer.
     *
     * @param answer function producing the outcome for each call
     */
    public RecordingRuleHandler(Function<P, Outcome> answer) {
        if (answer == null) {
            throw new IllegalArgumentException("answer cannot be null");
        }
        this.answer = answer;
    }

    /**
     * Handler that always produces a successful result whose message is the parameter's string form.
     */
    public static <P extends RuleParameters> RecordingRuleHandler<P> passing() {
        return new RecordingRuleHandler<>(params -> Outcome.produced(RuleResult.passed(params.toString())));
    }

    /**
     * Handler that always produces a business rule rejection.
     */
    public static <P extends RuleParameters> RecordingRuleHandler<P> rejecting(int errorCode, String message) {
        return new RecordingRuleHandler<>(params -> Outcome.produced(RuleResult.rejected(errorCode, message)));
    }

    /**
     * Handler that always returns Empty.
     */
    public static <P extends RuleParameters> RecordingRuleHandler<P> empty() {
        return new RecordingRuleHandler<>(params -> Outcome.empty());
    }

    /**
     * Handler that always returns the given outcome.
     */
    public static <P extends RuleParameters> RecordingRuleHandler<P> returning(Outcome outcome) {
        return new RecordingRuleHandler<>(params -> outcome);
    }

    /**
     * Handler that always throws the given exception.
     */
    public static <P extends RuleParameters> RecordingRuleHandler<P> throwing(RuntimeException exception) {
        return new RecordingRuleHandler<>(params -> {
            throw exception;
        });
    }

    /**
     * Handler that sleeps before answering, for deadline tests.
     *
     * <p>Interruption ends the sleep early and the handler answers Empty.</p>
     */
    public static <P extends RuleParameters> RecordingRuleHandler<P> sleeping(long millis, Outcome outcome) {
        return new RecordingRuleHandler<>(params -> {
            try {
                Thread.sleep(millis);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return Outcome.empty();
            }
            return outcome;
        });
    }

    @Override
    public Outcome handle(P params) {
        invocations.add(params);
        return answer.apply(params);
    }

    /**
     * Number of times the handler was invoked.
     */
    public int callCount() {
        return invocations.size();
    }

    /**
     * Parameters received, in call order.
     */
    public List<P> invocations() {
        return List.copyOf(invocations);
    }

    /**
     * Forgets all recorded invocations.
     */
    public void reset() {
        invocations.clear();
    }
}
