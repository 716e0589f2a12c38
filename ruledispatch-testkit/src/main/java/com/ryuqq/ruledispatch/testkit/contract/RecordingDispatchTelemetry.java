package com.ryuqq.ruledispatch.testkit.contract;

import com.ryuqq.ruledispatch.core.exception.RuleDispatchException;
import com.ryuqq.ruledispatch.core.model.ParameterTypeTag;
import com.ryuqq.ruledispatch.core.outcome.Failed;
import com.ryuqq.ruledispatch.core.outcome.Outcome;
import com.ryuqq.ruledispatch.core.spi.DispatchTelemetry;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Telemetry sink that keeps every report in memory for assertions.
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public final class RecordingDispatchTelemetry implements DispatchTelemetry {

    private final List<ParameterTypeTag> handlerNotFound = new CopyOnWriteArrayList<>();
    private final List<RuleDispatchException> registryErrors = new CopyOnWriteArrayList<>();
    private final List<Failed> failures = new CopyOnWriteArrayList<>();
    private final AtomicInteger dispatchedCount = new AtomicInteger();

    @Override
    public void onHandlerNotFound(ParameterTypeTag tag) {
        handlerNotFound.add(tag);
    }

    @Override
    public void onRegistryError(RuleDispatchException error) {
        registryErrors.add(error);
    }

    @Override
    public void onHandlerFailure(Failed failure) {
        failures.add(failure);
    }

    @Override
    public void onDispatched(ParameterTypeTag tag, Outcome outcome, long elapsedNanos) {
        dispatchedCount.incrementAndGet();
    }

    public List<ParameterTypeTag> handlerNotFound() {
        return List.copyOf(handlerNotFound);
    }

    public List<RuleDispatchException> registryErrors() {
        return List.copyOf(registryErrors);
    }

    public List<Failed> failures() {
        return List.copyOf(failures);
    }

    public int dispatchedCount() {
        return dispatchedCount.get();
    }

    /**
     * Clears all recorded reports.
     */
    public void clear() {
        handlerNotFound.clear();
        registryErrors.clear();
        failures.clear();
        dispatchedCount.set(0);
    }
}
