package com.ryuqq.ruledispatch.testkit.contract;

import com.ryuqq.ruledispatch.application.batch.BatchExecutor;
import com.ryuqq.ruledispatch.application.batch.BatchResult;
import com.ryuqq.ruledispatch.application.batch.BatchTermination;
import com.ryuqq.ruledispatch.core.handler.EnforcementGuard;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Contract Test: rule enablement through the configuration source.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Disabled rule answers Empty, so its rejection never stops the batch</li>
 *   <li>Scope-specific enablement overrides the global flag</li>
 * </ul>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
class EnforcementContractTest extends AbstractDispatchContractTest {

    @Test
    void testRunAll_DisabledRule_TreatedAsPass() {
        // Given
        RecordingRuleHandler<TestParameters> veto = RecordingRuleHandler.rejecting(4001, "Weekly hour limit exceeded");
        register("WEEKLY_HOURS", new EnforcementGuard<>(configurationSource, TestParameters::scope, veto));
        register("SHIFT_OVERLAP", RecordingRuleHandler.passing());
        configurationSource.disable(tag("WEEKLY_HOURS"));
        BatchExecutor executor = sealAndCreateBatchExecutor();

        // When
        BatchResult result = executor.runAll(List.of(
                params("WEEKLY_HOURS", "w1"),
                params("SHIFT_OVERLAP", "s1")));

        // Then
        assertTermination(result, BatchTermination.COMPLETED);
        assertResultIds(result, "s1");
        assertEquals(0, veto.callCount(), "Disabled rule must not reach its handler");
    }

    @Test
    void testRunAll_EnabledForScopeOnly_RejectsInThatScope() {
        // Given
        RecordingRuleHandler<TestParameters> veto = RecordingRuleHandler.rejecting(4001, "Weekly hour limit exceeded");
        register("WEEKLY_HOURS", new EnforcementGuard<>(configurationSource, TestParameters::scope, veto));
        configurationSource.disable(tag("WEEKLY_HOURS"));
        configurationSource.enable(tag("WEEKLY_HOURS"), "LOCATION_7");
        BatchExecutor executor = sealAndCreateBatchExecutor();

        // When
        BatchResult elsewhere = executor.runAll(List.of(TestParameters.scoped("WEEKLY_HOURS", "a", "LOCATION_1")));
        BatchResult enforced = executor.runAll(List.of(TestParameters.scoped("WEEKLY_HOURS", "b", "LOCATION_7")));

        // Then
        assertTermination(elsewhere, BatchTermination.COMPLETED);
        assertTrue(elsewhere.results().isEmpty());
        assertTermination(enforced, BatchTermination.BUSINESS_RULE_REJECTION);
        assertEquals(1, veto.callCount());
    }
}
