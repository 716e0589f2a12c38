/**
 * Runtime adapter for rule dispatch.
 *
 * <h2>Components</h2>
 * <ul>
 *   <li>{@link com.ryuqq.ruledispatch.adapter.runner.DefaultDispatcher} - Registry lookup, deadline-bounded handler invocation</li>
 *   <li>{@link com.ryuqq.ruledispatch.adapter.runner.SequentialBatchExecutor} - In-order fold with early exit</li>
 *   <li>{@link com.ryuqq.ruledispatch.adapter.runner.Slf4jDispatchTelemetry} - SLF4J telemetry sink</li>
 *   <li>{@link com.ryuqq.ruledispatch.adapter.runner.ConfiguredHandlerTimeoutPolicy} - Per-tag deadlines from {@link com.ryuqq.ruledispatch.adapter.runner.TimeoutConfig}</li>
 * </ul>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
package com.ryuqq.ruledispatch.adapter.runner;
