/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the external collaborators the dispatch core talks to.
 * Adapter modules provide concrete implementations.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.ruledispatch.core.spi.RuleConfigurationSource} - Per-rule enablement, consumed by handlers only</li>
 *   <li>{@link com.ryuqq.ruledispatch.core.spi.DispatchTelemetry} - Sink for handler-not-found and other dispatch failures</li>
 * </ul>
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>ruledispatch-adapter-inmemory: InMemoryRuleConfigurationSource</li>
 *   <li>ruledispatch-adapter-runner: Slf4jDispatchTelemetry</li>
 *   <li>{@link com.ryuqq.ruledispatch.core.spi.noop}: NoOp telemetry</li>
 * </ul>
 *
 * @since 1.0.0
 * @author RuleDispatch Team
 */
package com.ryuqq.ruledispatch.core.spi;
