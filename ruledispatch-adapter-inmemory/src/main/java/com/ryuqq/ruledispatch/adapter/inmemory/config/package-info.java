/**
 * In-memory rule configuration adapter.
 *
 * <p>Provides {@link com.ryuqq.ruledispatch.adapter.inmemory.config.InMemoryRuleConfigurationSource},
 * a thread-safe implementation of the {@link com.ryuqq.ruledispatch.core.spi.RuleConfigurationSource} SPI
 * suitable for tests and single-process deployments.</p>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
package com.ryuqq.ruledispatch.adapter.inmemory.config;
