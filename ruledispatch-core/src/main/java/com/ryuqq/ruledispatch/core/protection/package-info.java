/**
 * Protection SPI for handler invocation.
 *
 * <ul>
 *   <li>{@link com.ryuqq.ruledispatch.core.protection.HandlerTimeoutPolicy} - Per-tag handler deadline</li>
 *   <li>{@link com.ryuqq.ruledispatch.core.protection.noop.NoOpHandlerTimeoutPolicy} - No deadline, synchronous invocation</li>
 * </ul>
 *
 * @since 1.0.0
 * @author RuleDispatch Team
 */
package com.ryuqq.ruledispatch.core.protection;
