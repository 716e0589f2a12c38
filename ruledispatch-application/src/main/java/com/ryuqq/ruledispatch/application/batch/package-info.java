/**
 * Batch execution port.
 *
 * <ul>
 *   <li>{@link com.ryuqq.ruledispatch.application.batch.BatchExecutor} - Sequential fold with two early-exit conditions</li>
 *   <li>{@link com.ryuqq.ruledispatch.application.batch.BatchResult} - Ordered results plus termination reason</li>
 *   <li>{@link com.ryuqq.ruledispatch.application.batch.BatchTermination} - COMPLETED / BUSINESS_RULE_REJECTION / DISPATCH_FAILURE</li>
 * </ul>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
package com.ryuqq.ruledispatch.application.batch;
