/**
 * Rule dispatch outcome package.
 *
 * <p>This package defines the closed result model of a single rule invocation.
 * Consumers branch on the concrete record instead of downcasting mixed result lists.</p>
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.ruledispatch.core.outcome.Outcome} - Sealed interface (permits Produced, Empty, Failed)</li>
 * </ul>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.ruledispatch.core.outcome.Produced} - Rule produced a {@link com.ryuqq.ruledispatch.core.outcome.RuleResult}</li>
 *   <li>{@link com.ryuqq.ruledispatch.core.outcome.Empty} - Rule ran and opted out (pass)</li>
 *   <li>{@link com.ryuqq.ruledispatch.core.outcome.Failed} - Infrastructure or registry failure</li>
 * </ul>
 *
 * <h2>Business Rejection vs. Failure</h2>
 * <ul>
 *   <li><strong>Rejection:</strong> Produced with success=false and {@link com.ryuqq.ruledispatch.core.outcome.FailureReason#BUSINESS_RULE}; actionable by the user</li>
 *   <li><strong>Failure:</strong> Failed with a {@link com.ryuqq.ruledispatch.core.outcome.FailureKind}; actionable by the operator</li>
 * </ul>
 *
 * @since 1.0.0
 * @author RuleDispatch Team
 */
package com.ryuqq.ruledispatch.core.outcome;
