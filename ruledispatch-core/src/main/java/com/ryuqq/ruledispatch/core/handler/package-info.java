/**
 * Handler contract and registration pairing.
 *
 * <ul>
 *   <li>{@link com.ryuqq.ruledispatch.core.handler.RuleHandler} - Function from one parameter variant to an Outcome</li>
 *   <li>{@link com.ryuqq.ruledispatch.core.handler.HandlerRegistration} - Immutable (tag, type, handler) triple</li>
 *   <li>{@link com.ryuqq.ruledispatch.core.handler.EnforcementGuard} - Returns Empty for rules not enforced in a scope</li>
 * </ul>
 *
 * @since 1.0.0
 * @author RuleDispatch Team
 */
package com.ryuqq.ruledispatch.core.handler;
