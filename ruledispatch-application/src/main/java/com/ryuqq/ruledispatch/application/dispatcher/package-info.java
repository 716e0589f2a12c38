/**
 * Dispatcher port.
 *
 * <ul>
 *   <li>{@link com.ryuqq.ruledispatch.application.dispatcher.Dispatcher} - Resolves and invokes the handler for one parameter object</li>
 * </ul>
 *
 * <p>The runtime implementation lives in ruledispatch-adapter-runner.</p>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
package com.ryuqq.ruledispatch.application.dispatcher;
