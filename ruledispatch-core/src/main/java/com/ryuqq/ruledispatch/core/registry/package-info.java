/**
 * Handler Registry - type-indexed handler table with a two-phase lifecycle.
 *
 * <h2>Core Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.ruledispatch.core.registry.HandlerRegistry} - Read-side contract (resolve, contains, state)</li>
 *   <li>{@link com.ryuqq.ruledispatch.core.registry.DefaultHandlerRegistry} - Explicit registration, sealed into an immutable map</li>
 *   <li>{@link com.ryuqq.ruledispatch.core.registry.RegistryState} - BUILDING / SEALED</li>
 *   <li>{@link com.ryuqq.ruledispatch.core.registry.RegistryLifecycle} - Transition validation</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>One handler per tag:</strong> Duplicate registration fails at startup</li>
 *   <li><strong>Ahead-of-time coverage:</strong> seal(requiredTags) reports every missing handler before the first request</li>
 *   <li><strong>No runtime scanning:</strong> Registrations are explicit calls</li>
 *   <li><strong>Read-only after seal:</strong> Lock-free O(1) resolve</li>
 * </ul>
 *
 * @since 1.0.0
 * @author RuleDispatch Team
 */
package com.ryuqq.ruledispatch.core.registry;
