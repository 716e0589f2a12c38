/**
 * Core model package containing the parameter discriminator and the parameter contract.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.ruledispatch.core.model.ParameterTypeTag} - Discriminator identifying a parameter variant</li>
 * </ul>
 *
 * <h2>Contracts</h2>
 * <ul>
 *   <li>{@link com.ryuqq.ruledispatch.core.model.RuleParameters} - Parameters passed to exactly one handler</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> Tags and parameter variants are immutable</li>
 *   <li><strong>Explicit construction:</strong> Parameter variants are built by their callers, never reflectively</li>
 *   <li><strong>Pure Java:</strong> No external dependencies</li>
 * </ul>
 *
 * @since 1.0.0
 * @author RuleDispatch Team
 */
package com.ryuqq.ruledispatch.core.model;
