/**
 * Error taxonomy of the dispatch core.
 *
 * <ul>
 *   <li>Setup-time (fatal): {@link com.ryuqq.ruledispatch.core.exception.DuplicateRegistrationException},
 *       {@link com.ryuqq.ruledispatch.core.exception.RegistryAlreadySealedException},
 *       {@link com.ryuqq.ruledispatch.core.exception.MissingRegistrationException}</li>
 *   <li>Dispatch-time configuration defects: {@link com.ryuqq.ruledispatch.core.exception.HandlerNotFoundException},
 *       {@link com.ryuqq.ruledispatch.core.exception.ParameterTypeMismatchException}</li>
 *   <li>Lifecycle misuse: {@link com.ryuqq.ruledispatch.core.exception.RegistryNotSealedException}</li>
 * </ul>
 *
 * <p>Business-rule rejections are not exceptions; they travel as
 * {@link com.ryuqq.ruledispatch.core.outcome.Produced} outcomes.</p>
 *
 * @since 1.0.0
 * @author RuleDispatch Team
 */
package com.ryuqq.ruledispatch.core.exception;
