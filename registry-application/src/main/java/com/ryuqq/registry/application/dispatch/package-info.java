/**
 * Command dispatch package.
 *
 * <p>{@link com.ryuqq.registry.application.dispatch.CommandDispatcher} routes each
 * {@link com.ryuqq.registry.core.contract.Command} record to the matching
 * {@link com.ryuqq.registry.application.registry.Registry} operation and maps typed errors to
 * {@link com.ryuqq.registry.core.outcome.Fail} outcomes with stable reason codes.</p>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.application.dispatch;
