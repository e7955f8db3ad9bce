/**
 * Command runner adapters.
 *
 * <p>Implementations of {@link com.ryuqq.registry.application.runtime.CommandProcessor}:</p>
 * <ul>
 *   <li>{@link com.ryuqq.registry.adapter.runner.SingleWriterRunner} - Queue-fed single worker thread, FIFO</li>
 *   <li>{@link com.ryuqq.registry.adapter.runner.InlineRunner} - Synchronous execution on the caller thread</li>
 * </ul>
 *
 * <p>Both delegate to {@link com.ryuqq.registry.application.dispatch.CommandDispatcher}, so registry errors
 * reach callers as {@link com.ryuqq.registry.core.outcome.Fail} outcomes with stable reason codes.</p>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.adapter.runner;
