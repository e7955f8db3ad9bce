/**
 * Command submission runtime.
 *
 * <p>{@link com.ryuqq.registry.application.runtime.CommandProcessor} is implemented by the
 * runner adapters: a queue-fed single writer thread and an inline caller-thread variant.</p>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.application.runtime;
