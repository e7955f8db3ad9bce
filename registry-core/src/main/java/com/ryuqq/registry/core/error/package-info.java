/**
 * Typed registry errors.
 *
 * <p>{@link com.ryuqq.registry.core.error.RegistryException} is unchecked and carries an
 * {@link com.ryuqq.registry.core.error.ErrorKind} plus a stable
 * {@link com.ryuqq.registry.core.error.ReasonCode}. Each kind has one concrete subclass.</p>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.core.error;
