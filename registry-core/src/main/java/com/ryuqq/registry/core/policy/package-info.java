/**
 * Authorization policy layer.
 *
 * <p>{@link com.ryuqq.registry.core.policy.AuthorizationPolicy} holds the stateless guards every
 * mutating operation evaluates before staging a write. Guards read committed state through
 * {@link com.ryuqq.registry.core.spi.RegistryReader}, apply no side effects and short-circuit
 * on the first violation.</p>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.core.policy;
