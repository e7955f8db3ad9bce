/**
 * Registry notification events.
 *
 * <p>{@link com.ryuqq.registry.core.event.RegistryEvent} is a sealed hierarchy of immutable
 * records published through {@link com.ryuqq.registry.core.spi.EventPublisher} after a
 * transaction commits. A rejected command publishes nothing.</p>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.core.event;
