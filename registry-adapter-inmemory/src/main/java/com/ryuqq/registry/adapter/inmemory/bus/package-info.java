/**
 * In-memory EventPublisher adapter implementation package.
 *
 * <p>{@link com.ryuqq.registry.adapter.inmemory.bus.InMemoryEventBus} records published
 * {@link com.ryuqq.registry.core.event.RegistryEvent}s and delivers them to synchronous subscribers.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
package com.ryuqq.registry.adapter.inmemory.bus;
