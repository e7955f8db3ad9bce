package com.ryuqq.registry.core.spi;

import com.ryuqq.registry.core.event.RegistryEvent;

/**
 * Notification sink for committed registry changes (SPI).
 *
 * <p>Called by the registry after a transaction has been committed, once per event, in the
 * order the events were emitted. Implementations should not throw; a listener failure must
 * not undo a commit.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
@FunctionalInterface
public interface EventPublisher {

    /**
     * Publishes one event.
     *
     * @param event committed change
     * @throws IllegalArgumentException if event is null
     */
    void publish(RegistryEvent event);
}
