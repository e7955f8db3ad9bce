package com.ryuqq.registry.adapter.inmemory.bus;

import com.ryuqq.registry.core.event.RegistryEvent;
import com.ryuqq.registry.core.spi.EventPublisher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory implementation of {@link EventPublisher} SPI for testing and reference purposes.
 *
 * <p>Keeps every published event in publication order and fans each one out to the registered
 * subscribers synchronously, on the publishing thread.</p>
 *
 * <p><strong>Features:</strong></p>
 * <ul>
 *   <li>Publication history ({@link #published()}, {@link #published(Class)})</li>
 *   <li>Synchronous subscribers ({@link #subscribe(Consumer)})</li>
 *   <li>A failing subscriber is logged and skipped; delivery to the others continues</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * InMemoryEventBus bus = new InMemoryEventBus();
 * bus.subscribe(event -&gt; log.info("event: {}", event));
 *
 * Registry registry = new LedgerRegistry(new InMemoryRegistryStore(), bus);
 * registry.registerPrincipal(alice, "Alice", Role.INDIVIDUAL, aliceEntity, aliceWallet);
 *
 * List&lt;RegistryEvent.PrincipalRegistered&gt; events = bus.published(RegistryEvent.PrincipalRegistered.class);
 * </pre>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public class InMemoryEventBus implements EventPublisher {

    private static final Logger log = LoggerFactory.getLogger(InMemoryEventBus.class);

    private final CopyOnWriteArrayList<RegistryEvent> history = new CopyOnWriteArrayList<>();
    private final CopyOnWriteArrayList<Consumer<RegistryEvent>> subscribers = new CopyOnWriteArrayList<>();

    @Override
    public void publish(RegistryEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        history.add(event);
        for (Consumer<RegistryEvent> subscriber : subscribers) {
            try {
                subscriber.accept(event);
            } catch (RuntimeException e) {
                log.warn("Subscriber failed on {}: {}", event.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    /**
     * Registers a synchronous subscriber.
     *
     * @param subscriber event consumer
     * @throws IllegalArgumentException if subscriber is null
     */
    public void subscribe(Consumer<RegistryEvent> subscriber) {
        if (subscriber == null) {
            throw new IllegalArgumentException("subscriber cannot be null");
        }
        subscribers.add(subscriber);
    }

    /**
     * Snapshot of every published event, in publication order.
     *
     * @return published events
     */
    public List<RegistryEvent> published() {
        return List.copyOf(history);
    }

    /**
     * Published events of one type, in publication order.
     *
     * @param type event record type
     * @param <E> event type
     * @return matching events
     */
    public <E extends RegistryEvent> List<E> published(Class<E> type) {
        return history.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .toList();
    }

    /**
     * Clears the history. Subscribers stay registered.
     */
    public void clear() {
        history.clear();
    }
}
