package com.ryuqq.registry.testkit.contract;

import com.ryuqq.registry.core.event.RegistryEvent;
import com.ryuqq.registry.core.spi.EventPublisher;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link EventPublisher} that only records what it receives, in order.
 *
 * <p>Used by the contract suites so the testkit does not depend on a concrete adapter module.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public class RecordingEventPublisher implements EventPublisher {

    private final CopyOnWriteArrayList<RegistryEvent> events = new CopyOnWriteArrayList<>();

    @Override
    public void publish(RegistryEvent event) {
        if (event == null) {
            throw new IllegalArgumentException("event cannot be null");
        }
        events.add(event);
    }

    public List<RegistryEvent> published() {
        return List.copyOf(events);
    }

    public <E extends RegistryEvent> List<E> published(Class<E> type) {
        return events.stream()
            .filter(type::isInstance)
            .map(type::cast)
            .toList();
    }

    public int count() {
        return events.size();
    }

    public void clear() {
        events.clear();
    }
}
