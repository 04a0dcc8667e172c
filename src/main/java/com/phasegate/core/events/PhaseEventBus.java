package com.phasegate.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumSet;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for phase events.
 * <p>
 * Listeners can narrow delivery to one task, to some event types, or both. Delivery is
 * synchronous on the publishing thread, so a listener sees one task's events in commit order.
 * A listener that throws is logged and skipped.
 */
@Service
public class PhaseEventBus {

    private static final Logger log = LoggerFactory.getLogger(PhaseEventBus.class);

    private final CopyOnWriteArrayList<Registration> registrations = new CopyOnWriteArrayList<>();

    public void publish(PhaseEvent event) {
        log.debug("Publishing {} for task {}", event.type().wireName(), event.taskId());
        for (Registration registration : registrations) {
            if (registration.matches(event)) {
                deliverSafely(registration.listener(), event);
            }
        }
    }

    /** Every event of one task. */
    public Subscription subscribe(String taskId, Consumer<PhaseEvent> listener) {
        return register(new Registration(taskId, EnumSet.allOf(PhaseEventType.class), listener));
    }

    /** Every event of every task. */
    public Subscription subscribeAll(Consumer<PhaseEvent> listener) {
        return register(new Registration(null, EnumSet.allOf(PhaseEventType.class), listener));
    }

    /** Events of the given types across all tasks. */
    public Subscription on(Set<PhaseEventType> types, Consumer<PhaseEvent> listener) {
        if (types.isEmpty()) {
            throw new IllegalArgumentException("at least one event type is required");
        }
        return register(new Registration(null, EnumSet.copyOf(types), listener));
    }

    public int listenerCount() {
        return registrations.size();
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private Subscription register(Registration registration) {
        registrations.add(registration);
        log.debug("Registered listener for task {} on {}",
                registration.taskId() != null ? registration.taskId() : "*", registration.types());
        return () -> registrations.remove(registration);
    }

    private void deliverSafely(Consumer<PhaseEvent> listener, PhaseEvent event) {
        try {
            listener.accept(event);
        } catch (Exception e) {
            log.warn("Listener threw processing {} for task {}: {}",
                    event.type().wireName(), event.taskId(), e.getMessage(), e);
        }
    }

    // identity equality so the same listener can be registered twice and removed once
    private static final class Registration {
        private final String taskId;
        private final Set<PhaseEventType> types;
        private final Consumer<PhaseEvent> listener;

        Registration(String taskId, Set<PhaseEventType> types, Consumer<PhaseEvent> listener) {
            this.taskId = taskId;
            this.types = types;
            this.listener = listener;
        }

        String taskId() { return taskId; }
        Set<PhaseEventType> types() { return types; }
        Consumer<PhaseEvent> listener() { return listener; }

        boolean matches(PhaseEvent event) {
            return types.contains(event.type()) && (taskId == null || taskId.equals(event.taskId()));
        }
    }
}
