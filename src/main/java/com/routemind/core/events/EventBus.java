package com.routemind.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-process fan-out of {@link RoutemindEvent}s.
 * <p>
 * A listener either follows one workflow or sees everything, backend status changes included.
 * Delivery happens on the publishing thread, so listeners must not block.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final CopyOnWriteArrayList<Listener> listeners = new CopyOnWriteArrayList<>();

    public void publish(RoutemindEvent event) {
        log.debug("Event {} (workflow={}, task={})", event.eventType(), event.workflowId(), event.taskId());
        for (Listener listener : listeners) {
            if (listener.accepts(event)) {
                listener.deliver(event);
            }
        }
    }

    /**
     * Follows the events of one workflow.
     *
     * @return a {@link Subscription} handle to stop delivery
     */
    public Subscription subscribe(String workflowId, Consumer<RoutemindEvent> consumer) {
        if (workflowId == null) {
            throw new IllegalArgumentException("workflowId must not be null; use subscribeAll");
        }
        return register(new Listener(workflowId, consumer));
    }

    public Subscription subscribeAll(Consumer<RoutemindEvent> consumer) {
        return register(new Listener(null, consumer));
    }

    public int listenerCount() {
        return listeners.size();
    }

    private Subscription register(Listener listener) {
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    /** Identity-compared so that one consumer registered twice unsubscribes once per handle. */
    private static final class Listener {
        private final String workflowId;
        private final Consumer<RoutemindEvent> consumer;

        Listener(String workflowId, Consumer<RoutemindEvent> consumer) {
            this.workflowId = workflowId;
            this.consumer = consumer;
        }

        boolean accepts(RoutemindEvent event) {
            return workflowId == null || workflowId.equals(event.workflowId());
        }

        void deliver(RoutemindEvent event) {
            try {
                consumer.accept(event);
            } catch (RuntimeException e) {
                log.warn("Listener failed on {} for workflow {}: {}",
                        event.eventType(), event.workflowId(), e.getMessage(), e);
            }
        }
    }
}
