package com.crewloop.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for the instance-tagged event stream.
 * <p>
 * Supports per-instance subscriptions and global subscriptions that receive every event.
 * Publishing happens on the caller's thread, which for agent events is the controller's
 * reader thread; subscribers must not block.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    /** Per-instance subscribers keyed by instanceId. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<InstanceEvent>>> instanceSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<InstanceEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish an event to all matching subscribers (instance-specific and global).
     *
     * @param event the event to publish
     */
    public void publish(InstanceEvent event) {
        log.trace("Publishing {} for instance {}", event.eventType(), event.instanceId());

        List<Consumer<InstanceEvent>> subs = instanceSubscribers.get(event.instanceId());
        if (subs != null) {
            for (Consumer<InstanceEvent> subscriber : subs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<InstanceEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a single instance.
     *
     * @param instanceId the instance to follow
     * @param consumer   callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String instanceId, Consumer<InstanceEvent> consumer) {
        instanceSubscribers.computeIfAbsent(instanceId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to instance {}", instanceId);
        return () -> {
            CopyOnWriteArrayList<Consumer<InstanceEvent>> subs = instanceSubscribers.get(instanceId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    instanceSubscribers.remove(instanceId, subs);
                }
            }
        };
    }

    /**
     * Subscribe to events from every instance.
     *
     * @param consumer callback invoked for each event
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<InstanceEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    /**
     * Handle for cancelling a subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<InstanceEvent> subscriber, InstanceEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
