package com.auctionhouse.engine.event;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Event bus for marketplace observers.
 * Delivery is synchronous and in emission order; handler failures are logged
 * and never reach the emitting operation.
 */
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<MarketplaceEventType, CopyOnWriteArrayList<Subscription>> subscriptions;
    private final Map<String, Subscription> subscriptionById;

    public EventBus() {
        this.subscriptions = new ConcurrentHashMap<>();
        this.subscriptionById = new ConcurrentHashMap<>();
    }

    /**
     * Emits an event to all subscribers of its type, then to wildcard subscribers.
     *
     * @param event Event to emit
     */
    public void emit(MarketplaceEvent event) {
        if (event == null) {
            return;
        }
        deliver(subscriptions.get(event.eventType()), event);
        deliver(subscriptions.get(MarketplaceEventType.ALL), event);
    }

    private void deliver(CopyOnWriteArrayList<Subscription> subs, MarketplaceEvent event) {
        if (subs == null) {
            return;
        }
        for (Subscription sub : subs) {
            try {
                sub.handler().accept(event);
            } catch (RuntimeException e) {
                log.warn("Event handler {} failed on {} for listing {}",
                        sub.id(), event.eventType(), event.listingId(), e);
            }
        }
    }

    /**
     * Subscribes to events of a specific type.
     *
     * @param eventType Type of events to subscribe to, or {@link MarketplaceEventType#ALL}
     * @param handler Handler to invoke
     * @return Subscription ID
     */
    public String subscribe(MarketplaceEventType eventType, Consumer<MarketplaceEvent> handler) {
        String subscriptionId = UUID.randomUUID().toString();
        Subscription subscription = new Subscription(subscriptionId, eventType, handler);

        subscriptions.computeIfAbsent(eventType, k -> new CopyOnWriteArrayList<>()).add(subscription);
        subscriptionById.put(subscriptionId, subscription);

        return subscriptionId;
    }

    public void unsubscribe(String subscriptionId) {
        Subscription subscription = subscriptionById.remove(subscriptionId);
        if (subscription != null) {
            CopyOnWriteArrayList<Subscription> subs = subscriptions.get(subscription.eventType());
            if (subs != null) {
                subs.remove(subscription);
            }
        }
    }

    public int getSubscriberCount(MarketplaceEventType eventType) {
        CopyOnWriteArrayList<Subscription> subs = subscriptions.get(eventType);
        return subs != null ? subs.size() : 0;
    }

    private record Subscription(
            String id,
            MarketplaceEventType eventType,
            Consumer<MarketplaceEvent> handler
    ) {}
}
