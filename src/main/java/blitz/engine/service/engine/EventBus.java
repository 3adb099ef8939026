package blitz.engine.service.engine;

import lombok.extern.slf4j.Slf4j;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fans every published event out to all current subscribers.
 * <p>
 * Delivery is lossy: each subscription buffers at most {@code capacity} events and
 * a subscriber that falls behind loses its oldest events. {@link #publish} never
 * blocks, and publishing without subscribers does nothing. A subscriber only sees
 * events published after it subscribed.
 */
@Slf4j
public class EventBus<E> {
    private final int capacity;
    private final Set<Subscription<E>> subscriptions = ConcurrentHashMap.newKeySet();
    private final AtomicLong droppedEvents = new AtomicLong();

    public EventBus(int capacity) {
        if (capacity < 1) {
            throw new IllegalArgumentException("Event bus capacity must be positive: " + capacity);
        }
        this.capacity = capacity;
    }

    public void publish(E event) {
        for (Subscription<E> subscription : subscriptions) {
            subscription.offer(event);
        }
    }

    public Subscription<E> subscribe() {
        Subscription<E> subscription = new Subscription<>(this, capacity);
        subscriptions.add(subscription);
        log.debug("Subscriber added. Total subscribers: {}", subscriptions.size());
        return subscription;
    }

    void unsubscribe(Subscription<E> subscription) {
        if (subscriptions.remove(subscription)) {
            log.debug("Subscriber removed. Total subscribers: {}", subscriptions.size());
        }
    }

    void recordDrop() {
        droppedEvents.incrementAndGet();
    }

    public int getSubscriberCount() {
        return subscriptions.size();
    }

    /**
     * Total number of events lost by slow subscribers since the bus was created.
     */
    public long getDroppedEventCount() {
        return droppedEvents.get();
    }
}
