package com.crossreview.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub event bus for review session events.
 * <p>
 * Supports per-session subscriptions and global subscriptions that receive all events.
 * Delivery is synchronous and fire-and-forget: a throwing subscriber is logged and skipped.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<ReviewEvent>>> sessionSubscribers =
            new ConcurrentHashMap<>();

    private final CopyOnWriteArrayList<Consumer<ReviewEvent>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    public void publish(ReviewEvent event) {
        log.debug("Publishing event: {} for session {}", event.eventType(), event.sessionId());

        List<Consumer<ReviewEvent>> sessionSubs = sessionSubscribers.get(event.sessionId());
        if (sessionSubs != null) {
            for (Consumer<ReviewEvent> subscriber : sessionSubs) {
                deliverSafely(subscriber, event);
            }
        }

        for (Consumer<ReviewEvent> subscriber : globalSubscribers) {
            deliverSafely(subscriber, event);
        }
    }

    /**
     * Subscribe to events for a specific session.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String sessionId, Consumer<ReviewEvent> consumer) {
        sessionSubscribers.computeIfAbsent(sessionId, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to session {}", sessionId);
        return () -> {
            CopyOnWriteArrayList<Consumer<ReviewEvent>> subs = sessionSubscribers.get(sessionId);
            if (subs != null) {
                subs.remove(consumer);
                if (subs.isEmpty()) {
                    sessionSubscribers.remove(sessionId, subs);
                }
            }
        };
    }

    /**
     * Subscribe to events from all sessions.
     */
    public Subscription subscribeAll(Consumer<ReviewEvent> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all events (global)");
        return () -> globalSubscribers.remove(consumer);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private void deliverSafely(Consumer<ReviewEvent> subscriber, ReviewEvent event) {
        try {
            subscriber.accept(event);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing event {}: {}",
                    event.eventType(), e.getMessage(), e);
        }
    }
}
