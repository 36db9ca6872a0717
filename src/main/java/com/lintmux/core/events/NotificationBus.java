package com.lintmux.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for notifications travelling to the host.
 * <p>
 * Supports per-method subscriptions and global subscriptions that receive every
 * notification. Thread-safe for concurrent publish and subscribe operations.
 */
@Service
public class NotificationBus {

    private static final Logger log = LoggerFactory.getLogger(NotificationBus.class);

    /** Per-method subscribers keyed by wire method. */
    private final ConcurrentHashMap<String, CopyOnWriteArrayList<Consumer<HostNotification>>> methodSubscribers =
            new ConcurrentHashMap<>();

    /** Global subscribers that receive every notification. */
    private final CopyOnWriteArrayList<Consumer<HostNotification>> globalSubscribers =
            new CopyOnWriteArrayList<>();

    /**
     * Publish a notification to all matching subscribers (method-specific first, then global).
     *
     * @param notification the notification to publish
     */
    public void publish(HostNotification notification) {
        log.debug("Publishing host notification {}", notification.method());

        List<Consumer<HostNotification>> methodSubs = methodSubscribers.get(notification.method());
        if (methodSubs != null) {
            for (Consumer<HostNotification> subscriber : methodSubs) {
                deliverSafely(subscriber, notification);
            }
        }

        for (Consumer<HostNotification> subscriber : globalSubscribers) {
            deliverSafely(subscriber, notification);
        }
    }

    /**
     * Subscribe to notifications with a specific wire method.
     *
     * @param method   e.g. {@link HostNotification#PLUGIN_ERROR_METHOD}
     * @param consumer callback invoked for each matching notification
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribe(String method, Consumer<HostNotification> consumer) {
        methodSubscribers.computeIfAbsent(method, k -> new CopyOnWriteArrayList<>()).add(consumer);
        log.debug("Subscribed to host notifications of {}", method);
        return () -> {
            CopyOnWriteArrayList<Consumer<HostNotification>> subs = methodSubscribers.get(method);
            if (subs != null) {
                subs.remove(consumer);
            }
        };
    }

    /**
     * Subscribe to every notification.
     *
     * @param consumer callback invoked for each notification
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<HostNotification> consumer) {
        globalSubscribers.add(consumer);
        log.debug("Subscribed to all host notifications");
        return () -> globalSubscribers.remove(consumer);
    }

    private void deliverSafely(Consumer<HostNotification> subscriber, HostNotification notification) {
        try {
            subscriber.accept(notification);
        } catch (Exception e) {
            log.warn("Subscriber threw exception processing notification {}: {}",
                    notification.method(), e.getMessage(), e);
        }
    }
}
