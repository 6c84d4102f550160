package com.flowcluster.remote;

import com.flowcluster.core.Endpoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Publish/subscribe of endpoint up and down events.
 *
 * <p>Subscriptions and broadcasts are applied in order on one notifier thread.
 * Subscribing blocks until the subscription is registered; a subscriber only receives
 * events published after that point. Broadcasts do not block the publisher.
 *
 * <p>Subscriptions stay until explicitly removed.
 */
public class Notifier {

    private static final Logger logger = LoggerFactory.getLogger(Notifier.class);

    private final ExecutorService executor;
    private volatile Thread notifierThread;

    // Only accessed on the notifier thread
    private final Set<MembershipListener> upListeners = new LinkedHashSet<>();
    private final Set<MembershipListener> downListeners = new LinkedHashSet<>();

    public Notifier(String name) {
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "notifier-" + name);
            t.setDaemon(true);
            notifierThread = t;
            return t;
        });
    }

    public void subscribeUp(MembershipListener listener) {
        apply(() -> upListeners.add(listener));
    }

    public void subscribeDown(MembershipListener listener) {
        apply(() -> downListeners.add(listener));
    }

    public void unsubscribeUp(MembershipListener listener) {
        apply(() -> upListeners.remove(listener));
    }

    public void unsubscribeDown(MembershipListener listener) {
        apply(() -> downListeners.remove(listener));
    }

    public void notifyUp(Endpoint endpoint, Set<String> tags) {
        publish(upListeners, MembershipEvent.up(endpoint, tags));
    }

    public void notifyDown(Endpoint endpoint) {
        publish(downListeners, MembershipEvent.down(endpoint));
    }

    /**
     * Number of up and down subscriptions, counted once per topic.
     */
    public int subscriptionCount() {
        return CompletableFuture.supplyAsync(() -> upListeners.size() + downListeners.size(), executor).join();
    }

    public void stop() {
        executor.shutdown();
    }

    private void apply(Runnable change) {
        // A listener may (un)subscribe while handling an event
        if (Thread.currentThread() == notifierThread) {
            change.run();
            return;
        }
        try {
            CompletableFuture.runAsync(change, executor).join();
        } catch (RejectedExecutionException e) {
            logger.trace("Notifier stopped, ignoring subscription change");
        }
    }

    private void publish(Set<MembershipListener> topic, MembershipEvent event) {
        try {
            executor.execute(() -> {
                logger.debug("Publishing {} {}", event.kind(), event.endpoint());
                List<MembershipListener> listeners = new ArrayList<>(topic);
                for (MembershipListener listener : listeners) {
                    try {
                        listener.onEvent(event);
                    } catch (RuntimeException e) {
                        logger.warn("Listener failed on {} {}", event.kind(), event.endpoint(), e);
                    }
                }
            });
        } catch (RejectedExecutionException e) {
            logger.trace("Notifier stopped, dropping {}", event);
        }
    }
}
