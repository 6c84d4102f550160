package com.flowcluster.remote;

/**
 * Receives membership events from a {@link Notifier}.
 *
 * <p>Called on the notifier thread; implementations should return quickly.
 */
@FunctionalInterface
public interface MembershipListener {

    void onEvent(MembershipEvent event);
}
