package com.flowcluster.rpc;

/**
 * Handle to a long-lived subscription on a remote runtime.
 *
 * <p>Returned for liveness monitors and membership watches. Cancelling is idempotent;
 * after {@link #cancel()} returns, no further callbacks are delivered for this
 * subscription.
 */
@FunctionalInterface
public interface RemoteSubscription {

    void cancel();
}
