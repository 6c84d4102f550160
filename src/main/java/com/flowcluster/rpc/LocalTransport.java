package com.flowcluster.rpc;

import com.flowcluster.core.Endpoint;
import com.flowcluster.core.RemoteUnreachableException;
import com.flowcluster.rpc.proto.DispatchRequest;
import com.flowcluster.rpc.proto.DispatchResponse;
import com.flowcluster.rpc.proto.MembershipEventMessage;
import com.flowcluster.rpc.proto.MembershipRequest;
import com.flowcluster.rpc.proto.MembershipResponse;
import com.flowcluster.rpc.proto.ProbeRequest;
import com.flowcluster.rpc.proto.ProbeResponse;
import com.flowcluster.rpc.proto.TagsRequest;
import com.flowcluster.rpc.proto.TagsResponse;
import com.flowcluster.rpc.proto.WatchRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * In-memory transport for local testing.
 * All runtimes share a static registry to find each other.
 *
 * Shutting a transport down plays the role of a process exit: every monitor
 * installed on its endpoint fires and every membership watch it opened is closed.
 */
public class LocalTransport implements RpcTransport {

    private static final Logger logger = LoggerFactory.getLogger(LocalTransport.class);

    // Shared registry of all runtimes in the local cluster
    private static final Map<Endpoint, RpcHandler> REGISTRY = new ConcurrentHashMap<>();

    // Monitors installed on each endpoint
    private static final Map<Endpoint, Set<LocalMonitor>> MONITORS = new ConcurrentHashMap<>();

    // Membership watches opened by each endpoint, cancelled when it goes away
    private static final Map<Endpoint, Set<RemoteSubscription>> WATCHES = new ConcurrentHashMap<>();

    private final Endpoint self;
    private final ExecutorService executor;

    public LocalTransport(Endpoint self) {
        this.self = self;
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "local-rpc-" + self);
            t.setDaemon(true);
            return t;
        });
    }

    @Override
    public Endpoint getSelf() {
        return self;
    }

    @Override
    public void start(RpcHandler handler) {
        REGISTRY.put(self, handler);
        logger.info("LocalTransport started for {}", self);
    }

    @Override
    public void shutdown() {
        if (REGISTRY.remove(self) != null) {
            fireMonitors(self);
        }
        cancelWatches(self);
        executor.shutdown();
        logger.info("LocalTransport shutdown for {}", self);
    }

    @Override
    public CompletableFuture<ProbeResponse> sendProbe(Endpoint target, ProbeRequest request) {
        return call(target, "Probe", handler -> handler.handleProbe(request));
    }

    @Override
    public CompletableFuture<DispatchResponse> sendDispatch(Endpoint target, DispatchRequest request) {
        return call(target, "Dispatch(" + request.getOp() + ", " + request.getRole() + ")",
                handler -> handler.handleDispatch(request));
    }

    @Override
    public CompletableFuture<TagsResponse> sendTagsRequest(Endpoint target, TagsRequest request) {
        return call(target, "Tags", handler -> handler.handleTags(request));
    }

    @Override
    public CompletableFuture<MembershipResponse> sendMembershipRequest(Endpoint target, MembershipRequest request) {
        return call(target, "Membership", handler -> handler.handleMembership(request));
    }

    private <T> CompletableFuture<T> call(Endpoint target, String what, Function<RpcHandler, T> body) {
        if (executor.isShutdown()) {
            return CompletableFuture.failedFuture(
                    new RemoteUnreachableException(target, "Transport of " + self + " is shut down"));
        }
        return CompletableFuture.supplyAsync(() -> {
            RpcHandler handler = REGISTRY.get(target);
            if (handler == null) {
                throw new RemoteUnreachableException(target, "Endpoint not found: " + target);
            }

            logger.debug("{} -> {} {}", self, target, what);
            return body.apply(handler);
        }, executor);
    }

    @Override
    public RemoteSubscription monitor(Endpoint target, Runnable onDown) {
        LocalMonitor monitor = new LocalMonitor(target, onDown);
        MONITORS.computeIfAbsent(target, t -> ConcurrentHashMap.newKeySet()).add(monitor);

        // Target gone before (or while) the monitor was installed
        if (!REGISTRY.containsKey(target)) {
            MONITORS.getOrDefault(target, Set.of()).remove(monitor);
            monitor.fire();
        }

        logger.trace("{} monitoring {}", self, target);
        return monitor;
    }

    @Override
    public RemoteSubscription watchMembership(Endpoint target, Consumer<MembershipEventMessage> listener) {
        RpcHandler handler = REGISTRY.get(target);
        if (handler == null) {
            logger.debug("{} cannot watch {}: endpoint not found", self, target);
            return () -> { };
        }
        WatchRequest request = WatchRequest.newBuilder().setFrom(self.id()).build();
        RemoteSubscription subscription = handler.handleWatch(request, listener);

        Set<RemoteSubscription> watches = WATCHES.computeIfAbsent(self, s -> ConcurrentHashMap.newKeySet());
        RemoteSubscription tracked = new RemoteSubscription() {
            @Override
            public void cancel() {
                watches.remove(this);
                subscription.cancel();
            }
        };
        watches.add(tracked);
        return tracked;
    }

    private static void cancelWatches(Endpoint watcher) {
        Set<RemoteSubscription> watches = WATCHES.remove(watcher);
        if (watches != null) {
            for (RemoteSubscription watch : watches) {
                watch.cancel();
            }
        }
    }

    private static void fireMonitors(Endpoint target) {
        Set<LocalMonitor> monitors = MONITORS.remove(target);
        if (monitors != null) {
            for (LocalMonitor monitor : monitors) {
                monitor.fire();
            }
        }
    }

    /**
     * Simulate an abrupt exit of {@code endpoint}: it disappears from the registry and
     * every monitor on it fires, without its owner being shut down.
     */
    public static void kill(Endpoint endpoint) {
        if (REGISTRY.remove(endpoint) != null) {
            logger.info("Killed {}", endpoint);
            fireMonitors(endpoint);
        }
        cancelWatches(endpoint);
    }

    /**
     * Clear the registry. Useful for test cleanup.
     */
    public static void clearRegistry() {
        REGISTRY.clear();
        MONITORS.clear();
        WATCHES.clear();
    }

    private class LocalMonitor implements RemoteSubscription {
        private final Endpoint target;
        private final Runnable onDown;
        private final AtomicBoolean done = new AtomicBoolean(false);

        LocalMonitor(Endpoint target, Runnable onDown) {
            this.target = target;
            this.onDown = onDown;
        }

        void fire() {
            if (done.compareAndSet(false, true)) {
                logger.debug("{} observed {} going down", self, target);
                // The owner's executor may already be gone when it shut itself down
                CompletableFuture.runAsync(onDown);
            }
        }

        @Override
        public void cancel() {
            done.set(true);
            Set<LocalMonitor> monitors = MONITORS.get(target);
            if (monitors != null) {
                monitors.remove(this);
            }
        }
    }
}
