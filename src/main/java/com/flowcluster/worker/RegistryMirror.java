package com.flowcluster.worker;

import com.flowcluster.core.Endpoint;
import com.flowcluster.core.RemoteUnreachableException;
import com.flowcluster.core.Role;
import com.flowcluster.remote.Notifier;
import com.flowcluster.remote.Registry;
import com.flowcluster.rpc.RemoteSubscription;
import com.flowcluster.rpc.RpcTransport;
import com.flowcluster.rpc.proto.MembershipEntry;
import com.flowcluster.rpc.proto.MembershipEventMessage;
import com.flowcluster.rpc.proto.MembershipRequest;
import com.flowcluster.rpc.proto.MembershipResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Keeps a worker's registry in step with the registry of its master.
 *
 * <p>The mirror watches the master's notifier. Once the watch is registered it copies
 * the master's current membership, then applies every up and down event. Changes are
 * republished on the worker's own notifier. Events are applied in order on a
 * dedicated thread.
 */
class RegistryMirror {

    private static final Logger logger = LoggerFactory.getLogger(RegistryMirror.class);

    private final Endpoint self;
    private final Endpoint master;
    private final RpcTransport transport;
    private final Registry registry;
    private final Notifier notifier;
    private final ExecutorService executor;

    private volatile RemoteSubscription watch;
    // Only accessed on the mirror thread
    private boolean stopped;

    RegistryMirror(Endpoint master, RpcTransport transport, Registry registry, Notifier notifier) {
        this.self = transport.getSelf();
        this.master = master;
        this.transport = transport;
        this.registry = registry;
        this.notifier = notifier;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, "mirror-" + self);
            t.setDaemon(true);
            return t;
        });
    }

    void start() {
        watch = transport.watchMembership(master, this::enqueue);
        logger.debug("Mirroring registry of {}", master);
    }

    /**
     * Stop following the master and forget every mirrored record.
     * Waits for events already received to be applied.
     */
    void stop() {
        RemoteSubscription current = watch;
        if (current != null) {
            current.cancel();
        }
        try {
            CompletableFuture.runAsync(() -> stopped = true, executor).join();
        } catch (RejectedExecutionException e) {
            logger.trace("Mirror of {} already stopped", master);
        }
        executor.shutdown();
        registry.removeAll();
    }

    private void enqueue(MembershipEventMessage message) {
        try {
            executor.execute(() -> apply(message));
        } catch (RejectedExecutionException e) {
            logger.trace("Mirror of {} stopped, dropping {}", master, message.getKind());
        }
    }

    private void apply(MembershipEventMessage message) {
        if (stopped) {
            return;
        }
        MDC.put("nodeId", self.toString());
        switch (message.getKind()) {
            case SUBSCRIBED -> copyMembership();
            case UP -> added(Endpoint.of(message.getEndpoint()), Role.WORKER, Set.copyOf(message.getTagsList()));
            case DOWN -> {
                Endpoint endpoint = Endpoint.of(message.getEndpoint());
                if (registry.remove(endpoint) != null) {
                    notifier.notifyDown(endpoint);
                }
            }
            default -> logger.warn("Unexpected membership event {}", message.getKind());
        }
    }

    private void copyMembership() {
        MembershipResponse response;
        try {
            response = transport.sendMembershipRequest(master,
                    MembershipRequest.newBuilder().setFrom(self.id()).build()).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RemoteUnreachableException) {
                logger.warn("Could not copy membership of {}: {}", master, e.getCause().getMessage());
                return;
            }
            throw e;
        }
        for (MembershipEntry entry : response.getEntriesList()) {
            added(Endpoint.of(entry.getEndpoint()), Role.of(entry.getRole()), Set.copyOf(entry.getTagsList()));
        }
        logger.debug("Copied {} records from {}", response.getEntriesCount(), master);
    }

    private void added(Endpoint endpoint, Role role, Set<String> tags) {
        if (registry.add(endpoint, role, tags)) {
            notifier.notifyUp(endpoint, tags);
        }
    }
}
