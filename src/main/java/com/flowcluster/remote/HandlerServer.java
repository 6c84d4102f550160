package com.flowcluster.remote;

import com.flowcluster.core.ConnectionError;
import com.flowcluster.core.Endpoint;
import com.flowcluster.core.Role;
import com.flowcluster.rpc.RemoteSubscription;
import com.flowcluster.rpc.RpcTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;

/**
 * Long-lived runtime of one {@link ConnectionHandler}.
 *
 * <p>The server owns the handler state and processes one message at a time on a
 * dedicated thread, so the state is never touched concurrently. It also owns the
 * liveness monitors of every accepted endpoint:
 * <ul>
 *   <li>accepting an endpoint installs a monitor on it</li>
 *   <li>removing an endpoint cancels its monitor</li>
 *   <li>a firing monitor turns into a {@link ConnectionHandler#remoteDown} call</li>
 * </ul>
 *
 * @param <S> type of the handler state
 */
public class HandlerServer<S> {

    private static final Logger logger = LoggerFactory.getLogger(HandlerServer.class);

    private final Role role;
    private final ConnectionHandler<S> handler;
    private final RpcTransport transport;
    private final Endpoint self;
    private final ExecutorService executor;

    // Only accessed on the executor thread
    private final Map<Endpoint, RemoteSubscription> monitors = new HashMap<>();
    private S state;

    /**
     * Create a handler server.
     *
     * @param role role this server is bound to, or null for the default binding
     * @param handler the policy
     * @param transport transport used to monitor accepted endpoints
     */
    public HandlerServer(Role role, ConnectionHandler<S> handler, RpcTransport transport) {
        this.role = role;
        this.handler = handler;
        this.transport = transport;
        this.self = transport.getSelf();
        String name = "handler-" + (role != null ? role.name() : "default") + "-" + self;
        this.executor = Executors.newSingleThreadExecutor(r -> {
            Thread t = new Thread(r, name);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Initialise the handler state and bind this server in {@code dispatcher}.
     * Blocks until the state is initialised.
     */
    public void start(Dispatcher dispatcher) {
        CompletableFuture.runAsync(() -> {
            MDC.put("nodeId", self.toString());
            state = handler.init();
        }, executor).join();

        if (role == null) {
            dispatcher.defaultBind(this);
        } else {
            dispatcher.bind(role, this);
        }
        logger.debug("Handler {} bound to {}", handler.getClass().getSimpleName(),
                role != null ? role : "default");
    }

    /**
     * Cancel every monitor and stop processing messages.
     */
    public void stop() {
        try {
            executor.execute(() -> {
                for (RemoteSubscription monitor : monitors.values()) {
                    monitor.cancel();
                }
                monitors.clear();
            });
        } catch (RejectedExecutionException e) {
            logger.trace("Handler server already stopped", e);
        }
        executor.shutdown();
    }

    /**
     * Queue {@code message} for the handler.
     *
     * @param message the message
     * @return future completing with the handler's reply
     */
    public CompletableFuture<HandlerReply> submit(HandlerMessage message) {
        try {
            return CompletableFuture.supplyAsync(() -> process(message), executor);
        } catch (RejectedExecutionException e) {
            logger.debug("Handler for {} is stopped, dropping {}", role, message);
            return CompletableFuture.completedFuture(HandlerReply.error(ConnectionError.UNREACHABLE));
        }
    }

    private HandlerReply process(HandlerMessage message) {
        MDC.put("nodeId", self.toString());
        return switch (message.op()) {
            case ACCEPT -> accept(message.endpoint(), message.role());
            case REMOVE -> remove(message.endpoint());
        };
    }

    private HandlerReply accept(Endpoint remote, Role remoteRole) {
        Decision<S> decision;
        try {
            decision = handler.acceptConnection(remote, remoteRole, state);
        } catch (RuntimeException e) {
            logger.error("Handler failed to accept {}", remote, e);
            return HandlerReply.error(ConnectionError.REJECTED);
        }

        state = decision.state();
        if (!decision.accepted()) {
            logger.debug("Rejected {} ({}): {}", remote, remoteRole, decision.reason());
            return HandlerReply.error(decision.reason());
        }

        if (!monitors.containsKey(remote)) {
            monitors.put(remote, installMonitor(remote));
        }
        return HandlerReply.ok();
    }

    private RemoteSubscription installMonitor(Endpoint remote) {
        // Read on the handler thread, after this accept has finished assigning it
        RemoteSubscription[] holder = new RemoteSubscription[1];
        holder[0] = transport.monitor(remote, () -> onMonitorFired(remote, holder));
        return holder[0];
    }

    private void onMonitorFired(Endpoint remote, RemoteSubscription[] holder) {
        try {
            executor.execute(() -> down(remote, holder[0]));
        } catch (RejectedExecutionException e) {
            logger.trace("Ignoring down event for {} after stop", remote);
        }
    }

    private void down(Endpoint remote, RemoteSubscription monitor) {
        MDC.put("nodeId", self.toString());
        // A monitor cancelled by a remove, or superseded by a new accept, is stale
        if (monitor == null || monitors.get(remote) != monitor) {
            logger.trace("Stale down event for {}", remote);
            return;
        }
        monitors.remove(remote);
        try {
            state = handler.remoteDown(remote, state);
        } catch (RuntimeException e) {
            logger.error("Handler failed to process loss of {}", remote, e);
        }
    }

    private HandlerReply remove(Endpoint remote) {
        RemoteSubscription monitor = monitors.remove(remote);
        if (monitor != null) {
            monitor.cancel();
        }
        try {
            state = handler.removeConnection(remote, state);
        } catch (RuntimeException e) {
            logger.error("Handler failed to remove {}", remote, e);
        }
        return HandlerReply.ok();
    }

    /**
     * Read the handler state from the handler thread. Waits for every message queued
     * before this call, which makes it useful to synchronise with the handler in
     * diagnostics and tests.
     */
    public S inspectState() {
        return CompletableFuture.supplyAsync(() -> state, executor).join();
    }

    /**
     * Endpoints this server currently monitors.
     */
    public List<Endpoint> monitoredEndpoints() {
        try {
            return CompletableFuture.supplyAsync(() -> new ArrayList<>(monitors.keySet()), executor).join();
        } catch (RejectedExecutionException e) {
            // Stopping cancels every monitor
            return List.of();
        }
    }

    public Role getRole() {
        return role;
    }
}
