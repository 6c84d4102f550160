package com.flowcluster.remote;

import com.flowcluster.core.ConnectResult;
import com.flowcluster.core.ConnectionError;
import com.flowcluster.core.Endpoint;
import com.flowcluster.core.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Connection handshake between two runtimes, plus read access to the membership
 * they produce.
 *
 * <h2>Connecting</h2>
 * <ol>
 *   <li>Probe the remote for its role. A role other than the expected one fails with
 *       {@link ConnectionError#MODE_MISMATCH} before anything changes.</li>
 *   <li>Ask the handler the remote has bound for the local role to accept this
 *       runtime (remote accept).</li>
 *   <li>Ask the local handler bound for the remote role to accept the remote
 *       (local accept). If it refuses, the remote acceptance is undone with a
 *       remove message.</li>
 * </ol>
 * Each accepting handler server installs a liveness monitor on its counterpart.
 *
 * <h2>Disconnecting</h2>
 * <p>A remove message goes to both the local and the remote handler, which drives
 * {@link ConnectionHandler#removeConnection} on both sides.
 */
public class Remote {

    private static final Logger logger = LoggerFactory.getLogger(Remote.class);

    private final Endpoint self;
    private final Role role;
    private final Beacon beacon;
    private final Dispatcher dispatcher;
    private final Registry registry;

    public Remote(Endpoint self, Role role, Beacon beacon, Dispatcher dispatcher, Registry registry) {
        this.self = self;
        this.role = role;
        this.beacon = beacon;
        this.dispatcher = dispatcher;
        this.registry = registry;
    }

    /**
     * Connect to {@code remote} whatever role it declares.
     */
    public ConnectResult connect(Endpoint remote) {
        return connect(remote, null);
    }

    /**
     * Connect to {@code remote}, which must declare {@code expectedRole}.
     *
     * @param remote the endpoint to connect to
     * @param expectedRole the required role, or null to accept any
     * @return ok with the remote role, or the reason the connection was not made
     */
    public ConnectResult connect(Endpoint remote, Role expectedRole) {
        ConnectResult probe = beacon.verify(remote);
        if (!probe.isOk()) {
            return probe;
        }
        Role remoteRole = probe.role();
        if (expectedRole != null && !expectedRole.equals(remoteRole)) {
            logger.info("{} is a {}, expected a {}", remote, remoteRole, expectedRole);
            return ConnectResult.failed(ConnectionError.MODE_MISMATCH);
        }

        HandlerReply remoteReply = dispatcher.dispatch(remote, role, HandlerMessage.accept(self, role));
        if (!remoteReply.isOk()) {
            logger.info("{} refused connection: {}", remote, remoteReply.error());
            return ConnectResult.failed(remoteReply.error());
        }

        HandlerReply localReply = dispatcher.dispatch(remoteRole, HandlerMessage.accept(remote, remoteRole));
        if (!localReply.isOk()) {
            logger.info("Refused connection to {}: {}", remote, localReply.error());
            dispatcher.dispatch(remote, role, HandlerMessage.remove(self));
            return ConnectResult.failed(localReply.error());
        }

        logger.info("Connected to {} ({})", remote, remoteRole);
        return ConnectResult.ok(remoteRole);
    }

    /**
     * Tear down the relationship with {@code remote}, a runtime with role {@code remoteRole}.
     *
     * @return ok, or the error reported by the remote side
     */
    public HandlerReply disconnect(Endpoint remote, Role remoteRole) {
        HandlerReply localReply = dispatcher.dispatch(remoteRole, HandlerMessage.remove(remote));
        HandlerReply remoteReply = dispatcher.dispatch(remote, role, HandlerMessage.remove(self));
        logger.info("Disconnected from {} ({})", remote, remoteRole);
        return localReply.isOk() ? remoteReply : localReply;
    }

    /**
     * Tear down the relationship with {@code remote}, using the role it was registered with.
     */
    public HandlerReply disconnect(Endpoint remote) {
        ConnectionRecord record = registry.get(remote);
        if (record == null) {
            return HandlerReply.error(ConnectionError.NOT_CONNECTED);
        }
        return disconnect(remote, record.role());
    }

    public Endpoint self() {
        return self;
    }

    public Role role() {
        return role;
    }

    public Endpoint master() {
        return registry.master();
    }

    public List<Endpoint> workers() {
        return registry.workers();
    }

    public Set<Endpoint> withTag(String tag) {
        return registry.tags().workersWith(tag);
    }

    public Set<String> tags(Endpoint endpoint) {
        return registry.tags().ofWorker(endpoint);
    }

    public Map<Endpoint, Set<String>> tags() {
        return registry.tagsOfAllWorkers();
    }

    public boolean connected(Endpoint endpoint) {
        return registry.connected(endpoint);
    }

    public List<ConnectionRecord> all() {
        return registry.all();
    }
}
