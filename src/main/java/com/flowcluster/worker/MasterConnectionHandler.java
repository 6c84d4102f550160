package com.flowcluster.worker;

import com.flowcluster.core.ConnectionError;
import com.flowcluster.core.Endpoint;
import com.flowcluster.core.Role;
import com.flowcluster.remote.ConnectionHandler;
import com.flowcluster.remote.Decision;
import com.flowcluster.remote.Notifier;
import com.flowcluster.remote.Registry;
import com.flowcluster.rpc.RpcTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;

/**
 * Worker-side policy for the connection with a master.
 *
 * <p>A worker holds at most one master. The state is that master, or null.
 * Accepting a master registers it, announces it as up and starts mirroring its
 * registry. Losing it undoes all of that, and stops the runtime when the node
 * is configured to shut down with its master.
 */
public class MasterConnectionHandler implements ConnectionHandler<Endpoint> {

    private static final Logger logger = LoggerFactory.getLogger(MasterConnectionHandler.class);

    private final RpcTransport transport;
    private final Registry registry;
    private final Notifier notifier;
    private final Runnable onMasterDown;

    // Owned by the handler thread, like the state
    private RegistryMirror mirror;

    /**
     * @param onMasterDown run after the master went down, or null
     */
    public MasterConnectionHandler(RpcTransport transport, Registry registry, Notifier notifier,
                                   Runnable onMasterDown) {
        this.transport = transport;
        this.registry = registry;
        this.notifier = notifier;
        this.onMasterDown = onMasterDown;
    }

    @Override
    public Decision<Endpoint> acceptConnection(Endpoint master, Role role, Endpoint current) {
        if (current != null) {
            return Decision.reject(current.equals(master)
                    ? ConnectionError.ALREADY_CONNECTED
                    : ConnectionError.HAS_MASTER, current);
        }

        registry.add(master, role);
        notifier.notifyUp(master, Set.of());
        mirror = new RegistryMirror(master, transport, registry, notifier);
        mirror.start();
        logger.info("Connected to master {}", master);
        return Decision.accept(master);
    }

    @Override
    public Endpoint removeConnection(Endpoint endpoint, Endpoint current) {
        if (!endpoint.equals(current)) {
            return current;
        }
        release(current);
        logger.info("Disconnected from master {}", current);
        return null;
    }

    @Override
    public Endpoint remoteDown(Endpoint endpoint, Endpoint current) {
        if (!endpoint.equals(current)) {
            return current;
        }
        release(current);
        logger.warn("Master {} went down", current);
        if (onMasterDown != null) {
            onMasterDown.run();
        }
        return null;
    }

    private void release(Endpoint master) {
        if (mirror != null) {
            mirror.stop();
            mirror = null;
        }
        registry.remove(master);
        notifier.notifyDown(master);
    }
}
