package com.flowcluster.worker;

import com.flowcluster.core.ConnectResult;
import com.flowcluster.core.ConnectionError;
import com.flowcluster.core.Endpoint;
import com.flowcluster.core.Role;
import com.flowcluster.remote.HandlerReply;
import com.flowcluster.remote.HandlerServer;
import com.flowcluster.remote.Remote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.RejectedExecutionException;

/**
 * Worker-side management of the single connection to a master.
 *
 * <p>Unlike the master, a worker reports a repeated connect as
 * {@link ConnectionError#ALREADY_CONNECTED}, and a connect to a second master as
 * {@link ConnectionError#HAS_MASTER}.
 */
public class MasterConnection {

    private static final Logger logger = LoggerFactory.getLogger(MasterConnection.class);

    private final Remote remote;
    private final HandlerServer<Endpoint> masterServer;
    private final Endpoint configuredMaster;

    /**
     * @param remote handshake of this worker
     * @param masterServer handler server bound to the master role
     * @param configuredMaster master to connect to on bootstrap, or null
     */
    public MasterConnection(Remote remote, HandlerServer<Endpoint> masterServer, Endpoint configuredMaster) {
        this.remote = remote;
        this.masterServer = masterServer;
        this.configuredMaster = configuredMaster;
    }

    /**
     * Connect to the configured master, if any. A failure is logged and otherwise ignored;
     * there is no retry.
     */
    public void bootstrap() {
        if (configuredMaster == null) {
            logger.debug("No master configured");
            return;
        }
        ConnectResult result = connect(configuredMaster);
        if (!result.isOk()) {
            logger.warn("Could not connect to master {}: {}", configuredMaster, result.error());
        }
    }

    public ConnectResult connect(Endpoint master) {
        Endpoint current = master();
        if (current != null) {
            return ConnectResult.failed(current.equals(master)
                    ? ConnectionError.ALREADY_CONNECTED
                    : ConnectionError.HAS_MASTER);
        }
        return remote.connect(master, Role.MASTER);
    }

    /**
     * Disconnect from the current master.
     */
    public HandlerReply disconnect() {
        Endpoint current = master();
        if (current == null) {
            return HandlerReply.error(ConnectionError.NOT_CONNECTED);
        }
        return remote.disconnect(current, Role.MASTER);
    }

    /**
     * Returns the master this worker is connected to, or null. A stopped worker has no master.
     */
    public Endpoint master() {
        try {
            return masterServer.inspectState();
        } catch (RejectedExecutionException e) {
            return null;
        }
    }

    public boolean connected() {
        return master() != null;
    }
}
