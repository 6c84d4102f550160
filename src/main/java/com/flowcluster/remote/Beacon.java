package com.flowcluster.remote;

import com.flowcluster.core.ConnectResult;
import com.flowcluster.core.ConnectionError;
import com.flowcluster.core.Endpoint;
import com.flowcluster.core.RemoteUnreachableException;
import com.flowcluster.core.Role;
import com.flowcluster.rpc.RpcTransport;
import com.flowcluster.rpc.proto.ProbeRequest;
import com.flowcluster.rpc.proto.ProbeResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CompletionException;

/**
 * Announces the local role and protocol version, and reads those of other runtimes.
 */
public class Beacon {

    private static final Logger logger = LoggerFactory.getLogger(Beacon.class);

    /**
     * Protocol version. Runtimes only connect to runtimes with the same version.
     */
    public static final String VERSION = "1";

    private final Endpoint self;
    private final Role role;
    private final RpcTransport transport;

    public Beacon(Role role, RpcTransport transport) {
        this.self = transport.getSelf();
        this.role = role;
        this.transport = transport;
    }

    public ProbeResponse probe() {
        return ProbeResponse.newBuilder()
                .setEndpoint(self.id())
                .setRole(role.name())
                .setVersion(VERSION)
                .build();
    }

    /**
     * Read the declared role of {@code remote}. Never changes any state on either side.
     *
     * @return ok with the remote role, {@link ConnectionError#UNREACHABLE} if the remote
     *         did not answer, or {@link ConnectionError#INCOMPATIBLE} if it runs another
     *         protocol version
     */
    public ConnectResult verify(Endpoint remote) {
        ProbeResponse response;
        try {
            response = transport.sendProbe(remote, ProbeRequest.newBuilder().setFrom(self.id()).build()).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RemoteUnreachableException) {
                logger.debug("Probe of {} failed: {}", remote, e.getCause().getMessage());
                return ConnectResult.failed(ConnectionError.UNREACHABLE);
            }
            throw e;
        }

        if (!VERSION.equals(response.getVersion())) {
            logger.warn("{} runs protocol version {}, expected {}", remote, response.getVersion(), VERSION);
            return ConnectResult.failed(ConnectionError.INCOMPATIBLE);
        }
        return ConnectResult.ok(Role.of(response.getRole()));
    }

    public Role getRole() {
        return role;
    }
}
