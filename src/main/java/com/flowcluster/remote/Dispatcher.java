package com.flowcluster.remote;

import com.flowcluster.core.ConnectionError;
import com.flowcluster.core.Endpoint;
import com.flowcluster.core.RemoteUnreachableException;
import com.flowcluster.core.Role;
import com.flowcluster.rpc.RpcTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Routes role-addressed handler messages to the bound {@link HandlerServer}.
 *
 * <p>Every role has at most one bound server; binding again replaces the previous
 * server. A default server, if bound, receives messages for roles without a
 * specific binding. Messages for a role nobody handles are answered with
 * {@link ConnectionError#UNKNOWN_ROLE}.
 *
 * <p>{@link #dispatch(Endpoint, Role, HandlerMessage)} performs the same lookup on a
 * remote runtime, one forwarded call away.
 */
public class Dispatcher {

    private static final Logger logger = LoggerFactory.getLogger(Dispatcher.class);

    private final RpcTransport transport;
    private final Map<Role, HandlerServer<?>> bindings = new ConcurrentHashMap<>();
    private volatile HandlerServer<?> defaultHandler;

    public Dispatcher(RpcTransport transport) {
        this.transport = transport;
    }

    /**
     * Bind {@code server} as the sole handler of {@code role}, replacing any earlier binding.
     */
    public void bind(Role role, HandlerServer<?> server) {
        HandlerServer<?> previous = bindings.put(role, server);
        if (previous != null && previous != server) {
            logger.debug("Rebound role {}", role);
        }
    }

    /**
     * Bind {@code server} as the fallback for roles without a specific binding.
     */
    public void defaultBind(HandlerServer<?> server) {
        this.defaultHandler = server;
    }

    /**
     * Returns the server handling {@code role}, falling back to the default binding.
     *
     * @return the server, or null if nothing handles the role
     */
    public HandlerServer<?> getHandler(Role role) {
        HandlerServer<?> server = bindings.get(role);
        return server != null ? server : defaultHandler;
    }

    /**
     * Deliver {@code message} to the local handler of {@code role} and wait for its reply.
     */
    public HandlerReply dispatch(Role role, HandlerMessage message) {
        HandlerServer<?> server = getHandler(role);
        if (server == null) {
            logger.debug("No handler for role {}, dropping {}", role, message);
            return HandlerReply.error(ConnectionError.UNKNOWN_ROLE);
        }
        return server.submit(message).join();
    }

    /**
     * Deliver {@code message} to the handler of {@code role} on {@code remote} and wait
     * for its reply.
     *
     * @return the remote reply, or {@link ConnectionError#UNREACHABLE} if the remote
     *         could not be reached
     */
    public HandlerReply dispatch(Endpoint remote, Role role, HandlerMessage message) {
        try {
            return HandlerReply.fromProto(transport.sendDispatch(remote, message.toProto(role)).join());
        } catch (CompletionException e) {
            if (e.getCause() instanceof RemoteUnreachableException) {
                logger.debug("Dispatch to {} failed: {}", remote, e.getCause().getMessage());
                return HandlerReply.error(ConnectionError.UNREACHABLE);
            }
            throw e;
        }
    }

    /**
     * Drop every binding. Used when the runtime stops.
     */
    public void clear() {
        bindings.clear();
        defaultHandler = null;
    }
}
