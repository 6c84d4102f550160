package com.flowcluster.master;

import com.flowcluster.core.ConnectionError;
import com.flowcluster.core.Endpoint;
import com.flowcluster.core.RemoteUnreachableException;
import com.flowcluster.core.Role;
import com.flowcluster.remote.ConnectionHandler;
import com.flowcluster.remote.Decision;
import com.flowcluster.remote.Notifier;
import com.flowcluster.remote.Registry;
import com.flowcluster.rpc.RpcTransport;
import com.flowcluster.rpc.proto.TagsRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Set;
import java.util.concurrent.CompletionException;

/**
 * Master-side policy for connections with workers.
 *
 * <p>Every accepted worker is registered with the tags it reports and announced as up.
 * A worker that leaves, explicitly or by going down, is unregistered and announced as
 * down. All bookkeeping lives in the {@link Registry}, so the handler state is unused.
 */
public class WorkerConnectionHandler implements ConnectionHandler<Void> {

    private static final Logger logger = LoggerFactory.getLogger(WorkerConnectionHandler.class);

    private final Endpoint self;
    private final RpcTransport transport;
    private final Registry registry;
    private final Notifier notifier;
    private final Runnable onWorkerDown;

    /**
     * @param transport transport used to fetch worker tags
     * @param registry registry of the master
     * @param notifier notifier of the master
     * @param onWorkerDown run after a worker went down, or null
     */
    public WorkerConnectionHandler(RpcTransport transport, Registry registry, Notifier notifier,
                                   Runnable onWorkerDown) {
        this.self = transport.getSelf();
        this.transport = transport;
        this.registry = registry;
        this.notifier = notifier;
        this.onWorkerDown = onWorkerDown;
    }

    @Override
    public Void init() {
        registry.add(self, Role.MASTER);
        return null;
    }

    @Override
    public Decision<Void> acceptConnection(Endpoint worker, Role role, Void state) {
        if (registry.connected(worker)) {
            return Decision.reject(ConnectionError.ALREADY_CONNECTED, state);
        }

        Set<String> tags;
        try {
            tags = Set.copyOf(transport.sendTagsRequest(worker,
                    TagsRequest.newBuilder().setFrom(self.id()).build()).join().getTagsList());
        } catch (CompletionException e) {
            if (e.getCause() instanceof RemoteUnreachableException) {
                logger.info("Could not fetch tags of {}: {}", worker, e.getCause().getMessage());
                return Decision.reject(ConnectionError.UNREACHABLE, state);
            }
            throw e;
        }

        registry.add(worker, role, tags);
        notifier.notifyUp(worker, tags);
        logger.info("Worker {} joined with tags {}", worker, tags);
        return Decision.accept(state);
    }

    @Override
    public Void removeConnection(Endpoint worker, Void state) {
        if (registry.remove(worker) != null) {
            notifier.notifyDown(worker);
            logger.info("Worker {} removed", worker);
        }
        return state;
    }

    @Override
    public Void remoteDown(Endpoint worker, Void state) {
        if (registry.remove(worker) != null) {
            notifier.notifyDown(worker);
            logger.info("Worker {} went down", worker);
            if (onWorkerDown != null) {
                onWorkerDown.run();
            }
        }
        return state;
    }
}
