package com.flowcluster.server;

import com.flowcluster.config.NodeConfig;
import com.flowcluster.core.BulkConnectResult;
import com.flowcluster.core.Endpoint;
import com.flowcluster.core.Role;
import com.flowcluster.master.WorkerConnection;
import com.flowcluster.master.WorkerConnectionHandler;
import com.flowcluster.remote.Beacon;
import com.flowcluster.remote.ConnectionHandler;
import com.flowcluster.remote.ConnectionRecord;
import com.flowcluster.remote.Dispatcher;
import com.flowcluster.remote.HandlerMessage;
import com.flowcluster.remote.HandlerServer;
import com.flowcluster.remote.MembershipListener;
import com.flowcluster.remote.Notifier;
import com.flowcluster.remote.Registry;
import com.flowcluster.remote.Remote;
import com.flowcluster.rpc.RemoteSubscription;
import com.flowcluster.rpc.RpcHandler;
import com.flowcluster.rpc.RpcTransport;
import com.flowcluster.rpc.proto.DispatchRequest;
import com.flowcluster.rpc.proto.DispatchResponse;
import com.flowcluster.rpc.proto.MembershipEntry;
import com.flowcluster.rpc.proto.MembershipEventMessage;
import com.flowcluster.rpc.proto.MembershipRequest;
import com.flowcluster.rpc.proto.MembershipResponse;
import com.flowcluster.rpc.proto.ProbeRequest;
import com.flowcluster.rpc.proto.ProbeResponse;
import com.flowcluster.rpc.proto.TagsRequest;
import com.flowcluster.rpc.proto.TagsResponse;
import com.flowcluster.rpc.proto.WatchRequest;
import com.flowcluster.worker.MasterConnection;
import com.flowcluster.worker.MasterConnectionHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;

/**
 * A cluster runtime.
 *
 * Assembles the registry, notifier, dispatcher and handler servers of one endpoint,
 * and answers the RPCs other runtimes send to it.
 *
 * <p>A master binds {@link WorkerConnectionHandler} to the worker role, a worker binds
 * {@link MasterConnectionHandler} to the master role. Further handlers can be installed
 * for custom roles with {@link #installHandler}.
 */
public class ClusterNode implements RpcHandler {

    private static final Logger logger = LoggerFactory.getLogger(ClusterNode.class);

    private final NodeConfig config;
    private final Endpoint id;
    private final Role role;
    private final RpcTransport transport;

    private final Registry registry;
    private final Notifier notifier;
    private final Dispatcher dispatcher;
    private final Beacon beacon;
    private final Remote remote;

    private final List<HandlerServer<?>> handlerServers = new CopyOnWriteArrayList<>();

    // Set by start(), depending on the role
    private WorkerConnection workerConnection;
    private MasterConnection masterConnection;

    // Run when a remote the node depends on goes down and the config says to stop with it
    private volatile Runnable shutdownAction = this::stop;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public ClusterNode(NodeConfig config, RpcTransport transport) {
        this.config = config;
        this.id = transport.getSelf();
        this.role = config.getRole();
        this.transport = transport;
        this.registry = new Registry();
        this.notifier = new Notifier(id.toString());
        this.dispatcher = new Dispatcher(transport);
        this.beacon = new Beacon(role, transport);
        this.remote = new Remote(id, role, beacon, dispatcher, registry);
    }

    /**
     * Bind the handlers of the node's role and start answering RPCs.
     */
    public void start() {
        MDC.put("nodeId", id.toString());
        logger.info("Starting {} {}", role, id);

        if (role.isMaster()) {
            Runnable onWorkerDown = config.isShutdownWithWorkers() ? this::remoteShutdown : null;
            installHandler(Role.WORKER, new WorkerConnectionHandler(transport, registry, notifier, onWorkerDown));
            workerConnection = new WorkerConnection(remote, registry, notifier, config.getWorkers());
        } else if (role.isWorker()) {
            Runnable onMasterDown = config.isShutdownWithMaster() ? this::remoteShutdown : null;
            HandlerServer<Endpoint> masterServer = installHandler(Role.MASTER,
                    new MasterConnectionHandler(transport, registry, notifier, onMasterDown));
            masterConnection = new MasterConnection(remote, masterServer, config.getMaster());
        }

        transport.start(this);
        running.set(true);
    }

    /**
     * Make the connections named by the configuration: a master connects to its
     * workers, a worker to its master. Failures are logged; startup goes on.
     */
    public void bootstrap() {
        if (workerConnection != null && !config.getWorkers().isEmpty()) {
            BulkConnectResult result = workerConnection.connect();
            if (!result.isOk()) {
                logger.warn("Could not connect to all workers: {}", result);
            }
        }
        if (masterConnection != null) {
            masterConnection.bootstrap();
        }
    }

    /**
     * Start a handler server for {@code handlerRole} and bind it, replacing any server
     * bound to that role before.
     */
    public <S> HandlerServer<S> installHandler(Role handlerRole, ConnectionHandler<S> handler) {
        HandlerServer<S> server = new HandlerServer<>(handlerRole, handler, transport);
        server.start(dispatcher);
        handlerServers.add(server);
        return server;
    }

    /**
     * Start a handler server for every role without a specific binding.
     */
    public <S> HandlerServer<S> installDefaultHandler(ConnectionHandler<S> handler) {
        return installHandler(null, handler);
    }

    public void stop() {
        if (!running.compareAndSet(true, false)) {
            return;
        }
        logger.info("Stopping {} {}", role, id);

        if (workerConnection != null) {
            workerConnection.stop();
        }
        for (HandlerServer<?> server : handlerServers) {
            server.stop();
        }
        transport.shutdown();
        notifier.stop();
        dispatcher.clear();

        logger.info("{} {} stopped", role, id);
    }

    private void remoteShutdown() {
        logger.warn("Shutting down {} after losing a remote it depends on", id);
        // Off the handler thread, which the shutdown stops
        CompletableFuture.runAsync(shutdownAction);
    }

    /**
     * Replace what happens when the node decides to stop because a remote went down.
     * Defaults to {@link #stop()}.
     */
    public void setShutdownAction(Runnable shutdownAction) {
        this.shutdownAction = shutdownAction;
    }

    // ==================== RPC Handlers ====================

    @Override
    public ProbeResponse handleProbe(ProbeRequest request) {
        return beacon.probe();
    }

    @Override
    public DispatchResponse handleDispatch(DispatchRequest request) {
        MDC.put("nodeId", id.toString());
        HandlerMessage message = HandlerMessage.fromProto(request);
        logger.debug("Dispatch from remote: {} {} for role {}", message.op(), message.endpoint(), request.getRole());
        return dispatcher.dispatch(Role.of(request.getRole()), message).toProto();
    }

    @Override
    public TagsResponse handleTags(TagsRequest request) {
        return TagsResponse.newBuilder().addAllTags(config.getTags()).build();
    }

    @Override
    public MembershipResponse handleMembership(MembershipRequest request) {
        MembershipResponse.Builder response = MembershipResponse.newBuilder();
        for (ConnectionRecord record : registry.all()) {
            response.addEntries(MembershipEntry.newBuilder()
                    .setEndpoint(record.endpoint().id())
                    .setRole(record.role().name())
                    .addAllTags(record.tags()));
        }
        return response.build();
    }

    @Override
    public RemoteSubscription handleWatch(WatchRequest request, Consumer<MembershipEventMessage> sink) {
        MembershipListener listener = event -> sink.accept(event.toProto());
        notifier.subscribeUp(listener);
        notifier.subscribeDown(listener);
        logger.debug("{} watches membership", request.getFrom());

        sink.accept(MembershipEventMessage.newBuilder()
                .setKind(MembershipEventMessage.Kind.SUBSCRIBED)
                .build());

        return () -> {
            notifier.unsubscribeUp(listener);
            notifier.unsubscribeDown(listener);
            logger.debug("{} stopped watching membership", request.getFrom());
        };
    }

    // ==================== Getters ====================

    public Endpoint getId() {
        return id;
    }

    public Role getRole() {
        return role;
    }

    public NodeConfig getConfig() {
        return config;
    }

    public Registry getRegistry() {
        return registry;
    }

    public Notifier getNotifier() {
        return notifier;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public Remote getRemote() {
        return remote;
    }

    /**
     * Returns the worker connections of a master, or null on other roles.
     */
    public WorkerConnection getWorkerConnection() {
        return workerConnection;
    }

    /**
     * Returns the master connection of a worker, or null on other roles.
     */
    public MasterConnection getMasterConnection() {
        return masterConnection;
    }

    public boolean isRunning() {
        return running.get();
    }
}
