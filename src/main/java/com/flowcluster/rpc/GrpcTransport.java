package com.flowcluster.rpc;

import com.flowcluster.core.Endpoint;
import com.flowcluster.core.RemoteUnreachableException;
import com.flowcluster.rpc.proto.*;
import io.grpc.*;
import io.grpc.netty.shaded.io.grpc.netty.NettyServerBuilder;
import io.grpc.stub.ClientCallStreamObserver;
import io.grpc.stub.ClientResponseObserver;
import io.grpc.stub.ServerCallStreamObserver;
import io.grpc.stub.StreamObserver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * gRPC-based transport for real network communication.
 *
 * Each runtime runs a gRPC server and keeps one channel per remote endpoint.
 * Liveness uses a server-streaming call that the monitored runtime holds open
 * until it stops; the end or failure of that stream is the single down event.
 */
public class GrpcTransport implements RpcTransport {

    private static final Logger logger = LoggerFactory.getLogger(GrpcTransport.class);

    private static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(5);
    private static final Duration DEFAULT_KEEPALIVE = Duration.ofSeconds(10);

    private final Endpoint self;
    private final String host;
    private final int port;
    private final Duration timeout;
    private final Duration keepAlive;

    private Server server;
    private RpcHandler handler;

    // Channels and stubs per remote endpoint (lazily created and cached)
    private final Map<Endpoint, ManagedChannel> channels = new ConcurrentHashMap<>();
    private final Map<Endpoint, ClusterServiceGrpc.ClusterServiceFutureStub> futureStubs = new ConcurrentHashMap<>();
    private final Map<Endpoint, ClusterServiceGrpc.ClusterServiceStub> asyncStubs = new ConcurrentHashMap<>();

    // Server side streams held open for remote monitors and watchers
    private final Set<ServerCallStreamObserver<?>> openStreams = ConcurrentHashMap.newKeySet();

    // Client side monitors and watches, cancelled on shutdown
    private final Set<RemoteSubscription> subscriptions = ConcurrentHashMap.newKeySet();

    // Executor for async operations
    private final ExecutorService executor;

    /**
     * Create a GrpcTransport.
     *
     * @param self this runtime's endpoint
     * @param host host to bind the server to
     * @param port port to bind the server to
     * @param timeout bound on every request/response call
     * @param keepAlive keepalive interval used to detect silent connection loss
     */
    public GrpcTransport(Endpoint self, String host, int port, Duration timeout, Duration keepAlive) {
        this.self = self;
        this.host = host;
        this.port = port;
        this.timeout = timeout;
        this.keepAlive = keepAlive;
        this.executor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "grpc-client-" + self);
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Create a GrpcTransport for {@code host:port} with default timeouts.
     */
    public GrpcTransport(Endpoint self) {
        this(self, self.host(), self.port(), DEFAULT_TIMEOUT, DEFAULT_KEEPALIVE);
    }

    @Override
    public Endpoint getSelf() {
        return self;
    }

    @Override
    public void start(RpcHandler handler) {
        this.handler = handler;

        try {
            server = NettyServerBuilder.forPort(port)
                    .addService(new ClusterServiceImpl())
                    .permitKeepAliveTime(1, TimeUnit.SECONDS)
                    .permitKeepAliveWithoutCalls(true)
                    .build()
                    .start();

            logger.info("gRPC server started on {}:{}", host, port);

        } catch (IOException e) {
            throw new IllegalStateException("Failed to start gRPC server on port " + port, e);
        }
    }

    @Override
    public void shutdown() {
        for (RemoteSubscription subscription : subscriptions) {
            subscription.cancel();
        }
        subscriptions.clear();

        // End the streams remote monitors hold on us: this is our clean exit signal
        for (ServerCallStreamObserver<?> stream : openStreams) {
            synchronized (stream) {
                try {
                    stream.onCompleted();
                } catch (IllegalStateException e) {
                    logger.trace("Stream already closed", e);
                }
            }
        }
        openStreams.clear();

        // Shutdown all client channels
        for (ManagedChannel channel : channels.values()) {
            try {
                channel.shutdown().awaitTermination(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                channel.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        channels.clear();
        futureStubs.clear();
        asyncStubs.clear();

        // Shutdown server
        if (server != null) {
            server.shutdown();
            try {
                if (!server.awaitTermination(5, TimeUnit.SECONDS)) {
                    server.shutdownNow();
                }
            } catch (InterruptedException e) {
                server.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }

        executor.shutdown();
        logger.info("gRPC transport shutdown for {}", self);
    }

    @Override
    public CompletableFuture<ProbeResponse> sendProbe(Endpoint target, ProbeRequest request) {
        return call(target, "Probe", stub -> stub.probe(request));
    }

    @Override
    public CompletableFuture<DispatchResponse> sendDispatch(Endpoint target, DispatchRequest request) {
        return call(target, "Dispatch(" + request.getOp() + ", " + request.getRole() + ")",
                stub -> stub.dispatch(request));
    }

    @Override
    public CompletableFuture<TagsResponse> sendTagsRequest(Endpoint target, TagsRequest request) {
        return call(target, "GetTags", stub -> stub.getTags(request));
    }

    @Override
    public CompletableFuture<MembershipResponse> sendMembershipRequest(Endpoint target, MembershipRequest request) {
        return call(target, "GetMembership", stub -> stub.getMembership(request));
    }

    private <T> CompletableFuture<T> call(Endpoint target, String what,
                                          Function<ClusterServiceGrpc.ClusterServiceFutureStub, Future<T>> rpc) {
        if (executor.isShutdown()) {
            return CompletableFuture.failedFuture(
                    new RemoteUnreachableException(target, "Transport of " + self + " is shut down"));
        }
        return CompletableFuture.supplyAsync(() -> {
            try {
                T response = rpc.apply(getFutureStub(target))
                        .get(timeout.toMillis(), TimeUnit.MILLISECONDS);

                logger.debug("{} -> {} {} -> ok", self, target, what);
                return response;

            } catch (TimeoutException e) {
                throw new RemoteUnreachableException(target, what + " to " + target + " timed out", e);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new RemoteUnreachableException(target, what + " to " + target + " interrupted", e);
            } catch (ExecutionException e) {
                throw new RemoteUnreachableException(target, what + " to " + target + " failed", e.getCause());
            } catch (IllegalStateException | IllegalArgumentException e) {
                throw new RemoteUnreachableException(target, what + " to " + target + " failed", e);
            }
        }, executor);
    }

    @Override
    public RemoteSubscription monitor(Endpoint target, Runnable onDown) {
        MonitorObserver observer = new MonitorObserver(target, onDown);
        subscriptions.add(observer);
        try {
            getAsyncStub(target).monitor(MonitorRequest.newBuilder().setFrom(self.id()).build(), observer);
        } catch (RuntimeException e) {
            logger.debug("Could not install monitor on {}", target, e);
            observer.onError(e);
        }
        logger.trace("{} monitoring {}", self, target);
        return observer;
    }

    @Override
    public RemoteSubscription watchMembership(Endpoint target, Consumer<MembershipEventMessage> listener) {
        WatchObserver observer = new WatchObserver(target, listener);
        subscriptions.add(observer);
        try {
            getAsyncStub(target).watchMembership(WatchRequest.newBuilder().setFrom(self.id()).build(), observer);
        } catch (RuntimeException e) {
            logger.debug("Could not watch {}", target, e);
            observer.onError(e);
        }
        return observer;
    }

    /**
     * Get or create a future stub for the target endpoint.
     */
    private ClusterServiceGrpc.ClusterServiceFutureStub getFutureStub(Endpoint target) {
        return futureStubs.computeIfAbsent(target, id -> ClusterServiceGrpc.newFutureStub(getChannel(id)));
    }

    /**
     * Get or create an async stub for the target endpoint.
     */
    private ClusterServiceGrpc.ClusterServiceStub getAsyncStub(Endpoint target) {
        return asyncStubs.computeIfAbsent(target, id -> ClusterServiceGrpc.newStub(getChannel(id)));
    }

    /**
     * Get or create a channel to the target endpoint.
     */
    private ManagedChannel getChannel(Endpoint target) {
        return channels.computeIfAbsent(target, id -> {
            logger.debug("Creating channel to {}:{}", id.host(), id.port());

            return ManagedChannelBuilder.forAddress(id.host(), id.port())
                    .usePlaintext()  // Trust is assumed at the transport layer
                    .keepAliveTime(keepAlive.toMillis(), TimeUnit.MILLISECONDS)
                    .keepAliveTimeout(keepAlive.toMillis(), TimeUnit.MILLISECONDS)
                    .keepAliveWithoutCalls(true)
                    .build();
        });
    }

    /**
     * Get the port this transport is listening on.
     */
    public int getPort() {
        return server != null ? server.getPort() : port;
    }

    /**
     * Client side of a liveness monitor. Any terminal signal of the stream counts as down.
     */
    private class MonitorObserver implements ClientResponseObserver<MonitorRequest, MonitorSignal>, RemoteSubscription {
        private final Endpoint target;
        private final Runnable onDown;
        private final AtomicBoolean done = new AtomicBoolean(false);
        private volatile ClientCallStreamObserver<MonitorRequest> call;

        MonitorObserver(Endpoint target, Runnable onDown) {
            this.target = target;
            this.onDown = onDown;
        }

        @Override
        public void beforeStart(ClientCallStreamObserver<MonitorRequest> requestStream) {
            this.call = requestStream;
        }

        @Override
        public void onNext(MonitorSignal value) {
            logger.trace("Monitor signal from {}", target);
        }

        @Override
        public void onError(Throwable t) {
            logger.debug("Monitor on {} failed: {}", target, t.getMessage());
            fire();
        }

        @Override
        public void onCompleted() {
            logger.debug("Monitor on {} completed", target);
            fire();
        }

        private void fire() {
            subscriptions.remove(this);
            if (done.compareAndSet(false, true)) {
                CompletableFuture.runAsync(onDown);
            }
        }

        @Override
        public void cancel() {
            subscriptions.remove(this);
            if (done.compareAndSet(false, true) && call != null) {
                call.cancel("monitor cancelled", null);
            }
        }
    }

    /**
     * Client side of a membership watch.
     */
    private class WatchObserver implements ClientResponseObserver<WatchRequest, MembershipEventMessage>, RemoteSubscription {
        private final Endpoint target;
        private final Consumer<MembershipEventMessage> listener;
        private final AtomicBoolean done = new AtomicBoolean(false);
        private volatile ClientCallStreamObserver<WatchRequest> call;

        WatchObserver(Endpoint target, Consumer<MembershipEventMessage> listener) {
            this.target = target;
            this.listener = listener;
        }

        @Override
        public void beforeStart(ClientCallStreamObserver<WatchRequest> requestStream) {
            this.call = requestStream;
        }

        @Override
        public void onNext(MembershipEventMessage event) {
            if (!done.get()) {
                listener.accept(event);
            }
        }

        @Override
        public void onError(Throwable t) {
            done.set(true);
            subscriptions.remove(this);
            logger.debug("Watch on {} ended: {}", target, t.getMessage());
        }

        @Override
        public void onCompleted() {
            done.set(true);
            subscriptions.remove(this);
            logger.debug("Watch on {} completed", target);
        }

        @Override
        public void cancel() {
            subscriptions.remove(this);
            if (done.compareAndSet(false, true) && call != null) {
                call.cancel("watch cancelled", null);
            }
        }
    }

    /**
     * gRPC service implementation that delegates to RpcHandler.
     */
    private class ClusterServiceImpl extends ClusterServiceGrpc.ClusterServiceImplBase {

        @Override
        public void probe(ProbeRequest request, StreamObserver<ProbeResponse> responseObserver) {
            unary("Probe", () -> handler.handleProbe(request), responseObserver);
        }

        @Override
        public void dispatch(DispatchRequest request, StreamObserver<DispatchResponse> responseObserver) {
            unary("Dispatch", () -> handler.handleDispatch(request), responseObserver);
        }

        @Override
        public void getTags(TagsRequest request, StreamObserver<TagsResponse> responseObserver) {
            unary("GetTags", () -> handler.handleTags(request), responseObserver);
        }

        @Override
        public void getMembership(MembershipRequest request, StreamObserver<MembershipResponse> responseObserver) {
            unary("GetMembership", () -> handler.handleMembership(request), responseObserver);
        }

        @Override
        public void monitor(MonitorRequest request, StreamObserver<MonitorSignal> responseObserver) {
            ServerCallStreamObserver<MonitorSignal> stream = (ServerCallStreamObserver<MonitorSignal>) responseObserver;
            openStreams.add(stream);
            stream.setOnCancelHandler(() -> {
                openStreams.remove(stream);
                logger.trace("Monitor from {} cancelled", request.getFrom());
            });
            logger.trace("{} monitored by {}", self, request.getFrom());
        }

        @Override
        public void watchMembership(WatchRequest request, StreamObserver<MembershipEventMessage> responseObserver) {
            ServerCallStreamObserver<MembershipEventMessage> stream =
                    (ServerCallStreamObserver<MembershipEventMessage>) responseObserver;
            openStreams.add(stream);

            RemoteSubscription subscription = handler.handleWatch(request, event -> {
                synchronized (stream) {
                    if (!stream.isCancelled() && openStreams.contains(stream)) {
                        stream.onNext(event);
                    }
                }
            });

            stream.setOnCancelHandler(() -> {
                openStreams.remove(stream);
                subscription.cancel();
                logger.debug("Watch from {} ended, unsubscribed", request.getFrom());
            });
        }

        private <T> void unary(String what, Callable<T> body, StreamObserver<T> responseObserver) {
            MDC.put("nodeId", self.toString());
            try {
                T response = body.call();
                responseObserver.onNext(response);
                responseObserver.onCompleted();
            } catch (Exception e) {
                logger.error("Error handling {}", what, e);
                responseObserver.onError(Status.INTERNAL
                        .withDescription(e.getMessage())
                        .asRuntimeException());
            }
        }
    }
}
