package com.flowcluster.rpc;

import com.flowcluster.core.Endpoint;
import com.flowcluster.rpc.proto.DispatchRequest;
import com.flowcluster.rpc.proto.DispatchResponse;
import com.flowcluster.rpc.proto.MembershipEventMessage;
import com.flowcluster.rpc.proto.MembershipRequest;
import com.flowcluster.rpc.proto.MembershipResponse;
import com.flowcluster.rpc.proto.ProbeRequest;
import com.flowcluster.rpc.proto.ProbeResponse;
import com.flowcluster.rpc.proto.TagsRequest;
import com.flowcluster.rpc.proto.TagsResponse;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Abstraction layer for communication between cluster runtimes.
 *
 * <p>Request/response calls:
 * <ul>
 *   <li><b>Probe</b> - read a runtime's declared role without changing anything</li>
 *   <li><b>Dispatch</b> - one forwarded hop to the handler bound for a role</li>
 *   <li><b>Tags</b> - fetch a worker's configured tags</li>
 *   <li><b>Membership</b> - fetch a runtime's registry contents</li>
 * </ul>
 *
 * <p>Long-lived subscriptions:
 * <ul>
 *   <li><b>Monitor</b> - push-based liveness; fires at most once when the target exits,
 *       crashes or becomes unreachable</li>
 *   <li><b>Watch</b> - up/down events published by the target's notifier</li>
 * </ul>
 *
 * <h2>Implementations</h2>
 * <ul>
 *   <li>{@link LocalTransport} - In-memory transport for testing (single process)</li>
 *   <li>{@link GrpcTransport} - gRPC-based transport for production (real network)</li>
 * </ul>
 *
 * <h2>Failures</h2>
 * <p>Futures of request/response calls complete exceptionally with a
 * {@link com.flowcluster.core.RemoteUnreachableException} (possibly wrapped in a
 * {@link java.util.concurrent.CompletionException}) when the target cannot be reached.
 * Each call is bounded by the transport's own timeout; callers add none.
 *
 * @author flowcluster
 * @see RpcHandler
 */
public interface RpcTransport {

    /**
     * Returns the endpoint this transport answers for.
     */
    Endpoint getSelf();

    CompletableFuture<ProbeResponse> sendProbe(Endpoint target, ProbeRequest request);

    CompletableFuture<DispatchResponse> sendDispatch(Endpoint target, DispatchRequest request);

    CompletableFuture<TagsResponse> sendTagsRequest(Endpoint target, TagsRequest request);

    CompletableFuture<MembershipResponse> sendMembershipRequest(Endpoint target, MembershipRequest request);

    /**
     * Installs a liveness monitor on {@code target}.
     *
     * <p>{@code onDown} runs at most once, when the target exits, crashes or can no
     * longer be reached. If the target is already gone, it runs shortly after this
     * call. It never runs after the returned subscription was cancelled.
     *
     * @param target the endpoint to watch
     * @param onDown callback for the single terminal event
     * @return a handle cancelling the monitor
     */
    RemoteSubscription monitor(Endpoint target, Runnable onDown);

    /**
     * Subscribes to up/down events published by the notifier of {@code target}.
     *
     * @param target the endpoint whose notifier is watched
     * @param listener receives the events in publication order
     * @return a handle cancelling the watch; the remote side unsubscribes when it does
     */
    RemoteSubscription watchMembership(Endpoint target, Consumer<MembershipEventMessage> listener);

    /**
     * Starts the transport and begins listening for incoming requests.
     *
     * @param handler the handler that will process incoming requests
     */
    void start(RpcHandler handler);

    /**
     * Shuts down the transport and releases all resources.
     *
     * <p>Monitors other runtimes hold on this one observe its exit.
     */
    void shutdown();
}
