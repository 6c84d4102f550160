package com.flowcluster.rpc;

import com.flowcluster.rpc.proto.DispatchRequest;
import com.flowcluster.rpc.proto.DispatchResponse;
import com.flowcluster.rpc.proto.MembershipEventMessage;
import com.flowcluster.rpc.proto.MembershipRequest;
import com.flowcluster.rpc.proto.MembershipResponse;
import com.flowcluster.rpc.proto.ProbeRequest;
import com.flowcluster.rpc.proto.ProbeResponse;
import com.flowcluster.rpc.proto.TagsRequest;
import com.flowcluster.rpc.proto.TagsResponse;
import com.flowcluster.rpc.proto.WatchRequest;

import java.util.function.Consumer;

/**
 * Handler interface for processing incoming cluster RPC requests.
 *
 * <p>This interface is implemented by {@link com.flowcluster.server.ClusterNode}. The
 * transport layer ({@link RpcTransport}) receives incoming requests and delegates them
 * here:
 * <ul>
 *   <li><b>Probe</b> - report the declared role and protocol version</li>
 *   <li><b>Dispatch</b> - route a handler message to the handler bound for a role</li>
 *   <li><b>Tags</b> - report the locally configured tags</li>
 *   <li><b>Membership</b> - report the current registry contents</li>
 *   <li><b>Watch</b> - stream up/down events of the local notifier</li>
 * </ul>
 *
 * <p>Liveness monitoring is served by the transport itself and never reaches this
 * handler. All methods may be called concurrently from multiple transport threads.
 *
 * @author flowcluster
 * @see RpcTransport
 */
public interface RpcHandler {

    /**
     * Answers a probe. Probing never changes any state.
     *
     * @param request the probe, carrying the caller's endpoint
     * @return this runtime's endpoint, role and version
     */
    ProbeResponse handleProbe(ProbeRequest request);

    /**
     * Delivers a handler message to the locally bound handler for the requested role
     * and waits for its reply.
     *
     * @param request role, operation and subject endpoint
     * @return the handler's reply, or an {@code unknown_role} error when nothing is bound
     */
    DispatchResponse handleDispatch(DispatchRequest request);

    TagsResponse handleTags(TagsRequest request);

    MembershipResponse handleMembership(MembershipRequest request);

    /**
     * Subscribes {@code sink} to up/down events of the local notifier.
     *
     * @param request the watch request, carrying the caller's endpoint
     * @param sink receives every event published after the subscription is registered
     * @return a handle the transport cancels when the watching stream ends
     */
    RemoteSubscription handleWatch(WatchRequest request, Consumer<MembershipEventMessage> sink);
}
