package com.flowcluster.remote;

import com.flowcluster.core.Endpoint;
import com.flowcluster.core.Role;
import com.flowcluster.rpc.proto.DispatchRequest;
import com.flowcluster.rpc.proto.HandlerOp;

import java.util.Objects;

/**
 * Message delivered to a handler through the {@link Dispatcher}.
 *
 * @param op what the handler is asked to do
 * @param endpoint the counterpart the message is about
 * @param role the counterpart's declared role; only meaningful for {@link Op#ACCEPT}
 */
public record HandlerMessage(Op op, Endpoint endpoint, Role role) {

    public enum Op {
        ACCEPT,
        REMOVE
    }

    public HandlerMessage {
        Objects.requireNonNull(op, "op");
        Objects.requireNonNull(endpoint, "endpoint");
        if (op == Op.ACCEPT) {
            Objects.requireNonNull(role, "role is required to accept");
        }
    }

    public static HandlerMessage accept(Endpoint endpoint, Role role) {
        return new HandlerMessage(Op.ACCEPT, endpoint, role);
    }

    public static HandlerMessage remove(Endpoint endpoint) {
        return new HandlerMessage(Op.REMOVE, endpoint, null);
    }

    /**
     * Convert to protobuf, addressed to the handler bound for {@code target}.
     */
    public DispatchRequest toProto(Role target) {
        DispatchRequest.Builder builder = DispatchRequest.newBuilder()
                .setRole(target.name())
                .setOp(op == Op.ACCEPT ? HandlerOp.ACCEPT : HandlerOp.REMOVE)
                .setEndpoint(endpoint.id());
        if (role != null) {
            builder.setEndpointRole(role.name());
        }
        return builder.build();
    }

    /**
     * Create from protobuf.
     */
    public static HandlerMessage fromProto(DispatchRequest request) {
        Endpoint endpoint = Endpoint.of(request.getEndpoint());
        return switch (request.getOp()) {
            case ACCEPT -> accept(endpoint, Role.of(request.getEndpointRole()));
            case REMOVE -> remove(endpoint);
            default -> throw new IllegalArgumentException("Unknown handler op: " + request.getOp());
        };
    }
}
