package com.flowcluster.remote;

import com.flowcluster.core.Endpoint;
import com.flowcluster.rpc.proto.MembershipEventMessage;

import java.util.Objects;
import java.util.Set;

/**
 * Join or leave of an endpoint, as published by the {@link Notifier}.
 *
 * @param kind up or down
 * @param endpoint the endpoint that joined or left
 * @param tags tags of a joining endpoint; empty for down events
 */
public record MembershipEvent(Kind kind, Endpoint endpoint, Set<String> tags) {

    public enum Kind {
        UP,
        DOWN
    }

    public MembershipEvent {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(endpoint, "endpoint");
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }

    public static MembershipEvent up(Endpoint endpoint, Set<String> tags) {
        return new MembershipEvent(Kind.UP, endpoint, tags);
    }

    public static MembershipEvent down(Endpoint endpoint) {
        return new MembershipEvent(Kind.DOWN, endpoint, Set.of());
    }

    public MembershipEventMessage toProto() {
        return MembershipEventMessage.newBuilder()
                .setKind(kind == Kind.UP ? MembershipEventMessage.Kind.UP : MembershipEventMessage.Kind.DOWN)
                .setEndpoint(endpoint.id())
                .addAllTags(tags)
                .build();
    }
}
