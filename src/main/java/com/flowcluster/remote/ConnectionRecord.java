package com.flowcluster.remote;

import com.flowcluster.core.Endpoint;
import com.flowcluster.core.Role;

import java.util.Objects;
import java.util.Set;

/**
 * A connected endpoint as held by the {@link Registry}.
 *
 * @param endpoint the connected endpoint
 * @param role the role it declared when connecting
 * @param tags the tags it carried when connecting; never changed afterwards
 */
public record ConnectionRecord(Endpoint endpoint, Role role, Set<String> tags) {

    public ConnectionRecord {
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(role, "role");
        tags = tags == null ? Set.of() : Set.copyOf(tags);
    }
}
