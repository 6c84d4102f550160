package com.flowcluster.core;

import java.util.Objects;

/**
 * Outcome of connecting to a single endpoint.
 *
 * <p>On success {@link #role()} holds the role the remote declared; on failure
 * {@link #error()} holds the reason and the role is {@code null}.
 */
public record ConnectResult(Role role, ConnectionError error) {

    public ConnectResult {
        if ((role == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of role and error must be set");
        }
    }

    public static ConnectResult ok(Role role) {
        return new ConnectResult(Objects.requireNonNull(role), null);
    }

    public static ConnectResult failed(ConnectionError error) {
        return new ConnectResult(null, Objects.requireNonNull(error));
    }

    public boolean isOk() {
        return error == null;
    }

    @Override
    public String toString() {
        return isOk() ? "ok(" + role + ")" : "error(" + error + ")";
    }
}
