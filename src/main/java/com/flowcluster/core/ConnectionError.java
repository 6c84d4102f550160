package com.flowcluster.core;

import java.util.Objects;

/**
 * Reason a connection attempt or handler message did not succeed.
 *
 * <p>Errors are returned as values to the immediate caller, never thrown. The
 * built-in codes are:
 * <ul>
 *   <li>{@link #MODE_MISMATCH} - the remote declared a role other than the required one</li>
 *   <li>{@link #ALREADY_CONNECTED} - the relationship already exists</li>
 *   <li>{@link #HAS_MASTER} - the worker is already bound to a different master</li>
 *   <li>{@link #REJECTED} - a policy refused the connection</li>
 *   <li>{@link #UNREACHABLE} - the remote could not be reached</li>
 *   <li>{@link #UNKNOWN_ROLE} - no handler is bound for the role</li>
 *   <li>{@link #INCOMPATIBLE} - the remote speaks another protocol version</li>
 *   <li>{@link #NOT_CONNECTED} - disconnecting from an endpoint with no relationship</li>
 * </ul>
 *
 * <p>Policies may reject with their own codes through {@link #of(String)}.
 *
 * @author flowcluster
 */
public record ConnectionError(String code) {

    public static final ConnectionError MODE_MISMATCH = new ConnectionError("mode_mismatch");
    public static final ConnectionError ALREADY_CONNECTED = new ConnectionError("already_connected");
    public static final ConnectionError HAS_MASTER = new ConnectionError("has_master");
    public static final ConnectionError REJECTED = new ConnectionError("rejected");
    public static final ConnectionError UNREACHABLE = new ConnectionError("unreachable");
    public static final ConnectionError UNKNOWN_ROLE = new ConnectionError("unknown_role");
    public static final ConnectionError INCOMPATIBLE = new ConnectionError("incompatible");
    public static final ConnectionError NOT_CONNECTED = new ConnectionError("not_connected");

    public ConnectionError {
        Objects.requireNonNull(code, "Error code cannot be null");
        if (code.isBlank()) {
            throw new IllegalArgumentException("Error code cannot be blank");
        }
    }

    public static ConnectionError of(String code) {
        return new ConnectionError(code);
    }

    @Override
    public String toString() {
        return code;
    }
}
