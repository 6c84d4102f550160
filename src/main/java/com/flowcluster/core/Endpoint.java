package com.flowcluster.core;

import java.util.Objects;

/**
 * Immutable identifier of a runtime participating in the cluster.
 *
 * <p>An endpoint is referenced by value and is never owned by any single component.
 * It is used for:
 * <ul>
 *   <li>Addressing remote calls (probe, dispatch, tag and membership queries)</li>
 *   <li>Keying the connection registry and the tag index</li>
 *   <li>Identifying the counterpart of a liveness monitor</li>
 * </ul>
 *
 * <p>For the gRPC transport the identifier has the form {@code host:port}. The
 * in-memory transport accepts any non-blank name.
 *
 * <p>Example usage:
 * <pre>{@code
 * Endpoint worker = Endpoint.of("localhost:9101");
 * System.out.println(worker.id()); // "localhost:9101"
 * }</pre>
 *
 * @author flowcluster
 */
public record Endpoint(String id) implements Comparable<Endpoint> {

    /**
     * Constructs a new {@code Endpoint} with validation.
     *
     * @param id the identifier string for this endpoint
     * @throws NullPointerException if {@code id} is null
     * @throws IllegalArgumentException if {@code id} is blank
     */
    public Endpoint {
        Objects.requireNonNull(id, "Endpoint ID cannot be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("Endpoint ID cannot be blank");
        }
    }

    public static Endpoint of(String id) {
        return new Endpoint(id);
    }

    public static Endpoint of(String host, int port) {
        return new Endpoint(host + ":" + port);
    }

    /**
     * Returns the host part of a {@code host:port} identifier.
     *
     * @throws IllegalStateException if the identifier is not of that form
     */
    public String host() {
        int sep = separator();
        return id.substring(0, sep);
    }

    /**
     * Returns the port part of a {@code host:port} identifier.
     *
     * @throws IllegalStateException if the identifier is not of that form
     */
    public int port() {
        int sep = separator();
        try {
            return Integer.parseInt(id.substring(sep + 1));
        } catch (NumberFormatException e) {
            throw new IllegalStateException("Endpoint " + id + " has no numeric port", e);
        }
    }

    private int separator() {
        int sep = id.lastIndexOf(':');
        if (sep <= 0 || sep == id.length() - 1) {
            throw new IllegalStateException("Endpoint " + id + " is not of the form host:port");
        }
        return sep;
    }

    @Override
    public int compareTo(Endpoint other) {
        return id.compareTo(other.id);
    }

    @Override
    public String toString() {
        return id;
    }
}
