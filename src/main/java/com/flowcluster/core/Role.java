package com.flowcluster.core;

import java.util.Locale;
import java.util.Objects;

/**
 * Declared role of a runtime.
 *
 * <p>The role of an endpoint decides which connection policy governs relationships
 * involving it. Two roles are built in:
 * <ul>
 *   <li>{@link #MASTER} - coordinates the cluster and holds many workers</li>
 *   <li>{@link #WORKER} - executes work and belongs to at most one master</li>
 * </ul>
 *
 * <p>Other roles may be created with {@link #of(String)}; they are used to plug in
 * custom policies and to isolate test instances. Role names are case-insensitive and
 * stored in lower case.
 *
 * <pre>
 *     WORKER ──(connect, role check)──► MASTER
 *       ▲                                 │
 *       └──────(bulk connect, role check)─┘
 * </pre>
 *
 * @author flowcluster
 */
public record Role(String name) {

    public static final Role MASTER = new Role("master");

    public static final Role WORKER = new Role("worker");

    public Role {
        Objects.requireNonNull(name, "Role name cannot be null");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Role name cannot be blank");
        }
        name = name.toLowerCase(Locale.ROOT);
    }

    public static Role of(String name) {
        return new Role(name);
    }

    public boolean isMaster() {
        return equals(MASTER);
    }

    public boolean isWorker() {
        return equals(WORKER);
    }

    @Override
    public String toString() {
        return name;
    }
}
