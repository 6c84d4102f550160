package com.flowcluster.config;

import com.flowcluster.core.Endpoint;
import com.flowcluster.core.Role;

import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Configuration for a cluster runtime.
 */
public class NodeConfig {

    private final Endpoint endpoint;
    private final String host;
    private final int port;
    private final Role role;
    private final Endpoint master;
    private final List<Endpoint> workers;
    private final Set<String> tags;
    private final boolean shutdownWithMaster;
    private final boolean shutdownWithWorkers;
    private final Duration rpcTimeout;
    private final Duration keepAlive;

    private NodeConfig(Builder builder) {
        this.host = builder.host;
        this.port = builder.port;
        this.endpoint = builder.endpoint != null ? builder.endpoint : Endpoint.of(builder.host, builder.port);
        this.role = builder.role;
        this.master = builder.master;
        this.workers = List.copyOf(builder.workers);
        this.tags = Set.copyOf(builder.tags);
        this.shutdownWithMaster = builder.shutdownWithMaster;
        this.shutdownWithWorkers = builder.shutdownWithWorkers;
        this.rpcTimeout = builder.rpcTimeout;
        this.keepAlive = builder.keepAlive;
    }

    public Endpoint getEndpoint() {
        return endpoint;
    }

    public String getHost() {
        return host;
    }

    public int getPort() {
        return port;
    }

    public Role getRole() {
        return role;
    }

    /**
     * Master a worker connects to on start, or null.
     */
    public Endpoint getMaster() {
        return master;
    }

    /**
     * Workers a master connects to on start.
     */
    public List<Endpoint> getWorkers() {
        return workers;
    }

    public Set<String> getTags() {
        return tags;
    }

    public boolean isShutdownWithMaster() {
        return shutdownWithMaster;
    }

    public boolean isShutdownWithWorkers() {
        return shutdownWithWorkers;
    }

    public Duration getRpcTimeout() {
        return rpcTimeout;
    }

    public Duration getKeepAlive() {
        return keepAlive;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Parse command line arguments into NodeConfig.
     *
     * Expected format:
     *   --role=worker --port=9101 --master=localhost:9000 --tags=gpu,ssd
     *   --role=master --port=9000 --workers=localhost:9101,localhost:9102
     */
    public static NodeConfig fromArgs(String[] args) {
        Builder builder = builder();

        for (String arg : args) {
            if (arg.startsWith("--id=")) {
                builder.endpoint(Endpoint.of(arg.substring(5)));
            } else if (arg.startsWith("--host=")) {
                builder.host(arg.substring(7));
            } else if (arg.startsWith("--port=")) {
                builder.port(Integer.parseInt(arg.substring(7)));
            } else if (arg.startsWith("--role=")) {
                builder.role(Role.of(arg.substring(7)));
            } else if (arg.startsWith("--master=")) {
                String master = arg.substring(9);
                if (!master.isEmpty()) {
                    builder.master(Endpoint.of(master));
                }
            } else if (arg.startsWith("--workers=")) {
                // Format: localhost:9101,localhost:9102
                for (String worker : splitList(arg.substring(10))) {
                    builder.addWorker(Endpoint.of(worker));
                }
            } else if (arg.startsWith("--tags=")) {
                for (String tag : splitList(arg.substring(7))) {
                    builder.addTag(tag);
                }
            } else if (arg.startsWith("--shutdown-with-master=")) {
                builder.shutdownWithMaster(Boolean.parseBoolean(arg.substring(23)));
            } else if (arg.startsWith("--shutdown-with-workers=")) {
                builder.shutdownWithWorkers(Boolean.parseBoolean(arg.substring(24)));
            } else if (arg.startsWith("--rpc-timeout-ms=")) {
                builder.rpcTimeout(Duration.ofMillis(Long.parseLong(arg.substring(17))));
            } else if (arg.startsWith("--keepalive-ms=")) {
                builder.keepAlive(Duration.ofMillis(Long.parseLong(arg.substring(15))));
            } else {
                throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }

        return builder.build();
    }

    private static List<String> splitList(String value) {
        List<String> items = new ArrayList<>();
        for (String item : value.split(",")) {
            if (!item.isBlank()) {
                items.add(item.trim());
            }
        }
        return items;
    }

    @Override
    public String toString() {
        return "NodeConfig{" +
                "endpoint=" + endpoint +
                ", role=" + role +
                ", master=" + master +
                ", workers=" + workers +
                ", tags=" + tags +
                ", shutdownWithMaster=" + shutdownWithMaster +
                ", shutdownWithWorkers=" + shutdownWithWorkers +
                ", rpcTimeout=" + rpcTimeout +
                '}';
    }

    public static class Builder {
        private Endpoint endpoint;
        private String host = "localhost";
        private int port = 9000;
        private Role role;
        private Endpoint master;
        private final List<Endpoint> workers = new ArrayList<>();
        private final Set<String> tags = new LinkedHashSet<>();
        private boolean shutdownWithMaster = true;
        private boolean shutdownWithWorkers = false;
        private Duration rpcTimeout = Duration.ofSeconds(5);
        private Duration keepAlive = Duration.ofSeconds(10);

        /**
         * Override the endpoint id; defaults to {@code host:port}.
         */
        public Builder endpoint(Endpoint endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = Endpoint.of(endpoint);
            return this;
        }

        public Builder host(String host) {
            this.host = host;
            return this;
        }

        public Builder port(int port) {
            this.port = port;
            return this;
        }

        public Builder role(Role role) {
            this.role = role;
            return this;
        }

        public Builder master(Endpoint master) {
            this.master = master;
            return this;
        }

        public Builder addWorker(Endpoint worker) {
            this.workers.add(worker);
            return this;
        }

        public Builder addTag(String tag) {
            this.tags.add(tag);
            return this;
        }

        public Builder tags(Set<String> tags) {
            this.tags.clear();
            this.tags.addAll(tags);
            return this;
        }

        public Builder shutdownWithMaster(boolean shutdownWithMaster) {
            this.shutdownWithMaster = shutdownWithMaster;
            return this;
        }

        public Builder shutdownWithWorkers(boolean shutdownWithWorkers) {
            this.shutdownWithWorkers = shutdownWithWorkers;
            return this;
        }

        public Builder rpcTimeout(Duration rpcTimeout) {
            this.rpcTimeout = rpcTimeout;
            return this;
        }

        public Builder keepAlive(Duration keepAlive) {
            this.keepAlive = keepAlive;
            return this;
        }

        public NodeConfig build() {
            if (role == null) {
                throw new IllegalStateException("role is required");
            }
            if (port < 0 || port > 65535) {
                throw new IllegalStateException("port out of range: " + port);
            }
            if (rpcTimeout.isNegative() || rpcTimeout.isZero()) {
                throw new IllegalStateException("rpcTimeout must be positive");
            }
            return new NodeConfig(this);
        }
    }
}
