package com.flowcluster.integration;

import com.flowcluster.config.NodeConfig;
import com.flowcluster.core.Role;
import com.flowcluster.rpc.GrpcTransport;
import com.flowcluster.server.ClusterNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Helper class for managing cluster nodes with gRPC transport on loopback ports.
 */
public class GrpcTestCluster implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(GrpcTestCluster.class);

    private final List<ClusterNode> nodes = new ArrayList<>();
    private final int basePort;

    public GrpcTestCluster(int basePort) {
        this.basePort = basePort;
    }

    /**
     * Start a node listening on {@code basePort + offset}.
     */
    public ClusterNode start(int offset, Role role, Consumer<NodeConfig.Builder> customizer) {
        NodeConfig.Builder builder = NodeConfig.builder()
                .host("localhost")
                .port(basePort + offset)
                .role(role)
                .rpcTimeout(Duration.ofSeconds(2));
        customizer.accept(builder);
        NodeConfig config = builder.build();

        GrpcTransport transport = new GrpcTransport(
                config.getEndpoint(),
                config.getHost(),
                config.getPort(),
                config.getRpcTimeout(),
                config.getKeepAlive()
        );
        ClusterNode node = new ClusterNode(config, transport);
        node.start();
        nodes.add(node);

        logger.info("Started {} {} on port {}", role, config.getEndpoint(), config.getPort());
        return node;
    }

    public ClusterNode startMaster(int offset) {
        return start(offset, Role.MASTER, builder -> { });
    }

    public ClusterNode startWorker(int offset, String... tags) {
        return start(offset, Role.WORKER, builder -> {
            builder.shutdownWithMaster(false);
            for (String tag : tags) {
                builder.addTag(tag);
            }
        });
    }

    @Override
    public void close() {
        for (ClusterNode node : nodes) {
            try {
                node.stop();
            } catch (Exception e) {
                logger.warn("Error stopping {}", node.getId(), e);
            }
        }
        nodes.clear();
    }
}
