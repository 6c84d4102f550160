package com.flowcluster.server;

import com.flowcluster.config.NodeConfig;
import com.flowcluster.rpc.GrpcTransport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Cluster server main class.
 *
 * Starts a single master or worker runtime with gRPC transport.
 *
 * Usage:
 *   java -jar flowcluster.jar --role=master --port=9000 --workers=localhost:9101
 *   java -jar flowcluster.jar --role=worker --port=9101 --master=localhost:9000 --tags=gpu
 */
public class ClusterServer {

    private static final Logger logger = LoggerFactory.getLogger(ClusterServer.class);

    /**
     * Exit status of a runtime that stopped because its master (or a worker) went down.
     */
    public static final int EXIT_REMOTE_SHUTDOWN = 3;

    private final NodeConfig config;
    private volatile ClusterNode node;

    public ClusterServer(NodeConfig config) {
        this.config = config;
    }

    /**
     * Start the runtime and make the configured connections.
     */
    public void start() {
        logger.info("Starting cluster server with config: {}", config);

        GrpcTransport transport = new GrpcTransport(
                config.getEndpoint(),
                config.getHost(),
                config.getPort(),
                config.getRpcTimeout(),
                config.getKeepAlive()
        );

        node = new ClusterNode(config, transport);
        node.setShutdownAction(() -> {
            stop();
            System.exit(EXIT_REMOTE_SHUTDOWN);
        });
        node.start();
        node.bootstrap();

        logger.info("Cluster server started: {} ({}) listening on port {}",
                config.getEndpoint(), config.getRole(), config.getPort());
    }

    public synchronized void stop() {
        if (node == null) {
            return;
        }
        node.stop();
        node = null;
        notifyAll();
        logger.info("Cluster server stopped: {}", config.getEndpoint());
    }

    public ClusterNode getNode() {
        return node;
    }

    /**
     * Block until the server stops.
     */
    public void awaitTermination() throws InterruptedException {
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            logger.info("Shutdown signal received");
            stop();
        }));

        synchronized (this) {
            while (node != null) {
                wait(1000);
            }
        }
    }

    public static void main(String[] args) {
        if (args.length == 0) {
            printUsage();
            System.exit(1);
        }

        try {
            NodeConfig config = NodeConfig.fromArgs(args);
            ClusterServer server = new ClusterServer(config);

            server.start();
            server.awaitTermination();

        } catch (IllegalArgumentException | IllegalStateException e) {
            System.err.println(e.getMessage());
            printUsage();
            System.exit(1);
        } catch (Exception e) {
            logger.error("Failed to start cluster server", e);
            System.exit(1);
        }
    }

    private static void printUsage() {
        System.out.println("Usage: java -jar flowcluster.jar [options]");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --role=<role>                    master or worker (required)");
        System.out.println("  --id=<endpoint>                  Endpoint id (default: host:port)");
        System.out.println("  --host=<host>                    Advertised host (default: localhost)");
        System.out.println("  --port=<port>                    Port to listen on (default: 9000)");
        System.out.println("  --master=<host:port>             Master a worker connects to on start");
        System.out.println("  --workers=<host:port,...>        Workers a master connects to on start");
        System.out.println("  --tags=<tag,...>                 Tags of a worker");
        System.out.println("  --shutdown-with-master=<bool>    Worker stops when its master goes down (default: true)");
        System.out.println("  --shutdown-with-workers=<bool>   Master stops when a worker goes down (default: false)");
        System.out.println("  --rpc-timeout-ms=<ms>            Bound on every remote call (default: 5000)");
        System.out.println("  --keepalive-ms=<ms>              Transport keepalive interval (default: 10000)");
        System.out.println();
        System.out.println("Example:");
        System.out.println("  java -jar flowcluster.jar --role=master --port=9000");
        System.out.println("  java -jar flowcluster.jar --role=worker --port=9101 \\");
        System.out.println("      --master=localhost:9000 --tags=gpu");
    }
}
