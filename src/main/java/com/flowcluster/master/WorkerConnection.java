package com.flowcluster.master;

import com.flowcluster.core.BulkConnectResult;
import com.flowcluster.core.ConnectResult;
import com.flowcluster.core.ConnectionError;
import com.flowcluster.core.Endpoint;
import com.flowcluster.core.Role;
import com.flowcluster.remote.ConnectionRecord;
import com.flowcluster.remote.HandlerReply;
import com.flowcluster.remote.MembershipListener;
import com.flowcluster.remote.Notifier;
import com.flowcluster.remote.Registry;
import com.flowcluster.remote.Remote;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Master-side management of worker connections.
 *
 * <p>Connecting to a worker the master is already connected to succeeds without
 * changing anything. Connecting to many workers attempts every one of them
 * concurrently; workers that connected stay connected even when others fail.
 */
public class WorkerConnection {

    private static final Logger logger = LoggerFactory.getLogger(WorkerConnection.class);

    private final Remote remote;
    private final Registry registry;
    private final Notifier notifier;
    private final List<Endpoint> configuredWorkers;
    private final ExecutorService connectExecutor;

    public WorkerConnection(Remote remote, Registry registry, Notifier notifier, List<Endpoint> configuredWorkers) {
        this.remote = remote;
        this.registry = registry;
        this.notifier = notifier;
        this.configuredWorkers = List.copyOf(configuredWorkers);
        this.connectExecutor = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "worker-connect-" + remote.self());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Connect to every worker of the node configuration.
     */
    public BulkConnectResult connect() {
        if (configuredWorkers.isEmpty()) {
            return BulkConnectResult.ok();
        }
        return connect(configuredWorkers);
    }

    public ConnectResult connect(Endpoint worker) {
        ConnectionRecord record = registry.get(worker);
        if (record != null && record.role().isWorker()) {
            return ConnectResult.ok(Role.WORKER);
        }
        ConnectResult result = remote.connect(worker, Role.WORKER);
        if (!result.isOk() && result.error().equals(ConnectionError.ALREADY_CONNECTED)) {
            return ConnectResult.ok(Role.WORKER);
        }
        return result;
    }

    /**
     * Connect to every endpoint of {@code workers} concurrently and wait for all attempts.
     *
     * @return ok if every attempt succeeded, otherwise one failure per failed endpoint
     */
    public BulkConnectResult connect(Collection<Endpoint> workers) {
        Map<Endpoint, CompletableFuture<ConnectResult>> attempts = new HashMap<>();
        for (Endpoint worker : new LinkedHashSet<>(workers)) {
            attempts.put(worker, CompletableFuture.supplyAsync(() -> connect(worker), connectExecutor));
        }
        CompletableFuture.allOf(attempts.values().toArray(new CompletableFuture[0])).join();

        List<BulkConnectResult.Failure> failures = new ArrayList<>();
        for (Map.Entry<Endpoint, CompletableFuture<ConnectResult>> attempt : attempts.entrySet()) {
            ConnectResult result = attempt.getValue().join();
            if (!result.isOk()) {
                failures.add(new BulkConnectResult.Failure(attempt.getKey(), result.error()));
            }
        }

        if (!failures.isEmpty()) {
            logger.info("Connected to {} of {} workers, failed: {}",
                    attempts.size() - failures.size(), attempts.size(), failures);
        }
        return BulkConnectResult.of(failures);
    }

    public HandlerReply disconnect(Endpoint worker) {
        return remote.disconnect(worker, Role.WORKER);
    }

    public void subscribeUp(MembershipListener listener) {
        notifier.subscribeUp(listener);
    }

    public void subscribeDown(MembershipListener listener) {
        notifier.subscribeDown(listener);
    }

    public void unsubscribeUp(MembershipListener listener) {
        notifier.unsubscribeUp(listener);
    }

    public void unsubscribeDown(MembershipListener listener) {
        notifier.unsubscribeDown(listener);
    }

    public List<ConnectionRecord> all() {
        return registry.all();
    }

    public List<Endpoint> workers() {
        return registry.workers();
    }

    public boolean connected(Endpoint worker) {
        return registry.connected(worker);
    }

    public void stop() {
        connectExecutor.shutdownNow();
    }
}
