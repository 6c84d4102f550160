package com.flowcluster.master;

import com.flowcluster.core.BulkConnectResult;
import com.flowcluster.core.ConnectResult;
import com.flowcluster.core.ConnectionError;
import com.flowcluster.core.Endpoint;
import com.flowcluster.core.Role;
import com.flowcluster.integration.LocalTestCluster;
import com.flowcluster.remote.ConnectionRecord;
import com.flowcluster.remote.MembershipEvent;
import com.flowcluster.rpc.LocalTransport;
import com.flowcluster.server.ClusterNode;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.awaitility.Awaitility.await;

/**
 * Master-side connection tests over the in-process transport.
 */
class WorkerConnectionTest {

    private LocalTestCluster cluster;
    private ClusterNode master;
    private WorkerConnection workers;

    @BeforeEach
    void setUp() {
        cluster = new LocalTestCluster();
        master = cluster.startMaster("master");
        workers = master.getWorkerConnection();
    }

    @AfterEach
    void tearDown() {
        cluster.close();
    }

    @Test
    @DisplayName("The master registers itself")
    void testMasterRegistersItself() {
        assertThat(master.getRegistry().master()).isEqualTo(master.getId());
        assertThat(workers.workers()).isEmpty();
    }

    @Test
    @DisplayName("Connecting a worker registers it with its tags")
    void testConnectWorker() {
        ClusterNode worker = cluster.startWorker("worker-1", "gpu", "ssd");

        ConnectResult result = workers.connect(worker.getId());

        assertThat(result).isEqualTo(ConnectResult.ok(Role.WORKER));
        assertThat(workers.connected(worker.getId())).isTrue();
        assertThat(master.getRemote().tags(worker.getId())).containsExactlyInAnyOrder("gpu", "ssd");
        assertThat(master.getRemote().withTag("gpu")).containsExactly(worker.getId());
        assertThat(worker.getMasterConnection().master()).isEqualTo(master.getId());
    }

    @Test
    @DisplayName("Connecting an already connected worker changes nothing")
    void testReconnectIsNoOp() {
        ClusterNode worker = cluster.startWorker("worker-1", "gpu");
        workers.connect(worker.getId());
        List<ConnectionRecord> before = workers.all();
        List<MembershipEvent> ups = new CopyOnWriteArrayList<>();
        workers.subscribeUp(ups::add);

        ConnectResult again = workers.connect(worker.getId());
        BulkConnectResult bulk = workers.connect(List.of(worker.getId()));

        assertThat(again.isOk()).isTrue();
        assertThat(bulk.isOk()).isTrue();
        assertThat(workers.all()).containsExactlyInAnyOrderElementsOf(before);
        // Answered after every broadcast queued before it
        master.getNotifier().subscriptionCount();
        assertThat(ups).isEmpty();
    }

    @Test
    @DisplayName("The master's own endpoint is refused as a worker")
    void testConnectSelfAsWorker() {
        ClusterNode worker = cluster.startWorker("worker-1");

        ConnectResult single = workers.connect(master.getId());
        BulkConnectResult bulk = workers.connect(List.of(master.getId(), worker.getId()));

        assertThat(single.error()).isEqualTo(ConnectionError.MODE_MISMATCH);
        assertThat(bulk.failures()).containsExactly(
                new BulkConnectResult.Failure(master.getId(), ConnectionError.MODE_MISMATCH));
        assertThat(workers.connected(worker.getId())).isTrue();
        assertThat(workers.workers()).containsExactly(worker.getId());
        assertThat(master.getRegistry().master()).isEqualTo(master.getId());
    }

    @Test
    @DisplayName("Workers without tags are listed with an empty tag set")
    void testUntaggedWorkerTags() {
        ClusterNode tagged = cluster.startWorker("worker-1", "gpu");
        ClusterNode untagged = cluster.startWorker("worker-2");
        workers.connect(List.of(tagged.getId(), untagged.getId()));

        Map<Endpoint, Set<String>> tags = master.getRemote().tags();

        assertThat(tags).containsOnlyKeys(tagged.getId(), untagged.getId());
        assertThat(tags.get(tagged.getId())).containsExactly("gpu");
        assertThat(tags.get(untagged.getId())).isEmpty();
    }

    @Test
    @DisplayName("Bulk connect reports every mismatched endpoint and keeps the good ones")
    void testBulkModeMismatch() {
        ClusterNode notWorker1 = cluster.start("node-1", Role.of("test"), builder -> { });
        ClusterNode worker2 = cluster.startWorker("node-2");
        ClusterNode notWorker3 = cluster.start("node-3", Role.MASTER, builder -> { });

        BulkConnectResult result = workers.connect(List.of(
                notWorker1.getId(), worker2.getId(), notWorker3.getId()));

        assertThat(result.isOk()).isFalse();
        assertThat(result.failures()).containsExactlyInAnyOrder(
                new BulkConnectResult.Failure(notWorker1.getId(), ConnectionError.MODE_MISMATCH),
                new BulkConnectResult.Failure(notWorker3.getId(), ConnectionError.MODE_MISMATCH));
        assertThat(workers.connected(worker2.getId())).isTrue();
        assertThat(workers.all()).extracting(ConnectionRecord::endpoint)
                .doesNotContain(notWorker1.getId(), notWorker3.getId());
    }

    @Test
    @DisplayName("Bulk connect to healthy workers succeeds")
    void testBulkConnect() {
        List<Endpoint> ids = List.of(
                cluster.startWorker("worker-1").getId(),
                cluster.startWorker("worker-2").getId(),
                cluster.startWorker("worker-3").getId());

        BulkConnectResult result = workers.connect(ids);

        assertThat(result).isEqualTo(BulkConnectResult.ok());
        assertThat(workers.workers()).containsExactlyInAnyOrderElementsOf(ids);
    }

    @Test
    @DisplayName("Unreachable workers are reported without rolling back the others")
    void testBulkUnreachable() {
        ClusterNode worker = cluster.startWorker("worker-1");
        Endpoint missing = Endpoint.of("missing");

        BulkConnectResult result = workers.connect(List.of(worker.getId(), missing));

        assertThat(result.failures()).containsExactly(
                new BulkConnectResult.Failure(missing, ConnectionError.UNREACHABLE));
        assertThat(workers.connected(worker.getId())).isTrue();
    }

    @Test
    @DisplayName("A worker with a different master is refused")
    void testWorkerHasMaster() {
        ClusterNode worker = cluster.startWorker("worker-1");
        ClusterNode otherMaster = cluster.startMaster("other-master");
        otherMaster.getWorkerConnection().connect(worker.getId());

        ConnectResult result = workers.connect(worker.getId());

        assertThat(result.error()).isEqualTo(ConnectionError.HAS_MASTER);
        assertThat(workers.connected(worker.getId())).isFalse();
    }

    @Test
    @DisplayName("Killing a worker notifies every subscriber once and unregisters only it")
    void testKillWorker() throws InterruptedException {
        ClusterNode w1 = cluster.startWorker("worker-1");
        ClusterNode w2 = cluster.startWorker("worker-2");
        workers.connect(List.of(w1.getId(), w2.getId()));

        List<MembershipEvent> first = new CopyOnWriteArrayList<>();
        List<MembershipEvent> second = new CopyOnWriteArrayList<>();
        workers.subscribeDown(first::add);
        workers.subscribeDown(second::add);

        LocalTransport.kill(w1.getId());

        await().atMost(1, TimeUnit.SECONDS).until(() -> first.size() == 1 && second.size() == 1);
        Thread.sleep(200);
        assertThat(first).containsExactly(MembershipEvent.down(w1.getId()));
        assertThat(second).containsExactly(MembershipEvent.down(w1.getId()));
        assertThat(workers.connected(w1.getId())).isFalse();
        assertThat(workers.connected(w2.getId())).isTrue();
        assertThat(master.getRegistry().tags().ofWorker(w1.getId())).isEmpty();
    }

    @Test
    @DisplayName("A killed worker's membership watch is dropped by the master")
    void testKilledWorkerWatchDropped() {
        int baseline = master.getNotifier().subscriptionCount();
        ClusterNode worker = cluster.startWorker("worker-1");
        workers.connect(worker.getId());

        await().atMost(1, TimeUnit.SECONDS)
                .until(() -> master.getNotifier().subscriptionCount() == baseline + 2);

        LocalTransport.kill(worker.getId());

        await().atMost(1, TimeUnit.SECONDS)
                .until(() -> master.getNotifier().subscriptionCount() == baseline);
    }

    @Test
    @DisplayName("A stopped worker's membership watch is dropped by the master")
    void testStoppedWorkerWatchDropped() {
        int baseline = master.getNotifier().subscriptionCount();
        ClusterNode worker = cluster.startWorker("worker-1");
        workers.connect(worker.getId());
        await().atMost(1, TimeUnit.SECONDS)
                .until(() -> master.getNotifier().subscriptionCount() == baseline + 2);

        worker.stop();

        await().atMost(1, TimeUnit.SECONDS)
                .until(() -> master.getNotifier().subscriptionCount() == baseline);
        await().atMost(1, TimeUnit.SECONDS).until(() -> !workers.connected(worker.getId()));
    }

    @Test
    @DisplayName("Up subscribers only hear about workers joining after they subscribed")
    void testNoRetroactiveUp() {
        ClusterNode w1 = cluster.startWorker("worker-1");
        workers.connect(w1.getId());

        List<MembershipEvent> ups = new CopyOnWriteArrayList<>();
        workers.subscribeUp(ups::add);
        ClusterNode w2 = cluster.startWorker("worker-2", "fast");
        workers.connect(w2.getId());

        await().atMost(1, TimeUnit.SECONDS).until(() -> ups.size() == 1);
        assertThat(ups.get(0)).isEqualTo(MembershipEvent.up(w2.getId(), Set.of("fast")));
    }

    @Test
    @DisplayName("An endpoint of the wrong role is never registered")
    void testWrongRoleNeverRegistered() throws InterruptedException {
        ClusterNode other = cluster.start("not-a-worker", Role.of("test"), builder -> { });

        ConnectResult result = workers.connect(other.getId());
        Thread.sleep(200);

        assertThat(result.error()).isEqualTo(ConnectionError.MODE_MISMATCH);
        assertThat(workers.connected(other.getId())).isFalse();
    }

    @Test
    @DisplayName("Disconnecting a worker unregisters it on the master and frees the worker")
    void testDisconnect() {
        ClusterNode worker = cluster.startWorker("worker-1");
        workers.connect(worker.getId());
        List<MembershipEvent> downs = new CopyOnWriteArrayList<>();
        workers.subscribeDown(downs::add);

        workers.disconnect(worker.getId());

        assertThat(workers.connected(worker.getId())).isFalse();
        assertThat(worker.getMasterConnection().master()).isNull();
        await().atMost(1, TimeUnit.SECONDS).until(() -> downs.size() == 1);
    }

    @Test
    @DisplayName("Configured workers are connected on bootstrap")
    void testBootstrap() {
        ClusterNode w1 = cluster.startWorker("worker-1");
        ClusterNode w2 = cluster.startWorker("worker-2");
        ClusterNode configured = cluster.start("configured-master", Role.MASTER, builder -> builder
                .addWorker(w1.getId())
                .addWorker(w2.getId())
                .addWorker(Endpoint.of("missing")));

        configured.bootstrap();

        assertThat(configured.getRegistry().workers()).containsExactlyInAnyOrder(w1.getId(), w2.getId());
        assertThat(configured.isRunning()).isTrue();
    }

    @Test
    @DisplayName("A master configured to stop with its workers stops when one goes down")
    void testShutdownWithWorkers() {
        ClusterNode strict = cluster.start("strict-master", Role.MASTER,
                builder -> builder.shutdownWithWorkers(true));
        ClusterNode worker = cluster.startWorker("worker-1");
        strict.getWorkerConnection().connect(worker.getId());

        LocalTransport.kill(worker.getId());

        await().atMost(1, TimeUnit.SECONDS).until(() -> !strict.isRunning());
        assertThat(master.isRunning()).isTrue();
    }
}
