package com.flowcluster.remote;

import com.flowcluster.core.Endpoint;
import com.flowcluster.core.Role;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

import static org.assertj.core.api.Assertions.assertThat;

class RegistryTest {

    private final Endpoint master = Endpoint.of("master");
    private final Endpoint w1 = Endpoint.of("worker-1");
    private final Endpoint w2 = Endpoint.of("worker-2");

    private Registry registry;

    @BeforeEach
    void setUp() {
        registry = new Registry();
    }

    @Test
    @DisplayName("An endpoint is recorded at most once")
    void testNoDuplicates() {
        assertThat(registry.add(w1, Role.WORKER, Set.of("a"))).isTrue();
        assertThat(registry.add(w1, Role.WORKER, Set.of("b"))).isFalse();

        assertThat(registry.all()).hasSize(1);
        assertThat(registry.get(w1).tags()).containsExactly("a");
    }

    @Test
    @DisplayName("Master and workers are told apart by role")
    void testRoles() {
        registry.add(master, Role.MASTER);
        registry.add(w1, Role.WORKER);
        registry.add(w2, Role.WORKER);
        registry.add(Endpoint.of("probe"), Role.of("test"));

        assertThat(registry.master()).isEqualTo(master);
        assertThat(registry.workers()).containsExactlyInAnyOrder(w1, w2);
        assertThat(registry.connected(Endpoint.of("probe"))).isTrue();
    }

    @Test
    @DisplayName("No master is reported when none is connected")
    void testNoMaster() {
        registry.add(w1, Role.WORKER);

        assertThat(registry.master()).isNull();
    }

    @Test
    @DisplayName("Tags follow the records they belong to")
    void testTagsFollowRecords() {
        registry.add(w1, Role.WORKER, List.of("a", "b"));
        registry.add(w2, Role.WORKER, List.of("b"));

        assertThat(registry.tags().ofWorker(w1)).containsExactlyInAnyOrder("a", "b");
        assertThat(registry.tags().workersWith("a")).contains(w1);

        ConnectionRecord removed = registry.remove(w1);

        assertThat(removed.role()).isEqualTo(Role.WORKER);
        assertThat(registry.connected(w1)).isFalse();
        assertThat(registry.tags().workersWith("b")).containsExactly(w2);
        assertThat(registry.tags().ofWorker(w1)).isEmpty();
        assertThat(registry.remove(w1)).isNull();
    }

    @Test
    @DisplayName("Every worker has a tag entry, even without tags")
    void testTagsOfAllWorkers() {
        registry.add(master, Role.MASTER);
        registry.add(w1, Role.WORKER, List.of("gpu"));
        registry.add(w2, Role.WORKER);

        assertThat(registry.tagsOfAllWorkers()).containsOnlyKeys(w1, w2);
        assertThat(registry.tagsOfAllWorkers().get(w1)).containsExactly("gpu");
        assertThat(registry.tagsOfAllWorkers().get(w2)).isEmpty();
        assertThat(registry.tags().tagged()).containsOnlyKeys(w1);
    }

    @Test
    @DisplayName("removeAll clears records and tags")
    void testRemoveAll() {
        registry.add(master, Role.MASTER);
        registry.add(w1, Role.WORKER, List.of("a"));

        assertThat(registry.removeAll()).hasSize(2);
        assertThat(registry.all()).isEmpty();
        assertThat(registry.tags().isEmpty()).isTrue();
    }

    @Test
    @DisplayName("Concurrent adds of distinct endpoints are all kept")
    void testConcurrentAdds() {
        List<CompletableFuture<Boolean>> adds = new ArrayList<>();
        for (int i = 0; i < 50; i++) {
            Endpoint endpoint = Endpoint.of("worker-" + i);
            Set<String> tags = Set.of("t" + (i % 2));
            adds.add(CompletableFuture.supplyAsync(() -> registry.add(endpoint, Role.WORKER, tags)));
        }
        adds.forEach(CompletableFuture::join);

        assertThat(registry.size()).isEqualTo(50);
        assertThat(registry.tags().workersWith("t0")).hasSize(25);
        assertThat(registry.tags().workersWith("t1")).hasSize(25);
    }
}
