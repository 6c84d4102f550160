package com.flowcluster.remote;

import com.flowcluster.core.Endpoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class TagIndexTest {

    private final Endpoint w1 = Endpoint.of("worker-1");
    private final Endpoint w2 = Endpoint.of("worker-2");

    @Test
    @DisplayName("Tags are indexed in both directions")
    void testAddAndQuery() {
        TagIndex index = TagIndex.empty().add(w1, List.of("a", "b"));

        assertThat(index.ofWorker(w1)).containsExactlyInAnyOrder("a", "b");
        assertThat(index.workersWith("a")).contains(w1);
        assertThat(index.workersWith("c")).isEmpty();
        assertThat(index.ofWorker(w2)).isEmpty();
    }

    @Test
    @DisplayName("A tag shared by several workers lists all of them")
    void testSharedTag() {
        TagIndex index = TagIndex.empty()
                .add(w1, List.of("gpu"))
                .add(w2, List.of("gpu", "ssd"));

        assertThat(index.workersWith("gpu")).containsExactlyInAnyOrder(w1, w2);
        assertThat(index.tagged()).containsOnlyKeys(w1, w2);
        assertThat(index.tagged().get(w2)).containsExactlyInAnyOrder("gpu", "ssd");
    }

    @Test
    @DisplayName("Removing a worker drops it from every tag")
    void testRemove() {
        TagIndex index = TagIndex.empty()
                .add(w1, List.of("gpu"))
                .add(w2, List.of("gpu", "ssd"))
                .remove(w2);

        assertThat(index.workersWith("gpu")).containsExactly(w1);
        assertThat(index.workersWith("ssd")).isEmpty();
        assertThat(index.ofWorker(w2)).isEmpty();
    }

    @Test
    @DisplayName("Updates leave earlier indexes untouched")
    void testImmutable() {
        TagIndex before = TagIndex.empty().add(w1, Set.of("a"));
        TagIndex after = before.add(w2, Set.of("a")).remove(w1);

        assertThat(before.workersWith("a")).containsExactly(w1);
        assertThat(after.workersWith("a")).containsExactly(w2);
        assertThat(TagIndex.empty().add(w1, Set.of()).isEmpty()).isTrue();
    }
}
