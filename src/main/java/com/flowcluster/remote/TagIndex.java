package com.flowcluster.remote;

import com.flowcluster.core.Endpoint;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Immutable two-way index between worker endpoints and their tags.
 *
 * <p>Every update returns a new index. The {@link Registry} swaps its index together
 * with its records, so readers never see one without the other.
 */
public final class TagIndex {

    private static final TagIndex EMPTY = new TagIndex(Map.of(), Map.of());

    private final Map<String, Set<Endpoint>> byTag;
    private final Map<Endpoint, Set<String>> byEndpoint;

    private TagIndex(Map<String, Set<Endpoint>> byTag, Map<Endpoint, Set<String>> byEndpoint) {
        this.byTag = byTag;
        this.byEndpoint = byEndpoint;
    }

    public static TagIndex empty() {
        return EMPTY;
    }

    /**
     * Returns an index where {@code endpoint} additionally carries {@code tags}.
     */
    public TagIndex add(Endpoint endpoint, Collection<String> tags) {
        if (tags.isEmpty()) {
            return this;
        }
        Map<String, Set<Endpoint>> nextByTag = new HashMap<>(byTag);
        Map<Endpoint, Set<String>> nextByEndpoint = new HashMap<>(byEndpoint);

        Set<String> endpointTags = new HashSet<>(byEndpoint.getOrDefault(endpoint, Set.of()));
        for (String tag : tags) {
            endpointTags.add(tag);
            Set<Endpoint> endpoints = new HashSet<>(byTag.getOrDefault(tag, Set.of()));
            endpoints.add(endpoint);
            nextByTag.put(tag, Set.copyOf(endpoints));
        }
        nextByEndpoint.put(endpoint, Set.copyOf(endpointTags));

        return new TagIndex(Map.copyOf(nextByTag), Map.copyOf(nextByEndpoint));
    }

    /**
     * Returns an index without any tag of {@code endpoint}.
     */
    public TagIndex remove(Endpoint endpoint) {
        Set<String> tags = byEndpoint.get(endpoint);
        if (tags == null) {
            return this;
        }
        Map<String, Set<Endpoint>> nextByTag = new HashMap<>(byTag);
        for (String tag : tags) {
            Set<Endpoint> endpoints = new HashSet<>(byTag.get(tag));
            endpoints.remove(endpoint);
            if (endpoints.isEmpty()) {
                nextByTag.remove(tag);
            } else {
                nextByTag.put(tag, Set.copyOf(endpoints));
            }
        }
        Map<Endpoint, Set<String>> nextByEndpoint = new HashMap<>(byEndpoint);
        nextByEndpoint.remove(endpoint);

        return new TagIndex(Map.copyOf(nextByTag), Map.copyOf(nextByEndpoint));
    }

    public Set<Endpoint> workersWith(String tag) {
        return byTag.getOrDefault(tag, Set.of());
    }

    public Set<String> ofWorker(Endpoint endpoint) {
        return byEndpoint.getOrDefault(endpoint, Set.of());
    }

    /**
     * Tags of every endpoint carrying at least one tag. Untagged workers are absent,
     * see {@link Registry#tagsOfAllWorkers()}.
     */
    public Map<Endpoint, Set<String>> tagged() {
        return Collections.unmodifiableMap(byEndpoint);
    }

    public boolean isEmpty() {
        return byEndpoint.isEmpty();
    }

    @Override
    public String toString() {
        return "TagIndex" + byEndpoint;
    }
}
