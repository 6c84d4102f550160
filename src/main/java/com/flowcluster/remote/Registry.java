package com.flowcluster.remote;

import com.flowcluster.core.Endpoint;
import com.flowcluster.core.Role;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Authoritative table of the endpoints this runtime is connected to.
 *
 * <p>Reads never block: they are served from an immutable snapshot published through a
 * volatile field. Mutations serialize on a single lock and publish a new snapshot
 * holding both the records and the {@link TagIndex}, so a reader always sees records
 * and tags that agree with each other.
 *
 * <p>At most one record exists per endpoint.
 */
public class Registry {

    private static final Logger logger = LoggerFactory.getLogger(Registry.class);

    private record Snapshot(Map<Endpoint, ConnectionRecord> records, TagIndex tags) {
    }

    private static final Snapshot EMPTY = new Snapshot(Collections.emptyMap(), TagIndex.empty());

    private final ReentrantLock lock = new ReentrantLock();
    private volatile Snapshot snapshot = EMPTY;

    public boolean add(Endpoint endpoint, Role role) {
        return add(endpoint, role, Set.of());
    }

    /**
     * Record a connection.
     *
     * @return true if the endpoint was added, false if it already had a record
     */
    public boolean add(Endpoint endpoint, Role role, Collection<String> tags) {
        ConnectionRecord record = new ConnectionRecord(endpoint, role, Set.copyOf(tags));
        lock.lock();
        try {
            Snapshot current = snapshot;
            if (current.records().containsKey(endpoint)) {
                return false;
            }
            Map<Endpoint, ConnectionRecord> records = new TreeMap<>(current.records());
            records.put(endpoint, record);
            snapshot = new Snapshot(Collections.unmodifiableMap(records),
                    current.tags().add(endpoint, record.tags()));
        } finally {
            lock.unlock();
        }
        logger.debug("Registered {} as {} with tags {}", endpoint, role, record.tags());
        return true;
    }

    /**
     * Drop the record of {@code endpoint}.
     *
     * @return the removed record, or null if there was none
     */
    public ConnectionRecord remove(Endpoint endpoint) {
        ConnectionRecord removed;
        lock.lock();
        try {
            Snapshot current = snapshot;
            removed = current.records().get(endpoint);
            if (removed == null) {
                return null;
            }
            Map<Endpoint, ConnectionRecord> records = new TreeMap<>(current.records());
            records.remove(endpoint);
            snapshot = new Snapshot(Collections.unmodifiableMap(records), current.tags().remove(endpoint));
        } finally {
            lock.unlock();
        }
        logger.debug("Unregistered {}", endpoint);
        return removed;
    }

    /**
     * Drop every record.
     *
     * @return the records that were removed
     */
    public List<ConnectionRecord> removeAll() {
        lock.lock();
        try {
            List<ConnectionRecord> removed = new ArrayList<>(snapshot.records().values());
            snapshot = EMPTY;
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public List<ConnectionRecord> all() {
        return List.copyOf(snapshot.records().values());
    }

    public ConnectionRecord get(Endpoint endpoint) {
        return snapshot.records().get(endpoint);
    }

    public boolean connected(Endpoint endpoint) {
        return snapshot.records().containsKey(endpoint);
    }

    /**
     * Returns the connected endpoint with the master role, or null.
     */
    public Endpoint master() {
        for (ConnectionRecord record : snapshot.records().values()) {
            if (record.role().isMaster()) {
                return record.endpoint();
            }
        }
        return null;
    }

    public List<Endpoint> workers() {
        List<Endpoint> workers = new ArrayList<>();
        for (ConnectionRecord record : snapshot.records().values()) {
            if (record.role().isWorker()) {
                workers.add(record.endpoint());
            }
        }
        return workers;
    }

    /**
     * Tag index consistent with the current records.
     */
    public TagIndex tags() {
        return snapshot.tags();
    }

    /**
     * Tags of every connected worker, with an empty set for a worker without tags.
     */
    public Map<Endpoint, Set<String>> tagsOfAllWorkers() {
        Snapshot current = snapshot;
        Map<Endpoint, Set<String>> result = new LinkedHashMap<>();
        for (ConnectionRecord record : current.records().values()) {
            if (record.role().isWorker()) {
                result.put(record.endpoint(), current.tags().ofWorker(record.endpoint()));
            }
        }
        return Collections.unmodifiableMap(result);
    }

    public int size() {
        return snapshot.records().size();
    }
}
