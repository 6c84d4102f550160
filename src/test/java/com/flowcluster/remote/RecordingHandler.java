package com.flowcluster.remote;

import com.flowcluster.core.ConnectionError;
import com.flowcluster.core.Endpoint;
import com.flowcluster.core.Role;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Test handler keeping the set of accepted endpoints as its state and recording every
 * callback as {@code "<op> <endpoint>"}.
 */
public class RecordingHandler implements ConnectionHandler<Set<Endpoint>> {

    private final ConnectionError rejectWith;
    private final List<String> calls = new CopyOnWriteArrayList<>();

    private RecordingHandler(ConnectionError rejectWith) {
        this.rejectWith = rejectWith;
    }

    public static RecordingHandler accepting() {
        return new RecordingHandler(null);
    }

    public static RecordingHandler rejecting(ConnectionError reason) {
        return new RecordingHandler(reason);
    }

    @Override
    public Set<Endpoint> init() {
        calls.add("init");
        return new HashSet<>();
    }

    @Override
    public Decision<Set<Endpoint>> acceptConnection(Endpoint endpoint, Role role, Set<Endpoint> state) {
        calls.add("accept " + endpoint);
        if (rejectWith != null) {
            return Decision.reject(rejectWith, state);
        }
        if (state.contains(endpoint)) {
            return Decision.reject(ConnectionError.ALREADY_CONNECTED, state);
        }
        state.add(endpoint);
        return Decision.accept(state);
    }

    @Override
    public Set<Endpoint> removeConnection(Endpoint endpoint, Set<Endpoint> state) {
        calls.add("remove " + endpoint);
        state.remove(endpoint);
        return state;
    }

    @Override
    public Set<Endpoint> remoteDown(Endpoint endpoint, Set<Endpoint> state) {
        calls.add("down " + endpoint);
        state.remove(endpoint);
        return state;
    }

    public List<String> calls() {
        return calls;
    }
}
