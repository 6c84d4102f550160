package com.flowcluster.remote;

import com.flowcluster.core.Endpoint;
import com.flowcluster.core.Role;

/**
 * Connection policy for one role.
 *
 * <p>A handler decides whether relationships with endpoints of a role are allowed
 * and cleans up after them. Each handler runs inside exactly one {@link HandlerServer},
 * which owns the policy state and invokes the callbacks below one at a time, never
 * concurrently. The state is only ever touched from inside these callbacks.
 *
 * <ul>
 *   <li>{@link #init()} - produce the initial state when the handler is bound</li>
 *   <li>{@link #acceptConnection} - accept or reject an endpoint; called for inbound
 *       handshakes and for the initiator's own side of an outbound connect</li>
 *   <li>{@link #removeConnection} - clean up after an explicit, locally initiated
 *       disconnect or a rolled back handshake</li>
 *   <li>{@link #remoteDown} - clean up after the counterpart became unreachable</li>
 * </ul>
 *
 * <p>Once a connection is accepted the handler server monitors the endpoint; its loss
 * is reported through {@link #remoteDown}. After {@link #removeConnection} no down
 * event is reported for that endpoint.
 *
 * @param <S> type of the policy state
 * @author flowcluster
 * @see HandlerServer
 * @see Dispatcher
 */
public interface ConnectionHandler<S> {

    /**
     * Creates the initial state. Called once, on the handler's own thread, when the
     * handler is bound.
     *
     * @return the initial state, may be null
     */
    default S init() {
        return null;
    }

    /**
     * Accepts or rejects a relationship with {@code endpoint}.
     *
     * @param endpoint the counterpart
     * @param role the role the counterpart declared
     * @param state current policy state
     * @return the decision together with the next state
     */
    Decision<S> acceptConnection(Endpoint endpoint, Role role, S state);

    /**
     * Removes a previously accepted relationship on request of the local runtime.
     *
     * @param endpoint the counterpart
     * @param state current policy state
     * @return the next state
     */
    S removeConnection(Endpoint endpoint, S state);

    /**
     * Reacts to the counterpart becoming unreachable.
     *
     * @param endpoint the counterpart that went down
     * @param state current policy state
     * @return the next state
     */
    S remoteDown(Endpoint endpoint, S state);
}
