package com.flowcluster.remote;

import com.flowcluster.core.ConnectionError;

import java.util.Objects;

/**
 * Result of {@link ConnectionHandler#acceptConnection}: accept or reject, plus the
 * handler's next state.
 *
 * @param reason null when accepted, the rejection reason otherwise
 * @param state the next policy state
 * @param <S> type of the policy state
 */
public record Decision<S>(ConnectionError reason, S state) {

    public static <S> Decision<S> accept(S state) {
        return new Decision<>(null, state);
    }

    public static <S> Decision<S> reject(ConnectionError reason, S state) {
        return new Decision<>(Objects.requireNonNull(reason, "reason"), state);
    }

    public boolean accepted() {
        return reason == null;
    }
}
