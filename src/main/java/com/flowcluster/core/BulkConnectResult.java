package com.flowcluster.core;

import java.util.List;

/**
 * Combined outcome of connecting to many endpoints at once.
 *
 * <p>The result is ok only if every attempt succeeded. Otherwise {@link #failures()}
 * lists one entry per failed endpoint. Endpoints that connected stay connected.
 * The order of the failures is not defined.
 */
public record BulkConnectResult(List<Failure> failures) {

    private static final BulkConnectResult OK = new BulkConnectResult(List.of());

    public BulkConnectResult {
        failures = List.copyOf(failures);
    }

    public static BulkConnectResult ok() {
        return OK;
    }

    public static BulkConnectResult of(List<Failure> failures) {
        return failures.isEmpty() ? OK : new BulkConnectResult(failures);
    }

    public boolean isOk() {
        return failures.isEmpty();
    }

    /**
     * A failed attempt and its reason.
     */
    public record Failure(Endpoint endpoint, ConnectionError error) {

        @Override
        public String toString() {
            return "(" + endpoint + ", " + error + ")";
        }
    }

    @Override
    public String toString() {
        return isOk() ? "ok" : "error(" + failures + ")";
    }
}
