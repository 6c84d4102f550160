package com.flowcluster.remote;

import com.flowcluster.core.ConnectionError;
import com.flowcluster.rpc.proto.DispatchResponse;

/**
 * Reply of a handler to a {@link HandlerMessage}: ok, or an error value.
 */
public record HandlerReply(ConnectionError error) {

    private static final HandlerReply OK = new HandlerReply(null);

    public static HandlerReply ok() {
        return OK;
    }

    public static HandlerReply error(ConnectionError error) {
        return new HandlerReply(error);
    }

    public boolean isOk() {
        return error == null;
    }

    public DispatchResponse toProto() {
        return isOk()
                ? DispatchResponse.newBuilder().setOk(true).build()
                : DispatchResponse.newBuilder().setOk(false).setError(error.code()).build();
    }

    public static HandlerReply fromProto(DispatchResponse response) {
        return response.getOk() ? OK : error(ConnectionError.of(response.getError()));
    }

    @Override
    public String toString() {
        return isOk() ? "ok" : "error(" + error + ")";
    }
}
