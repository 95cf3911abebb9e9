package io.hearthwarrio.remoteui.device;

import java.util.List;

/**
 * Receives every completed remote call.
 * <p>
 * Implementations may log to stdout, Allure, files, etc.
 * <p>
 * Note: {@link #detail()} is used to decide whether call parameters are passed at all.
 */
@FunctionalInterface
public interface RpcCallLogger {

    /**
     * Called after the remote service returned.
     *
     * @param method remote operation name
     * @param params positional parameters; empty when {@link #detail()} is {@link RpcLogDetail#NONE}
     * @param result raw result (may be null)
     */
    void logCall(String method, List<Object> params, Object result);

    /**
     * Declares how much call info this logger needs.
     */
    default RpcLogDetail detail() {
        return RpcLogDetail.FULL;
    }

    /**
     * Called when a caller uses a deprecated argument.
     */
    default void logDeprecation(String message) {
        System.err.println("[RemoteUi] DEPRECATED: " + message);
    }
}
