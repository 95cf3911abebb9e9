package io.hearthwarrio.remoteui.core;

import java.time.Duration;

/**
 * Default time bounds.
 */
public final class RpcTimeouts {

    /**
     * Round-trip ceiling of the RPC channel. Waits must be strictly shorter.
     */
    public static final Duration DEFAULT_RPC_TIMEOUT = Duration.ofSeconds(60);

    /**
     * Default bound for wait-style operations.
     */
    public static final Duration DEFAULT_UI_WAIT_TIME = Duration.ofSeconds(10);

    private RpcTimeouts() {
        // constants
    }
}
