package io.hearthwarrio.remoteui.device;

/**
 * Controls how much of each remote call should be logged.
 */
public enum RpcLogDetail {

    /**
     * Operation name and result only.
     */
    NONE,

    /**
     * Operation name, target selector and result.
     */
    SELECTOR,

    /**
     * Operation name, all parameters and result.
     */
    FULL
}
