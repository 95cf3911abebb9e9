package io.hearthwarrio.remoteui.allure;

import io.hearthwarrio.remoteui.device.RpcCallLogger;
import io.hearthwarrio.remoteui.device.RpcLogDetail;

/**
 * Factory methods for Allure-related RemoteUi loggers.
 * <p>
 * This class lives in the remoteui-allure module to avoid leaking Allure
 * dependencies into remoteui-core or remoteui-device.
 */
public final class RemoteUiAllureLoggers {

    private RemoteUiAllureLoggers() {
        // utility class
    }

    /**
     * Creates an Allure logger that records every call with its target selector.
     */
    public static RpcCallLogger remoteCalls() {
        return new AllureRpcCallLogger(RpcLogDetail.SELECTOR, false);
    }

    /**
     * Creates an Allure logger with explicit detail and failure filter.
     */
    public static RpcCallLogger remoteCalls(RpcLogDetail detail, boolean failedCallsOnly) {
        return new AllureRpcCallLogger(detail, failedCallsOnly);
    }
}
