package io.hearthwarrio.remoteui.device;

import io.hearthwarrio.remoteui.core.Criteria;
import io.hearthwarrio.remoteui.core.RemoteAutomationService;
import io.hearthwarrio.remoteui.core.RpcTimeouts;
import io.hearthwarrio.remoteui.core.Selector;
import io.hearthwarrio.remoteui.core.TimeoutGuard;

import java.time.Duration;
import java.util.Objects;

/**
 * Entry point: binds a connected {@link RemoteAutomationService} to the handle API.
 * <p>
 * Typical flow:
 * <pre>
 * RemoteUiDevice device = new RemoteUiDevice(service).logCalls();
 *
 * UiObject title = device.ui(Criteria.text("Network &amp; internet"));
 * title.waitFor().assertExists("Settings did not open");
 * title.parent().click().perform();
 * </pre>
 * <p>
 * Handles read the configuration of this device at call time, so changes made here apply to handles created earlier.
 * Instances are not thread-safe.
 */
public class RemoteUiDevice {

    private final AutomationRpc rpc;

    private Duration rpcTimeout = RpcTimeouts.DEFAULT_RPC_TIMEOUT;
    private TimeoutGuard timeoutGuard = new TimeoutGuard(RpcTimeouts.DEFAULT_RPC_TIMEOUT);
    private Duration uiWaitTime = RpcTimeouts.DEFAULT_UI_WAIT_TIME;

    /**
     * Default raise-on-missing mode of root handles created by {@link #ui(Criteria)}.
     */
    private boolean raiseOnMissing = false;

    /**
     * Mutable to support runtime overrides and DSL sugar.
     */
    private RpcCallLogger logger;

    public RemoteUiDevice(RemoteAutomationService service) {
        this(service, null);
    }

    public RemoteUiDevice(RemoteAutomationService service, RpcCallLogger logger) {
        this.rpc = new AutomationRpc(Objects.requireNonNull(service, "service must not be null"), this);
        this.logger = logger;
    }

    // ----------- configuration -----------

    /**
     * Sets the round-trip ceiling of the RPC channel. Every wait-style timeout must be strictly shorter.
     *
     * @param rpcTimeout channel timeout (positive)
     * @return this device for fluent chaining
     * @throws io.hearthwarrio.remoteui.core.ActionArgumentException if the configured UI wait time would no longer fit
     */
    public RemoteUiDevice withRpcTimeout(Duration rpcTimeout) {
        TimeoutGuard guard = new TimeoutGuard(rpcTimeout);
        guard.toMillis("withRpcTimeout", uiWaitTime);
        this.rpcTimeout = rpcTimeout;
        this.timeoutGuard = guard;
        return this;
    }

    /**
     * Sets the default bound used by wait operations called without an explicit timeout.
     *
     * @throws io.hearthwarrio.remoteui.core.ActionArgumentException if the wait time is not below the RPC timeout
     */
    public RemoteUiDevice withUiWaitTime(Duration uiWaitTime) {
        timeoutGuard.toMillis("withUiWaitTime", uiWaitTime);
        this.uiWaitTime = uiWaitTime;
        return this;
    }

    /**
     * Sets the raise-on-missing mode for root handles created afterwards.
     */
    public RemoteUiDevice withRaiseOnMissing(boolean raiseOnMissing) {
        this.raiseOnMissing = raiseOnMissing;
        return this;
    }

    public RemoteUiDevice withLogger(RpcCallLogger logger) {
        this.logger = logger;
        return this;
    }

    public RemoteUiDevice withLoggingToStdOut(RpcLogDetail detail) {
        this.logger = new StdOutRpcCallLogger(detail);
        return this;
    }

    public RemoteUiDevice logCalls() {
        return withLoggingToStdOut(RpcLogDetail.SELECTOR);
    }

    public RemoteUiDevice disableCallLogging() {
        this.logger = null;
        return this;
    }

    public Duration getRpcTimeout() {
        return rpcTimeout;
    }

    public Duration getUiWaitTime() {
        return uiWaitTime;
    }

    public boolean isRaiseOnMissing() {
        return raiseOnMissing;
    }

    public RpcCallLogger getLogger() {
        return logger;
    }

    // ----------- handles -----------

    /**
     * Creates a root handle whose selector matches the given criteria.
     *
     * @param criteria "by" criteria of the root step
     * @return root handle
     */
    public UiObject ui(Criteria criteria) {
        return ui(Selector.by(criteria));
    }

    /**
     * Creates a handle for an existing selector.
     */
    public UiObject ui(Selector selector) {
        return new UiObject(this, selector, raiseOnMissing);
    }

    /**
     * Clicks at an absolute screen coordinate.
     */
    public boolean click(int x, int y) {
        return rpc.click(x, y);
    }

    // ----------- package-private plumbing -----------

    AutomationRpc rpc() {
        return rpc;
    }

    TimeoutGuard timeoutGuard() {
        return timeoutGuard;
    }

    RpcLogDetail currentLogDetail() {
        if (logger == null) {
            return RpcLogDetail.NONE;
        }

        RpcLogDetail d;
        try {
            d = logger.detail();
        } catch (RuntimeException e) {
            d = RpcLogDetail.FULL;
        }
        return d == null ? RpcLogDetail.FULL : d;
    }

    void warnDeprecated(String message) {
        if (logger != null) {
            logger.logDeprecation(message);
        } else {
            System.err.println("[RemoteUi] DEPRECATED: " + message);
        }
    }
}
