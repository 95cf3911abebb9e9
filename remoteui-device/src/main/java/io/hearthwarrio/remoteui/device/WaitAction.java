package io.hearthwarrio.remoteui.device;

import io.hearthwarrio.remoteui.core.ActionArgumentException;
import io.hearthwarrio.remoteui.core.ObjectSearchException;

import java.time.Duration;

/**
 * Waits for one element to appear or disappear. Created via {@link UiObject#waitFor()}.
 * <p>
 * Each wait is a single remote polling call bounded by its timeout, which must be below the RPC timeout. A failed wait
 * returns {@code false}, or throws {@link ObjectSearchException} when the builder was created from a raise-on-missing
 * handle or the call asks for it.
 *
 * <pre>
 * dialog.waitFor().gone(Duration.ofSeconds(3));
 * okButton.waitFor().assertExists("OK button never showed up");
 * </pre>
 */
public final class WaitAction {

    private final UiObject target;
    private final boolean raiseOnMissing;

    WaitAction(UiObject target, boolean raiseOnMissing) {
        this.target = target;
        this.raiseOnMissing = raiseOnMissing;
    }

    // ----------- appear -----------

    public boolean exists() {
        return exists(defaultTimeout(), false);
    }

    public boolean exists(Duration timeout) {
        return exists(timeout, false);
    }

    /**
     * Waits for the element to appear.
     *
     * @param timeout        wait bound, must be below the RPC timeout
     * @param raiseOnFailure throw instead of returning {@code false}
     * @return {@code true} if the element appeared in time
     * @throws ActionArgumentException if the timeout is not below the RPC timeout (no remote call is made)
     * @throws ObjectSearchException   if the element did not appear and strict mode applies
     */
    public boolean exists(Duration timeout, boolean raiseOnFailure) {
        long timeoutMs = guard("wait.exists", timeout);
        if (target.rpc().waitForExists(target.wire(), timeoutMs)) {
            return true;
        }
        if (raiseOnMissing || raiseOnFailure) {
            throw new ObjectSearchException(
                    "Not found " + target.getSelector() + " over " + timeoutMs + " ms", target.wire(), timeoutMs);
        }
        return false;
    }

    public void assertExists(String message) {
        assertExists(message, defaultTimeout());
    }

    /**
     * Like {@link #exists(Duration, boolean)} with strict mode forced.
     *
     * @throws ObjectSearchException with the given message, caused by the original search failure
     */
    public void assertExists(String message, Duration timeout) {
        try {
            exists(timeout, true);
        } catch (ObjectSearchException e) {
            throw new ObjectSearchException(message, e);
        }
    }

    // ----------- disappear -----------

    public boolean gone() {
        return gone(defaultTimeout(), false);
    }

    public boolean gone(Duration timeout) {
        return gone(timeout, false);
    }

    /**
     * Waits for the element to disappear.
     *
     * @param timeout        wait bound, must be below the RPC timeout
     * @param raiseOnFailure throw instead of returning {@code false}
     * @return {@code true} if the element was gone in time
     * @throws ActionArgumentException if the timeout is not below the RPC timeout (no remote call is made)
     * @throws ObjectSearchException   if the element is still there and strict mode applies
     */
    public boolean gone(Duration timeout, boolean raiseOnFailure) {
        long timeoutMs = guard("wait.gone", timeout);
        if (target.rpc().waitUntilGone(target.wire(), timeoutMs)) {
            return true;
        }
        if (raiseOnMissing || raiseOnFailure) {
            throw new ObjectSearchException(
                    "Still found " + target.getSelector() + " over " + timeoutMs + " ms", target.wire(), timeoutMs);
        }
        return false;
    }

    public void assertGone(String message) {
        assertGone(message, defaultTimeout());
    }

    /**
     * Like {@link #gone(Duration, boolean)} with strict mode forced.
     *
     * @throws ObjectSearchException with the given message, caused by the original search failure
     */
    public void assertGone(String message, Duration timeout) {
        try {
            gone(timeout, true);
        } catch (ObjectSearchException e) {
            throw new ObjectSearchException(message, e);
        }
    }

    // ----------- wait then act -----------

    public boolean click() {
        return click(defaultTimeout());
    }

    /**
     * Waits for the element to appear, then clicks it.
     * <p>
     * Never throws {@link ObjectSearchException}, whatever the raise-on-missing mode.
     *
     * @return {@code false} if the element did not appear or the click failed
     * @throws ActionArgumentException if the timeout is not below the RPC timeout
     */
    public boolean click(Duration timeout) {
        long timeoutMs = guard("wait.click", timeout);
        if (target.rpc().waitForExists(target.wire(), timeoutMs)) {
            return target.rpc().clickObj(target.wire(), null);
        }
        return false;
    }

    private long guard(String operation, Duration timeout) {
        return target.device().timeoutGuard().toMillis(operation, timeout);
    }

    private Duration defaultTimeout() {
        return target.device().getUiWaitTime();
    }
}
