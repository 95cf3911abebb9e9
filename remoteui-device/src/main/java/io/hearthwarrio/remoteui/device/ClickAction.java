package io.hearthwarrio.remoteui.device;

import io.hearthwarrio.remoteui.core.ActionArgumentException;
import io.hearthwarrio.remoteui.core.Rect;
import io.hearthwarrio.remoteui.core.TimeoutGuard;

import java.time.Duration;

/**
 * Click operations on one element. Created via {@link UiObject#click()}.
 */
public final class ClickAction {

    private final UiObject target;

    ClickAction(UiObject target) {
        this.target = target;
    }

    /**
     * Plain click.
     */
    public boolean perform() {
        return perform(null, null, null);
    }

    /**
     * Click and hold for the given duration.
     */
    public boolean perform(Duration duration) {
        return perform(duration, null, null);
    }

    /**
     * Clicks a point within the element's visible bounds.
     */
    public boolean at(int x, int y) {
        return perform(null, x, y);
    }

    public boolean at(int x, int y, Duration duration) {
        return perform(duration, x, y);
    }

    /**
     * General form. Dispatches on which arguments are present:
     * <ul>
     *   <li>{@code x} and {@code y} – click at that point (held for {@code duration} when given)</li>
     *   <li>neither – click the element (held for {@code duration} when given)</li>
     * </ul>
     *
     * @param duration hold time (optional)
     * @param x        X coordinate (optional, requires {@code y})
     * @param y        Y coordinate (optional, requires {@code x})
     * @return {@code true} if the click succeeded
     * @throws ActionArgumentException if only one coordinate is given or the duration is negative
     */
    public boolean perform(Duration duration, Integer x, Integer y) {
        if ((x == null) != (y == null)) {
            throw new ActionArgumentException("click",
                    "must provide both x and y to click on a point, got x=" + x + ", y=" + y);
        }

        Long durationMs = duration == null ? null : TimeoutGuard.durationMillis("click", duration);
        if (x != null) {
            return target.rpc().clickObjPoint(target.wire(), x, y, durationMs);
        }
        return target.rpc().clickObj(target.wire(), durationMs);
    }

    /**
     * Older form where the hold time was called {@code timeout}.
     * <p>
     * When {@code timeout} is given it replaces {@code duration} and a deprecation notice is reported to the device's
     * logger (or stderr).
     *
     * @deprecated Use {@link #perform(Duration, Integer, Integer)}; {@code timeout} means the same as {@code duration}.
     */
    @Deprecated
    public boolean perform(Duration duration, Duration timeout, Integer x, Integer y) {
        if (timeout != null) {
            target.device().warnDeprecated("The 'timeout' argument of click is deprecated, use 'duration' instead.");
            duration = timeout;
        }
        return perform(duration, x, y);
    }

    /**
     * Clicks the lower right corner of the visible bounds.
     *
     * @return {@code false} if the element could not be resolved
     */
    public boolean bottomRight() {
        Rect bounds = target.rpc().getVisibleBounds(target.wire());
        if (bounds == null) {
            return false;
        }
        return target.rpc().click(bounds.getRight(), bounds.getBottom());
    }

    /**
     * Clicks the upper left corner of the visible bounds.
     *
     * @return {@code false} if the element could not be resolved
     */
    public boolean topLeft() {
        Rect bounds = target.rpc().getVisibleBounds(target.wire());
        if (bounds == null) {
            return false;
        }
        return target.rpc().click(bounds.getLeft(), bounds.getTop());
    }

    /**
     * Clicks and waits up to the device's UI wait time for a window transition.
     */
    public boolean andWait() {
        return andWait(target.device().getUiWaitTime());
    }

    /**
     * Clicks and waits for a window transition.
     *
     * @param timeout wait bound, must be below the RPC timeout
     * @return {@code true} if a window update occurred
     * @throws ActionArgumentException if the timeout is not below the RPC timeout
     */
    public boolean andWait(Duration timeout) {
        long timeoutMs = target.device().timeoutGuard().toMillis("click.andWait", timeout);
        return target.rpc().clickObjAndWait(target.wire(), timeoutMs);
    }
}
