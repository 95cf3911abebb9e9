package io.hearthwarrio.remoteui.device;

import io.hearthwarrio.remoteui.core.ActionArgumentException;
import io.hearthwarrio.remoteui.core.Criteria;
import io.hearthwarrio.remoteui.core.Selector;

/**
 * Drags one element to a point or onto another element. Created via {@link UiObject#drag()}.
 */
public final class DragAction {

    private final UiObject target;

    DragAction(UiObject target) {
        this.target = target;
    }

    public boolean to(int x, int y) {
        return to(x, y, null, null);
    }

    public boolean to(int x, int y, Integer speed) {
        return to(x, y, speed, null);
    }

    /**
     * Drags onto the first element matching the criteria.
     */
    public boolean to(Criteria destination) {
        return to(null, null, null, destination);
    }

    public boolean to(Criteria destination, Integer speed) {
        return to(null, null, speed, destination);
    }

    /**
     * General form: exactly one of {coordinates} or {destination criteria} must be given.
     *
     * @param x           destination X (requires {@code y})
     * @param y           destination Y (requires {@code x})
     * @param speed       pixels per second (optional)
     * @param destination criteria of the destination element (optional)
     * @throws ActionArgumentException if both or neither destination kinds are given
     */
    public boolean to(Integer x, Integer y, Integer speed, Criteria destination) {
        boolean hasDestination = destination != null && !destination.isEmpty();

        if (x == null && y == null && hasDestination) {
            return target.rpc().dragObjToObj(target.wire(), Selector.by(destination).toWireFormat(), speed);
        }
        if (x != null && y != null && !hasDestination) {
            return target.rpc().dragObj(target.wire(), x, y, speed);
        }
        throw new ActionArgumentException("drag.to",
                "drag to object and drag to coordinates cannot be mixed, got x=" + x + ", y=" + y
                        + ", destination=" + destination);
    }
}
