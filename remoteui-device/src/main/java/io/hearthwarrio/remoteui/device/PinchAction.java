package io.hearthwarrio.remoteui.device;

/**
 * Pinch gestures. Created via {@link UiObject#pinch()}.
 */
public final class PinchAction {

    private final UiObject target;

    PinchAction(UiObject target) {
        this.target = target;
    }

    public boolean close(int percent) {
        return close(percent, null);
    }

    /**
     * @param percent size of the pinch as a percentage of the element size
     * @param speed   pixels per second (optional)
     */
    public boolean close(int percent, Integer speed) {
        return target.rpc().pinchClose(target.wire(), percent, speed);
    }

    public boolean open(int percent) {
        return open(percent, null);
    }

    /**
     * @param percent size of the pinch as a percentage of the element size
     * @param speed   pixels per second (optional)
     */
    public boolean open(int percent, Integer speed) {
        return target.rpc().pinchOpen(target.wire(), percent, speed);
    }
}
