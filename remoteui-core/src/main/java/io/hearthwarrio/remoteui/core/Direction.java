package io.hearthwarrio.remoteui.core;

/**
 * Gesture direction as understood by the remote service.
 */
public enum Direction {
    DOWN,
    LEFT,
    RIGHT,
    UP;

    public String wireName() {
        return name();
    }
}
