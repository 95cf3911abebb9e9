package io.hearthwarrio.remoteui.core;

import java.util.Map;
import java.util.Objects;

/**
 * Bounds rectangle in screen pixels.
 */
public final class Rect {

    private final int left;
    private final int top;
    private final int right;
    private final int bottom;

    public Rect(int left, int top, int right, int bottom) {
        this.left = left;
        this.top = top;
        this.right = right;
        this.bottom = bottom;
    }

    /**
     * Builds a rectangle from a remote bounds record with {@code left/top/right/bottom} entries.
     *
     * @throws IllegalArgumentException if an entry is missing or not numeric
     */
    public static Rect fromRecord(Map<?, ?> record) {
        Objects.requireNonNull(record, "record must not be null");
        return new Rect(
                Records.intValue(record, "left"),
                Records.intValue(record, "top"),
                Records.intValue(record, "right"),
                Records.intValue(record, "bottom")
        );
    }

    public int getLeft() {
        return left;
    }

    public int getTop() {
        return top;
    }

    public int getRight() {
        return right;
    }

    public int getBottom() {
        return bottom;
    }

    public int width() {
        return right - left;
    }

    public int height() {
        return bottom - top;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Rect)) {
            return false;
        }
        Rect rect = (Rect) o;
        return left == rect.left && top == rect.top && right == rect.right && bottom == rect.bottom;
    }

    @Override
    public int hashCode() {
        return Objects.hash(left, top, right, bottom);
    }

    @Override
    public String toString() {
        return "Rect{" +
                "left=" + left +
                ", top=" + top +
                ", right=" + right +
                ", bottom=" + bottom +
                '}';
    }
}
