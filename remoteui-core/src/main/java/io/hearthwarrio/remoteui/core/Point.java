package io.hearthwarrio.remoteui.core;

import java.util.Map;
import java.util.Objects;

/**
 * Point in screen pixels.
 */
public final class Point {

    private final int x;
    private final int y;

    public Point(int x, int y) {
        this.x = x;
        this.y = y;
    }

    /**
     * Builds a point from a remote record with {@code x/y} entries.
     *
     * @throws IllegalArgumentException if an entry is missing or not numeric
     */
    public static Point fromRecord(Map<?, ?> record) {
        Objects.requireNonNull(record, "record must not be null");
        return new Point(Records.intValue(record, "x"), Records.intValue(record, "y"));
    }

    public int getX() {
        return x;
    }

    public int getY() {
        return y;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Point)) {
            return false;
        }
        Point point = (Point) o;
        return x == point.x && y == point.y;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y);
    }

    @Override
    public String toString() {
        return "Point{x=" + x + ", y=" + y + '}';
    }
}
