package io.hearthwarrio.remoteui.device;

import io.hearthwarrio.remoteui.core.ActionArgumentException;
import io.hearthwarrio.remoteui.core.Direction;

import java.util.Locale;

/**
 * Swipe or fling gesture on one element. Created via {@link UiObject#swipe()} or {@link UiObject#fling()}.
 * <p>
 * Margins are configured first, then a direction is picked:
 * <pre>
 * list.swipe().withMarginPercent(10).up().perform(80);
 * list.fling().down().perform();
 * </pre>
 * Margins belong to this builder only; the handle it was created from is not affected.
 */
public final class GestureAction {

    /**
     * Gesture flavor.
     */
    public enum Kind {
        SWIPE("swipe"),
        FLING("fling");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    private final UiObject target;
    private final Kind kind;

    private Margins margins = Margins.NONE;

    GestureAction(UiObject target, Kind kind) {
        this.target = target;
        this.kind = kind;
    }

    /**
     * Sets the gesture margins, in pixels or as a percentage of the element size. Both may be {@code null}.
     *
     * @throws ActionArgumentException if both are given
     */
    public GestureAction margins(Integer margin, Integer percent) {
        this.margins = Margins.of(kind.label() + ".margins", margin, percent);
        return this;
    }

    public GestureAction withMargin(int margin) {
        return margins(margin, null);
    }

    public GestureAction withMarginPercent(int percent) {
        return margins(null, percent);
    }

    public Kind getKind() {
        return kind;
    }

    public To down() {
        return new To(Direction.DOWN);
    }

    public To left() {
        return new To(Direction.LEFT);
    }

    public To right() {
        return new To(Direction.RIGHT);
    }

    public To up() {
        return new To(Direction.UP);
    }

    /**
     * Direction-bound gesture. Direction, kind and margins are fixed at creation.
     */
    public final class To {

        private final Direction direction;
        private final Margins boundMargins;
        private final String operation;

        private To(Direction direction) {
            this.direction = direction;
            this.boundMargins = margins;
            this.operation = kind.label() + "." + direction.name().toLowerCase(Locale.ROOT);
        }

        public Direction getDirection() {
            return direction;
        }

        /**
         * Performs the gesture with a percent of {@code 0} and the default speed.
         */
        public boolean perform() {
            return perform(0, null);
        }

        public boolean perform(int percent) {
            return perform(percent, null);
        }

        /**
         * @param percent swipe length as a percentage of the element size, {@code 0..100}; must be {@code 0} for fling
         * @param speed   pixels per second (optional)
         * @throws ActionArgumentException if the percent is out of range for swipe, or non-zero for fling
         */
        public boolean perform(int percent, Integer speed) {
            if (kind == Kind.FLING) {
                if (percent != 0) {
                    throw new ActionArgumentException(operation,
                            "fling gesture does not support changing the percent, got " + percent);
                }
                return target.rpc().fling(target.wire(), direction.wireName(), speed,
                        boundMargins.pixels(), boundMargins.percent());
            }

            if (percent < 0 || percent > 100) {
                throw new ActionArgumentException(operation,
                        "swipe gesture requires percent to be between 0 and 100, got " + percent);
            }
            return target.rpc().swipeObj(target.wire(), direction.wireName(), percent, speed,
                    boundMargins.pixels(), boundMargins.percent());
        }
    }
}
