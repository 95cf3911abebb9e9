package io.hearthwarrio.remoteui.device;

import io.hearthwarrio.remoteui.core.ActionArgumentException;
import io.hearthwarrio.remoteui.core.Criteria;
import io.hearthwarrio.remoteui.core.Direction;
import io.hearthwarrio.remoteui.core.Selector;

import java.util.Locale;

/**
 * Scrolls a scrollable element. Created via {@link UiObject#scroll()}.
 * <p>
 * A direction-bound {@link To} supports four shapes:
 * <ul>
 *   <li>{@link To#by(int)} – fixed distance, as a percentage of the element size</li>
 *   <li>{@link To#until(Criteria)} – until an element matching the criteria is visible</li>
 *   <li>{@link To#until(UiObject)} – until another handle's element is visible</li>
 *   <li>{@link To#toEnd()} – until no further scrolling is possible</li>
 * </ul>
 *
 * <pre>
 * settingsList.scroll().withMargin(50).down().until(Criteria.text("System"));
 * settingsList.scroll().up().toEnd();
 * </pre>
 */
public final class ScrollAction {

    private final UiObject target;

    private Margins margins = Margins.NONE;

    ScrollAction(UiObject target) {
        this.target = target;
    }

    /**
     * Sets the gesture margins, in pixels or as a percentage of the element size. Both may be {@code null}.
     *
     * @throws ActionArgumentException if both are given
     */
    public ScrollAction margins(Integer margin, Integer percent) {
        this.margins = Margins.of("scroll.margins", margin, percent);
        return this;
    }

    public ScrollAction withMargin(int margin) {
        return margins(margin, null);
    }

    public ScrollAction withMarginPercent(int percent) {
        return margins(null, percent);
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
     * Direction-bound scroll. Direction and margins are fixed at creation.
     */
    public final class To {

        private final Direction direction;
        private final Margins boundMargins;
        private final String operation;

        private To(Direction direction) {
            this.direction = direction;
            this.boundMargins = margins;
            this.operation = "scroll." + direction.name().toLowerCase(Locale.ROOT);
        }

        public Direction getDirection() {
            return direction;
        }

        public boolean by(int percent) {
            return perform(percent, null, null, null);
        }

        public boolean by(int percent, Integer speed) {
            return perform(percent, speed, null, null);
        }

        public boolean until(Criteria criteria) {
            return perform(null, null, null, criteria);
        }

        public boolean until(UiObject other) {
            return perform(null, null, other, null);
        }

        public boolean toEnd() {
            return perform(null, null, null, null);
        }

        /**
         * General form. Valid combinations:
         * <ul>
         *   <li>{@code percent} (with optional {@code speed}), no target, no criteria – fixed-distance scroll</li>
         *   <li>{@code criteria} only – scroll until a matching element is visible</li>
         *   <li>{@code other} only – scroll until that handle's element is visible</li>
         *   <li>nothing – scroll to the end</li>
         * </ul>
         *
         * @throws ActionArgumentException for any other combination
         */
        public boolean perform(Integer percent, Integer speed, UiObject other, Criteria criteria) {
            boolean hasCriteria = criteria != null && !criteria.isEmpty();

            if (percent != null && other == null && !hasCriteria) {
                return target.rpc().scroll(target.wire(), direction.wireName(), percent, speed,
                        boundMargins.pixels(), boundMargins.percent());
            }

            if (percent == null && speed == null) {
                if (other == null && hasCriteria) {
                    return target.rpc().scrollUntil(target.wire(), Selector.by(criteria).toWireFormat(),
                            direction.wireName(), boundMargins.pixels(), boundMargins.percent());
                }
                if (other == null) {
                    return target.rpc().scrollUntilFinished(target.wire(), direction.wireName(),
                            boundMargins.pixels(), boundMargins.percent());
                }
                if (!hasCriteria) {
                    return target.rpc().scrollUntil(target.wire(), other.wire(),
                            direction.wireName(), boundMargins.pixels(), boundMargins.percent());
                }
            }

            throw new ActionArgumentException(operation,
                    "scroll by percentage and scroll by condition cannot be mixed, got percent=" + percent
                            + ", speed=" + speed + ", target=" + (other == null ? null : other.getSelector())
                            + ", criteria=" + criteria);
        }

        /**
         * Scrolls until an element matching the criteria is visible, then clicks it.
         *
         * @return {@code false} if the element never became visible
         * @throws ActionArgumentException if the criteria are empty
         */
        public boolean click(Criteria criteria) {
            if (criteria == null || criteria.isEmpty()) {
                throw new ActionArgumentException(operation + ".click", "target to scroll to is not defined");
            }
            if (until(criteria)) {
                return target.rpc().clickObj(Selector.by(criteria).toWireFormat(), null);
            }
            return false;
        }
    }
}
