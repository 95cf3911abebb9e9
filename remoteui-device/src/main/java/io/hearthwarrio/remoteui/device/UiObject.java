package io.hearthwarrio.remoteui.device;

import io.hearthwarrio.remoteui.core.Criteria;
import io.hearthwarrio.remoteui.core.ObjectSearchException;
import io.hearthwarrio.remoteui.core.Point;
import io.hearthwarrio.remoteui.core.Rect;
import io.hearthwarrio.remoteui.core.Relation;
import io.hearthwarrio.remoteui.core.Selector;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Client-side handle of a UI element on the device.
 * <p>
 * A handle is not a live reference: it pairs a {@link Selector} with the device, and every query or action re-resolves
 * the selector remotely. Navigation methods ({@link #parent()}, {@link #child(Criteria)}, ...) return new handles with
 * one more selector step and never call the device.
 * <p>
 * Action builders ({@link #click()}, {@link #scroll()}, {@link #waitFor()}, ...) validate their arguments locally and
 * then issue a single remote call.
 *
 * <pre>
 * UiObject list = device.ui(Criteria.res("com.android.settings:id/recycler_view"));
 * list.scroll().down().click(Criteria.text("About phone"));
 * list.child(Criteria.text("Battery")).waitFor().exists(Duration.ofSeconds(5));
 * </pre>
 */
public final class UiObject {

    private final RemoteUiDevice device;
    private final Selector selector;

    /**
     * Sticky strict mode: when set, a failed {@link #exists()} throws {@link ObjectSearchException}.
     * Only {@link #assertExists(String)} changes it, and restores it before returning.
     */
    private boolean raiseOnMissing;

    UiObject(RemoteUiDevice device, Selector selector, boolean raiseOnMissing) {
        this.device = Objects.requireNonNull(device, "device must not be null");
        this.selector = Objects.requireNonNull(selector, "selector must not be null");
        this.raiseOnMissing = raiseOnMissing;
    }

    public Selector getSelector() {
        return selector;
    }

    public boolean isRaiseOnMissing() {
        return raiseOnMissing;
    }

    /**
     * Returns a handle for the same selector with the given raise-on-missing mode.
     */
    public UiObject withRaiseOnMissing(boolean raiseOnMissing) {
        return new UiObject(device, selector, raiseOnMissing);
    }

    // ----------- navigation -----------

    public UiObject parent() {
        return navigate(Relation.PARENT, Criteria.any());
    }

    public UiObject ancestor(Criteria criteria) {
        return navigate(Relation.ANCESTOR, criteria);
    }

    public UiObject child(Criteria criteria) {
        return navigate(Relation.CHILD, criteria);
    }

    /**
     * Element sharing the parent of this element.
     */
    public UiObject sibling(Criteria criteria) {
        return navigate(Relation.SIBLING, criteria);
    }

    /**
     * Closest matching element below this one.
     */
    public UiObject bottom(Criteria criteria) {
        return navigate(Relation.BOTTOM, criteria);
    }

    /**
     * Closest matching element to the left of this one.
     */
    public UiObject left(Criteria criteria) {
        return navigate(Relation.LEFT, criteria);
    }

    /**
     * Closest matching element to the right of this one.
     */
    public UiObject right(Criteria criteria) {
        return navigate(Relation.RIGHT, criteria);
    }

    /**
     * Closest matching element above this one.
     */
    public UiObject top(Criteria criteria) {
        return navigate(Relation.TOP, criteria);
    }

    private UiObject navigate(Relation relation, Criteria criteria) {
        return new UiObject(device, selector.append(relation, criteria), raiseOnMissing);
    }

    // ----------- existence -----------

    /**
     * Checks whether the element currently exists.
     *
     * @return {@code true} if found
     * @throws ObjectSearchException if not found and this handle is in raise-on-missing mode
     */
    public boolean exists() {
        boolean found = rpc().exists(wire());
        if (!found && raiseOnMissing) {
            throw new ObjectSearchException("Not found " + selector, wire(), -1);
        }
        return found;
    }

    /**
     * Asserts that the element currently exists, regardless of this handle's raise-on-missing mode.
     *
     * @param message message of the thrown exception
     * @throws ObjectSearchException with the given message, caused by the original search failure
     */
    public void assertExists(String message) {
        try {
            inStrictMode(this::exists);
        } catch (ObjectSearchException e) {
            throw new ObjectSearchException(message, e);
        }
    }

    /**
     * Runs the body with raise-on-missing enabled and restores the previous mode on every exit path.
     */
    private <T> T inStrictMode(Supplier<T> body) {
        boolean previous = raiseOnMissing;
        raiseOnMissing = true;
        try {
            return body.get();
        } finally {
            raiseOnMissing = previous;
        }
    }

    // ----------- queries -----------

    /**
     * Number of elements matching this selector.
     */
    public int count() {
        return rpc().findObjects(wire()).size();
    }

    /**
     * Direct children of this element, as property records.
     */
    public List<Map<String, Object>> children() {
        return rpc().getChildren(wire());
    }

    /**
     * Finds all elements under this one matching the criteria. This handle is not changed.
     */
    public List<Map<String, Object>> find(Criteria criteria) {
        return rpc().findChildObjects(wire(), Selector.by(criteria).toWireFormat());
    }

    /**
     * Whether any element under this one matches the criteria.
     */
    public boolean has(Criteria criteria) {
        return rpc().hasChildObject(wire(), Selector.by(criteria).toWireFormat());
    }

    /**
     * All properties of the element as reported by the device (empty when not found).
     */
    public Map<String, Object> info() {
        Map<String, Object> info = rpc().getObjInfo(wire());
        return info == null ? Map.of() : info;
    }

    /**
     * @return visible bounds, or {@code null} when the element is not found
     */
    public Rect visibleBounds() {
        return rpc().getVisibleBounds(wire());
    }

    /**
     * @return center of the visible bounds, or {@code null} when the element is not found
     */
    public Point visibleCenter() {
        return rpc().getVisibleCenter(wire());
    }

    /**
     * @return id of the display containing the element, or {@code null} when not found
     */
    public Integer displayId() {
        return rpc().getDisplayId(wire());
    }

    public String text() {
        return rpc().string("getText", wire());
    }

    public String className() {
        return rpc().string("getClassName", wire());
    }

    /**
     * Content description.
     */
    public String description() {
        return rpc().string("getContentDescription", wire());
    }

    public String hint() {
        return rpc().string("getHint", wire());
    }

    public String packageName() {
        return rpc().string("getApplicationPackage", wire());
    }

    /**
     * Fully qualified resource name of the element's id.
     */
    public String resourceId() {
        return rpc().string("getResourceName", wire());
    }

    public boolean isCheckable() {
        return rpc().bool("isCheckable", wire());
    }

    public boolean isChecked() {
        return rpc().bool("isChecked", wire());
    }

    public boolean isClickable() {
        return rpc().bool("isClickable", wire());
    }

    public boolean isEnabled() {
        return rpc().bool("isEnabled", wire());
    }

    public boolean isFocusable() {
        return rpc().bool("isFocusable", wire());
    }

    public boolean isFocused() {
        return rpc().bool("isFocused", wire());
    }

    public boolean isLongClickable() {
        return rpc().bool("isLongClickable", wire());
    }

    public boolean isScrollable() {
        return rpc().bool("isScrollable", wire());
    }

    public boolean isSelected() {
        return rpc().bool("isSelected", wire());
    }

    // ----------- direct actions -----------

    /**
     * Clears the text of an editable field.
     */
    public boolean clearText() {
        return rpc().clear(wire());
    }

    /**
     * Replaces the text of an editable field.
     */
    public boolean setText(String text) {
        Objects.requireNonNull(text, "text must not be null");
        return rpc().setText(wire(), text);
    }

    public boolean longClick() {
        return rpc().longClick(wire());
    }

    // ----------- action builders -----------

    public ClickAction click() {
        return new ClickAction(this);
    }

    public DragAction drag() {
        return new DragAction(this);
    }

    public GestureAction swipe() {
        return new GestureAction(this, GestureAction.Kind.SWIPE);
    }

    public GestureAction fling() {
        return new GestureAction(this, GestureAction.Kind.FLING);
    }

    public PinchAction pinch() {
        return new PinchAction(this);
    }

    public ScrollAction scroll() {
        return new ScrollAction(this);
    }

    /**
     * Wait operations. The returned builder inherits this handle's current raise-on-missing mode.
     */
    public WaitAction waitFor() {
        return new WaitAction(this, raiseOnMissing);
    }

    @Override
    public String toString() {
        return "UiObject{" + selector + ", raiseOnMissing=" + raiseOnMissing + '}';
    }

    // ----------- package-private plumbing -----------

    RemoteUiDevice device() {
        return device;
    }

    AutomationRpc rpc() {
        return device.rpc();
    }

    Map<String, Object> wire() {
        return selector.toWireFormat();
    }
}
