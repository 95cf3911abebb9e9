package io.hearthwarrio.remoteui.core;

/**
 * Recognized matching criteria for a single selector step.
 * <p>
 * The set mirrors what the remote automation service understands. Keys outside this set may still be passed as raw
 * strings via {@link Criteria#with(String, Object)}; the remote side decides whether they are valid.
 */
public enum CriterionKey {

    CHECKABLE("checkable"),
    CHECKED("checked"),
    /**
     * Fully qualified widget class name, e.g. {@code android.widget.TextView}.
     */
    CLAZZ("clazz"),
    CLICKABLE("clickable"),
    /**
     * Depth of the element in the hierarchy.
     */
    DEPTH("depth"),
    /**
     * Content description.
     */
    DESC("desc"),
    ENABLED("enabled"),
    FOCUSABLE("focusable"),
    FOCUSED("focused"),
    /**
     * Nested criteria that a direct child must satisfy.
     */
    HAS_CHILD("hasChild"),
    /**
     * Nested criteria that any descendant must satisfy.
     */
    HAS_DESCENDANT("hasDescendant"),
    LONG_CLICKABLE("longClickable"),
    /**
     * Application package name.
     */
    PKG("pkg"),
    /**
     * Fully qualified resource name, e.g. {@code com.android.settings:id/title}.
     */
    RES("res"),
    SCROLLABLE("scrollable"),
    SELECTED("selected"),
    TEXT("text");

    private final String wireName;

    CriterionKey(String wireName) {
        this.wireName = wireName;
    }

    /**
     * @return key name as sent to the remote service
     */
    public String wireName() {
        return wireName;
    }
}
