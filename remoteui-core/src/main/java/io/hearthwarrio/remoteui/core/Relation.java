package io.hearthwarrio.remoteui.core;

/**
 * How a selector step navigates from the element matched by the previous step.
 */
public enum Relation {

    PARENT("parent"),
    ANCESTOR("ancestor"),
    CHILD("child"),
    SIBLING("sibling"),
    /**
     * Closest element below.
     */
    BOTTOM("bottom"),
    /**
     * Closest element to the left.
     */
    LEFT("left"),
    /**
     * Closest element to the right.
     */
    RIGHT("right"),
    /**
     * Closest element above.
     */
    TOP("top");

    private final String tag;

    Relation(String tag) {
        this.tag = tag;
    }

    /**
     * @return relation tag used in the wire format
     */
    public String tag() {
        return tag;
    }
}
