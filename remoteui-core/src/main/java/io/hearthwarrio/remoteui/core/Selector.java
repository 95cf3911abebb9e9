package io.hearthwarrio.remoteui.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Declarative path to a UI element: a root step holding the "by" criteria, followed by zero or more
 * (relation, criteria) steps.
 * <p>
 * Instances are immutable. {@link #append(Relation, Criteria)} returns a new selector, so two selectors derived from
 * the same prefix never observe each other's steps.
 * <p>
 * Wire format: the root criteria are the top-level entries; every following step is nested under its relation tag
 * inside the map of the step before it:
 * <pre>
 * {"text":"Settings","child":{"res":"android:id/title","sibling":{"clazz":"android.widget.Switch"}}}
 * </pre>
 */
public final class Selector {

    private final List<Step> steps;

    private Selector(List<Step> steps) {
        this.steps = steps;
    }

    /**
     * Creates a selector whose root step matches the given criteria.
     *
     * @param criteria root criteria
     * @return new selector with a single step
     */
    public static Selector by(Criteria criteria) {
        Objects.requireNonNull(criteria, "criteria must not be null");
        return new Selector(Collections.singletonList(new Step(null, criteria)));
    }

    /**
     * Returns a new selector with one more step. This selector is left untouched.
     *
     * @param relation how to navigate from the current target
     * @param criteria criteria the navigated-to element must match (may be {@link Criteria#any()})
     * @return extended selector
     */
    public Selector append(Relation relation, Criteria criteria) {
        Objects.requireNonNull(relation, "relation must not be null");
        Objects.requireNonNull(criteria, "criteria must not be null");
        List<Step> extended = new ArrayList<>(steps.size() + 1);
        extended.addAll(steps);
        extended.add(new Step(relation, criteria));
        return new Selector(Collections.unmodifiableList(extended));
    }

    /**
     * Returns an independent snapshot of this selector.
     * <p>
     * Since selectors are immutable the snapshot shares the step list.
     */
    public Selector copy() {
        return new Selector(steps);
    }

    public List<Step> getSteps() {
        return steps;
    }

    public int size() {
        return steps.size();
    }

    /**
     * Serializes all steps for transport, preserving their order.
     *
     * @return a fresh mutable nested map
     */
    public Map<String, Object> toWireFormat() {
        Map<String, Object> next = null;
        for (int i = steps.size() - 1; i >= 0; i--) {
            Map<String, Object> current = steps.get(i).getCriteria().toWireFormat();
            if (next != null) {
                current.put(steps.get(i + 1).getRelation().tag(), next);
            }
            next = current;
        }
        return next;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Selector)) {
            return false;
        }
        return steps.equals(((Selector) o).steps);
    }

    @Override
    public int hashCode() {
        return steps.hashCode();
    }

    @Override
    public String toString() {
        return "Selector" + SelectorJson.toJson(toWireFormat());
    }

    /**
     * One navigation step.
     */
    public static final class Step {

        /**
         * {@code null} for the root step.
         */
        private final Relation relation;
        private final Criteria criteria;

        Step(Relation relation, Criteria criteria) {
            this.relation = relation;
            this.criteria = criteria;
        }

        public Relation getRelation() {
            return relation;
        }

        public Criteria getCriteria() {
            return criteria;
        }

        public boolean isRoot() {
            return relation == null;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Step)) {
                return false;
            }
            Step other = (Step) o;
            return relation == other.relation && criteria.equals(other.criteria);
        }

        @Override
        public int hashCode() {
            return Objects.hash(relation, criteria);
        }

        @Override
        public String toString() {
            return (relation == null ? "by" : relation.tag()) + criteria.toWireFormat();
        }
    }
}
