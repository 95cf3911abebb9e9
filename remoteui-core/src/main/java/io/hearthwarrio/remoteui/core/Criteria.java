package io.hearthwarrio.remoteui.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable, ordered set of matching criteria for one selector step.
 * <p>
 * Values may be {@link String}, {@link Boolean}, {@link Number} or nested {@link Criteria} (for
 * {@link CriterionKey#HAS_CHILD} and {@link CriterionKey#HAS_DESCENDANT}). Raw key names are accepted as long as they are not {@link Relation} tags.
 *
 * <pre>
 * Criteria.res("com.android.settings:id/title").with(CriterionKey.TEXT, "Network")
 * </pre>
 */
public final class Criteria {

    private static final Criteria ANY = new Criteria(Collections.emptyMap());

    private final Map<String, Object> entries;

    private Criteria(Map<String, Object> entries) {
        this.entries = entries;
    }

    /**
     * Empty criteria: matches any element reachable through the step's relation.
     */
    public static Criteria any() {
        return ANY;
    }

    public static Criteria of(CriterionKey key, Object value) {
        return ANY.with(key, value);
    }

    public static Criteria of(String key, Object value) {
        return ANY.with(key, value);
    }

    public static Criteria text(String text) {
        return of(CriterionKey.TEXT, text);
    }

    public static Criteria res(String resourceName) {
        return of(CriterionKey.RES, resourceName);
    }

    public static Criteria clazz(String className) {
        return of(CriterionKey.CLAZZ, className);
    }

    public static Criteria desc(String description) {
        return of(CriterionKey.DESC, description);
    }

    public static Criteria pkg(String packageName) {
        return of(CriterionKey.PKG, packageName);
    }

    /**
     * Returns a copy with the given criterion added (or replaced, keeping its original position).
     */
    public Criteria with(CriterionKey key, Object value) {
        Objects.requireNonNull(key, "key must not be null");
        return with(key.wireName(), value);
    }

    /**
     * Raw variant of {@link #with(CriterionKey, Object)} for keys not covered by {@link CriterionKey}.
     *
     * @throws IllegalArgumentException if the key is blank or a relation tag, or the value type is unsupported
     */
    public Criteria with(String key, Object value) {
        Objects.requireNonNull(key, "key must not be null");
        Objects.requireNonNull(value, "value must not be null");
        if (key.isBlank()) {
            throw new IllegalArgumentException("Criterion key must not be blank");
        }
        for (Relation relation : Relation.values()) {
            if (relation.tag().equals(key)) {
                throw new IllegalArgumentException(
                        "Criterion key '" + key + "' is reserved for the " + relation + " selector step");
            }
        }
        if (!(value instanceof String || value instanceof Boolean || value instanceof Number
                || value instanceof Criteria)) {
            throw new IllegalArgumentException(
                    "Unsupported value type for criterion '" + key + "': " + value.getClass().getName());
        }
        Map<String, Object> copy = new LinkedHashMap<>(entries);
        copy.put(key, value);
        return new Criteria(Collections.unmodifiableMap(copy));
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    /**
     * @return read-only view of the criteria, in insertion order
     */
    public Map<String, Object> asMap() {
        return entries;
    }

    /**
     * Serializes the criteria for transport. Nested criteria are serialized recursively.
     *
     * @return a fresh mutable ordered map
     */
    public Map<String, Object> toWireFormat() {
        Map<String, Object> wire = new LinkedHashMap<>();
        for (Map.Entry<String, Object> e : entries.entrySet()) {
            Object value = e.getValue();
            wire.put(e.getKey(), value instanceof Criteria ? ((Criteria) value).toWireFormat() : value);
        }
        return wire;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Criteria)) {
            return false;
        }
        return entries.equals(((Criteria) o).entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "Criteria" + SelectorJson.toJson(toWireFormat());
    }
}
