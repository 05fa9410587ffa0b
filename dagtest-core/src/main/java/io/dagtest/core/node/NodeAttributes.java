package io.dagtest.core.node;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Immutable, ordered map of attribute name to {@link AttributeValue}.
public final class NodeAttributes {

    private static final NodeAttributes EMPTY = new NodeAttributes(Map.of());

    private final Map<String, AttributeValue> values;

    private NodeAttributes(Map<String, AttributeValue> values) {
        this.values = values;
    }

    public static NodeAttributes empty() {
        return EMPTY;
    }

    /// Creates attributes from plain values.
    ///
    /// @param values attribute name to value, see {@link AttributeValue#of(Object)}
    /// @return attributes in the iteration order of `values`, never null
    public static NodeAttributes of(Map<String, ?> values) {
        Objects.requireNonNull(values, "values must not be null");
        if (values.isEmpty()) {
            return EMPTY;
        }
        Map<String, AttributeValue> typed = new LinkedHashMap<>();
        values.forEach(
                (name, value) ->
                        typed.put(
                                Objects.requireNonNull(name, "attribute name must not be null"),
                                AttributeValue.of(value)));
        return new NodeAttributes(Collections.unmodifiableMap(typed));
    }

    /// Returns a copy with one attribute added or replaced.
    ///
    /// @param name attribute name, not null
    /// @param value attribute value, see {@link AttributeValue#of(Object)}
    /// @return new attributes, never null
    public NodeAttributes with(String name, Object value) {
        Objects.requireNonNull(name, "name must not be null");
        Map<String, AttributeValue> copy = new LinkedHashMap<>(values);
        copy.put(name, AttributeValue.of(value));
        return new NodeAttributes(Collections.unmodifiableMap(copy));
    }

    public boolean contains(String name) {
        return values.containsKey(name);
    }

    public Optional<AttributeValue> get(String name) {
        return Optional.ofNullable(values.get(name));
    }

    /// Returns the text form of an attribute.
    ///
    /// @param name attribute name, not null
    /// @return text form, or empty if the attribute is absent
    public Optional<String> getText(String name) {
        return get(name).map(AttributeValue::asText);
    }

    public Map<String, AttributeValue> asMap() {
        return values;
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        return o instanceof NodeAttributes other && values.equals(other.values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return values.toString();
    }
}
