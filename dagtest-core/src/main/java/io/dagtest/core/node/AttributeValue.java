package io.dagtest.core.node;

import java.util.Objects;

/// Typed value of a node attribute.
///
/// Attributes are free-form tags attached at discovery and consulted by skip
/// rules and reporters. Every value has a canonical text form, used when a
/// rule compares an attribute against a string typed by a user.
public sealed interface AttributeValue
        permits AttributeValue.Text, AttributeValue.Whole, AttributeValue.Decimal, AttributeValue.Flag {

    /// Returns the canonical text form of the value.
    ///
    /// @return text form, never null
    String asText();

    /// Wraps a plain Java value.
    ///
    /// @param value a `String`, integral `Number`, floating-point `Number` or
    ///     `Boolean`, not null
    /// @return the typed value, never null
    /// @throws IllegalArgumentException for any other type
    static AttributeValue of(Object value) {
        Objects.requireNonNull(value, "value must not be null");
        if (value instanceof AttributeValue typed) {
            return typed;
        }
        if (value instanceof String text) {
            return new Text(text);
        }
        if (value instanceof Boolean flag) {
            return new Flag(flag);
        }
        if (value instanceof Double || value instanceof Float) {
            return new Decimal(((Number) value).doubleValue());
        }
        if (value instanceof Number number) {
            return new Whole(number.longValue());
        }
        throw new IllegalArgumentException(
                "Unsupported attribute type: " + value.getClass().getName());
    }

    record Text(String value) implements AttributeValue {
        public Text {
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public String asText() {
            return value;
        }
    }

    record Whole(long value) implements AttributeValue {
        @Override
        public String asText() {
            return Long.toString(value);
        }
    }

    record Decimal(double value) implements AttributeValue {
        @Override
        public String asText() {
            return Double.toString(value);
        }
    }

    record Flag(boolean value) implements AttributeValue {
        @Override
        public String asText() {
            return Boolean.toString(value);
        }
    }
}
