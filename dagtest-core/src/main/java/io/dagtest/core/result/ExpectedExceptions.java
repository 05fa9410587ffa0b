package io.dagtest.core.result;

import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/// Exception types a test body is expected to raise.
///
/// A body raising an instance of one of the declared types passes. When
/// types are declared, completing normally is a failure unless
/// {@link #orNormalCompletion()} relaxed the expectation.
///
/// ### Example
/// {@snippet :
/// ExpectedExceptions.of(IllegalStateException.class, IOException.class)
///         .orNormalCompletion();
/// }
public final class ExpectedExceptions {

    private static final ExpectedExceptions NONE = new ExpectedExceptions(Set.of(), true);

    private final Set<Class<? extends Throwable>> types;
    private final boolean normalCompletionAllowed;

    private ExpectedExceptions(
            Set<Class<? extends Throwable>> types, boolean normalCompletionAllowed) {
        this.types = types;
        this.normalCompletionAllowed = normalCompletionAllowed;
    }

    /// Returns the expectation used when nothing was declared.
    ///
    /// @return shared empty expectation, never null
    public static ExpectedExceptions none() {
        return NONE;
    }

    /// Declares the exception types a body must raise.
    ///
    /// @param types expected types, not null, at least one
    /// @return expectation requiring one of the types, never null
    /// @throws IllegalArgumentException if no type is given
    @SafeVarargs
    public static ExpectedExceptions of(Class<? extends Throwable>... types) {
        Objects.requireNonNull(types, "types must not be null");
        if (types.length == 0) {
            throw new IllegalArgumentException("At least one exception type is required");
        }
        Set<Class<? extends Throwable>> declared = new LinkedHashSet<>();
        for (Class<? extends Throwable> type : types) {
            declared.add(Objects.requireNonNull(type, "exception type must not be null"));
        }
        return new ExpectedExceptions(Set.copyOf(declared), false);
    }

    /// Returns a copy that also accepts a body completing normally.
    ///
    /// @return relaxed expectation, never null
    public ExpectedExceptions orNormalCompletion() {
        return normalCompletionAllowed ? this : new ExpectedExceptions(types, true);
    }

    /// Returns the declared types.
    ///
    /// @return unmodifiable set, empty when nothing is expected
    public Set<Class<? extends Throwable>> getTypes() {
        return types;
    }

    public boolean isEmpty() {
        return types.isEmpty();
    }

    public boolean isNormalCompletionAllowed() {
        return normalCompletionAllowed;
    }

    /// Returns whether a raised throwable satisfies the expectation.
    ///
    /// Subclasses of a declared type match.
    ///
    /// @param thrown the raised throwable, not null
    /// @return true if it is an instance of a declared type
    public boolean matches(Throwable thrown) {
        for (Class<? extends Throwable> type : types) {
            if (type.isInstance(thrown)) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ExpectedExceptions other)) return false;
        return normalCompletionAllowed == other.normalCompletionAllowed
                && types.equals(other.types);
    }

    @Override
    public int hashCode() {
        return Objects.hash(types, normalCompletionAllowed);
    }

    @Override
    public String toString() {
        return "ExpectedExceptions{types="
                + types
                + ", normalCompletionAllowed="
                + normalCompletionAllowed
                + "}";
    }
}
