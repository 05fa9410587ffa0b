package io.dagtest.core.node;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Sub-test emitted by a {@link TestGenerator}.
///
/// The body sees `args` and `kwargs` through
/// {@link TestContext#getArgs()} and {@link TestContext#getKwargs()}.
///
/// @param name requested sub-invocation name; null means the node key
/// @param body callable to run, not null
/// @param args positional arguments, never null
/// @param kwargs named arguments, never null
public record SubTest(String name, TestBody body, List<Object> args, Map<String, Object> kwargs) {

    public SubTest {
        Objects.requireNonNull(body, "body must not be null");
        args = args != null ? List.copyOf(args) : List.of();
        kwargs = kwargs != null ? Map.copyOf(kwargs) : Map.of();
    }

    /// Creates an unnamed sub-test without arguments.
    ///
    /// @param body callable to run, not null
    /// @return sub-test named after its node, never null
    public static SubTest of(TestBody body) {
        return new SubTest(null, body, List.of(), Map.of());
    }

    /// Creates a named sub-test with positional arguments.
    ///
    /// @param name sub-invocation name, may be null
    /// @param body callable to run, not null
    /// @param args positional arguments
    /// @return the sub-test, never null
    public static SubTest of(String name, TestBody body, Object... args) {
        return new SubTest(name, body, List.of(args), Map.of());
    }
}
