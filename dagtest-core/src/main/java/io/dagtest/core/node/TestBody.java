package io.dagtest.core.node;

/// Callable run as a node's body, or as its pre or post phase.
///
/// A body fails by throwing an `AssertionError`; any other throwable is an
/// error unless the node expects it.
@FunctionalInterface
public interface TestBody {

    /// Runs the body.
    ///
    /// @param context per-execution context, never null
    /// @throws Exception anything the body raises; recorded, never propagated
    void run(TestContext context) throws Exception;
}
