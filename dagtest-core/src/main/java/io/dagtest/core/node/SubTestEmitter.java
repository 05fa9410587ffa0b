package io.dagtest.core.node;

/// Receives the sub-tests produced by a {@link TestGenerator}.
@FunctionalInterface
public interface SubTestEmitter {

    /// Hands a sub-test to the node's strategy.
    ///
    /// Depending on the strategy the sub-test may already have run when this
    /// returns.
    ///
    /// @param subTest the sub-test, not null
    void emit(SubTest subTest);
}
