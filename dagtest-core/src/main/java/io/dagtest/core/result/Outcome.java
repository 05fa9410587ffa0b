package io.dagtest.core.result;

/// Classification of a single phase or sub-invocation.
public enum Outcome {
    PASS,
    FAIL,
    ERROR;

    /// Classifies how a body finished.
    ///
    /// An `AssertionError` is a failure, any other throwable an error,
    /// unless it matches the expected exceptions, which makes it a pass.
    ///
    /// @param thrown what the body raised, or null if it completed normally
    /// @param expected expected exceptions, not null
    /// @return the outcome, never null
    public static Outcome classify(Throwable thrown, ExpectedExceptions expected) {
        if (thrown == null) {
            return expected.isEmpty() || expected.isNormalCompletionAllowed() ? PASS : FAIL;
        }
        if (expected.matches(thrown)) {
            return PASS;
        }
        return thrown instanceof AssertionError ? FAIL : ERROR;
    }
}
