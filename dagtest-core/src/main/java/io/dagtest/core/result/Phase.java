package io.dagtest.core.result;

/// Execution phase a {@link TestMessage} was produced in.
public enum Phase {

    /// Pre-test fixture callable.
    PRE,

    /// The test body itself.
    TEST,

    /// Post-test fixture callable.
    POST
}
