package io.dagtest.core.result;

import java.io.Serial;
import java.time.Duration;

/// Failure recorded when a phase does not finish within its node's timeout.
///
/// Extends `AssertionError` so a timed-out test is reported as a failure
/// rather than an error.
public class TestTimeoutError extends AssertionError {

    @Serial private static final long serialVersionUID = 4127316120957702301L;

    private final transient Duration timeout;

    /// Creates the failure for the given limit.
    ///
    /// @param timeout the limit that was exceeded, not null
    public TestTimeoutError(Duration timeout) {
        super("Timed out after " + timeout.toMillis() + " ms");
        this.timeout = timeout;
    }

    /// Returns the limit that was exceeded.
    ///
    /// @return the timeout, never null
    public Duration getTimeout() {
        return timeout;
    }
}
