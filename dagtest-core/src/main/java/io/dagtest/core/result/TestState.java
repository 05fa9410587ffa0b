package io.dagtest.core.result;

/// States a test or fixture moves through during one scheduling run.
///
/// A node that has not been touched in the current run has no state at all
/// (`null`); every other state is reached exactly once per run.
///
/// ### Transitions
/// ```
/// null ──► RUNNING ──► OK | UOK | FAIL | XFAIL | ERROR
/// null ──► DEPFAIL | SKIPPED                (short circuits, never RUNNING)
/// ```
///
/// @see TestResult for the object that carries the state
public enum TestState {

    /// Node is executing.
    RUNNING,

    /// Completed successfully.
    OK,

    /// Marked as expected to fail, but completed successfully.
    UOK,

    /// Failed an assertion.
    FAIL,

    /// Marked as expected to fail, and failed.
    XFAIL,

    /// Raised an unexpected exception.
    ERROR,

    /// Not run because a dependency failed or errored.
    DEPFAIL,

    /// Deliberately not run.
    SKIPPED;

    /// Returns whether a state still blocks fixtures waiting on it.
    ///
    /// @param state the state to inspect, may be null
    /// @return true if `state` is null or {@link #RUNNING}
    public static boolean isPending(TestState state) {
        return state == null || state == RUNNING;
    }

    /// Returns whether a dependency in this state lets a regular test run.
    ///
    /// @return true for {@link #OK} and {@link #UOK}
    public boolean isResolvedPositive() {
        return this == OK || this == UOK;
    }

    /// Returns whether a dependency in this state causes dependents to be
    /// short-circuited to {@link #DEPFAIL}.
    ///
    /// @return true for {@link #FAIL}, {@link #XFAIL}, {@link #ERROR} and {@link #DEPFAIL}
    public boolean isFailing() {
        return this == FAIL || this == XFAIL || this == ERROR || this == DEPFAIL;
    }

    /// Returns whether this state counts as a pass in run summaries.
    ///
    /// Expected failures count as passes; unexpected passes do too.
    ///
    /// @return true for {@link #OK}, {@link #UOK} and {@link #XFAIL}
    public boolean countsAsPass() {
        return this == OK || this == UOK || this == XFAIL;
    }

    /// Returns whether this state fails a run.
    ///
    /// @return true for {@link #FAIL}, {@link #ERROR} and {@link #DEPFAIL}
    public boolean countsAsFailure() {
        return this == FAIL || this == ERROR || this == DEPFAIL;
    }
}
