package io.dagtest.core.result;

import io.dagtest.core.capture.CapturedOutput;
import java.util.List;

/// Accounting for one phase, or one sub-invocation, of a node.
///
/// Opening a scope clears the calling task's captured output; closing it
/// collects the output, classifies what the phase raised and records a
/// {@link TestMessage} on the owning {@link TestResult}. `close()` never
/// throws, so it is always safe in try-with-resources.
///
/// @see TestResult#accumulate(Phase, ExpectedExceptions)
public final class PhaseScope implements AutoCloseable {

    /// Body run inside a scope.
    @FunctionalInterface
    public interface Call {
        void call() throws Exception;
    }

    private final TestResult result;
    private final Phase phase;
    private final String id;
    private final ExpectedExceptions expected;
    private final boolean subInvocation;

    private Throwable thrown;
    private boolean closed;

    PhaseScope(
            TestResult result,
            Phase phase,
            String id,
            ExpectedExceptions expected,
            boolean subInvocation) {
        this.result = result;
        this.phase = phase;
        this.id = id;
        this.expected = expected;
        this.subInvocation = subInvocation;
        result.capture().clear();
    }

    public Phase getPhase() {
        return phase;
    }

    public String getId() {
        return id;
    }

    /// Runs a call, recording anything it raises.
    ///
    /// @param call the phase body, not null
    /// @return true if the call completed without raising
    public boolean execute(Call call) {
        try {
            call.call();
            return true;
        } catch (Throwable t) {
            fail(t);
            return false;
        }
    }

    /// Records a throwable raised on behalf of this phase.
    ///
    /// Only the first throwable is kept.
    ///
    /// @param error the throwable, not null
    public void fail(Throwable error) {
        if (thrown == null) {
            thrown = error;
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        List<CapturedOutput> captured = result.capture().retrieve();
        Outcome outcome = Outcome.classify(thrown, expected);
        Throwable reported = thrown;
        if (reported == null && outcome == Outcome.FAIL) {
            reported =
                    new AssertionError(
                            "Expected one of " + expected.getTypes() + " to be raised");
        }
        TestMessage message =
                reported != null || !captured.isEmpty()
                        ? new TestMessage(phase, id, captured, reported)
                        : null;
        result.record(phase, id, outcome, message, subInvocation);
    }
}
