package io.dagtest.core.result;

import io.dagtest.core.capture.CapturedOutput;
import java.util.List;
import java.util.Objects;

/// Exception and output information produced by one phase, or by one
/// sub-invocation of a multi-result test.
///
/// A message only exists when there is something to report: a throwable,
/// captured output, or both.
///
/// @param phase phase that produced the message, not null
/// @param id slot identifier; the node key for single-result phases, the
///     sub-invocation id for multi-result test phases, not null
/// @param captured output captured during the phase, never null (may be empty)
/// @param error throwable raised by the phase, may be null
public record TestMessage(
        Phase phase, String id, List<CapturedOutput> captured, Throwable error) {

    public TestMessage {
        Objects.requireNonNull(phase, "phase must not be null");
        Objects.requireNonNull(id, "id must not be null");
        captured = captured != null ? List.copyOf(captured) : List.of();
    }

    /// Returns whether the phase raised anything.
    ///
    /// @return true if {@link #error()} is set
    public boolean hasError() {
        return error != null;
    }
}
