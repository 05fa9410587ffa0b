package io.dagtest.core.result;

import java.util.Objects;

/// Failure of the engine itself while handling a node, as opposed to a
/// failure raised by test code.
///
/// The affected node is forced to {@link TestState#ERROR}.
///
/// @param nodeKey key of the affected node, not null
/// @param message what went wrong, not null
/// @param cause underlying throwable, may be null
public record FrameworkError(String nodeKey, String message, Throwable cause) {

    public FrameworkError {
        Objects.requireNonNull(nodeKey, "nodeKey must not be null");
        Objects.requireNonNull(message, "message must not be null");
    }
}
