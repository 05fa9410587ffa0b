package io.dagtest.core.capture;

import java.util.Objects;

/// Output collected from one capture channel during one phase.
///
/// @param name short channel name, e.g. `stdout`, not null
/// @param description human-readable channel description, not null
/// @param text captured text, never empty
public record CapturedOutput(String name, String description, String text) {

    public CapturedOutput {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(description, "description must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }
}
