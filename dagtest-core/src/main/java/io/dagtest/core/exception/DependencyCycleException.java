package io.dagtest.core.exception;

import java.io.Serial;
import java.util.List;

/// Thrown before a run starts when the dependency graph contains a cycle.
///
/// A cycle would leave every node on it waiting forever, so the run is
/// refused instead.
public class DependencyCycleException extends Exception {

    @Serial private static final long serialVersionUID = 6051232984407763158L;

    private final List<String> cycle;

    /// Creates the exception for a detected cycle.
    ///
    /// @param cycle keys of the nodes on the cycle, in dependency order,
    ///     with the first key repeated at the end, not null
    public DependencyCycleException(List<String> cycle) {
        super("Dependency cycle detected: " + String.join(" -> ", cycle));
        this.cycle = List.copyOf(cycle);
    }

    /// Returns the keys on the cycle.
    ///
    /// @return unmodifiable list, first key repeated at the end
    public List<String> getCycle() {
        return cycle;
    }
}
