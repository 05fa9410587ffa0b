package io.dagtest.core.execution;

import io.dagtest.core.node.TestNode;
import io.dagtest.core.result.RunSummary;
import io.dagtest.core.result.TestState;
import java.util.Collection;

/// Listener for run lifecycle events.
///
/// All methods have default no-op implementations, so reporters override
/// only what they need.
///
/// ### Callback Lifecycle
/// ```
/// onRunStart(nodes)              - results prepared, nothing transitioned yet
/// onStateChange(node, SKIPPED)   - skip rule applied, before scheduling
/// onStateChange(node, RUNNING)   - node starts executing
/// onStateChange(node, OK | ...)  - node reached its terminal state
/// onStateChange(node, DEPFAIL)   - node short-circuited, never RUNNING
/// onRunComplete(summary)         - every node resolved
/// ```
///
/// State changes are reported for fixtures too; use
/// {@link TestNode#isTest()} to tell them apart.
///
/// @implNote Implementations must be thread-safe. State changes arrive from
/// the threads executing the nodes, concurrently.
public interface RunListener {

    /// Called once before scheduling starts.
    ///
    /// @param nodes every node taking part in the run, not null
    default void onRunStart(Collection<TestNode> nodes) {}

    /// Called after a node moved to a new state.
    ///
    /// @param node the node, not null
    /// @param state the state it moved to, not null
    default void onStateChange(TestNode node, TestState state) {}

    /// Called once after every node resolved.
    ///
    /// @param summary aggregate outcome, not null
    default void onRunComplete(RunSummary summary) {}

    /// Listener that ignores all events.
    RunListener NOOP = new RunListener() {};
}
