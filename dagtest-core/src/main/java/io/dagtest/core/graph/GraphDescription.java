package io.dagtest.core.graph;

import io.dagtest.core.node.NodeKind;
import io.dagtest.core.result.TestState;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Snapshot of a dependency graph, detached from the live nodes.
///
/// Renderers and serializers work on this description so they never touch
/// nodes while a run may be changing their state.
///
/// @param name graph name, not null
/// @param nodes one entry per node, in registration order, never null
/// @param edges one entry per dependency edge, never null
public record GraphDescription(
        String name, List<NodeDescription> nodes, List<EdgeDescription> edges) {

    public GraphDescription {
        Objects.requireNonNull(name, "name must not be null");
        nodes = nodes != null ? List.copyOf(nodes) : List.of();
        edges = edges != null ? List.copyOf(edges) : List.of();
    }

    /// One vertex.
    ///
    /// @param key node key, not null
    /// @param kind test or fixture, not null
    /// @param state state in the latest run, null if never run
    /// @param attributes attribute text forms, never null
    public record NodeDescription(
            String key, NodeKind kind, TestState state, Map<String, String> attributes) {

        public NodeDescription {
            Objects.requireNonNull(key, "key must not be null");
            Objects.requireNonNull(kind, "kind must not be null");
            attributes = attributes != null ? Map.copyOf(attributes) : Map.of();
        }

        public boolean isFixture() {
            return kind == NodeKind.FIXTURE;
        }
    }

    /// One dependency edge, pointing from the dependent to its dependency.
    ///
    /// @param from key of the dependent node, not null
    /// @param to key of the dependency, not null
    /// @param fixture whether either end is a fixture
    /// @param partner whether the edge pairs a tear-down with its set-up
    public record EdgeDescription(String from, String to, boolean fixture, boolean partner) {

        public EdgeDescription {
            Objects.requireNonNull(from, "from must not be null");
            Objects.requireNonNull(to, "to must not be null");
        }
    }
}
