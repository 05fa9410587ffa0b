package io.dagtest.core.graph;

import io.dagtest.core.node.FixtureNode;
import io.dagtest.core.node.NodeKind;
import io.dagtest.core.node.TestNode;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Builds {@link GraphDescription}s from live nodes.
public final class GraphExporter {

    /// Default graph name.
    public static final String DEFAULT_NAME = "testdeps";

    private GraphExporter() {}

    /// Describes the given nodes and the edges between them.
    ///
    /// Edges to nodes outside the collection are omitted.
    ///
    /// @param name graph name, not null
    /// @param nodes nodes to describe, not null
    /// @return detached description, never null
    public static GraphDescription describe(String name, Collection<? extends TestNode> nodes) {
        Objects.requireNonNull(name, "name must not be null");
        Objects.requireNonNull(nodes, "nodes must not be null");
        List<GraphDescription.NodeDescription> vertices = new ArrayList<>();
        List<GraphDescription.EdgeDescription> edges = new ArrayList<>();
        for (TestNode node : nodes) {
            Map<String, String> attributes = new LinkedHashMap<>();
            node.getAttributes().asMap().forEach((key, value) -> attributes.put(key, value.asText()));
            vertices.add(
                    new GraphDescription.NodeDescription(
                            node.getKey(), node.getKind(), node.getState(), attributes));

            TestNode partner = node instanceof FixtureNode fixture ? fixture.getPartner() : null;
            for (TestNode dependency : node.getDependencies()) {
                if (!nodes.contains(dependency)) {
                    continue;
                }
                boolean fixtureEdge =
                        node.getKind() == NodeKind.FIXTURE
                                || dependency.getKind() == NodeKind.FIXTURE;
                edges.add(
                        new GraphDescription.EdgeDescription(
                                node.getKey(),
                                dependency.getKey(),
                                fixtureEdge,
                                dependency.equals(partner)));
            }
        }
        return new GraphDescription(name, vertices, edges);
    }

    /// Describes the given nodes under {@link #DEFAULT_NAME}.
    ///
    /// @param nodes nodes to describe, not null
    /// @return detached description, never null
    public static GraphDescription describe(Collection<? extends TestNode> nodes) {
        return describe(DEFAULT_NAME, nodes);
    }
}
