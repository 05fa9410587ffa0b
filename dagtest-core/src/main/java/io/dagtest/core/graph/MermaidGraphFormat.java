package io.dagtest.core.graph;

import io.dagtest.core.result.TestState;

/// Mermaid flowchart rendering, wrapped in a Markdown code block.
///
/// ### Node Shapes
/// - **Test**: rectangle
/// - **Fixture**: stadium
///
/// Nodes that ran carry their state in the label and a class per outcome
/// (`passed`, `failed`, `skipped`) styled at the end of the diagram.
/// Arrows point from a dependency to its dependents, in execution order;
/// partner edges are dotted.
///
/// @implNote Thread-safe. Stateless rendering.
public class MermaidGraphFormat implements GraphFormat {

    @Override
    public String getName() {
        return "mermaid";
    }

    @Override
    public String render(GraphDescription graph) {
        StringBuilder sb = new StringBuilder();
        sb.append("```mermaid\n");
        sb.append("flowchart TD\n");
        sb.append("  %% ").append(graph.name()).append('\n');

        for (GraphDescription.NodeDescription node : graph.nodes()) {
            String id = sanitizeId(node.key());
            String label = node.key() + (node.state() != null ? "\\n(" + node.state() + ")" : "");
            sb.append("    ").append(id);
            if (node.isFixture()) {
                sb.append("([\"").append(label).append("\"])");
            } else {
                sb.append("[\"").append(label).append("\"]");
            }
            String styleClass = styleClass(node.state());
            if (styleClass != null) {
                sb.append(":::").append(styleClass);
            }
            sb.append('\n');
        }

        sb.append('\n');
        for (GraphDescription.EdgeDescription edge : graph.edges()) {
            sb.append("    ")
                    .append(sanitizeId(edge.to()))
                    .append(edge.partner() ? " -.-> " : " --> ")
                    .append(sanitizeId(edge.from()))
                    .append('\n');
        }

        sb.append('\n');
        sb.append("  classDef passed stroke:#2e7d32\n");
        sb.append("  classDef failed stroke:#c62828\n");
        sb.append("  classDef skipped stroke-dasharray: 4 4\n");
        sb.append("```\n");
        return sb.toString();
    }

    private String styleClass(TestState state) {
        if (state == null || state == TestState.RUNNING) {
            return null;
        }
        if (state == TestState.SKIPPED) {
            return "skipped";
        }
        return state.isFailing() ? "failed" : "passed";
    }

    private String sanitizeId(String key) {
        return key.replaceAll("[^a-zA-Z0-9_]", "_");
    }
}
