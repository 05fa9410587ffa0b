package io.dagtest.core.graph;

import io.dagtest.core.result.TestState;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

/// GraphViz rendering, suitable for the `dot` tool.
///
/// ### Styling
/// - failed nodes (FAIL, XFAIL, ERROR, DEPFAIL) are red, other fixtures blue
/// - skipped nodes are dotted, dependency failures dashed
/// - edges touching a fixture are blue and dashed, partner edges dotted
///
/// Edges point from a node to the node it depends on.
///
/// @implNote Thread-safe. Stateless rendering.
public class DotGraphFormat implements GraphFormat {

    @Override
    public String getName() {
        return "dot";
    }

    @Override
    public String render(GraphDescription graph) {
        StringBuilder sb = new StringBuilder();
        sb.append("strict digraph \"").append(escape(graph.name())).append("\" {\n");

        for (GraphDescription.NodeDescription node : graph.nodes()) {
            Map<String, String> options = new LinkedHashMap<>();
            String label = node.key();
            if (node.state() != null) {
                label += "\\n(Result: " + node.state() + ")";
            }
            options.put("label", label);
            if (node.state() != null && node.state().isFailing()) {
                options.put("color", "red");
            } else if (node.isFixture()) {
                options.put("color", "blue");
            }
            if (node.state() == TestState.SKIPPED) {
                options.put("style", "dotted");
            } else if (node.state() == TestState.DEPFAIL) {
                options.put("style", "dashed");
            }
            sb.append("\t\"").append(escape(node.key())).append('"');
            sb.append(options(options)).append(";\n");
        }

        sb.append('\n');
        for (GraphDescription.EdgeDescription edge : graph.edges()) {
            Map<String, String> options = new LinkedHashMap<>();
            if (edge.fixture()) {
                options.put("color", "blue");
                options.put("style", "dashed");
            }
            if (edge.partner()) {
                options.put("style", "dotted");
            }
            sb.append("\t\"")
                    .append(escape(edge.from()))
                    .append("\" -> \"")
                    .append(escape(edge.to()))
                    .append('"')
                    .append(options(options))
                    .append(";\n");
        }

        sb.append("}\n");
        return sb.toString();
    }

    private String options(Map<String, String> options) {
        if (options.isEmpty()) {
            return "";
        }
        return options.entrySet().stream()
                .map(entry -> entry.getKey() + "=\"" + entry.getValue() + "\"")
                .collect(Collectors.joining(",", " [", "]"));
    }

    private String escape(String text) {
        return text.replace("\"", "\\\"");
    }
}
