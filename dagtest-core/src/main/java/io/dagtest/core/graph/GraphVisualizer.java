package io.dagtest.core.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Registry and dispatcher for graph formats.
///
/// @implNote Thread-safe after construction. Format map is immutable.
/// @see GraphFormat
public class GraphVisualizer {

    private final Map<String, GraphFormat> formats;

    /// Creates a visualizer with the built-in `dot` and `mermaid` formats.
    public GraphVisualizer() {
        this(List.of(new DotGraphFormat(), new MermaidGraphFormat()));
    }

    /// Creates a visualizer with the given formats.
    ///
    /// @param formats formats to register, not null; later ones replace
    ///     earlier ones with the same name
    public GraphVisualizer(List<? extends GraphFormat> formats) {
        Objects.requireNonNull(formats, "formats must not be null");
        Map<String, GraphFormat> byName = new LinkedHashMap<>();
        for (GraphFormat format : formats) {
            byName.put(format.getName(), format);
        }
        this.formats = Collections.unmodifiableMap(byName);
    }

    /// Renders a graph in the named format.
    ///
    /// @param graph graph to render, not null
    /// @param formatName format name, not null
    /// @return rendered text, never null
    /// @throws IllegalArgumentException if no format has that name
    public String visualize(GraphDescription graph, String formatName) {
        GraphFormat format = formats.get(formatName);
        if (format == null) {
            throw new IllegalArgumentException(
                    "Unsupported format: "
                            + formatName
                            + ". Available: "
                            + String.join(", ", formats.keySet()));
        }
        return format.render(graph);
    }

    /// Renders a graph in the `dot` format.
    ///
    /// @param graph graph to render, not null
    /// @return GraphViz text, never null
    public String visualize(GraphDescription graph) {
        return visualize(graph, "dot");
    }

    public Iterable<String> getAvailableFormats() {
        return formats.keySet();
    }
}
