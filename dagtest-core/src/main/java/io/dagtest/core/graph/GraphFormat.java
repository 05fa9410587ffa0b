package io.dagtest.core.graph;

/// Renders a {@link GraphDescription} in a textual diagram format.
///
/// ### Built-in Formats
/// - `dot` - GraphViz ({@link DotGraphFormat})
/// - `mermaid` - Mermaid flowchart ({@link MermaidGraphFormat})
///
/// @see GraphVisualizer
public interface GraphFormat {

    /// Returns the unique identifier for this format.
    ///
    /// @return format name, never null
    String getName();

    /// Renders the graph.
    ///
    /// @param graph graph to render, not null
    /// @return rendered text, never null
    String render(GraphDescription graph);
}
