package io.dagtest.core.graph;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.dagtest.core.capture.OutputCapture;
import io.dagtest.core.execution.RunListener;
import io.dagtest.core.node.FixtureNode;
import io.dagtest.core.node.NodeKind;
import io.dagtest.core.node.NodeRegistry;
import io.dagtest.core.node.Scope;
import io.dagtest.core.node.TestCaseNode;
import io.dagtest.core.node.TestNode;
import io.dagtest.core.result.TestState;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("GraphVisualizer")
class GraphVisualizerTest {

    private GraphVisualizer visualizer;
    private NodeRegistry registry;
    private FixtureNode setUp;
    private FixtureNode tearDown;
    private TestCaseNode login;
    private TestCaseNode checkout;

    @BeforeEach
    void setUp() {
        visualizer = new GraphVisualizer();
        registry = new NodeRegistry();
        Scope scope = Scope.root(registry, "shop");
        setUp = scope.setUp(ctx -> {});
        tearDown = scope.tearDown(ctx -> {});
        login = scope.test("login", ctx -> {});
        checkout = scope.test("checkout", ctx -> {});
        checkout.addDependency(login);
        scope.wire();
    }

    private void finish(TestNode node, TestState state) {
        node.transition(TestState.RUNNING, RunListener.NOOP);
        node.transition(state, RunListener.NOOP);
    }

    private GraphDescription graphAfterFailedLogin() {
        for (TestNode node : registry.getNodes()) {
            node.prepare(OutputCapture.NONE);
        }
        finish(setUp, TestState.OK);
        finish(login, TestState.FAIL);
        checkout.transition(TestState.DEPFAIL, RunListener.NOOP);
        finish(tearDown, TestState.OK);
        return GraphExporter.describe(registry.getNodes());
    }

    @Nested
    @DisplayName("GraphExporter")
    class Exporter {

        @Test
        void shouldDescribeNodesAndEdges() {
            GraphDescription graph = GraphExporter.describe("shop", registry.getNodes());

            assertThat(graph.name()).isEqualTo("shop");
            assertThat(graph.nodes())
                    .extracting(GraphDescription.NodeDescription::key)
                    .containsExactly("shop.setUp", "shop.tearDown", "shop.login", "shop.checkout");
            assertThat(graph.nodes().get(0).kind()).isEqualTo(NodeKind.FIXTURE);
            assertThat(graph.edges())
                    .contains(
                            new GraphDescription.EdgeDescription(
                                    "shop.checkout", "shop.login", false, false),
                            new GraphDescription.EdgeDescription(
                                    "shop.tearDown", "shop.setUp", true, true),
                            new GraphDescription.EdgeDescription(
                                    "shop.login", "shop.setUp", true, false));
        }

        @Test
        void shouldCarryStatesOfLatestRun() {
            GraphDescription graph = graphAfterFailedLogin();

            assertThat(graph.nodes())
                    .extracting(GraphDescription.NodeDescription::state)
                    .containsExactly(TestState.OK, TestState.OK, TestState.FAIL, TestState.DEPFAIL);
        }
    }

    @Nested
    @DisplayName("dot")
    class Dot {

        @Test
        void shouldRenderStrictDigraph() {
            String dot = visualizer.visualize(GraphExporter.describe(registry.getNodes()));

            assertThat(dot).startsWith("strict digraph \"testdeps\" {\n");
            assertThat(dot).endsWith("}\n");
            assertThat(dot).contains("\t\"shop.login\" [label=\"shop.login\"];");
            assertThat(dot).contains("\t\"shop.setUp\" [label=\"shop.setUp\",color=\"blue\"];");
            assertThat(dot).contains("\t\"shop.checkout\" -> \"shop.login\";");
            assertThat(dot)
                    .contains("\t\"shop.tearDown\" -> \"shop.setUp\" [color=\"blue\",style=\"dotted\"];");
        }

        @Test
        void shouldStyleResults() {
            String dot = visualizer.visualize(graphAfterFailedLogin(), "dot");

            assertThat(dot)
                    .contains("\"shop.login\" [label=\"shop.login\\n(Result: FAIL)\",color=\"red\"];");
            assertThat(dot)
                    .contains(
                            "\"shop.checkout\" [label=\"shop.checkout\\n(Result: DEPFAIL)\","
                                    + "color=\"red\",style=\"dashed\"];");
        }
    }

    @Nested
    @DisplayName("mermaid")
    class Mermaid {

        @Test
        void shouldRenderFlowchart() {
            String mermaid =
                    visualizer.visualize(graphAfterFailedLogin(), "mermaid");

            assertThat(mermaid).startsWith("```mermaid\nflowchart TD\n");
            assertThat(mermaid).contains("shop_setUp([\"shop.setUp\\n(OK)\"]):::passed");
            assertThat(mermaid).contains("shop_login[\"shop.login\\n(FAIL)\"]:::failed");
            assertThat(mermaid).contains("shop_login --> shop_checkout");
            assertThat(mermaid).contains("shop_setUp -.-> shop_tearDown");
            assertThat(mermaid).endsWith("```\n");
        }
    }

    @Test
    void shouldRejectUnknownFormat() {
        GraphDescription graph = GraphExporter.describe(registry.getNodes());

        assertThatThrownBy(() -> visualizer.visualize(graph, "svg"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessage("Unsupported format: svg. Available: dot, mermaid");
    }

    @Test
    void shouldListAvailableFormats() {
        assertThat(visualizer.getAvailableFormats()).containsExactly("dot", "mermaid");
    }
}
