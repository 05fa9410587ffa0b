package io.dagtest.serialization;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.dagtest.core.DagTestFactory;
import io.dagtest.core.DagTestRunner;
import io.dagtest.core.capture.ThreadLocalOutputCapture;
import io.dagtest.core.execution.RunListener;
import io.dagtest.core.graph.GraphDescription;
import io.dagtest.core.graph.GraphExporter;
import io.dagtest.core.node.NodeKind;
import io.dagtest.core.node.NodeRegistry;
import io.dagtest.core.node.Scope;
import io.dagtest.core.result.RunSummary;
import io.dagtest.core.result.TestState;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

@DisplayName("RunReportSerializer")
class RunReportSerializerTest {

    private final ObjectMapper mapper = RunReportSerializer.createMapper();

    private NodeRegistry registry;
    private ThreadLocalOutputCapture capture;
    private DagTestRunner runner;

    @BeforeEach
    void setUp() {
        registry = new NodeRegistry();
        capture = new ThreadLocalOutputCapture();
        runner = DagTestFactory.builder().capture(capture).listener(RunListener.NOOP).build();

        Scope scope = Scope.root(registry, "shop");
        scope.setUp(ctx -> {});
        scope.tearDown(ctx -> {});
        scope.test("login", ctx -> capture.write(ThreadLocalOutputCapture.STDOUT, "logged in\n"));
        scope.configure(
                "checkout",
                builder ->
                        builder.body(
                                ctx -> {
                                    throw new AssertionError(
                                            "total was 0", new IllegalStateException("empty cart"));
                                }));
        scope.configure("search", builder -> builder.repeat(2).body(ctx -> {}));
        scope.wire();
    }

    @AfterEach
    void tearDown() {
        runner.close();
    }

    @Nested
    @DisplayName("run summary")
    class Summary {

        @Test
        void shouldWriteTotalsAndResults() throws Exception {
            // Given
            RunSummary summary = runner.run(registry);

            // When
            JsonNode json = mapper.readTree(RunReportSerializer.toJson(summary));

            // Then
            assertThat(json.get("successful").asBoolean()).isFalse();
            assertThat(json.get("totalTests").asInt()).isEqualTo(3);
            assertThat(json.get("passed").asInt()).isEqualTo(2);
            assertThat(json.get("failed").asInt()).isEqualTo(1);
            assertThat(json.get("counts").get("FAIL").asInt()).isEqualTo(1);
            assertThat(json.get("duration").asText()).startsWith("PT");
            assertThat(json.get("results").size()).isEqualTo(5);
            assertThat(json.get("frameworkErrors").size()).isZero();
            assertThat(json.get("resourceErrors").size()).isZero();
        }

        @Test
        void shouldWriteMessagesWithErrorChainAndOutput() throws Exception {
            RunSummary summary = runner.run(registry);

            JsonNode results = mapper.readTree(RunReportSerializer.toJson(summary)).get("results");

            JsonNode checkout = find(results, "shop.checkout");
            assertThat(checkout.get("state").asText()).isEqualTo(TestState.FAIL.name());
            assertThat(checkout.get("kind").asText()).isEqualTo("TEST");
            JsonNode error = checkout.get("messages").get(0).get("error");
            assertThat(error.get("type").asText()).isEqualTo("java.lang.AssertionError");
            assertThat(error.get("message").asText()).isEqualTo("total was 0");
            assertThat(error.get("stackTrace").size()).isPositive();
            assertThat(error.get("cause").get("message").asText()).isEqualTo("empty cart");

            JsonNode login = find(results, "shop.login");
            JsonNode captured = login.get("messages").get(0).get("captured").get(0);
            assertThat(captured.get("name").asText()).isEqualTo("stdout");
            assertThat(captured.get("text").asText()).isEqualTo("logged in\n");
            assertThat(login.has("startedAt")).isTrue();
        }

        @Test
        void shouldWriteSubInvocationsOfMultiResultTests() throws Exception {
            RunSummary summary = runner.run(registry);

            JsonNode search =
                    find(mapper.readTree(RunReportSerializer.toJson(summary)).get("results"),
                            "shop.search");

            assertThat(search.get("total").asInt()).isEqualTo(2);
            assertThat(search.get("successes").asInt()).isEqualTo(2);
            assertThat(search.get("subInvocations").size()).isEqualTo(2);
            assertThat(search.get("subInvocations").get(1).get("id").asText())
                    .isEqualTo("shop.search#1");
            assertThat(search.has("messages")).isFalse();
        }

        private JsonNode find(JsonNode results, String key) {
            for (JsonNode result : results) {
                if (key.equals(result.get("key").asText())) {
                    return result;
                }
            }
            throw new AssertionError("No result for " + key);
        }
    }

    @Nested
    @DisplayName("graph")
    class Graph {

        @Test
        void shouldRoundTripGraphDescription() throws Exception {
            // Given
            runner.run(registry);
            GraphDescription graph = GraphExporter.describe("shop", registry.getNodes());

            // When
            GraphDescription restored =
                    RunReportSerializer.graphFromJson(RunReportSerializer.toJson(graph));

            // Then
            assertThat(restored).isEqualTo(graph);
            assertThat(restored.nodes().get(0).kind()).isEqualTo(NodeKind.FIXTURE);
        }

        @Test
        void shouldLeaveOutDerivedFixtureFlag() throws Exception {
            GraphDescription graph = GraphExporter.describe(registry.getNodes());

            JsonNode node = mapper.readTree(RunReportSerializer.toJson(graph)).get("nodes").get(0);

            assertThat(node.has("fixture")).isFalse();
            assertThat(node.get("state").isNull()).isTrue();
        }

        @Test
        void shouldIgnoreUnknownProperties() {
            String json =
                    "{\"name\":\"g\",\"version\":2,\"nodes\":[{\"key\":\"a\",\"kind\":\"TEST\","
                            + "\"state\":\"OK\",\"attributes\":{},\"owner\":\"qa\"}],\"edges\":[]}";

            GraphDescription graph = RunReportSerializer.graphFromJson(json);

            assertThat(graph.nodes()).singleElement()
                    .satisfies(node -> assertThat(node.state()).isEqualTo(TestState.OK));
        }

        @Test
        void shouldWrapMalformedInput() {
            assertThatThrownBy(() -> RunReportSerializer.graphFromJson("{not json"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageStartingWith("Failed to deserialize graph");
        }
    }
}
