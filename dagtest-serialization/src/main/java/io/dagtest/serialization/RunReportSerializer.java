package io.dagtest.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.dagtest.core.graph.GraphDescription;
import io.dagtest.core.result.RunSummary;

/// Utility class for writing run reports and dependency graphs as JSON.
///
/// Run summaries are export-only: they reference live nodes and throwables
/// that cannot be rebuilt from JSON. Graph descriptions round-trip.
///
/// ### Usage
/// {@snippet :
/// String report = RunReportSerializer.toJson(summary);
///
/// String graph = RunReportSerializer.toJson(GraphExporter.describe(registry.getNodes()));
/// GraphDescription restored = RunReportSerializer.graphFromJson(graph);
/// }
///
/// @implNote Thread-safe. A new `ObjectMapper` is created per call via
/// `createMapper()`; cache one for high-throughput use.
///
/// @see DagTestJacksonModule for the registered type handlers
public final class RunReportSerializer {

    private RunReportSerializer() {}

    /// Serializes a run summary to pretty-printed JSON.
    ///
    /// @param summary the summary to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(RunSummary summary) {
        try {
            return createMapper().writeValueAsString(summary);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize run summary: " + e.getMessage(), e);
        }
    }

    /// Serializes a graph description to pretty-printed JSON.
    ///
    /// @param graph the graph to serialize, not null
    /// @return JSON string representation, never null
    /// @throws IllegalArgumentException if serialization fails
    public static String toJson(GraphDescription graph) {
        try {
            return createMapper().writeValueAsString(graph);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to serialize graph: " + e.getMessage(), e);
        }
    }

    /// Deserializes a graph description from JSON.
    ///
    /// @param json JSON string, not null
    /// @return deserialized graph, never null
    /// @throws IllegalArgumentException if deserialization fails
    public static GraphDescription graphFromJson(String json) {
        try {
            return createMapper().readValue(json, GraphDescription.class);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException(
                    "Failed to deserialize graph: " + e.getMessage(), e);
        }
    }

    /// Creates an ObjectMapper configured for run report serialization.
    ///
    /// Registers:
    /// - `DagTestJacksonModule` for results, messages and summaries
    /// - `JavaTimeModule` for `Instant` and `Duration` fields
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    /// - Timestamps written as ISO-8601 strings (not numeric)
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new DagTestJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
                .enable(SerializationFeature.INDENT_OUTPUT);
    }
}
