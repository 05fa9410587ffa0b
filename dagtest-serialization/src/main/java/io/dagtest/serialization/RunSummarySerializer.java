package io.dagtest.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.dagtest.core.resource.ResourceReleaseError;
import io.dagtest.core.result.FrameworkError;
import io.dagtest.core.result.RunSummary;
import io.dagtest.core.result.TestResult;
import io.dagtest.core.result.TestState;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Serializes a run summary: totals first, then per-node results, then
/// engine and resource errors.
///
/// `counts` lists every state with at least one test, keyed by state name.
/// `duration` is an ISO-8601 duration when the mapper disables
/// `WRITE_DURATIONS_AS_TIMESTAMPS`.
///
/// @implNote Package-private. Registered by {@link DagTestJacksonModule}.
class RunSummarySerializer extends StdSerializer<RunSummary> {

    @Serial private static final long serialVersionUID = 7759302148016223950L;

    RunSummarySerializer() {
        super(RunSummary.class);
    }

    @Override
    public void serialize(RunSummary summary, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeBooleanField("successful", summary.isSuccessful());
        gen.writeNumberField("totalTests", summary.getTotalTests());
        gen.writeNumberField("passed", summary.getPassCount());
        gen.writeNumberField("failed", summary.getFailureCount());
        gen.writeNumberField("skipped", summary.getSkippedCount());
        gen.writeNumberField("maxConcurrent", summary.getMaxConcurrent());
        provider.defaultSerializeField("duration", summary.getDuration(), gen);

        gen.writeObjectFieldStart("counts");
        for (Map.Entry<TestState, Integer> entry : summary.getCounts().entrySet()) {
            gen.writeNumberField(entry.getKey().name(), entry.getValue());
        }
        gen.writeEndObject();

        gen.writeArrayFieldStart("results");
        for (TestResult result : summary.getResults().values()) {
            provider.defaultSerializeValue(result, gen);
        }
        gen.writeEndArray();

        gen.writeArrayFieldStart("frameworkErrors");
        for (FrameworkError error : summary.getFrameworkErrors()) {
            gen.writeStartObject();
            gen.writeStringField("nodeKey", error.nodeKey());
            gen.writeStringField("message", error.message());
            if (error.cause() != null) {
                provider.defaultSerializeField("cause", error.cause(), gen);
            }
            gen.writeEndObject();
        }
        gen.writeEndArray();

        gen.writeArrayFieldStart("resourceErrors");
        for (ResourceReleaseError error : summary.getResourceErrors()) {
            gen.writeStartObject();
            gen.writeStringField("resourceKey", error.resourceKey());
            provider.defaultSerializeField("error", error.error(), gen);
            gen.writeEndObject();
        }
        gen.writeEndArray();
        gen.writeEndObject();
    }
}
