package io.dagtest.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.dagtest.core.node.TestNode;
import io.dagtest.core.result.TestMessage;
import io.dagtest.core.result.TestResult;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Serializes the outcome of one node.
///
/// ```
/// Field             Written when
/// ——————————————————+——————————————————————————————————————
/// key, kind         │ always
/// state             │ always (null if the node never resolved)
/// expectedFailure   │ always
/// startedAt         │ the node was started or resolved
/// finishedAt        │ the node reached a terminal state
/// total, successes, │ multi-result tests
/// failures, errors  │
/// subInvocations    │ multi-result tests, in reservation order
/// messages          │ at least one phase produced a message
/// ```
///
/// @implNote Package-private. Registered by {@link DagTestJacksonModule}.
class TestResultSerializer extends StdSerializer<TestResult> {

    @Serial private static final long serialVersionUID = -3394410878221574620L;

    TestResultSerializer() {
        super(TestResult.class);
    }

    @Override
    public void serialize(TestResult result, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        TestNode node = result.getNode();
        gen.writeStartObject();
        gen.writeStringField("key", node.getKey());
        gen.writeStringField("kind", node.getKind().name());
        if (result.getState() != null) {
            gen.writeStringField("state", result.getState().name());
        } else {
            gen.writeNullField("state");
        }
        gen.writeBooleanField("expectedFailure", node.isExpectedFailure());
        if (result.getStartedAt() != null) {
            provider.defaultSerializeField("startedAt", result.getStartedAt(), gen);
        }
        if (result.getFinishedAt() != null) {
            provider.defaultSerializeField("finishedAt", result.getFinishedAt(), gen);
        }

        if (result.isMultiResult()) {
            gen.writeNumberField("total", result.getTotal());
            gen.writeNumberField("successes", result.getSuccessCount());
            gen.writeNumberField("failures", result.getFailureCount());
            gen.writeNumberField("errors", result.getErrorCount());
            gen.writeArrayFieldStart("subInvocations");
            for (Map.Entry<String, TestMessage> entry : result.getSubInvocations().entrySet()) {
                provider.defaultSerializeValue(entry.getValue(), gen);
            }
            gen.writeEndArray();
        }

        if (!result.getMessages().isEmpty()) {
            gen.writeArrayFieldStart("messages");
            for (TestMessage message : result.getMessages()) {
                provider.defaultSerializeValue(message, gen);
            }
            gen.writeEndArray();
        }
        gen.writeEndObject();
    }
}
