package io.dagtest.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.dagtest.core.capture.CapturedOutput;
import io.dagtest.core.result.TestMessage;
import java.io.IOException;
import java.io.Serial;

/// Serializes a phase message with its captured output and error.
///
/// `captured` is omitted when nothing was captured and `error` when the
/// phase raised nothing.
///
/// @implNote Package-private. Registered by {@link DagTestJacksonModule}.
class TestMessageSerializer extends StdSerializer<TestMessage> {

    @Serial private static final long serialVersionUID = 2281975523004469183L;

    TestMessageSerializer() {
        super(TestMessage.class);
    }

    @Override
    public void serialize(TestMessage message, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("phase", message.phase().name());
        gen.writeStringField("id", message.id());
        if (!message.captured().isEmpty()) {
            gen.writeArrayFieldStart("captured");
            for (CapturedOutput output : message.captured()) {
                gen.writeStartObject();
                gen.writeStringField("name", output.name());
                gen.writeStringField("description", output.description());
                gen.writeStringField("text", output.text());
                gen.writeEndObject();
            }
            gen.writeEndArray();
        }
        if (message.hasError()) {
            provider.defaultSerializeField("error", message.error(), gen);
        }
        gen.writeEndObject();
    }
}
