package io.dagtest.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import java.io.IOException;
import java.io.Serial;
import java.util.IdentityHashMap;
import java.util.Map;

/// Serializes a throwable as a flat description of its chain.
///
/// ```
/// {
///   "type": "java.lang.AssertionError",
///   "message": "expected 2",
///   "stackTrace": ["com.acme.CheckoutTest.total(CheckoutTest.java:41)", ...],
///   "cause": { ... }
/// }
/// ```
///
/// `message` and `cause` are omitted when absent. A cause already written
/// higher in the chain ends the chain.
///
/// @implNote Package-private. Registered by {@link DagTestJacksonModule}.
class ThrowableSerializer extends StdSerializer<Throwable> {

    @Serial private static final long serialVersionUID = -6019472258731904415L;

    ThrowableSerializer() {
        super(Throwable.class);
    }

    @Override
    public void serialize(Throwable error, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        write(error, gen, new IdentityHashMap<>());
    }

    private void write(Throwable error, JsonGenerator gen, Map<Throwable, Boolean> seen)
            throws IOException {
        seen.put(error, Boolean.TRUE);
        gen.writeStartObject();
        gen.writeStringField("type", error.getClass().getName());
        if (error.getMessage() != null) {
            gen.writeStringField("message", error.getMessage());
        }
        gen.writeArrayFieldStart("stackTrace");
        for (StackTraceElement element : error.getStackTrace()) {
            gen.writeString(element.toString());
        }
        gen.writeEndArray();

        Throwable cause = error.getCause();
        if (cause != null && !seen.containsKey(cause)) {
            gen.writeFieldName("cause");
            write(cause, gen, seen);
        }
        gen.writeEndObject();
    }
}
