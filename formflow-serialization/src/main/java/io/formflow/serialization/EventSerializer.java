package io.formflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.formflow.core.event.Event;
import java.io.IOException;
import java.io.Serial;
import java.util.Map;

/// Writes an {@link Event} as `{"kind":"<name>","fields":{...}}`.
///
/// Field values go through the provider, so anything the mapper can serialize may sit in
/// a payload. Handles that are only meaningful inside a run (a document index, say) never
/// reach outward events.
///
/// @implNote Package-private. Registered by {@link FormflowJacksonModule}.
class EventSerializer extends StdSerializer<Event> {

    @Serial private static final long serialVersionUID = 5524803914260713379L;

    EventSerializer() {
        super(Event.class);
    }

    @Override
    public void serialize(Event event, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeStartObject();
        gen.writeStringField("kind", event.kind().name());
        gen.writeObjectFieldStart("fields");
        for (Map.Entry<String, Object> field : event.fields().entrySet()) {
            provider.defaultSerializeField(field.getKey(), field.getValue(), gen);
        }
        gen.writeEndObject();
        gen.writeEndObject();
    }
}
