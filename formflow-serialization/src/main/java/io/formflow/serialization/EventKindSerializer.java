package io.formflow.serialization;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import io.formflow.core.event.EventKind;
import java.io.IOException;
import java.io.Serial;

/// Writes any {@link EventKind} as its bare name.
///
/// @implNote Package-private. Registered by {@link FormflowJacksonModule}.
class EventKindSerializer extends StdSerializer<EventKind> {

    @Serial private static final long serialVersionUID = -3094511826473365028L;

    EventKindSerializer() {
        super(EventKind.class);
    }

    @Override
    public void serialize(EventKind kind, JsonGenerator gen, SerializerProvider provider)
            throws IOException {
        gen.writeString(kind.name());
    }
}
