package io.formflow.serialization;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/// Factory for the `ObjectMapper` used across Formflow.
///
/// The server produces its JSON provider from this mapper, so events placed in a
/// response body are rendered by {@link FormflowJacksonModule}.
///
/// ### Usage
/// {@snippet :
/// ObjectMapper mapper = FormflowSerializer.createMapper();
/// String json = mapper.writeValueAsString(run.pendingInput().orElseThrow());
/// }
///
/// @implNote Thread-safe. A new mapper is created per `createMapper()` call; cache it for
/// repeated use.
public final class FormflowSerializer {

    private FormflowSerializer() {}

    /// Creates an ObjectMapper configured for Formflow.
    ///
    /// Registers:
    /// - `FormflowJacksonModule` for events and event kinds
    /// - `JavaTimeModule` for `Instant` and `Duration` values
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for lenient request bodies
    /// - Timestamps written as ISO-8601 strings
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new FormflowJacksonModule())
                .registerModule(new JavaTimeModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
    }
}
