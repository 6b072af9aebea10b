package io.formflow.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.formflow.core.event.Event;
import io.formflow.core.event.EventKind;
import java.io.Serial;

/// Jackson `SimpleModule` registering the Formflow serializers.
///
/// - `Event` - {@link EventSerializer}, shape `{"kind":..., "fields":{...}}`
/// - `EventKind` - {@link EventKindSerializer}, the kind's name
///
/// Events are write-only: they leave the process in HTTP responses and logs, and are
/// never read back.
///
/// @see FormflowSerializer for the convenience factory API
public class FormflowJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 1964305873127705513L;

    public FormflowJacksonModule() {
        super("FormflowJacksonModule");
        addSerializer(Event.class, new EventSerializer());
        addSerializer(EventKind.class, new EventKindSerializer());
    }
}
