package io.formflow.core.event;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class EventTest {

    enum Kinds implements EventKind {
        PING
    }

    @Nested
    class Construction {

        @Test
        void shouldCopyPayloadOnConstruction() {
            Map<String, Object> fields = new HashMap<>();
            fields.put("field", "Name");

            Event event = Event.of(Kinds.PING, fields);
            fields.put("field", "changed");

            assertThat(event.getString("field")).isEqualTo("Name");
        }

        @Test
        void shouldExposeUnmodifiablePayload() {
            Event event = Event.of(Kinds.PING, Map.of("a", 1));

            assertThatThrownBy(() -> event.fields().put("b", 2))
                    .isInstanceOf(UnsupportedOperationException.class);
        }

        @Test
        void shouldKeepFieldOrder() {
            Map<String, Object> fields = new LinkedHashMap<>();
            fields.put("z", 1);
            fields.put("a", 2);
            fields.put("m", 3);

            Event event = Event.of(Kinds.PING, fields);

            assertThat(event.fields().keySet()).containsExactly("z", "a", "m");
        }

        @Test
        void shouldRejectNullValues() {
            Map<String, Object> fields = new HashMap<>();
            fields.put("missing", null);

            assertThatThrownBy(() -> Event.of(Kinds.PING, fields))
                    .isInstanceOf(NullPointerException.class)
                    .hasMessageContaining("missing");
        }
    }

    @Nested
    class Access {

        @Test
        void shouldReturnTypedField() {
            Event event = Event.of(Kinds.PING, Map.of("count", 3));

            assertThat(event.get("count", Integer.class)).isEqualTo(3);
            assertThat(event.find("count")).hasValue(3);
            assertThat(event.find("other")).isEmpty();
        }

        @Test
        void shouldFailOnMissingField() {
            Event event = Event.of(Kinds.PING);

            assertThatThrownBy(() -> event.getString("field"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("PING")
                    .hasMessageContaining("field");
        }

        @Test
        void shouldFailOnWrongType() {
            Event event = Event.of(Kinds.PING, Map.of("count", "three"));

            assertThatThrownBy(() -> event.get("count", Integer.class))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("expected Integer");
        }
    }

    @Nested
    class SystemEventFactories {

        @Test
        void shouldBuildInputRequired() {
            Event event = SystemEvents.inputRequired("Review please", "form");

            assertThat(event.is(SystemEvents.INPUT_REQUIRED)).isTrue();
            assertThat(event.getString(SystemEvents.PREFIX)).isEqualTo("Review please");
            assertThat(event.getString(SystemEvents.RESULT)).isEqualTo("form");
        }

        @Test
        void shouldBuildHumanResponse() {
            Event event = SystemEvents.humanResponse("OKAY");

            assertThat(event.kind()).isEqualTo(SystemEvents.HUMAN_RESPONSE);
            assertThat(event.getString(SystemEvents.RESPONSE)).isEqualTo("OKAY");
        }

        @Test
        void shouldCarryArgumentsInStart() {
            Event event = SystemEvents.start(Map.of("resume_file", "/tmp/r.pdf"));

            assertThat(event.getString("resume_file")).isEqualTo("/tmp/r.pdf");
        }
    }
}
