package io.formflow.core.event;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/// Immutable typed message exchanged between steps.
///
/// An event is a {@link EventKind} discriminator plus an ordered payload of named
/// fields. The payload is copied on construction and exposed read-only, so an event can
/// be handed to any number of concurrently running steps.
///
/// ### Usage
/// {@snippet :
/// Event query = Event.of(JobApplicationEvents.FIELD_QUERY,
///         Map.of("field", "Full name", "query", "What is the candidate's name?"));
/// String field = query.getString("field");
/// }
///
/// @param kind discriminator used for routing, not null
/// @param fields payload fields in insertion order, not null; values not null
public record Event(EventKind kind, Map<String, Object> fields) {

    public Event {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(fields, "fields must not be null");
        Map<String, Object> copy = new LinkedHashMap<>();
        fields.forEach(
                (key, value) -> {
                    Objects.requireNonNull(key, "field name must not be null");
                    Objects.requireNonNull(value, "field '" + key + "' must not be null");
                    copy.put(key, value);
                });
        fields = Collections.unmodifiableMap(copy);
    }

    /// Creates an event with the given payload.
    ///
    /// @param kind event kind, not null
    /// @param fields payload fields, not null
    /// @return new event, never null
    public static Event of(EventKind kind, Map<String, ?> fields) {
        return new Event(kind, new LinkedHashMap<>(fields));
    }

    /// Creates an event without payload.
    ///
    /// @param kind event kind, not null
    /// @return new event, never null
    public static Event of(EventKind kind) {
        return new Event(kind, Map.of());
    }

    /// Checks whether this event is of the given kind.
    ///
    /// @param other kind to compare with, may be null
    /// @return true if the kinds are equal
    public boolean is(EventKind other) {
        return kind.equals(other);
    }

    /// Looks up a payload field.
    ///
    /// @param name field name, not null
    /// @return the value, or empty if absent
    public Optional<Object> find(String name) {
        return Optional.ofNullable(fields.get(name));
    }

    /// Returns a payload field cast to the requested type.
    ///
    /// @param name field name, not null
    /// @param type expected value type, not null
    /// @param <T> value type
    /// @return the value, never null
    /// @throws IllegalArgumentException if the field is missing or has another type
    public <T> T get(String name, Class<T> type) {
        Object value = fields.get(name);
        if (value == null) {
            throw new IllegalArgumentException(
                    "Event " + kind.name() + " has no field '" + name + "'");
        }
        if (!type.isInstance(value)) {
            throw new IllegalArgumentException(
                    "Field '"
                            + name
                            + "' of event "
                            + kind.name()
                            + " is "
                            + value.getClass().getSimpleName()
                            + ", expected "
                            + type.getSimpleName());
        }
        return type.cast(value);
    }

    /// Returns a payload field rendered as text.
    ///
    /// @param name field name, not null
    /// @return string form of the value, never null
    /// @throws IllegalArgumentException if the field is missing
    public String getString(String name) {
        return get(name, Object.class).toString();
    }

    @Override
    public String toString() {
        return kind.name() + fields;
    }
}
