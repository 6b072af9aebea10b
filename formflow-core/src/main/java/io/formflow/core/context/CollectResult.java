package io.formflow.core.context;

import io.formflow.core.event.Event;
import java.util.List;

/// Outcome of offering an event to a {@link Barrier}.
///
/// ### Permitted Subtypes
/// - {@link Batch} - the requirement was met; carries exactly the required events
/// - {@link Incomplete} - the event was buffered, nothing is released yet
public sealed interface CollectResult {

    /// Requirement met. Events are grouped by the requirement's kind order and keep
    /// arrival order within a kind.
    ///
    /// @param events released events, not null
    record Batch(List<Event> events) implements CollectResult {
        public Batch {
            events = List.copyOf(events);
        }
    }

    /// Requirement not met yet.
    record Incomplete() implements CollectResult {}

    /// Returns whether this result released a batch.
    ///
    /// @return true for {@link Batch}
    default boolean isBatch() {
        return this instanceof Batch;
    }
}
