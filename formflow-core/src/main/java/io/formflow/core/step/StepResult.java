package io.formflow.core.step;

import io.formflow.core.event.Event;
import java.util.Arrays;
import java.util.List;

/// What a step produced for one execution.
///
/// ### Permitted Subtypes
/// - {@link Emit} - one or more events, delivered in list order
/// - {@link None} - nothing; typical for a barrier step whose batch is not complete
public sealed interface StepResult {

    /// Events produced by the step, in emission order.
    ///
    /// @param events produced events, not null, may be empty
    record Emit(List<Event> events) implements StepResult {
        public Emit {
            events = List.copyOf(events);
        }
    }

    /// No output.
    record None() implements StepResult {}

    /// Creates a result emitting the given events in order.
    ///
    /// @param events events to emit, not null
    /// @return emit result, never null
    static StepResult emit(Event... events) {
        return new Emit(Arrays.asList(events));
    }

    /// Creates a result emitting the given events in order.
    ///
    /// @param events events to emit, not null
    /// @return emit result, never null
    static StepResult emit(List<Event> events) {
        return new Emit(events);
    }

    /// Returns the empty result.
    ///
    /// @return none result, never null
    static StepResult none() {
        return new None();
    }

    /// Returns the produced events.
    ///
    /// @return events in emission order, empty for {@link None}
    default List<Event> events() {
        if (this instanceof Emit emit) {
            return emit.events;
        }
        return List.of();
    }
}
