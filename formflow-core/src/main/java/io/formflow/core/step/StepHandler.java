package io.formflow.core.step;

import io.formflow.core.event.Event;

/// Body of a step.
///
/// Invoked once per matching event on a worker thread. The handler reads and writes
/// run state through the given {@link StepContext} only; anything it throws fails the
/// step and aborts the run.
///
/// @see StepDefinition
@FunctionalInterface
public interface StepHandler {

    /// Handles one event.
    ///
    /// @param event the triggering event, not null
    /// @param context per-execution view of the run, not null
    /// @return events to emit, or {@link StepResult#none()}; never null
    /// @throws Exception any failure, reported as a step failure
    StepResult handle(Event event, StepContext context) throws Exception;
}
