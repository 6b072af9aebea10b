package io.formflow.core.execution;

import io.formflow.core.event.Event;
import java.util.List;

/// Listener for run lifecycle events.
///
/// All methods have default no-op implementations, so implementations override only
/// what they need.
///
/// ### Callback Lifecycle
/// ```
/// onRunStarted                  run created, START queued
/// onStepStarted / onStepCompleted   per step execution, on a worker thread
/// onEventEmitted                an emitted event reached the dispatch loop
/// onSuspended / onResumed       INPUT_REQUIRED surfaced / HUMAN_RESPONSE injected
/// onRunTerminated               exactly once, with the terminal status
/// ```
///
/// @implNote Implementations must be thread-safe. Step callbacks arrive from worker
/// threads, the others from whichever thread drives or injects into the run.
public interface RunListener {

    /// Called once a run was created.
    ///
    /// @param runId run identifier, not null
    /// @param workflowId workflow being run, not null
    default void onRunStarted(String runId, String workflowId) {}

    /// Called before a step body runs.
    ///
    /// @param runId run identifier, not null
    /// @param stepId step about to run, not null
    /// @param trigger event the step handles, not null
    default void onStepStarted(String runId, String stepId, Event trigger) {}

    /// Called after a step body returned normally.
    ///
    /// @param runId run identifier, not null
    /// @param stepId step that ran, not null
    /// @param emitted events the step returned, not null
    default void onStepCompleted(String runId, String stepId, List<Event> emitted) {}

    /// Called when the dispatch loop picks up an emitted event.
    ///
    /// @param runId run identifier, not null
    /// @param stepId emitting step, not null
    /// @param event emitted event, not null
    default void onEventEmitted(String runId, String stepId, Event event) {}

    /// Called when the run suspends for human input.
    ///
    /// @param runId run identifier, not null
    /// @param request the INPUT_REQUIRED event surfaced to the caller, not null
    default void onSuspended(String runId, Event request) {}

    /// Called when a human response was accepted.
    ///
    /// @param runId run identifier, not null
    /// @param response the injected HUMAN_RESPONSE event, not null
    default void onResumed(String runId, Event response) {}

    /// Called exactly once when the run reaches a terminal status.
    ///
    /// @param runId run identifier, not null
    /// @param status terminal status, not null
    /// @param failure failure cause, null when COMPLETED
    default void onRunTerminated(String runId, RunStatus status, Throwable failure) {}

    /// No-op listener instance that ignores all events.
    RunListener NOOP = new RunListener() {};
}
