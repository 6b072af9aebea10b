package io.formflow.core.execution;

import io.formflow.core.event.Event;
import io.formflow.core.exception.InjectionRejectedException;
import io.formflow.core.exception.WorkflowException;
import java.time.Instant;
import java.util.Iterator;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.stream.Stream;

/// Caller-side handle of one running workflow.
///
/// The handle exposes the run's outward events (each INPUT_REQUIRED, then the final
/// STOP) as a pull-based sequence: pulling is what drives dispatch, so a run nobody
/// pulls makes no progress beyond the steps already scheduled. Only one thread drives
/// at a time; concurrent pullers queue up.
///
/// ### Usage
/// {@snippet :
/// RunHandle run = runner.start(workflow, Map.of("resume_file", resume, "application_form", form));
/// Event request = run.nextEvent().orElseThrow();   // INPUT_REQUIRED
/// run.respond("OKAY");
/// Object filledForm = run.await();
/// }
///
/// ### Contracts
/// - Exactly one terminal outcome per run
/// - Injection is only accepted while `SUSPENDED_FOR_INPUT`
/// - A second INPUT_REQUIRED produced while one is outstanding surfaces only after the
///   first is answered
///
/// @see WorkflowRunner#start
public interface RunHandle {

    String runId();

    Instant startedAt();

    RunStatus status();

    /// Returns the outstanding request for human input.
    ///
    /// @return the INPUT_REQUIRED event awaiting a response, or empty
    Optional<Event> pendingInput();

    /// Returns the number of step executions currently scheduled or running.
    ///
    /// @return in-flight count, never negative
    int inFlightSteps();

    /// Drives the run until the next outward event.
    ///
    /// Blocks while steps are running, while suspended (until a response is injected
    /// from another thread), or until the deadline.
    ///
    /// @return the next INPUT_REQUIRED or STOP event; empty once the run has completed
    ///     and its STOP was delivered
    /// @throws WorkflowException the run's failure, timeout or cancellation
    /// @throws InterruptedException if the calling thread was interrupted while waiting
    Optional<Event> nextEvent() throws WorkflowException, InterruptedException;

    /// Returns a lazy iterator over the remaining outward events.
    ///
    /// Each call starts from the run's current position. The iterator ends when the run
    /// terminates; a failure ends it early and is reported by {@link #await()} and
    /// {@link #result()}.
    ///
    /// @return iterator driving the run on `hasNext()`, never null
    Iterator<Event> events();

    /// Returns {@link #events()} as a sequential stream.
    ///
    /// @return lazy stream, never null
    Stream<Event> streamEvents();

    /// Injects a human response built from free text.
    ///
    /// @param feedback reviewer's reply, not null
    /// @throws InjectionRejectedException if the run is not suspended for input
    void respond(String feedback) throws InjectionRejectedException;

    /// Injects a HUMAN_RESPONSE event. Safe to call from any thread.
    ///
    /// @param event HUMAN_RESPONSE event, not null
    /// @throws InjectionRejectedException if the run is not suspended for input or the
    ///     event is of another kind
    void inject(Event event) throws InjectionRejectedException;

    /// Drives the run to its terminal outcome.
    ///
    /// @return the STOP result
    /// @throws WorkflowException step failure, timeout or cancellation
    /// @throws InterruptedException if the calling thread was interrupted while waiting
    Object await() throws WorkflowException, InterruptedException;

    /// Returns the terminal outcome as a future. Completing it does not drive the run.
    ///
    /// @return future completed with the STOP result, or exceptionally with a
    ///     {@link WorkflowException}
    CompletableFuture<Object> result();

    /// Terminates the run as FAILED with a cancellation cause.
    ///
    /// @return true if this call terminated the run, false if it was already terminal
    boolean cancel();
}
