package io.formflow.core.execution;

import io.formflow.core.event.Event;

/// Messages delivered to a run's dispatch loop through its blocking queue.
sealed interface RunSignal {

    /// A step produced an event.
    record Emitted(String stepId, Event event) implements RunSignal {}

    /// A step raised or broke its output contract.
    record StepFailed(String stepId, Throwable cause) implements RunSignal {}

    /// The caller injected a human response.
    record Injected(Event event) implements RunSignal {}

    /// The run was terminated from outside the loop; wake up and observe it.
    record Wakeup() implements RunSignal {}
}
