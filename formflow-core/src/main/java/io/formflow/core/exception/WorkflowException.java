package io.formflow.core.exception;

import java.io.Serial;

/// Base class of every failure a run or its caller can observe.
///
/// Callers that only need to know that a run did not complete normally can catch this
/// type; the subclasses distinguish the outcomes:
/// - {@link WorkflowValidationException} - run refused before it started
/// - {@link StepFailureException} - a step raised, the run is `FAILED`
/// - {@link WorkflowTimeoutException} - the wall-clock deadline elapsed
/// - {@link WorkflowCancelledException} - the run was cancelled by its owner
/// - {@link InjectionRejectedException} - an injection arrived while not suspended
public class WorkflowException extends Exception {

    @Serial private static final long serialVersionUID = 4471390188207164502L;

    /// Creates exception with message.
    ///
    /// @param message failure description
    public WorkflowException(String message) {
        super(message);
    }

    /// Creates exception with message and cause.
    ///
    /// @param message failure description
    /// @param cause the underlying exception
    public WorkflowException(String message, Throwable cause) {
        super(message, cause);
    }
}
