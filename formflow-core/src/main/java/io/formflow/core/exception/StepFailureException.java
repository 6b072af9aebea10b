package io.formflow.core.exception;

import java.io.Serial;

/// Thrown when a step body raises or violates its declared contract.
///
/// Aborts the run with status `FAILED`. The failing step id is kept so transports
/// can report which part of the workflow broke without exposing the cause.
public class StepFailureException extends WorkflowException {

    @Serial private static final long serialVersionUID = 8093617435240913256L;

    private final String stepId;

    /// Creates exception for the given step.
    ///
    /// @param stepId identifier of the failing step, not null
    /// @param message failure description
    /// @param cause the exception raised by the step, may be null
    public StepFailureException(String stepId, String message, Throwable cause) {
        super("Step '" + stepId + "' failed: " + message, cause);
        this.stepId = stepId;
    }

    /// Returns the identifier of the step that failed.
    ///
    /// @return step id, never null
    public String getStepId() {
        return stepId;
    }
}
