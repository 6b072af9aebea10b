package io.formflow.core.exception;

import java.io.Serial;

/// Thrown by a run that was cancelled through its handle.
public class WorkflowCancelledException extends WorkflowException {

    @Serial private static final long serialVersionUID = -7348166295012841379L;

    /// Creates exception for the given run.
    ///
    /// @param runId identifier of the cancelled run, not null
    public WorkflowCancelledException(String runId) {
        super("Run " + runId + " was cancelled");
    }
}
