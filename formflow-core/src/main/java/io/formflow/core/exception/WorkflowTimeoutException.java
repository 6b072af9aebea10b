package io.formflow.core.exception;

import java.io.Serial;
import java.time.Duration;

/// Thrown when a run exceeds its wall-clock deadline.
///
/// A barrier that never receives its required events also ends here.
public class WorkflowTimeoutException extends WorkflowException {

    @Serial private static final long serialVersionUID = -1937522843560210384L;

    private final Duration timeout;

    /// Creates exception for the given run.
    ///
    /// @param runId identifier of the run that timed out, not null
    /// @param timeout deadline that elapsed, not null
    public WorkflowTimeoutException(String runId, Duration timeout) {
        super("Run " + runId + " timed out after " + timeout.toSeconds() + "s");
        this.timeout = timeout;
    }

    /// Returns the deadline that elapsed.
    ///
    /// @return timeout duration, never null
    public Duration getTimeout() {
        return timeout;
    }
}
