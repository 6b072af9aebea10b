package io.formflow.core.exception;

import java.io.Serial;

/// Thrown when a human response is injected into a run that is not awaiting one.
///
/// The run's status is left unchanged.
public class InjectionRejectedException extends WorkflowException {

    @Serial private static final long serialVersionUID = 6110398524061842277L;

    /// Creates exception with message.
    ///
    /// @param message why the injection was refused
    public InjectionRejectedException(String message) {
        super(message);
    }
}
