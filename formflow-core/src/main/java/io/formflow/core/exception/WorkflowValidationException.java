package io.formflow.core.exception;

import java.io.Serial;

/// Thrown when a workflow definition or the arguments of a run are invalid.
///
/// Raised synchronously by registration or by
/// {@link io.formflow.core.execution.WorkflowRunner#start}, before any run context
/// exists. Common causes:
/// - A mandatory run argument is missing or blank
/// - Two steps share an id
/// - A step declares an outward-only kind as accepted
public class WorkflowValidationException extends WorkflowException {

    @Serial private static final long serialVersionUID = -2650431784220914127L;

    /// Creates exception with message.
    ///
    /// @param message description of the violated rule
    public WorkflowValidationException(String message) {
        super(message);
    }
}
