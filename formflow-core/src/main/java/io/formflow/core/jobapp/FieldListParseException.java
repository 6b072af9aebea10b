package io.formflow.core.jobapp;

import java.io.IOException;
import java.io.Serial;

/// Thrown when model output does not contain a readable field list.
public class FieldListParseException extends IOException {

    @Serial private static final long serialVersionUID = 2318874650247190435L;

    /// Creates exception with message.
    ///
    /// @param message what was wrong with the content
    public FieldListParseException(String message) {
        super(message);
    }

    /// Creates exception with message and cause.
    ///
    /// @param message what was wrong with the content
    /// @param cause the underlying parse error
    public FieldListParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
