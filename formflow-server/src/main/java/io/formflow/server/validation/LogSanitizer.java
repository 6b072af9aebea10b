package io.formflow.server.validation;

/// Strips control characters from strings before they reach the log.
///
/// Run ids and uploaded file names arrive from clients; a value carrying
/// {@code \r} or {@code \n} could otherwise forge log entries.
/// ```
/// LOG.infov("Respond request: workflow={0}", LogSanitizer.sanitize(workflowId));
/// ```
public final class LogSanitizer {

    private LogSanitizer() {}

    /// Removes carriage-return and newline characters from the input.
    ///
    /// @param value the string to sanitize, may be null
    /// @return sanitized string, or {@code "null"} if input is null
    public static String sanitize(String value) {
        if (value == null) {
            return "null";
        }
        return value.replace("\r", "").replace("\n", "");
    }
}
