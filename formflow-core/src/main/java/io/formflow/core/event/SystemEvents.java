package io.formflow.core.event;

import java.util.LinkedHashMap;
import java.util.Map;

/// The event kinds the orchestrator itself understands.
///
/// - {@link #START} carries the run arguments and is queued when a run starts
/// - {@link #STOP} carries the final `result` and terminates the run
/// - {@link #INPUT_REQUIRED} carries a `prefix` prompt and the intermediate `result`;
///   it suspends the run and is surfaced to the caller instead of being routed
/// - {@link #HUMAN_RESPONSE} carries the caller's `response` and is only ever injected
///   from outside the run
public enum SystemEvents implements EventKind {
    START,
    STOP,
    INPUT_REQUIRED,
    HUMAN_RESPONSE;

    public static final String RESULT = "result";
    public static final String PREFIX = "prefix";
    public static final String RESPONSE = "response";

    /// Creates the start event for a run.
    ///
    /// @param arguments run arguments, not null
    /// @return START event carrying the arguments as payload, never null
    public static Event start(Map<String, ?> arguments) {
        return Event.of(START, arguments);
    }

    /// Creates the terminal event.
    ///
    /// @param result final artifact of the run, not null
    /// @return STOP event, never null
    public static Event stop(Object result) {
        return Event.of(STOP, Map.of(RESULT, result));
    }

    /// Creates a request for human input.
    ///
    /// @param prefix prompt shown to the reviewer, not null
    /// @param result intermediate artifact under review, not null
    /// @return INPUT_REQUIRED event, never null
    public static Event inputRequired(String prefix, Object result) {
        Map<String, Object> fields = new LinkedHashMap<>();
        fields.put(PREFIX, prefix);
        fields.put(RESULT, result);
        return Event.of(INPUT_REQUIRED, fields);
    }

    /// Creates the reply to an INPUT_REQUIRED event.
    ///
    /// @param response free-text reply, not null
    /// @return HUMAN_RESPONSE event, never null
    public static Event humanResponse(String response) {
        return Event.of(HUMAN_RESPONSE, Map.of(RESPONSE, response));
    }
}
