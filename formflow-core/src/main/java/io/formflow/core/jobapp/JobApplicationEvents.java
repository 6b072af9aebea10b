package io.formflow.core.jobapp;

import io.formflow.core.event.EventKind;

/// Event kinds private to the job-application workflow.
public enum JobApplicationEvents implements EventKind {
    /// Resume indexed; carries `application_form`.
    PARSE_FORM,
    /// Form fields known; carries `fields`.
    GENERATE_QUESTIONS,
    /// One question per form field; carries `field` and `query`.
    FIELD_QUERY,
    /// Answer to one field question; carries `field` and `response`.
    FIELD_RESPONSE,
    /// Reviewer asked for changes; carries `feedback`.
    FEEDBACK
}
