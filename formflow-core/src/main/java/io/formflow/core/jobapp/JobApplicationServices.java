package io.formflow.core.jobapp;

import java.util.Objects;

/// The collaborators the job-application workflow calls out to.
///
/// @param documentIndex resume indexing and retrieval, not null
/// @param fieldExtractor application form field extraction, not null
/// @param completion text completion, not null
public record JobApplicationServices(
        DocumentIndexService documentIndex,
        FormFieldExtractor fieldExtractor,
        TextCompletionService completion) {

    public JobApplicationServices {
        Objects.requireNonNull(documentIndex, "documentIndex must not be null");
        Objects.requireNonNull(fieldExtractor, "fieldExtractor must not be null");
        Objects.requireNonNull(completion, "completion must not be null");
    }
}
