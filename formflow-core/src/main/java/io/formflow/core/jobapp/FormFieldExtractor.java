package io.formflow.core.jobapp;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/// Finds the fields a form asks the applicant to fill in.
@FunctionalInterface
public interface FormFieldExtractor {

    /// Extracts the fillable fields of a form.
    ///
    /// @param form form document, not null
    /// @return field names in form order, never null
    /// @throws IOException if the form cannot be read or its fields cannot be determined
    List<String> extractFields(Path form) throws IOException;
}
