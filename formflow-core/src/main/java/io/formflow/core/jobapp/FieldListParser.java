package io.formflow.core.jobapp;

import java.util.List;

/// Turns a model's answer to "list the fields of this form" into field names.
///
/// @see FormFieldExtractor
@FunctionalInterface
public interface FieldListParser {

    /// Parses the field list from raw model output.
    ///
    /// @param content model output, not null
    /// @return field names in the order given, never null
    /// @throws FieldListParseException if no field list can be read from the content
    List<String> parse(String content) throws FieldListParseException;
}
