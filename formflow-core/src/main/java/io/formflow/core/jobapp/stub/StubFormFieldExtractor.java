package io.formflow.core.jobapp.stub;

import io.formflow.core.jobapp.FormFieldExtractor;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/// Field extractor that needs no model.
///
/// With a fixed field list it returns that list for any existing form. Without one it
/// reads the form as UTF-8 text and treats every non-blank line as a field, dropping
/// list bullets and trailing colons.
public class StubFormFieldExtractor implements FormFieldExtractor {

    private final List<String> fields;

    /// Creates an extractor that reads fields from the form's lines.
    public StubFormFieldExtractor() {
        this.fields = null;
    }

    /// Creates an extractor that always returns the given fields.
    ///
    /// @param fields field names, not null
    public StubFormFieldExtractor(List<String> fields) {
        this.fields = List.copyOf(fields);
    }

    @Override
    public List<String> extractFields(Path form) throws IOException {
        if (!Files.isRegularFile(form)) {
            throw new NoSuchFileException(form.toString());
        }
        if (fields != null) {
            return fields;
        }
        return Files.readAllLines(form, StandardCharsets.UTF_8).stream()
                .map(String::strip)
                .map(line -> line.replaceFirst("^[-*•]\\s*", ""))
                .map(line -> line.replaceFirst(":\\s*$", ""))
                .filter(line -> !line.isBlank())
                .collect(Collectors.toList());
    }
}
