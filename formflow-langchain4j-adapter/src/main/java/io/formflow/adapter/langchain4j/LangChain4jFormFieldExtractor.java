package io.formflow.adapter.langchain4j;

import io.formflow.core.jobapp.FieldListParser;
import io.formflow.core.jobapp.FormFieldExtractor;
import io.formflow.core.jobapp.TextCompletionService;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// {@link FormFieldExtractor} that asks a model to list the form's fields as JSON.
///
/// The form is parsed to text, the model is asked for `{ "fields": [...] }`, and the
/// answer is read by a {@link FieldListParser}.
public class LangChain4jFormFieldExtractor implements FormFieldExtractor {

    private static final Logger logger =
            Logger.getLogger(LangChain4jFormFieldExtractor.class.getName());

    private final TextCompletionService completion;
    private final FieldListParser parser;
    private final DocumentReader reader = new DocumentReader();

    /// Creates an extractor.
    ///
    /// @param completion model used to list the fields, not null
    /// @param parser reader for the model's JSON answer, not null
    public LangChain4jFormFieldExtractor(TextCompletionService completion, FieldListParser parser) {
        this.completion = Objects.requireNonNull(completion, "completion must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
    }

    @Override
    public List<String> extractFields(Path form) throws IOException {
        String text = reader.read(form).text();
        String answer =
                completion.complete(
                        "This is a parsed form. Convert it into a JSON object containing only the"
                                + " list of fields to be filled in, in the form { \"fields\":"
                                + " [...] }. <form>"
                                + text
                                + "</form>. Return JSON ONLY, no markdown.");
        List<String> fields = parser.parse(answer);
        logger.info("Extracted " + fields.size() + " fields from " + form.getFileName());
        return fields;
    }
}
