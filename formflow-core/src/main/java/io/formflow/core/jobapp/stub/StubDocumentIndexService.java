package io.formflow.core.jobapp.stub;

import io.formflow.core.jobapp.DocumentIndex;
import io.formflow.core.jobapp.DocumentIndexService;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/// Document index that answers from a fixed table instead of a vector store.
///
/// Questions are matched on the form field embedded in `<field>` tags; fields without a
/// configured answer get a placeholder naming the field. Every question is recorded so
/// tests can assert on fan-out.
public class StubDocumentIndexService implements DocumentIndexService {

    private static final Pattern FIELD_TAG =
            Pattern.compile("<field>(.*?)</field>", Pattern.DOTALL);

    private final Map<String, String> answers = new ConcurrentHashMap<>();
    private final List<String> questions = new CopyOnWriteArrayList<>();

    /// Registers the answer returned for a field.
    ///
    /// @param field form field name, not null
    /// @param answer answer text, not null
    /// @return this service for chaining
    public StubDocumentIndexService withAnswer(String field, String answer) {
        answers.put(field, answer);
        return this;
    }

    @Override
    public DocumentIndex index(List<Path> documents) throws IOException {
        for (Path document : documents) {
            if (!Files.isRegularFile(document)) {
                throw new NoSuchFileException(document.toString());
            }
        }
        return new StubIndex(List.copyOf(documents));
    }

    @Override
    public String query(DocumentIndex index, String question) {
        questions.add(question);
        Matcher matcher = FIELD_TAG.matcher(question);
        String field = matcher.find() ? matcher.group(1) : question;
        return answers.getOrDefault(field, "No information about " + field + " in the resume");
    }

    /// Returns every question received so far, in arrival order.
    ///
    /// @return snapshot of received questions, never null
    public List<String> questions() {
        return List.copyOf(questions);
    }

    record StubIndex(List<Path> documents) implements DocumentIndex {}
}
