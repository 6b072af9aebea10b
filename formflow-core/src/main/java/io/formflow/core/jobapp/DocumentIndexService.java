package io.formflow.core.jobapp;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/// Builds searchable indexes over documents and answers questions against them.
///
/// @see io.formflow.core.jobapp.stub.StubDocumentIndexService
public interface DocumentIndexService {

    /// Indexes the given documents.
    ///
    /// @param documents files to index, not null, not empty
    /// @return queryable handle, never null
    /// @throws IOException if a document cannot be read or parsed
    DocumentIndex index(List<Path> documents) throws IOException;

    /// Answers a question from the indexed content.
    ///
    /// @param index handle returned by {@link #index}, not null
    /// @param question natural-language question, not null
    /// @return answer text, never null
    String query(DocumentIndex index, String question);
}
