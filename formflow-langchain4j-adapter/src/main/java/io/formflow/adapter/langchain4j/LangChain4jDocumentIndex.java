package io.formflow.adapter.langchain4j;

import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.store.embedding.EmbeddingStore;
import io.formflow.core.jobapp.DocumentIndex;
import java.nio.file.Path;
import java.util.List;

/// Embedding store holding the segments of the indexed documents.
///
/// @param documents source files, not null
/// @param store segments and their embeddings, not null
record LangChain4jDocumentIndex(List<Path> documents, EmbeddingStore<TextSegment> store)
        implements DocumentIndex {}
