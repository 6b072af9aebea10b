package io.formflow.adapter.langchain4j;

import dev.langchain4j.data.document.Document;
import dev.langchain4j.data.document.splitter.DocumentSplitters;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.store.embedding.EmbeddingMatch;
import dev.langchain4j.store.embedding.EmbeddingSearchRequest;
import dev.langchain4j.store.embedding.EmbeddingStoreIngestor;
import dev.langchain4j.store.embedding.inmemory.InMemoryEmbeddingStore;
import io.formflow.core.jobapp.DocumentIndex;
import io.formflow.core.jobapp.DocumentIndexService;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/// Retrieval-augmented {@link DocumentIndexService} on LangChain4j.
///
/// ### Indexing
/// Documents are parsed ({@link DocumentReader}), split recursively into overlapping
/// segments, embedded and stored in an {@link InMemoryEmbeddingStore}. The store is
/// written to the storage directory under a name derived from the documents' content,
/// so indexing the same resume again reloads the stored embeddings instead of
/// re-embedding.
///
/// ### Querying
/// The question is embedded, the {@value #DEFAULT_MAX_RESULTS} closest segments are
/// retrieved, and the chat model answers from those segments only.
///
/// @implNote Thread-safe. Indexes are independent; the only shared state is the
/// storage directory, and each index file is written once per content digest.
public class LangChain4jDocumentIndexService implements DocumentIndexService {

    private static final Logger logger =
            Logger.getLogger(LangChain4jDocumentIndexService.class.getName());

    static final int DEFAULT_MAX_RESULTS = 5;
    private static final int SEGMENT_SIZE = 500;
    private static final int SEGMENT_OVERLAP = 50;

    private final EmbeddingModel embeddingModel;
    private final ChatModel chatModel;
    private final Path storageDir;
    private final DocumentReader reader = new DocumentReader();

    /// Creates an index service.
    ///
    /// @param embeddingModel model embedding segments and questions, not null
    /// @param chatModel model answering questions from retrieved segments, not null
    /// @param storageDir directory for persisted stores, not null; created on demand
    public LangChain4jDocumentIndexService(
            EmbeddingModel embeddingModel, ChatModel chatModel, Path storageDir) {
        this.embeddingModel = Objects.requireNonNull(embeddingModel, "embeddingModel");
        this.chatModel = Objects.requireNonNull(chatModel, "chatModel");
        this.storageDir = Objects.requireNonNull(storageDir, "storageDir");
    }

    @Override
    public DocumentIndex index(List<Path> documents) throws IOException {
        if (documents.isEmpty()) {
            throw new IllegalArgumentException("No documents to index");
        }
        Path storeFile = storageDir.resolve("index-" + digest(documents) + ".json");
        if (Files.isRegularFile(storeFile)) {
            logger.info("Loading existing index from " + storeFile);
            return new LangChain4jDocumentIndex(
                    List.copyOf(documents), InMemoryEmbeddingStore.fromFile(storeFile));
        }

        InMemoryEmbeddingStore<TextSegment> store = new InMemoryEmbeddingStore<>();
        EmbeddingStoreIngestor ingestor =
                EmbeddingStoreIngestor.builder()
                        .documentSplitter(DocumentSplitters.recursive(SEGMENT_SIZE, SEGMENT_OVERLAP))
                        .embeddingModel(embeddingModel)
                        .embeddingStore(store)
                        .build();
        for (Path path : documents) {
            Document document = reader.read(path);
            ingestor.ingest(document);
        }

        Files.createDirectories(storageDir);
        store.serializeToFile(storeFile);
        logger.info("Indexed " + documents.size() + " document(s), persisted to " + storeFile);
        return new LangChain4jDocumentIndex(List.copyOf(documents), store);
    }

    @Override
    public String query(DocumentIndex index, String question) {
        if (!(index instanceof LangChain4jDocumentIndex langChainIndex)) {
            throw new IllegalArgumentException(
                    "Index was not created by this service: " + index.getClass().getName());
        }
        Embedding queryEmbedding = embeddingModel.embed(question).content();
        List<EmbeddingMatch<TextSegment>> matches =
                langChainIndex
                        .store()
                        .search(
                                EmbeddingSearchRequest.builder()
                                        .queryEmbedding(queryEmbedding)
                                        .maxResults(DEFAULT_MAX_RESULTS)
                                        .build())
                        .matches();
        String context =
                matches.stream()
                        .map(match -> match.embedded().text())
                        .collect(Collectors.joining("\n\n"));
        logger.fine(() -> "Retrieved " + matches.size() + " segments for question");

        String answer =
                chatModel.chat(
                        "Context information is below.\n"
                                + "---------------------\n"
                                + context
                                + "\n---------------------\n"
                                + "Given the context information and not prior knowledge, "
                                + "answer the query.\n"
                                + "Query: "
                                + question
                                + "\nAnswer: ");
        return answer == null ? "" : answer.strip();
    }

    private static String digest(List<Path> documents) throws IOException {
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            for (Path path : documents) {
                sha.update(Files.readAllBytes(path));
            }
            return HexFormat.of().formatHex(sha.digest()).substring(0, 16);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
