package io.formflow.adapter.langchain4j;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.formflow.core.jobapp.DocumentIndex;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class LangChain4jDocumentIndexServiceTest {

    @TempDir Path tempDir;

    @Mock private ChatModel chatModel;

    private WordHashEmbeddingModel embeddingModel;
    private Path storageDir;
    private Path resume;

    @BeforeEach
    void setUp() throws Exception {
        embeddingModel = new WordHashEmbeddingModel();
        storageDir = tempDir.resolve("storage");
        resume =
                Files.writeString(
                        tempDir.resolve("resume.txt"),
                        "Ada Lovelace. Analyst at the Analytical Engine company since 1843.");
    }

    @Test
    void shouldIndexAndPersistStore() throws Exception {
        LangChain4jDocumentIndexService service =
                new LangChain4jDocumentIndexService(embeddingModel, chatModel, storageDir);

        DocumentIndex index = service.index(List.of(resume));

        assertThat(index.documents()).containsExactly(resume);
        assertThat(embeddingModel.embedded()).isPositive();
        try (var files = Files.list(storageDir)) {
            assertThat(files.map(p -> p.getFileName().toString()))
                    .singleElement()
                    .satisfies(name -> assertThat(name).startsWith("index-").endsWith(".json"));
        }
    }

    @Test
    void shouldReloadPersistedStoreForSameDocument() throws Exception {
        new LangChain4jDocumentIndexService(embeddingModel, chatModel, storageDir)
                .index(List.of(resume));
        int embeddedAfterFirst = embeddingModel.embedded();

        DocumentIndex reloaded =
                new LangChain4jDocumentIndexService(embeddingModel, chatModel, storageDir)
                        .index(List.of(resume));

        assertThat(reloaded).isNotNull();
        assertThat(embeddingModel.embedded()).isEqualTo(embeddedAfterFirst);
    }

    @Test
    void shouldAnswerFromRetrievedSegments() throws Exception {
        // Given
        when(chatModel.chat(anyString())).thenReturn(" Ada Lovelace \n");
        LangChain4jDocumentIndexService service =
                new LangChain4jDocumentIndexService(embeddingModel, chatModel, storageDir);
        DocumentIndex index = service.index(List.of(resume));

        // When
        String answer = service.query(index, "What is the candidate's name?");

        // Then
        assertThat(answer).isEqualTo("Ada Lovelace");
        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(chatModel).chat(prompt.capture());
        assertThat(prompt.getValue())
                .contains("Analytical Engine")
                .contains("Query: What is the candidate's name?");
    }

    @Test
    void shouldRejectMissingDocument() {
        LangChain4jDocumentIndexService service =
                new LangChain4jDocumentIndexService(embeddingModel, chatModel, storageDir);

        assertThatThrownBy(() -> service.index(List.of(tempDir.resolve("missing.txt"))))
                .isInstanceOf(NoSuchFileException.class);
    }

    @Test
    void shouldRejectForeignIndex() {
        LangChain4jDocumentIndexService service =
                new LangChain4jDocumentIndexService(embeddingModel, chatModel, storageDir);
        DocumentIndex foreign = () -> List.of(resume);

        assertThatThrownBy(() -> service.query(foreign, "question"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    /// Deterministic bag-of-words embedding, enough for similarity search in tests.
    static class WordHashEmbeddingModel implements EmbeddingModel {
        private static final int DIMENSIONS = 64;
        private final AtomicInteger embedded = new AtomicInteger();

        @Override
        public Response<List<Embedding>> embedAll(List<TextSegment> segments) {
            embedded.addAndGet(segments.size());
            return Response.from(
                    segments.stream()
                            .map(segment -> embedText(segment.text().toLowerCase(Locale.ROOT)))
                            .collect(Collectors.toList()));
        }

        int embedded() {
            return embedded.get();
        }

        private static Embedding embedText(String text) {
            float[] vector = new float[DIMENSIONS];
            vector[0] = 0.01f;
            for (String word : text.split("\\W+")) {
                if (!word.isEmpty()) {
                    vector[Math.floorMod(word.hashCode(), DIMENSIONS)] += 1f;
                }
            }
            return Embedding.from(vector);
        }
    }
}
