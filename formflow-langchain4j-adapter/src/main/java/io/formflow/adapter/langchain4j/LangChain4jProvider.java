package io.formflow.adapter.langchain4j;

import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import io.formflow.core.jobapp.FieldListParser;
import io.formflow.core.jobapp.JobApplicationServices;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.logging.Logger;

/// Builds the LangChain4j-backed collaborators of the job-application workflow.
///
/// Chat and embedding models are OpenAI models; the API key is looked up in the
/// credentials map under `openai_api_key` or `OPENAI_API_KEY`.
///
/// ### Default Values
/// - chat model: `gpt-4o-mini`
/// - embedding model: `text-embedding-3-small`
/// - request timeout: 60 s
///
/// @implNote Stateless and thread-safe. Each call creates new model instances.
public class LangChain4jProvider {

    private static final Logger logger = Logger.getLogger(LangChain4jProvider.class.getName());

    public static final String DEFAULT_CHAT_MODEL = "gpt-4o-mini";
    public static final String DEFAULT_EMBEDDING_MODEL = "text-embedding-3-small";

    private static final long DEFAULT_TIMEOUT_SECONDS = 60;
    private static final double DEFAULT_TEMPERATURE = 0.0;

    /// Returns whether the given chat model name can be served.
    ///
    /// @param modelName model name, may be null
    /// @return true for OpenAI chat models
    public boolean supportsModel(String modelName) {
        if (modelName == null) return false;
        return modelName.startsWith("gpt") || modelName.startsWith("o1");
    }

    /// Creates all collaborators on OpenAI models.
    ///
    /// @param chatModelName chat model name, not null
    /// @param embeddingModelName embedding model name, not null
    /// @param storageDir directory for persisted indexes, not null
    /// @param parser reader for the field-extraction answer, not null
    /// @param credentials API keys, not null
    /// @return services bundle, never null
    /// @throws IllegalArgumentException if the chat model is not supported
    /// @throws IllegalStateException if no API key is configured
    public JobApplicationServices createServices(
            String chatModelName,
            String embeddingModelName,
            Path storageDir,
            FieldListParser parser,
            Map<String, String> credentials) {
        ChatModel chat = createChatModel(chatModelName, credentials);
        EmbeddingModel embedding = createEmbeddingModel(embeddingModelName, credentials);
        LangChain4jCompletionService completion = new LangChain4jCompletionService(chat);
        logger.info(
                "Created LangChain4j services with chat model "
                        + chatModelName
                        + " and embedding model "
                        + embeddingModelName);
        return new JobApplicationServices(
                new LangChain4jDocumentIndexService(embedding, chat, storageDir),
                new LangChain4jFormFieldExtractor(completion, parser),
                completion);
    }

    /// Creates an OpenAI chat model.
    ///
    /// @param modelName model name, not null
    /// @param credentials API keys, not null
    /// @return configured model, never null
    /// @throws IllegalArgumentException if the model is not supported
    /// @throws IllegalStateException if no API key is configured
    public ChatModel createChatModel(String modelName, Map<String, String> credentials) {
        if (!supportsModel(modelName)) {
            throw new IllegalArgumentException("Unsupported model: " + modelName);
        }
        return OpenAiChatModel.builder()
                .apiKey(requireApiKey(credentials, "openai_api_key", "OPENAI_API_KEY"))
                .modelName(modelName)
                .temperature(DEFAULT_TEMPERATURE)
                .timeout(Duration.ofSeconds(DEFAULT_TIMEOUT_SECONDS))
                .build();
    }

    /// Creates an OpenAI embedding model.
    ///
    /// @param modelName model name, not null
    /// @param credentials API keys, not null
    /// @return configured model, never null
    /// @throws IllegalStateException if no API key is configured
    public EmbeddingModel createEmbeddingModel(String modelName, Map<String, String> credentials) {
        return OpenAiEmbeddingModel.builder()
                .apiKey(requireApiKey(credentials, "openai_api_key", "OPENAI_API_KEY"))
                .modelName(modelName)
                .timeout(Duration.ofSeconds(DEFAULT_TIMEOUT_SECONDS))
                .build();
    }

    /// Looks up an API key from credentials, trying each key name in order.
    ///
    /// @param credentials credential map to search, not null
    /// @param keyNames candidate key names in priority order
    /// @return the first non-blank value found, never null
    /// @throws IllegalStateException if no key name resolves to a value
    private String requireApiKey(Map<String, String> credentials, String... keyNames) {
        for (String keyName : keyNames) {
            String value = credentials.get(keyName);
            if (value != null && !value.isBlank()) return value;
        }
        throw new IllegalStateException(
                "API key not found. Provide one of: " + String.join(", ", keyNames));
    }
}
