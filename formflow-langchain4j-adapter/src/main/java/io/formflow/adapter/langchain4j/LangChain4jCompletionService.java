package io.formflow.adapter.langchain4j;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import io.formflow.core.jobapp.TextCompletionService;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// {@link TextCompletionService} backed by a LangChain4j {@link ChatModel}.
///
/// Each prompt is sent as a single user message with no conversation history.
///
/// @implNote Thread-safe if the wrapped model is (the OpenAI model is).
public class LangChain4jCompletionService implements TextCompletionService {

    private static final Logger logger =
            Logger.getLogger(LangChain4jCompletionService.class.getName());

    private final ChatModel model;

    /// Creates a completion service.
    ///
    /// @param model chat model to delegate to, not null
    public LangChain4jCompletionService(ChatModel model) {
        this.model = Objects.requireNonNull(model, "model must not be null");
    }

    @Override
    public String complete(String prompt) {
        logger.fine(() -> "Completing prompt of " + prompt.length() + " chars");
        ChatResponse response = model.chat(List.of(UserMessage.from(prompt)));
        if (response == null || response.aiMessage() == null) {
            throw new IllegalStateException("No response from model");
        }
        AiMessage message = response.aiMessage();
        return message.text() == null ? "" : message.text().strip();
    }
}
