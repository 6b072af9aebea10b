package io.formflow.core.jobapp;

/// Single-prompt text completion.
@FunctionalInterface
public interface TextCompletionService {

    /// Completes a prompt.
    ///
    /// @param prompt full prompt text, not null
    /// @return completion text, never null
    String complete(String prompt);
}
