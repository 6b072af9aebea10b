package io.formflow.core.jobapp.stub;

import io.formflow.core.jobapp.TextCompletionService;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CopyOnWriteArrayList;

/// Deterministic stand-in for a chat model, recognising the prompts of the
/// job-application workflow.
///
/// - combine prompt: echoes the `<responses>` block as the filled form
/// - review verdict prompt: `OKAY` when the reviewer wrote exactly "okay" (any case),
///   otherwise `FEEDBACK`
/// - integrate prompt: appends the feedback to the current form
///
/// Any other prompt is answered with `OK`.
public class StubTextCompletionService implements TextCompletionService {

    private final List<String> prompts = new CopyOnWriteArrayList<>();

    @Override
    public String complete(String prompt) {
        prompts.add(prompt);
        if (prompt.contains("respond with just the word 'OKAY'")) {
            String feedback = between(prompt, "<feedback>", "</feedback>").strip();
            return feedback.toUpperCase(Locale.ROOT).equals("OKAY") ? "OKAY" : "FEEDBACK";
        }
        if (prompt.contains("<responses>")) {
            return "Filled form:\n" + between(prompt, "<responses>", "</responses>").strip();
        }
        if (prompt.contains("integrate the feedback")) {
            return between(prompt, "<form>", "</form>")
                    + "\nRevised after feedback: "
                    + between(prompt, "<feedback>", "</feedback>");
        }
        return "OK";
    }

    /// Returns every prompt received so far, in arrival order.
    ///
    /// @return snapshot of prompts, never null
    public List<String> prompts() {
        return List.copyOf(prompts);
    }

    private static String between(String text, String open, String close) {
        int start = text.indexOf(open);
        int end = text.indexOf(close, start + 1);
        if (start < 0 || end < 0) {
            return "";
        }
        return text.substring(start + open.length(), end);
    }
}
