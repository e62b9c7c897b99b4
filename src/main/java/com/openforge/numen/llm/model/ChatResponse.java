package com.openforge.numen.llm.model;

import java.util.List;

/**
 * Top-level response from /chat/completions.
 */
public record ChatResponse(
        String id,
        String object,
        Long created,
        String model,
        List<Choice> choices,
        Usage usage
) {

    /** Text of the first choice; empty string when the model returned none. */
    public String firstContent() {
        if (choices == null || choices.isEmpty()) {
            throw new IllegalStateException("Completion returned no choices: " + id);
        }
        Message message = choices.get(0).message();
        return message == null || message.content() == null ? "" : message.content();
    }

    public record Choice(int index, Message message, String finishReason) {}

    public record Usage(int promptTokens, int completionTokens, int totalTokens) {}
}
