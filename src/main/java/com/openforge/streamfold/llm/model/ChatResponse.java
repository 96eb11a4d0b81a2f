package com.openforge.streamfold.llm.model;

import java.util.List;

/**
 * Top-level body of a non-streaming /chat/completions response.
 */
public record ChatResponse(
        String id,
        String model,
        List<Choice> choices,
        Usage usage
) {

    /** First choice message; a response without choices is a provider error. */
    public WireMessage firstMessage() {
        if (choices == null || choices.isEmpty() || choices.get(0).message() == null) {
            throw new IllegalStateException("Provider returned no choices in response: " + id);
        }
        return choices.get(0).message();
    }

    public record Choice(
            int index,
            WireMessage message,
            String finishReason
    ) {}

    public record Usage(
            int promptTokens,
            int completionTokens,
            int totalTokens
    ) {}
}
