package com.openforge.streamfold.message;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The input handed to a chat model: an ordered, immutable list of messages.
 */
public record Prompt(List<Message> messages) {

    public Prompt {
        messages = messages == null ? List.of() : List.copyOf(messages);
    }

    /** A bare string becomes a single human message. */
    public static Prompt of(String text) {
        return new Prompt(List.of(Message.human(text)));
    }

    public static Prompt of(Message... messages) {
        return new Prompt(Arrays.asList(messages));
    }

    public static Prompt of(List<Message> messages) {
        return new Prompt(messages);
    }

    /**
     * Coerces alternating role / text arguments:
     * {@code Prompt.ofPairs("system", "be brief", "ai", "blah")}.
     */
    public static Prompt ofPairs(String... roleThenText) {
        if (roleThenText.length % 2 != 0) {
            throw new IllegalArgumentException("Expected role/text pairs, got odd argument count "
                    + roleThenText.length);
        }
        List<Message> messages = new ArrayList<>(roleThenText.length / 2);
        for (int i = 0; i < roleThenText.length; i += 2) {
            messages.add(Message.of(roleThenText[i], roleThenText[i + 1]));
        }
        return new Prompt(messages);
    }

    public boolean isEmpty() {
        return messages.isEmpty();
    }

    public Message last() {
        if (messages.isEmpty()) {
            throw new IllegalArgumentException("Prompt contains no messages");
        }
        return messages.get(messages.size() - 1);
    }
}
