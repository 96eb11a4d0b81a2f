package com.openforge.streamfold.model;

import com.openforge.streamfold.callback.RunContext;
import com.openforge.streamfold.message.Message;

import java.util.List;

/** Echoes the last prompt message back, role included. */
public class ParrotFakeChatModel extends AbstractChatModel {

    @Override
    protected Message generate(List<Message> messages, RunContext run) {
        if (messages.isEmpty()) {
            throw new IllegalArgumentException("ParrotFakeChatModel needs at least one message");
        }
        return messages.get(messages.size() - 1);
    }

    @Override
    public String modelType() {
        return "parrot-fake-chat-model";
    }
}
