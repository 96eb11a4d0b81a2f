package com.openforge.streamfold.model;

import com.openforge.streamfold.callback.RunContext;
import com.openforge.streamfold.message.Message;
import com.openforge.streamfold.message.MessageChunk;
import com.openforge.streamfold.stream.MessageFragmenter;

import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.stream.Stream;

/**
 * Scripted chat model for tests: ignores the prompt and replies with the next
 * message from a supplied iterator.
 *
 * invoke() returns the next message as-is (id stamped if missing).
 * stream() cuts the next message into chunks with a {@link MessageFragmenter}:
 * "hello goodbye" streams as "hello", " ", "goodbye".
 *
 * The iterator is shared across calls and is not thread-safe.  A supply built
 * with {@link #cycling} never ends, so consumers must bound how many replies
 * they take.
 */
public class GenericFakeChatModel extends AbstractChatModel {

    private final Iterator<Message>  messages;
    private final MessageFragmenter  fragmenter;

    public GenericFakeChatModel(Iterator<Message> messages) {
        this(messages, MessageFragmenter.withDefaults());
    }

    public GenericFakeChatModel(Iterator<Message> messages, MessageFragmenter fragmenter) {
        this.messages   = messages;
        this.fragmenter = fragmenter;
    }

    /** Replies with the given messages in order, forever. */
    public static GenericFakeChatModel cycling(Message... replies) {
        return new GenericFakeChatModel(cycle(List.of(replies)));
    }

    static Iterator<Message> cycle(List<Message> replies) {
        if (replies.isEmpty()) {
            throw new IllegalArgumentException("At least one reply is required to cycle");
        }
        return new Iterator<>() {
            private int next;

            @Override
            public boolean hasNext() {
                return true;
            }

            @Override
            public Message next() {
                Message reply = replies.get(next);
                next = (next + 1) % replies.size();
                return reply;
            }
        };
    }

    @Override
    protected Message generate(List<Message> prompt, RunContext run) {
        return nextReply();
    }

    @Override
    protected Stream<MessageChunk> generateStream(List<Message> prompt, RunContext run) {
        Message reply = nextReply();
        return fragmenter.fragment(reply.id() != null ? reply : reply.withId(run.defaultMessageId()));
    }

    @Override
    public String modelType() {
        return "generic-fake-chat-model";
    }

    private Message nextReply() {
        try {
            return messages.next();
        } catch (NoSuchElementException e) {
            throw new IllegalStateException("Scripted reply supply is exhausted", e);
        }
    }
}
