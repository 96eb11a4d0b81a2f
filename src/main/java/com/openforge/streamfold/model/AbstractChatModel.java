package com.openforge.streamfold.model;

import com.openforge.streamfold.callback.CallbackDispatcher;
import com.openforge.streamfold.callback.RunContext;
import com.openforge.streamfold.message.Message;
import com.openforge.streamfold.message.MessageChunk;
import com.openforge.streamfold.message.Prompt;
import com.openforge.streamfold.stream.ChunkAccumulator;

import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Template for chat models: subclasses produce messages, this class runs the
 * callbacks and stamps identity.
 *
 * Per call:
 *   1. a fresh {@link RunContext} is created from the {@link ChatConfig}
 *   2. on_chat_model_start is dispatched with {@link #serialized()} and the prompt
 *   3. output without an id gets {@code "run-<runId>"}, so all chunks of one
 *      stream share one identity
 *   4. each streamed chunk is dispatched as a token, in emission order
 *   5. on_chat_model_end carries the folded message once the stream is
 *      exhausted; on_chat_model_error is dispatched before a failure propagates
 */
public abstract class AbstractChatModel implements ChatModel {

    /** Produces one complete message for the prompt. */
    protected abstract Message generate(List<Message> messages, RunContext run);

    /** Short type label reported to callbacks, e.g. "generic-fake-chat-model". */
    public abstract String modelType();

    /**
     * Produces the chunk stream for the prompt.  Default: the whole
     * {@link #generate} result as a single chunk.
     */
    protected Stream<MessageChunk> generateStream(List<Message> messages, RunContext run) {
        return Stream.of(generate(messages, run).toChunk());
    }

    /** Parameters that distinguish this model instance (model name, temperature …). */
    protected Map<String, Object> identifyingParams() {
        return Map.of();
    }

    public Map<String, Object> serialized() {
        Map<String, Object> serialized = new LinkedHashMap<>();
        serialized.put("type", modelType());
        serialized.put("name", getClass().getSimpleName());
        serialized.put("params", identifyingParams());
        return serialized;
    }

    // ── ChatModel ────────────────────────────────────────────────────────────

    @Override
    public Message invoke(Prompt prompt, ChatConfig config) {
        RunContext run = RunContext.start(config.parentRunId(), config.tags(), config.metadata());
        CallbackDispatcher dispatcher = new CallbackDispatcher(config.callbacks());
        dispatcher.chatModelStart(serialized(), prompt.messages(), run);

        Message result;
        try {
            result = generate(prompt.messages(), run);
        } catch (RuntimeException e) {
            dispatcher.chatModelError(e, run);
            throw e;
        }
        if (result.id() == null) {
            result = result.withId(run.defaultMessageId());
        }
        dispatcher.chatModelEnd(result, run);
        return result;
    }

    @Override
    public Stream<MessageChunk> stream(Prompt prompt, ChatConfig config) {
        RunContext run = RunContext.start(config.parentRunId(), config.tags(), config.metadata());
        CallbackDispatcher dispatcher = new CallbackDispatcher(config.callbacks());
        dispatcher.chatModelStart(serialized(), prompt.messages(), run);

        Stream<MessageChunk> chunks;
        try {
            chunks = generateStream(prompt.messages(), run);
        } catch (RuntimeException e) {
            dispatcher.chatModelError(e, run);
            throw e;
        }

        ObservedChunks observed = new ObservedChunks(chunks.iterator(), dispatcher, run);
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(observed, Spliterator.ORDERED), false)
                .onClose(chunks::close);
    }

    // ── Stream observation ───────────────────────────────────────────────────

    /**
     * Wraps the producer's iterator: stamps ids, accumulates the final
     * message and fires the token / end / error callbacks.
     */
    private static final class ObservedChunks implements Iterator<MessageChunk> {

        private final Iterator<MessageChunk> source;
        private final CallbackDispatcher     dispatcher;
        private final RunContext             run;
        private final ChunkAccumulator       accumulator = new ChunkAccumulator();
        private boolean                      finished;

        ObservedChunks(Iterator<MessageChunk> source, CallbackDispatcher dispatcher, RunContext run) {
            this.source     = source;
            this.dispatcher = dispatcher;
            this.run        = run;
        }

        @Override
        public boolean hasNext() {
            boolean more;
            try {
                more = source.hasNext();
            } catch (RuntimeException e) {
                fail(e);
                throw e;
            }
            if (!more && !finished) {
                finished = true;
                Message result = accumulator.current()
                        .map(MessageChunk::toMessage)
                        .orElseGet(() -> Message.builder().id(run.defaultMessageId()).build());
                dispatcher.chatModelEnd(result, run);
            }
            return more;
        }

        @Override
        public MessageChunk next() {
            MessageChunk chunk;
            try {
                chunk = source.next();
                if (chunk.id() == null) {
                    chunk = chunk.withId(run.defaultMessageId());
                }
                accumulator.add(chunk);
            } catch (RuntimeException e) {
                fail(e);
                throw e;
            }
            dispatcher.newToken(chunk, run);
            return chunk;
        }

        private void fail(RuntimeException e) {
            if (!finished) {
                finished = true;
                dispatcher.chatModelError(e, run);
            }
        }
    }
}
