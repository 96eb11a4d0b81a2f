package com.openforge.streamfold.model;

import com.openforge.streamfold.message.Message;
import com.openforge.streamfold.message.MessageChunk;
import com.openforge.streamfold.message.Prompt;
import com.openforge.streamfold.stream.ChunkAccumulator;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * A chat model with three calling styles:
 *
 *   invoke()  — one prompt, one complete message
 *   stream()  — one prompt, a lazy single-use stream of chunks that fold
 *               back into the message; every chunk shares one id
 *   batch()   — many prompts, one message each, in input order
 */
public interface ChatModel {

    Message invoke(Prompt prompt, ChatConfig config);

    Stream<MessageChunk> stream(Prompt prompt, ChatConfig config);

    /** Sequential and order-preserving; the first failure propagates. */
    default List<Message> batch(List<Prompt> prompts, ChatConfig config) {
        List<Message> results = new ArrayList<>(prompts.size());
        for (Prompt prompt : prompts) {
            results.add(invoke(prompt, config));
        }
        return results;
    }

    /**
     * Streams the run as progressively growing log states: after each chunk,
     * the chunks seen so far and their fold.
     */
    default Stream<RunLogState> streamLog(Prompt prompt, ChatConfig config) {
        Stream<MessageChunk> chunks = stream(prompt, config);
        Iterator<MessageChunk> source = chunks.iterator();
        List<MessageChunk> seen = new ArrayList<>();
        ChunkAccumulator accumulator = new ChunkAccumulator();

        Iterator<RunLogState> states = new Iterator<>() {
            @Override
            public boolean hasNext() {
                return source.hasNext();
            }

            @Override
            public RunLogState next() {
                MessageChunk chunk = source.next();
                seen.add(chunk);
                return new RunLogState(seen, accumulator.add(chunk));
            }
        };
        return StreamSupport.stream(Spliterators.spliteratorUnknownSize(states, Spliterator.ORDERED), false)
                .onClose(chunks::close);
    }

    // ── String convenience overloads ─────────────────────────────────────────

    default Message invoke(String prompt) {
        return invoke(Prompt.of(prompt), ChatConfig.defaults());
    }

    default Message invoke(String prompt, ChatConfig config) {
        return invoke(Prompt.of(prompt), config);
    }

    default Stream<MessageChunk> stream(String prompt) {
        return stream(Prompt.of(prompt), ChatConfig.defaults());
    }

    default Stream<MessageChunk> stream(String prompt, ChatConfig config) {
        return stream(Prompt.of(prompt), config);
    }
}
