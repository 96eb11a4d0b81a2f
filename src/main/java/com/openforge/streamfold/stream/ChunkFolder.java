package com.openforge.streamfold.stream;

import com.openforge.streamfold.message.Message;
import com.openforge.streamfold.message.MessageChunk;

import java.util.Iterator;
import java.util.Optional;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Consumer-facing fold driver.
 *
 * Both operations make a single pass on the caller's thread and pull from the
 * source only as fast as they are pulled themselves; a source that blocks on
 * network I/O blocks the fold with it.  A merge failure aborts the fold and
 * propagates; no partial result is returned.
 */
public final class ChunkFolder {

    private ChunkFolder() {}

    /** Batch consumption: the fully merged chunk, or empty for an empty stream. */
    public static Optional<MessageChunk> fold(Stream<MessageChunk> chunks) {
        ChunkAccumulator accumulator = new ChunkAccumulator();
        try (chunks) {
            chunks.forEachOrdered(accumulator::add);
        }
        return accumulator.current();
    }

    public static Optional<Message> foldToMessage(Stream<MessageChunk> chunks) {
        return fold(chunks).map(MessageChunk::toMessage);
    }

    /**
     * Progressive consumption: yields the accumulated value after every chunk,
     * e.g. "hello", "hello ", "hello goodbye".
     */
    public static Stream<MessageChunk> running(Stream<MessageChunk> chunks) {
        Iterator<MessageChunk> source = chunks.iterator();
        ChunkAccumulator accumulator = new ChunkAccumulator();

        Iterator<MessageChunk> runningValues = new Iterator<>() {
            @Override
            public boolean hasNext() {
                return source.hasNext();
            }

            @Override
            public MessageChunk next() {
                return accumulator.add(source.next());
            }
        };

        return StreamSupport.stream(
                        Spliterators.spliteratorUnknownSize(runningValues, Spliterator.ORDERED), false)
                .onClose(chunks::close);
    }
}
