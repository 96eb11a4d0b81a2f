package com.openforge.streamfold.stream;

import com.openforge.streamfold.message.MessageChunk;

import java.util.Optional;

/**
 * Running fold over one chunk stream.  One instance per stream; not thread-safe.
 *
 * If {@link #add} throws, the accumulator must be abandoned: the partial value
 * it holds describes a response that can no longer be reconstructed.
 */
public final class ChunkAccumulator {

    private MessageChunk accumulated;
    private int          chunkCount;

    /** Merges {@code chunk} into the running value and returns the new value. */
    public MessageChunk add(MessageChunk chunk) {
        accumulated = ChunkMerger.merge(accumulated, chunk);
        chunkCount++;
        return accumulated;
    }

    public Optional<MessageChunk> current() {
        return Optional.ofNullable(accumulated);
    }

    public int chunkCount() {
        return chunkCount;
    }
}
