package com.openforge.streamfold.model;

import com.openforge.streamfold.message.MessageChunk;

import java.util.List;

/**
 * Snapshot of a streaming run after one more chunk arrived.
 *
 * streamedOutput — every chunk seen so far, in emission order
 * finalOutput    — the chunks folded into one value
 */
public record RunLogState(
        List<MessageChunk> streamedOutput,
        MessageChunk finalOutput
) {

    public RunLogState {
        streamedOutput = List.copyOf(streamedOutput);
    }
}
