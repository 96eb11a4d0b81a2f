package com.openforge.streamfold.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * One SSE data frame from a streaming /chat/completions response.
 *
 *   data: {"id":"chatcmpl-xxx","choices":[{"index":0,"delta":{"content":"Hello"}}]}
 *   ...
 *   data: [DONE]
 *
 * The id is the same on every frame of one response and becomes the
 * identity of every MessageChunk built from the stream.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamingChunk(
        String id,
        String model,
        List<ChunkChoice> choices
) {

    public record ChunkChoice(
            int index,
            Delta delta,
            String finishReason
    ) {}

    /** Sparse delta: only the fields that changed in this frame are non-null. */
    public record Delta(
            String role,
            String content,
            List<ToolCallDelta> toolCalls
    ) {}

    /**
     * Incremental tool-call fragment.  id and type arrive on the first frame
     * of a call; name and arguments are spread over the following frames.
     */
    public record ToolCallDelta(
            Integer index,
            String id,
            String type,
            FunctionCallResult function
    ) {}
}
