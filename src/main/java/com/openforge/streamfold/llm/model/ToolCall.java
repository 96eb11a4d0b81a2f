package com.openforge.streamfold.llm.model;

/**
 * A tool invocation requested by the model, as reassembled from
 * {@code tool_calls.<index>} message fields.
 */
public record ToolCall(
        String id,
        String type,
        FunctionCallResult function
) {}
