package com.openforge.streamfold.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * A conversation entry in the OpenAI-compatible wire format.
 *
 * role variants:
 *   "system"    — initial persona / instructions
 *   "user"      — human turn
 *   "assistant" — model reply; may carry tool_calls instead of content
 *   "tool"      — result of a tool call, linked by tool_call_id
 *   "function"  — legacy function result, linked by name
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WireMessage(
        String role,

        /** Null for assistant messages that only contain tool_calls. */
        String content,

        List<ToolCall> toolCalls,

        String toolCallId,

        /** Function name, for "function" role messages. */
        String name
) {}
