package com.openforge.streamfold.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

import java.util.List;

/**
 * The request body sent to an OpenAI-compatible /chat/completions endpoint.
 *
 * toolChoice is either a string or a forced-function object:
 *   "none"     — model will not call any tool
 *   "auto"     — model decides
 *   "required" — model MUST call at least one tool
 *   {"type": "function", "function": {"name": "MyTool"}} — model MUST call MyTool
 */
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ChatRequest(
        String model,
        List<WireMessage> messages,
        List<Tool> tools,
        Object toolChoice,
        Double temperature,
        Integer maxTokens
) {}
