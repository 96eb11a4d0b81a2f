package com.openforge.streamfold.llm.model;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One entry of the "tools" array:
 * {"type": "function", "function": {"name": ..., "description": ..., "parameters": {...}}}
 */
public record Tool(
        String type,
        ToolFunction function
) {

    public static Tool function(String name, String description, JsonNode parameters) {
        return new Tool("function", new ToolFunction(name, description, parameters));
    }

    public String name() {
        return function == null ? null : function.name();
    }
}
