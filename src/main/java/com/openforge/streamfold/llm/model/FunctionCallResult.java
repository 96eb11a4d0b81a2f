package com.openforge.streamfold.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Function name plus raw JSON argument string.  In streaming deltas either
 * part may be null or a partial fragment.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FunctionCallResult(
        String name,
        String arguments
) {}
