package com.openforge.streamfold.callback;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Identifiers and labels for one model call, handed to every callback.
 *
 * runId        — fresh per invoke/stream call
 * parentRunId  — the enclosing run, when the call is nested in a larger chain
 */
public record RunContext(
        UUID runId,
        UUID parentRunId,
        List<String> tags,
        Map<String, Object> metadata
) {

    public RunContext {
        tags = tags == null ? List.of() : List.copyOf(tags);
        metadata = metadata == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(metadata));
    }

    public static RunContext start(UUID parentRunId, List<String> tags, Map<String, Object> metadata) {
        return new RunContext(UUID.randomUUID(), parentRunId, tags, metadata);
    }

    /** Id stamped on messages and chunks that the model produced without one. */
    public String defaultMessageId() {
        return "run-" + runId;
    }
}
