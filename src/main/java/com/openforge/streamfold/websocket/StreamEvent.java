package com.openforge.streamfold.websocket;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.UUID;

/**
 * The event envelope pushed to STOMP subscribers of one run.
 *
 * Fields:
 *   runId       — the model call this event belongs to
 *   parentRunId — enclosing run, if any
 *   type        — discriminator; tells the client how to render the event
 *   content     — token text for TOKEN, error message for ERROR
 *   payload     — structured object (chunk, message, model description)
 *   timestamp   — epoch millis
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StreamEvent(
        UUID      runId,
        UUID      parentRunId,
        EventType type,
        String    content,
        Object    payload,
        long      timestamp
) {

    public static StreamEvent start(UUID runId, UUID parentRunId, Object serialized) {
        return new StreamEvent(runId, parentRunId, EventType.START, null, serialized, now());
    }

    public static StreamEvent token(UUID runId, UUID parentRunId, String token, Object chunk) {
        return new StreamEvent(runId, parentRunId, EventType.TOKEN, token, chunk, now());
    }

    public static StreamEvent end(UUID runId, UUID parentRunId, Object message) {
        return new StreamEvent(runId, parentRunId, EventType.END, null, message, now());
    }

    public static StreamEvent error(UUID runId, UUID parentRunId, String message) {
        return new StreamEvent(runId, parentRunId, EventType.ERROR, message, null, now());
    }

    private static long now() {
        return System.currentTimeMillis();
    }
}
