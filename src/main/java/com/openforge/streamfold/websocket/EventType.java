package com.openforge.streamfold.websocket;

/**
 * Classifies every event published for a streaming run.
 *
 * Flow: START → TOKEN × n → END, or START → TOKEN × k → ERROR.
 */
public enum EventType {

    /** Model call began. payload = serialized model description. */
    START,

    /** One streamed chunk. content = token, payload = the chunk. */
    TOKEN,

    /** Stream exhausted. payload = the folded message. */
    END,

    /** Run failed. content = error message. */
    ERROR
}
