package com.openforge.streamfold.model;

import com.openforge.streamfold.callback.CallbackHandler;
import lombok.Builder;

import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Per-call options for a {@link ChatModel}.
 *
 * callbacks    — handlers notified for this call only
 * tags         — free-form labels copied into every callback's RunContext
 * metadata     — free-form key/values copied likewise
 * parentRunId  — links the call to an enclosing run
 */
@Builder(toBuilder = true)
public record ChatConfig(
        List<CallbackHandler> callbacks,
        List<String> tags,
        Map<String, Object> metadata,
        UUID parentRunId
) {

    public ChatConfig {
        callbacks = callbacks == null ? List.of() : List.copyOf(callbacks);
        tags = tags == null ? List.of() : List.copyOf(tags);
        metadata = metadata == null ? Map.of() : metadata;
    }

    public static ChatConfig defaults() {
        return ChatConfig.builder().build();
    }

    public static ChatConfig withCallbacks(CallbackHandler... handlers) {
        return ChatConfig.builder().callbacks(List.of(handlers)).build();
    }
}
