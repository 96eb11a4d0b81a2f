package com.openforge.streamfold.callback;

import com.openforge.streamfold.message.Message;
import com.openforge.streamfold.message.MessageChunk;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Stream-scoped fan-out over a fixed list of handlers.
 *
 * Fire-and-forget: a handler that throws is logged and skipped, the remaining
 * handlers still run, and the producing stream carries on.
 */
@Slf4j
public class CallbackDispatcher {

    private final List<CallbackHandler> handlers;

    public CallbackDispatcher(List<CallbackHandler> handlers) {
        this.handlers = handlers == null ? List.of() : List.copyOf(handlers);
    }

    public void chatModelStart(Map<String, Object> serialized, List<Message> messages, RunContext run) {
        dispatch("chat_model_start", run, h -> h.onChatModelStart(serialized, messages, run));
    }

    public void newToken(MessageChunk chunk, RunContext run) {
        dispatch("new_token", run, h -> h.onNewToken(chunk.content(), chunk, run));
    }

    public void chatModelEnd(Message message, RunContext run) {
        dispatch("chat_model_end", run, h -> h.onChatModelEnd(message, run));
    }

    public void chatModelError(Throwable error, RunContext run) {
        dispatch("chat_model_error", run, h -> h.onChatModelError(error, run));
    }

    public boolean isEmpty() {
        return handlers.isEmpty();
    }

    private void dispatch(String event, RunContext run, Consumer<CallbackHandler> call) {
        for (CallbackHandler handler : handlers) {
            try {
                call.accept(handler);
            } catch (RuntimeException e) {
                // A broken observer must not take the stream down with it
                log.warn("[Callbacks] {} failed in {} for run {}: {}",
                        event, handler.getClass().getSimpleName(), run.runId(), e.getMessage());
            }
        }
    }
}
