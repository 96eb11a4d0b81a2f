package com.openforge.streamfold.websocket;

import com.openforge.streamfold.callback.CallbackHandler;
import com.openforge.streamfold.callback.RunContext;
import com.openforge.streamfold.message.Message;
import com.openforge.streamfold.message.MessageChunk;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Forwards chat-model callbacks to WebSocket subscribers.
 *
 * Topic layout:
 *   /topic/stream/{runId}  → START, TOKEN…, END / ERROR for one run
 *
 * Usage:
 *   model.stream(prompt, ChatConfig.withCallbacks(stompCallbackHandler));
 *
 * Thread safety: SimpMessagingTemplate is thread-safe; concurrent runs can
 * share one handler.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class StompCallbackHandler implements CallbackHandler {

    static final String TOPIC_PREFIX = "/topic/stream/";

    private final SimpMessagingTemplate messagingTemplate;

    @Override
    public void onChatModelStart(Map<String, Object> serialized, List<Message> messages, RunContext run) {
        publish(StreamEvent.start(run.runId(), run.parentRunId(), serialized));
    }

    @Override
    public void onNewToken(String token, MessageChunk chunk, RunContext run) {
        publish(StreamEvent.token(run.runId(), run.parentRunId(), token, chunk));
    }

    @Override
    public void onChatModelEnd(Message message, RunContext run) {
        publish(StreamEvent.end(run.runId(), run.parentRunId(), message));
    }

    @Override
    public void onChatModelError(Throwable error, RunContext run) {
        publish(StreamEvent.error(run.runId(), run.parentRunId(), error.getMessage()));
    }

    /**
     * Fire-and-forget: the producing stream is never failed by
     * a broken subscriber.
     */
    void publish(StreamEvent event) {
        String destination = TOPIC_PREFIX + event.runId();
        try {
            messagingTemplate.convertAndSend(destination, event);
        } catch (Exception e) {
            log.warn("[Publisher] Failed to deliver {} event to {}: {}",
                    event.type(), destination, e.getMessage());
        }
    }
}
