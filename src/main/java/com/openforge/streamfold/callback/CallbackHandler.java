package com.openforge.streamfold.callback;

import com.openforge.streamfold.message.Message;
import com.openforge.streamfold.message.MessageChunk;

import java.util.List;
import java.util.Map;

/**
 * Observer of chat-model runs.  Every method is optional.
 *
 * Handlers are invoked synchronously on the thread that produces the stream,
 * in emission order.  Exceptions thrown here are logged by
 * {@link CallbackDispatcher} and never reach the producer.
 */
public interface CallbackHandler {

    /**
     * @param serialized description of the model and its identifying parameters
     * @param messages   the prompt as sent
     */
    default void onChatModelStart(Map<String, Object> serialized, List<Message> messages, RunContext run) {
    }

    /** Called once per streamed chunk; {@code token} is the chunk's content, possibly "". */
    default void onNewToken(String token, MessageChunk chunk, RunContext run) {
    }

    default void onChatModelEnd(Message message, RunContext run) {
    }

    default void onChatModelError(Throwable error, RunContext run) {
    }
}
