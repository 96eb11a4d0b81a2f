package com.openforge.streamfold.llm;

import com.openforge.streamfold.message.Message;
import com.openforge.streamfold.message.MessageChunk;
import com.openforge.streamfold.message.Prompt;
import com.openforge.streamfold.model.ChatConfig;
import com.openforge.streamfold.model.ChatModel;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;
import java.util.stream.Stream;

/**
 * High-availability chat model: primary first, fallback second.
 *
 * Call graph (invoke and stream):
 *
 *   invoke(prompt) / stream(prompt)
 *     └─ primaryCircuitBreaker + primaryRetry
 *           └─ primary.{invoke|stream}
 *                 ↓ (on CallNotPermittedException or any exception)
 *     └─ fallbackCircuitBreaker + fallbackRetry
 *           └─ fallback.{invoke|stream}
 *
 * Streaming note:
 *   Only opening the stream is guarded.  Once chunks flow, a mid-stream
 *   failure reaches the consumer directly: chunks already delivered cannot
 *   be retracted, so switching providers would corrupt the fold.
 */
@Slf4j
public class LlmRouter implements ChatModel {

    private final ChatModel      primary;
    private final ChatModel      fallback;
    private final CircuitBreaker primaryCb;
    private final CircuitBreaker fallbackCb;
    private final Retry          primaryRetry;
    private final Retry          fallbackRetry;

    public LlmRouter(ChatModel primary,
                     ChatModel fallback,
                     CircuitBreaker primaryLlmCircuitBreaker,
                     CircuitBreaker fallbackLlmCircuitBreaker,
                     Retry primaryLlmRetry,
                     Retry fallbackLlmRetry) {
        this.primary       = primary;
        this.fallback      = fallback;
        this.primaryCb     = primaryLlmCircuitBreaker;
        this.fallbackCb    = fallbackLlmCircuitBreaker;
        this.primaryRetry  = primaryLlmRetry;
        this.fallbackRetry = fallbackLlmRetry;
    }

    @Override
    public Message invoke(Prompt prompt, ChatConfig config) {
        try {
            return executeWithResilience(primaryCb, primaryRetry,
                    () -> primary.invoke(prompt, config), "primary");
        } catch (OpenAiCompatibleChatModel.LlmException primaryException) {
            log.warn("[LlmRouter] Primary provider failed, engaging fallback. Cause: {}",
                    primaryException.getMessage());
            return executeWithResilience(fallbackCb, fallbackRetry,
                    () -> fallback.invoke(prompt, config), "fallback");
        }
    }

    @Override
    public Stream<MessageChunk> stream(Prompt prompt, ChatConfig config) {
        try {
            return executeWithResilience(primaryCb, primaryRetry,
                    () -> primary.stream(prompt, config), "primary");
        } catch (OpenAiCompatibleChatModel.LlmException primaryException) {
            log.warn("[LlmRouter] Primary stream failed to open, engaging fallback. Cause: {}",
                    primaryException.getMessage());
            return executeWithResilience(fallbackCb, fallbackRetry,
                    () -> fallback.stream(prompt, config), "fallback");
        }
    }

    /**
     * Decorates a supplier with circuit-breaker + retry, then executes it.
     * Fully programmatic: no AOP proxies.
     */
    private <T> T executeWithResilience(CircuitBreaker cb,
                                        Retry retry,
                                        Supplier<T> call,
                                        String label) {
        Supplier<T> decorated =
                CircuitBreaker.decorateSupplier(cb,
                        Retry.decorateSupplier(retry, call));
        try {
            return decorated.get();
        } catch (Exception e) {
            throw new OpenAiCompatibleChatModel.LlmException(
                    "[LlmRouter] %s provider ultimately failed: %s".formatted(label, e.getMessage()), e);
        }
    }
}
