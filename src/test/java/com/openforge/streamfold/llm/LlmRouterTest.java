package com.openforge.streamfold.llm;

import com.openforge.streamfold.message.Message;
import com.openforge.streamfold.message.MessageChunk;
import com.openforge.streamfold.message.Prompt;
import com.openforge.streamfold.model.ChatConfig;
import com.openforge.streamfold.model.ChatModel;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class LlmRouterTest {

    private static final Prompt PROMPT = Prompt.of("hi");

    @Mock
    private ChatModel primary;

    @Mock
    private ChatModel fallback;

    private LlmRouter router;

    @BeforeEach
    void setUp() {
        router = routerWith(Retry.of("primary", noRetry()), Retry.of("fallback", noRetry()));
    }

    private LlmRouter routerWith(Retry primaryRetry, Retry fallbackRetry) {
        return new LlmRouter(primary, fallback,
                CircuitBreaker.ofDefaults("primary"), CircuitBreaker.ofDefaults("fallback"),
                primaryRetry, fallbackRetry);
    }

    private static RetryConfig noRetry() {
        return RetryConfig.custom().maxAttempts(1).build();
    }

    @Test
    void shouldUsePrimaryWhenHealthy() {
        when(primary.invoke(any(Prompt.class), any(ChatConfig.class))).thenReturn(Message.ai("primary"));

        Message reply = router.invoke(PROMPT, ChatConfig.defaults());

        assertThat(reply.content()).isEqualTo("primary");
        verify(fallback, never()).invoke(any(Prompt.class), any(ChatConfig.class));
    }

    @Test
    void shouldFallBackWhenPrimaryFails() {
        when(primary.invoke(any(Prompt.class), any(ChatConfig.class)))
                .thenThrow(new OpenAiCompatibleChatModel.LlmException("down"));
        when(fallback.invoke(any(Prompt.class), any(ChatConfig.class))).thenReturn(Message.ai("fallback"));

        Message reply = router.invoke(PROMPT, ChatConfig.defaults());

        assertThat(reply.content()).isEqualTo("fallback");
    }

    @Test
    void shouldFailWhenBothProvidersFail() {
        when(primary.invoke(any(Prompt.class), any(ChatConfig.class)))
                .thenThrow(new OpenAiCompatibleChatModel.LlmException("down"));
        when(fallback.invoke(any(Prompt.class), any(ChatConfig.class)))
                .thenThrow(new IllegalStateException("also down"));

        assertThatThrownBy(() -> router.invoke(PROMPT, ChatConfig.defaults()))
                .isInstanceOf(OpenAiCompatibleChatModel.LlmException.class)
                .hasMessageContaining("fallback provider ultimately failed")
                .hasMessageContaining("also down");
    }

    @Test
    void shouldRetryPrimaryBeforeFallingBack() {
        Retry threeAttempts = Retry.of("primary", RetryConfig.custom()
                .maxAttempts(3)
                .waitDuration(Duration.ofMillis(1))
                .retryExceptions(OpenAiCompatibleChatModel.LlmException.class)
                .build());
        LlmRouter retrying = routerWith(threeAttempts, Retry.of("fallback", noRetry()));
        when(primary.invoke(any(Prompt.class), any(ChatConfig.class)))
                .thenThrow(new OpenAiCompatibleChatModel.LlmRateLimitException("429"))
                .thenThrow(new OpenAiCompatibleChatModel.LlmRateLimitException("429"))
                .thenReturn(Message.ai("third time"));

        Message reply = retrying.invoke(PROMPT, ChatConfig.defaults());

        assertThat(reply.content()).isEqualTo("third time");
        verify(primary, times(3)).invoke(any(Prompt.class), any(ChatConfig.class));
    }

    @Test
    void shouldFallBackWhenPrimaryStreamFailsToOpen() {
        when(primary.stream(any(Prompt.class), any(ChatConfig.class)))
                .thenThrow(new OpenAiCompatibleChatModel.LlmException("refused"));
        when(fallback.stream(any(Prompt.class), any(ChatConfig.class)))
                .thenReturn(Stream.of(MessageChunk.ofContent("ok", "f")));

        assertThat(router.stream(PROMPT, ChatConfig.defaults()))
                .extracting(MessageChunk::content)
                .containsExactly("ok");
    }

    @Test
    void shouldSkipPrimaryWhileCircuitIsOpen() {
        CircuitBreaker open = CircuitBreaker.of("primary", CircuitBreakerConfig.ofDefaults());
        open.transitionToOpenState();
        LlmRouter tripped = new LlmRouter(primary, fallback,
                open, CircuitBreaker.ofDefaults("fallback"),
                Retry.of("primary", noRetry()), Retry.of("fallback", noRetry()));
        when(fallback.invoke(any(Prompt.class), any(ChatConfig.class))).thenReturn(Message.ai("fallback"));

        assertThat(tripped.invoke(PROMPT, ChatConfig.defaults()).content()).isEqualTo("fallback");
        verify(primary, never()).invoke(any(Prompt.class), any(ChatConfig.class));
    }
}
