package com.openforge.streamfold.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.retry.Retry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.net.http.HttpClient;

/**
 * Wires the two configured providers behind one {@link LlmRouter}.
 * Only active when streamfold.llm.enabled=true.
 */
@Configuration
@EnableConfigurationProperties(LlmProperties.class)
@ConditionalOnProperty(name = "streamfold.llm.enabled", havingValue = "true")
public class LlmConfig {

    @Bean
    public LlmRouter llmRouter(HttpClient httpClient,
                               ObjectMapper objectMapper,
                               LlmProperties properties,
                               CircuitBreaker primaryLlmCircuitBreaker,
                               CircuitBreaker fallbackLlmCircuitBreaker,
                               Retry primaryLlmRetry,
                               Retry fallbackLlmRetry) {
        OpenAiCompatibleChatModel primary =
                new OpenAiCompatibleChatModel(httpClient, objectMapper, properties.primary());
        // Without a fallback provider the primary is retried as its own fallback
        LlmProperties.ProviderConfig fallbackConfig = properties.fallback();
        OpenAiCompatibleChatModel fallback = fallbackConfig == null
                || fallbackConfig.baseUrl() == null || fallbackConfig.baseUrl().isBlank()
                ? primary
                : new OpenAiCompatibleChatModel(httpClient, objectMapper, fallbackConfig);
        return new LlmRouter(primary, fallback,
                primaryLlmCircuitBreaker, fallbackLlmCircuitBreaker,
                primaryLlmRetry, fallbackLlmRetry);
    }
}
