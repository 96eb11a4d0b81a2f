package com.openforge.streamfold.config;

import com.openforge.streamfold.llm.OpenAiCompatibleChatModel;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Programmatic Resilience4j wiring for the two chat providers:
 *   • "primaryLlm"
 *   • "fallbackLlm"
 *
 * LlmRouter tries primaryLlm first; an OPEN circuit or exhausted retries
 * fall through to fallbackLlm. Thresholds come from {@link ResilienceProperties}.
 */
@Configuration
public class Resilience4jConfig {

    // ── Circuit Breaker ──────────────────────────────────────────────────────

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(ResilienceProperties props) {
        CircuitBreakerRegistry registry = CircuitBreakerRegistry.of(circuitBreakerConfig(props.circuitBreaker()));
        registry.circuitBreaker("primaryLlm");
        registry.circuitBreaker("fallbackLlm");
        return registry;
    }

    @Bean
    public CircuitBreaker primaryLlmCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker("primaryLlm");
    }

    @Bean
    public CircuitBreaker fallbackLlmCircuitBreaker(CircuitBreakerRegistry registry) {
        return registry.circuitBreaker("fallbackLlm");
    }

    static CircuitBreakerConfig circuitBreakerConfig(ResilienceProperties.CircuitBreakerSettings settings) {
        return CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(settings.slidingWindowSize())
                // a handful of failed opens after a restart must not trip the circuit
                .minimumNumberOfCalls(settings.minimumNumberOfCalls())
                .failureRateThreshold(settings.failureRateThreshold())
                .slowCallDurationThreshold(settings.slowCallDuration())
                .slowCallRateThreshold(settings.slowCallRateThreshold())
                .permittedNumberOfCallsInHalfOpenState(settings.permittedCallsInHalfOpenState())
                .waitDurationInOpenState(settings.waitInOpenState())
                .recordExceptions(OpenAiCompatibleChatModel.LlmException.class)
                .build();
    }

    // ── Retry ────────────────────────────────────────────────────────────────

    @Bean
    public RetryRegistry retryRegistry(ResilienceProperties props) {
        RetryRegistry registry = RetryRegistry.of(retryConfig(props.retry()));
        registry.retry("primaryLlm");
        registry.retry("fallbackLlm");
        return registry;
    }

    @Bean
    public Retry primaryLlmRetry(RetryRegistry registry) {
        return registry.retry("primaryLlm");
    }

    @Bean
    public Retry fallbackLlmRetry(RetryRegistry registry) {
        return registry.retry("fallbackLlm");
    }

    static RetryConfig retryConfig(ResilienceProperties.RetrySettings settings) {
        return RetryConfig.custom()
                .maxAttempts(Math.max(settings.maxAttempts(), 1))
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        settings.initialBackoff(), settings.backoffMultiplier()))
                // network errors and 5xx surface as LlmException
                .retryExceptions(OpenAiCompatibleChatModel.LlmException.class)
                // a 429 goes straight to the fallback provider; the circuit still records it
                .ignoreExceptions(OpenAiCompatibleChatModel.LlmRateLimitException.class)
                .build();
    }
}
