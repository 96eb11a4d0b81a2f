package com.openforge.streamfold.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * Circuit-breaker and retry settings shared by both chat providers.
 *
 * Reads from application.yml under the "streamfold.llm.resilience" prefix:
 *
 * streamfold:
 *   llm:
 *     resilience:
 *       circuit-breaker:
 *         sliding-window-size: 20
 *         slow-call-duration: 15s
 *       retry:
 *         max-attempts: 2
 *         initial-backoff: 500ms
 *
 * The guarded call is the request that opens a stream, so "slow" means slow
 * to answer with headers, not slow to finish generating.
 */
@ConfigurationProperties(prefix = "streamfold.llm.resilience")
public record ResilienceProperties(
        @DefaultValue CircuitBreakerSettings circuitBreaker,
        @DefaultValue RetrySettings retry
) {

    public record CircuitBreakerSettings(
            @DefaultValue("20")  int      slidingWindowSize,
            @DefaultValue("5")   int      minimumNumberOfCalls,
            @DefaultValue("50")  float    failureRateThreshold,
            @DefaultValue("15s") Duration slowCallDuration,
            @DefaultValue("50")  float    slowCallRateThreshold,
            @DefaultValue("3")   int      permittedCallsInHalfOpenState,
            @DefaultValue("20s") Duration waitInOpenState
    ) {}

    public record RetrySettings(
            @DefaultValue("2")     int      maxAttempts,
            @DefaultValue("500ms") Duration initialBackoff,
            @DefaultValue("2.0")   double   backoffMultiplier
    ) {}

    /** The values used when nothing is configured. */
    public static ResilienceProperties defaults() {
        return new ResilienceProperties(
                new CircuitBreakerSettings(20, 5, 50, Duration.ofSeconds(15), 50, 3, Duration.ofSeconds(20)),
                new RetrySettings(2, Duration.ofMillis(500), 2.0));
    }
}
