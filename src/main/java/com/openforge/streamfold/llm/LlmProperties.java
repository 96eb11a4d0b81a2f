package com.openforge.streamfold.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * OpenAI-compatible provider configuration.
 *
 * Reads from application.yml under the "streamfold.llm" prefix:
 *
 * streamfold:
 *   llm:
 *     enabled: true
 *     primary:
 *       name: fireworks
 *       base-url: https://api.fireworks.ai/inference/v1
 *       api-key: ${FIREWORKS_API_KEY:}
 *       model: accounts/fireworks/models/firefunction-v1
 *       temperature: 0
 *     fallback:
 *       name: openai
 *       base-url: https://api.openai.com/v1
 *       api-key: ${OPENAI_API_KEY:}
 *       model: gpt-4o-mini
 */
@ConfigurationProperties(prefix = "streamfold.llm")
public record LlmProperties(
        boolean enabled,
        ProviderConfig primary,
        ProviderConfig fallback
) {

    public record ProviderConfig(
            String name,
            String baseUrl,
            String apiKey,
            String model,
            Double temperature,
            Integer maxTokens,
            @DefaultValue("120") int timeoutSeconds
    ) {}
}
