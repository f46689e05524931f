package com.openforge.toolbridge.llm;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Externalised model backend configuration.
 *
 * Reads from application.yml under the "agent.llm" prefix. Any
 * OpenAI-compatible endpoint works; the default targets a local Ollama:
 *
 * agent:
 *   llm:
 *     name: ollama
 *     base-url: http://localhost:11434/v1
 *     api-key: ollama
 *     model: mistral
 *     timeout-seconds: 60
 *     temperature: 0.0
 */
@ConfigurationProperties(prefix = "agent.llm")
public record LlmProperties(
        @DefaultValue("ollama") String name,
        @DefaultValue("http://localhost:11434/v1") String baseUrl,
        @DefaultValue("ollama") String apiKey,
        @DefaultValue("mistral") String model,
        @DefaultValue("60") int timeoutSeconds,
        @DefaultValue("0.0") double temperature
) {}
