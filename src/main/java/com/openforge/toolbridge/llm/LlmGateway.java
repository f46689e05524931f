package com.openforge.toolbridge.llm;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.toolbridge.llm.model.ChatRequest;
import com.openforge.toolbridge.llm.model.ChatResponse;
import com.openforge.toolbridge.llm.model.Message;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.stereotype.Component;

import java.net.http.HttpClient;
import java.util.List;
import java.util.function.Supplier;

/**
 * The model backend as seen by the orchestrator.
 *
 * Call graph:
 *
 *   complete(messages)
 *     └─ llmCircuitBreaker
 *           └─ llmClient.chat(request)
 *
 * No Retry decorator: a failed model call ends the turn, and retrying is left
 * to whoever calls handleTurn. An open breaker is reported like any other
 * unreachable-model failure.
 */
@Slf4j
@Component
@EnableConfigurationProperties(LlmProperties.class)
public class LlmGateway implements ModelBackend {

    private final LlmClient      client;
    private final CircuitBreaker circuitBreaker;
    private final double         temperature;

    public LlmGateway(HttpClient httpClient,
                      ObjectMapper objectMapper,
                      LlmProperties properties,
                      CircuitBreaker llmCircuitBreaker) {
        this.client         = new LlmClient(httpClient, objectMapper, properties);
        this.circuitBreaker = llmCircuitBreaker;
        this.temperature    = properties.temperature();
    }

    @Override
    public String complete(List<Message> messages) {
        ChatRequest request = ChatRequest.of(client.modelName(), messages, temperature);
        Supplier<ChatResponse> decorated =
                CircuitBreaker.decorateSupplier(circuitBreaker, () -> client.chat(request));

        ChatResponse response;
        try {
            response = decorated.get();
        } catch (CallNotPermittedException e) {
            log.warn("[LlmGateway] Circuit open for provider [{}], failing fast", client.providerName());
            throw new LlmClient.LlmException(
                    "Provider [%s] is unavailable (circuit open)".formatted(client.providerName()), e);
        }

        String content = response.firstContent();
        if (content == null || content.isBlank()) {
            throw new LlmClient.LlmException(
                    "Provider [%s] returned an empty completion".formatted(client.providerName()));
        }
        return content;
    }
}
