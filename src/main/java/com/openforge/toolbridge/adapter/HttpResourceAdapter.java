package com.openforge.toolbridge.adapter;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.toolbridge.tool.ToolResult;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;

/**
 * GET-by-id adapter over the shared JDK HttpClient.
 *
 * Subclasses supply the resource URI and decide how a 200 body maps to a
 * result; status translation, timeouts and diagnostics live here:
 *
 *   id <= 0             → ADAPTER_ERROR, no request sent
 *   HTTP 404            → NOT_FOUND
 *   other non-2xx       → ADAPTER_ERROR "HTTP <status>"
 *   timeout / I/O error → ADAPTER_ERROR with a short diagnostic
 *   unparsable body     → ADAPTER_ERROR
 */
@Slf4j
public abstract class HttpResourceAdapter implements ResourceAdapter {

    private static final int MAX_DIAGNOSTIC_LENGTH = 200;

    private final HttpClient                httpClient;
    private final ObjectMapper              objectMapper;
    protected final JsonPlaceholderProperties properties;

    protected HttpResourceAdapter(HttpClient httpClient,
                                  ObjectMapper objectMapper,
                                  JsonPlaceholderProperties properties) {
        this.httpClient   = httpClient;
        this.objectMapper = objectMapper;
        this.properties   = properties;
    }

    /** Short resource label used in logs and diagnostics, e.g. "post". */
    protected abstract String resourceLabel();

    protected abstract URI resourceUri(long id);

    /** Maps a successfully parsed 200 body to a result. */
    protected abstract ToolResult interpret(long id, JsonNode body);

    @Override
    public ToolResult fetch(long id) {
        if (id <= 0) {
            log.debug("[Adapter:{}] Rejected id={} without calling upstream", resourceLabel(), id);
            return ToolResult.adapterError(toolName(),
                    "%s id must be a positive integer, got %d".formatted(resourceLabel(), id));
        }

        URI uri = resourceUri(id);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .header("Accept", "application/json")
                .timeout(Duration.ofSeconds(properties.timeoutSeconds()))
                .GET()
                .build();

        log.debug("[Adapter:{}] → GET {}", resourceLabel(), uri);
        HttpResponse<String> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (HttpTimeoutException e) {
            log.warn("[Adapter:{}] Timeout fetching id={}", resourceLabel(), id);
            return ToolResult.adapterError(toolName(),
                    "Timeout while fetching %s %d".formatted(resourceLabel(), id));
        } catch (IOException e) {
            log.warn("[Adapter:{}] Network error fetching id={}: {}", resourceLabel(), id, e.toString());
            return ToolResult.adapterError(toolName(), truncate("Network error: " + e));
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return ToolResult.adapterError(toolName(), "Interrupted while fetching %s %d"
                    .formatted(resourceLabel(), id));
        }

        int status = response.statusCode();
        log.debug("[Adapter:{}] ← HTTP {} for id={}", resourceLabel(), status, id);
        if (status == 404) {
            return ToolResult.notFound(toolName(), "%s %d not found".formatted(resourceLabel(), id));
        }
        if (status < 200 || status >= 300) {
            return ToolResult.adapterError(toolName(), "Upstream returned HTTP " + status);
        }

        JsonNode body;
        try {
            body = objectMapper.readTree(response.body() == null ? "" : response.body());
        } catch (JsonProcessingException e) {
            return ToolResult.adapterError(toolName(), "Upstream returned invalid JSON");
        }
        if (body == null || body.isMissingNode()) {
            return ToolResult.adapterError(toolName(), "Upstream returned an empty body");
        }
        return interpret(id, body);
    }

    private static String truncate(String s) {
        return s.length() <= MAX_DIAGNOSTIC_LENGTH ? s : s.substring(0, MAX_DIAGNOSTIC_LENGTH) + "...";
    }
}
