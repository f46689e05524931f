package com.openforge.toolbridge.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.toolbridge.tool.ToolResult;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;

/**
 * Backs the "post_call" tool: GET {base}/posts/{id}.
 *
 * The payload is the post object as returned upstream
 * ({"userId", "id", "title", "body"}).
 */
@Component
public class JsonPlaceholderPostAdapter extends HttpResourceAdapter {

    public static final String TOOL_NAME = "post_call";

    public JsonPlaceholderPostAdapter(HttpClient httpClient,
                                      ObjectMapper objectMapper,
                                      JsonPlaceholderProperties properties) {
        super(httpClient, objectMapper, properties);
    }

    @Override
    public String toolName() {
        return TOOL_NAME;
    }

    @Override
    protected String resourceLabel() {
        return "post";
    }

    @Override
    protected URI resourceUri(long id) {
        return URI.create(properties.normalizedBaseUrl() + "/posts/" + id);
    }

    @Override
    protected ToolResult interpret(long id, JsonNode body) {
        if (!body.isObject()) {
            return ToolResult.adapterError(TOOL_NAME, "Expected a JSON object for post " + id);
        }
        // Some mirrors answer 200 with {} instead of 404.
        if (body.isEmpty()) {
            return ToolResult.notFound(TOOL_NAME, "post %d not found".formatted(id));
        }
        return ToolResult.ok(TOOL_NAME, body);
    }
}
