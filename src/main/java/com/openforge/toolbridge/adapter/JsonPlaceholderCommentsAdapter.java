package com.openforge.toolbridge.adapter;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.openforge.toolbridge.tool.ToolResult;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.http.HttpClient;

/**
 * Backs the "comments_call" tool: GET {base}/comments?postId={id}.
 *
 * The upstream answers an unknown post with 200 and an empty array, which is
 * reported as NOT_FOUND so the caller can say "no comments for that post".
 */
@Component
public class JsonPlaceholderCommentsAdapter extends HttpResourceAdapter {

    public static final String TOOL_NAME = "comments_call";

    public JsonPlaceholderCommentsAdapter(HttpClient httpClient,
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
        return "comments";
    }

    @Override
    protected URI resourceUri(long id) {
        return URI.create(properties.normalizedBaseUrl() + "/comments?postId=" + id);
    }

    @Override
    protected ToolResult interpret(long id, JsonNode body) {
        if (!body.isArray()) {
            return ToolResult.adapterError(TOOL_NAME, "Expected a JSON array of comments for post " + id);
        }
        if (body.isEmpty()) {
            return ToolResult.notFound(TOOL_NAME, "no comments for post %d".formatted(id));
        }
        return ToolResult.ok(TOOL_NAME, body);
    }
}
