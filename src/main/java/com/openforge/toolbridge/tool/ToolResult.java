package com.openforge.toolbridge.tool;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Immutable result of one adapter call.
 *
 * payload is present only when status = OK; rawError only for ADAPTER_ERROR
 * (and optionally NOT_FOUND).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolResult(
        String     toolName,
        ToolStatus status,
        JsonNode   payload,
        String     rawError
) {

    public static ToolResult ok(String toolName, JsonNode payload) {
        return new ToolResult(toolName, ToolStatus.OK, payload, null);
    }

    public static ToolResult notFound(String toolName, String detail) {
        return new ToolResult(toolName, ToolStatus.NOT_FOUND, null, detail);
    }

    public static ToolResult adapterError(String toolName, String diagnostic) {
        return new ToolResult(toolName, ToolStatus.ADAPTER_ERROR, null, diagnostic);
    }

    public boolean isOk() {
        return status == ToolStatus.OK;
    }
}
