package com.openforge.toolbridge.agent.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.openforge.toolbridge.agent.AgentTurnResult;

import java.util.Map;

/**
 * Response body for POST /api/agent/turns.
 *
 * status is "success" for a DONE turn and "error" otherwise; errorType is then
 * one of the snake_case codes of AgentTurnResult. Tool fields are present only
 * when an adapter was called.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TurnResponse(
        String              status,
        String              sessionId,
        String              finalText,
        String              tool,
        Map<String, Object> arguments,
        String              toolStatus,
        JsonNode            payload,
        String              errorType,
        String              wsSubscribePath
) {

    public static TurnResponse from(String sessionId, AgentTurnResult result) {
        var invocation = result.invokedTool();
        var toolResult = result.toolResult();
        return new TurnResponse(
                result.isDone() ? "success" : "error",
                sessionId,
                result.finalText(),
                invocation == null ? null : invocation.toolName(),
                invocation == null ? null : invocation.arguments(),
                toolResult == null ? null : toolResult.status().code(),
                toolResult == null ? null : toolResult.payload(),
                result.errorType(),
                "/topic/agent/" + sessionId
        );
    }
}
