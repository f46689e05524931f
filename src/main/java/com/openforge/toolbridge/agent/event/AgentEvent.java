package com.openforge.toolbridge.agent.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.openforge.toolbridge.agent.TurnState;
import com.openforge.toolbridge.invocation.ToolInvocation;
import com.openforge.toolbridge.tool.ToolResult;

/**
 * The single event envelope broadcast over WebSocket.
 *
 * Fields:
 *   sessionId  - the session this event belongs to
 *   type       - discriminator; tells the client how to render the event
 *   content    - free-form text (state name, answer, error message)
 *   payload    - structured object for TOOL_CALL / TOOL_RESULT / ERROR
 *   timestamp  - epoch millis
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AgentEvent(
        String    sessionId,
        EventType type,
        String    content,
        Object    payload,
        long      timestamp
) {

    public static AgentEvent stateChange(String sessionId, TurnState state) {
        return new AgentEvent(sessionId, EventType.STATE_CHANGE, state.name(), null, now());
    }

    public static AgentEvent toolCall(String sessionId, ToolInvocation invocation) {
        return new AgentEvent(sessionId, EventType.TOOL_CALL, invocation.toolName(), invocation, now());
    }

    public static AgentEvent toolResult(String sessionId, ToolResult result) {
        return new AgentEvent(sessionId, EventType.TOOL_RESULT, result.status().code(), result, now());
    }

    public static AgentEvent finalAnswer(String sessionId, String answer) {
        return new AgentEvent(sessionId, EventType.FINAL_ANSWER, answer, null, now());
    }

    public static AgentEvent error(String sessionId, String message, String errorType) {
        return new AgentEvent(sessionId, EventType.ERROR, message, errorType, now());
    }

    private static long now() {
        return System.currentTimeMillis();
    }
}
