package com.openforge.toolbridge.agent;

import com.openforge.toolbridge.invocation.ToolInvocation;
import com.openforge.toolbridge.tool.ToolResult;

/**
 * Terminal artifact of one turn. Immutable.
 *
 * @param finalText   user-facing answer or failure message
 * @param invokedTool the dispatched invocation, null when none was dispatched
 * @param toolResult  the adapter's result, null when none was dispatched
 * @param state       DONE or ERROR
 * @param errorType   snake_case failure code when state = ERROR, else null
 */
public record AgentTurnResult(
        String         finalText,
        ToolInvocation invokedTool,
        ToolResult     toolResult,
        TurnState      state,
        String         errorType
) {

    public static AgentTurnResult done(String finalText, ToolInvocation invokedTool, ToolResult toolResult) {
        return new AgentTurnResult(finalText, invokedTool, toolResult, TurnState.DONE, null);
    }

    public static AgentTurnResult error(String message, String errorType) {
        return new AgentTurnResult(message, null, null, TurnState.ERROR, errorType);
    }

    public boolean isDone() {
        return state == TurnState.DONE;
    }
}
