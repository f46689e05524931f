package com.openforge.toolbridge.agent.event;

/**
 * Classifies every event a turn emits over WebSocket.
 *
 * Flow: STATE_CHANGE(PROMPTING_MODEL) → STATE_CHANGE(PARSING_OUTPUT) → TOOL_CALL →
 *       TOOL_RESULT → FINAL_ANSWER, or ERROR from any step.
 */
public enum EventType {

    /** The turn's state machine moved. content = new state. */
    STATE_CHANGE,

    /** A validated invocation is about to be dispatched. payload = ToolInvocation. */
    TOOL_CALL,

    /** The adapter returned. payload = ToolResult. */
    TOOL_RESULT,

    /** Turn finished; content = user-facing answer. */
    FINAL_ANSWER,

    /** Turn ended in ERROR. content = user-facing message, payload = error type. */
    ERROR
}
