package com.openforge.toolbridge.llm.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;

/**
 * A single entry in the LLM conversation.
 *
 * role variants:
 *   "system"    - tool catalogue and answer-format instructions
 *   "user"      - human turn (or the synthesis request)
 *   "assistant" - model reply
 *
 * Tool calls travel as JSON text inside assistant content, not as native
 * function-calling fields, so any chat model can drive the dispatcher.
 */
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Message(
        String role,
        String content
) {

    public static Message system(String content) {
        return Message.builder().role("system").content(content).build();
    }

    public static Message user(String content) {
        return Message.builder().role("user").content(content).build();
    }

    public static Message assistant(String content) {
        return Message.builder().role("assistant").content(content).build();
    }
}
