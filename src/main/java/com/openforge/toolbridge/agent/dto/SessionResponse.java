package com.openforge.toolbridge.agent.dto;

import com.openforge.toolbridge.context.ConversationContext;

import java.util.LinkedHashMap;
import java.util.Map;

/** Response body for GET /api/agent/sessions/{id}. */
public record SessionResponse(
        String            sessionId,
        int               turnCount,
        Map<String, Long> lastEntities,
        String            wsSubscribePath
) {

    public static SessionResponse from(ConversationContext context) {
        return new SessionResponse(
                context.sessionId(),
                context.turnCount(),
                new LinkedHashMap<>(context.lastEntities()),
                "/topic/agent/" + context.sessionId()
        );
    }
}
